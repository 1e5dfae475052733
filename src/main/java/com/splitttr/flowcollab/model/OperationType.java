package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.splitttr.flowcollab.model.payload.EdgeAddPayload;
import com.splitttr.flowcollab.model.payload.EdgeDeletePayload;
import com.splitttr.flowcollab.model.payload.EdgeUpdatePayload;
import com.splitttr.flowcollab.model.payload.NodeAddPayload;
import com.splitttr.flowcollab.model.payload.NodeDeletePayload;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import com.splitttr.flowcollab.model.payload.OperationPayload;
import com.splitttr.flowcollab.model.payload.PropertyUpdatePayload;

import java.util.Arrays;

public enum OperationType {
    NODE_ADD("node_add", NodeAddPayload.class),
    NODE_UPDATE("node_update", NodeUpdatePayload.class),
    NODE_DELETE("node_delete", NodeDeletePayload.class),
    EDGE_ADD("edge_add", EdgeAddPayload.class),
    EDGE_UPDATE("edge_update", EdgeUpdatePayload.class),
    EDGE_DELETE("edge_delete", EdgeDeletePayload.class),
    PROPERTY_UPDATE("property_update", PropertyUpdatePayload.class);

    private final String wireName;
    private final Class<? extends OperationPayload> payloadType;

    OperationType(String wireName, Class<? extends OperationPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends OperationPayload> payloadType() {
        return payloadType;
    }

    public boolean isDelete() {
        return this == NODE_DELETE || this == EDGE_DELETE;
    }

    public boolean isUpdate() {
        return this == NODE_UPDATE || this == EDGE_UPDATE || this == PROPERTY_UPDATE;
    }

    public boolean isAdd() {
        return this == NODE_ADD || this == EDGE_ADD;
    }

    public boolean touchesEdgeEndpoints() {
        return this == EDGE_ADD || this == EDGE_UPDATE;
    }

    @JsonCreator
    public static OperationType fromWire(String value) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operation type: " + value));
    }
}
