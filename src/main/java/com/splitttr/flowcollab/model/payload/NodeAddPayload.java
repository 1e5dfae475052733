package com.splitttr.flowcollab.model.payload;

import com.splitttr.flowcollab.model.Bounds;

import java.util.Map;

public record NodeAddPayload(
    String nodeType,
    String label,
    Bounds bounds,
    Map<String, Object> data
) implements OperationPayload {
    public NodeAddPayload {
        data = data == null ? Map.of() : data;
    }
}
