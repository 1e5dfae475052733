package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TargetKind {
    NODE,
    EDGE,
    WORKFLOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TargetKind fromWire(String value) {
        return valueOf(value.toUpperCase());
    }
}
