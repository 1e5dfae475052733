package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationStatus {
    PENDING,
    APPLIED,
    TRANSFORMED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Committed operations in either of these states contribute to the workflow state. */
    public boolean isEffective() {
        return this == APPLIED || this == TRANSFORMED;
    }
}
