package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

// Participant role within a collaboration session.
public enum Role {
    VIEWER,
    EDITOR,
    OWNER;

    public boolean canWrite() {
        return this == EDITOR || this == OWNER;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Role fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
