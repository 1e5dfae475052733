package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    DELETE("delete"),
    DEPENDENCY("dependency"),
    SAME_TARGET_UPDATE("same-target-update"),
    POSITION("position");

    private final String wireName;

    ConflictType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
