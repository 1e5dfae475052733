package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RejectionReason {
    TARGET_DELETED("target-deleted"),
    DANGLING_REFERENCE("dangling-reference"),
    ALREADY_EXISTS("already-exists");

    private final String wireName;

    RejectionReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
