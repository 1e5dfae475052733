package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionState {
    CREATED,
    ACTIVE,
    ENDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
