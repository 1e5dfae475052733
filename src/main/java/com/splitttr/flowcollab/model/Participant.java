package com.splitttr.flowcollab.model;

import java.time.Instant;

public record Participant(
    String userId,
    String connectionId,
    Role role,
    Instant joinedAt,
    boolean isActive
) {}
