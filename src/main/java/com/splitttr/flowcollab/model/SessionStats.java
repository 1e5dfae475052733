package com.splitttr.flowcollab.model;

public record SessionStats(
    String sessionId,
    int participants,
    long committedOperations,
    long rejectedOperations,
    long headVersion,
    long durationMinutes
) {}
