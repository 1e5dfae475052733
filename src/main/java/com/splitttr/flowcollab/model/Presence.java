package com.splitttr.flowcollab.model;

import java.time.Instant;
import java.util.List;

/**
 * Ephemeral editor presence. Never persisted and never ordered relative to operations.
 */
public record Presence(
    String userId,
    boolean online,
    Cursor cursor,
    Selection selection,
    Instant updatedAt
) {
    public record Cursor(double x, double y, String nodeId) {}

    public record Selection(List<String> nodeIds, List<String> edgeIds) {}

    public static Presence offline(String userId, Instant at) {
        return new Presence(userId, false, null, null, at);
    }

    public Presence withIdentity(String userId, Instant fallbackTime) {
        return new Presence(userId, online, cursor, selection, updatedAt != null ? updatedAt : fallbackTime);
    }
}
