package com.splitttr.flowcollab.model;

import java.util.List;
import java.util.UUID;

/**
 * Relationship between a submitted operation and one operation of its concurrent window.
 * {@code operationIds} is always {@code [windowOperationId, submittedOperationId]}.
 */
public record Conflict(
    String id,
    List<String> operationIds,
    ConflictType type,
    String resolution
) {
    public static Conflict between(Operation windowOp, Operation submitted, ConflictType type) {
        return new Conflict(UUID.randomUUID().toString(), List.of(windowOp.id(), submitted.id()), type, null);
    }

    public String windowOperationId() {
        return operationIds.get(0);
    }

    public String submittedOperationId() {
        return operationIds.get(1);
    }

    public Conflict resolvedAs(String resolution) {
        return new Conflict(id, operationIds, type, resolution);
    }
}
