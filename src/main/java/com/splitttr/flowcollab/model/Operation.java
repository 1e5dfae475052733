package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.splitttr.flowcollab.model.payload.FieldUpdate;
import com.splitttr.flowcollab.model.payload.OperationPayload;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single edit intent against a workflow graph. Immutable: status transitions and version
 * assignment produce copies.
 *
 * <p>{@code mergedFrom} maps the key paths a field merge folded into the payload to the
 * concurrent operation each value came from. Those paths describe the merged target only; the
 * operation's own effect on the graph is {@link #ownPayload()}.
 */
public record Operation(
    String id,
    String sessionId,
    String workflowId,
    String authorId,
    OperationType type,
    Target target,
    OperationPayload payload,
    long baseVersion,
    Long committedVersion,
    OperationStatus status,
    Instant timestamp,
    RejectionReason rejection,
    String supersededBy,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> mergedFrom
) {

    public Operation {
        mergedFrom = mergedFrom == null ? Map.of() : Map.copyOf(mergedFrom);
    }

    public Operation(String id, String sessionId, String workflowId, String authorId, OperationType type,
                     Target target, OperationPayload payload, long baseVersion, Long committedVersion,
                     OperationStatus status, Instant timestamp, RejectionReason rejection, String supersededBy) {
        this(id, sessionId, workflowId, authorId, type, target, payload, baseVersion, committedVersion,
            status, timestamp, rejection, supersededBy, Map.of());
    }

    /**
     * Deterministic precedence used for every tie-break: {@code (timestamp, authorId)}, then id.
     */
    public static final Comparator<Operation> PRECEDENCE = Comparator
        .comparing(Operation::timestamp)
        .thenComparing(Operation::authorId)
        .thenComparing(Operation::id);

    public Operation withPayload(OperationPayload newPayload) {
        return new Operation(id, sessionId, workflowId, authorId, type, target, newPayload,
            baseVersion, committedVersion, status, timestamp, rejection, supersededBy, mergedFrom);
    }

    public Operation mergedFrom(Map<String, String> sources) {
        return new Operation(id, sessionId, workflowId, authorId, type, target, payload,
            baseVersion, committedVersion, status, timestamp, rejection, supersededBy, sources);
    }

    public Operation committedAs(long version) {
        return new Operation(id, sessionId, workflowId, authorId, type, target, payload,
            baseVersion, version, status, timestamp, rejection, supersededBy, mergedFrom);
    }

    public Operation applied() {
        return new Operation(id, sessionId, workflowId, authorId, type, target, payload,
            baseVersion, committedVersion, OperationStatus.APPLIED, timestamp, null, null, mergedFrom);
    }

    public Operation transformed(String winnerId) {
        return new Operation(id, sessionId, workflowId, authorId, type, target, payload,
            baseVersion, committedVersion, OperationStatus.TRANSFORMED, timestamp, null, winnerId, mergedFrom);
    }

    public Operation rejected(RejectionReason reason) {
        return new Operation(id, sessionId, workflowId, authorId, type, target, payload,
            baseVersion, committedVersion, OperationStatus.REJECTED, timestamp, reason, supersededBy, mergedFrom);
    }

    /**
     * The payload without the paths folded in from concurrent operations.
     */
    public OperationPayload ownPayload() {
        if (mergedFrom.isEmpty() || !(payload instanceof FieldUpdate update)) {
            return payload;
        }
        return update.withFieldChanges(ownFieldChanges());
    }

    public Map<String, Object> ownFieldChanges() {
        if (!(payload instanceof FieldUpdate update)) {
            return Map.of();
        }
        Map<String, Object> own = new LinkedHashMap<>(update.fieldChanges());
        own.keySet().removeAll(mergedFrom.keySet());
        return own;
    }

    public boolean precedes(Operation other) {
        return PRECEDENCE.compare(this, other) < 0;
    }

    public boolean targets(TargetKind kind, String targetId) {
        return target.kind() == kind && target.id().equals(targetId);
    }
}
