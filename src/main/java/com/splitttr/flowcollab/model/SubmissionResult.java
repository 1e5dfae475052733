package com.splitttr.flowcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Authoritative outcome of a submission, returned to the originating participant.
 */
public record SubmissionResult(
    Outcome outcome,
    Operation operation,
    RejectionReason reason,
    String detail,
    String targetId,
    String conflictingOperationId,
    List<Conflict> conflicts
) {
    public enum Outcome {
        COMMITTED,
        REJECTED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static SubmissionResult committed(Operation operation, List<Conflict> conflicts) {
        return new SubmissionResult(Outcome.COMMITTED, operation, null, null,
            operation.target().id(), null, List.copyOf(conflicts));
    }

    public static SubmissionResult rejected(Operation operation, RejectionReason reason, String detail,
                                            String conflictingOperationId, List<Conflict> conflicts) {
        return new SubmissionResult(Outcome.REJECTED, operation, reason, detail,
            operation.target().id(), conflictingOperationId, List.copyOf(conflicts));
    }

    public boolean wasCommitted() {
        return outcome == Outcome.COMMITTED;
    }
}
