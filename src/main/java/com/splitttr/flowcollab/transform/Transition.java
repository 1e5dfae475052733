package com.splitttr.flowcollab.transform;

import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.RejectionReason;

/**
 * Status change of an operation that was committed before the submission that defeated it.
 */
public record Transition(String operationId, RejectionReason reason, String supersededBy) {

    public static Transition rejected(String operationId, RejectionReason reason) {
        return new Transition(operationId, reason, null);
    }

    public static Transition superseded(String operationId, String winnerId) {
        return new Transition(operationId, null, winnerId);
    }

    public Operation applyTo(Operation op) {
        return reason != null ? op.rejected(reason) : op.transformed(supersededBy);
    }
}
