package com.splitttr.flowcollab.transform;

import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.RejectionReason;

import java.util.List;

/**
 * Outcome of transforming one submission against its concurrent window.
 *
 * @param operation the resolved submission: applied, transformed or rejected
 * @param transitions status changes for committed window operations the submission defeated
 * @param followUps derived operations to commit right after the submission
 */
public record Resolution(
    Operation operation,
    String conflictingOperationId,
    String detail,
    List<Conflict> conflicts,
    List<Transition> transitions,
    List<Operation> followUps
) {
    public static Resolution rejected(Operation submitted, RejectionReason reason, String conflictingOperationId,
                                      String detail, List<Conflict> conflicts) {
        return new Resolution(submitted.rejected(reason), conflictingOperationId, detail,
            List.copyOf(conflicts), List.of(), List.of());
    }

    public boolean isRejected() {
        return operation.status() == OperationStatus.REJECTED;
    }

    public RejectionReason reason() {
        return operation.rejection();
    }
}
