package com.splitttr.flowcollab.broadcast;

import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.SubmissionResult;
import com.splitttr.flowcollab.session.WorkflowSession;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Writes session events to the participants' outbound channels.
 *
 * <p>Called from the session pipeline in commit order; since every channel is FIFO, all
 * participants observe committed operations in the same order. Delivery is at-least-once and
 * clients apply operations idempotently by id.
 */
@ApplicationScoped
public class BroadcastCoordinator {

    /**
     * Delivers a committed submission: the originator receives the authoritative result,
     * everybody else the committed operation.
     */
    public void publish(WorkflowSession session, SubmissionResult result) {
        Operation op = result.operation();
        ServerMessage toOthers = ServerMessage.committed(op);
        ServerMessage toAuthor = ServerMessage.submissionResult(result);
        session.channels().forEach((userId, channel) ->
            channel.send(userId.equals(op.authorId()) ? toAuthor : toOthers));
    }

    /**
     * Rejections are surfaced to the originating participant only.
     */
    public void publishRejection(WorkflowSession session, SubmissionResult result) {
        sendTo(session, result.operation().authorId(), ServerMessage.submissionResult(result));
    }

    /**
     * Derived operations, such as a position nudge, go to every participant.
     */
    public void publishDerived(WorkflowSession session, Operation op) {
        toAll(session, ServerMessage.committed(op), null);
    }

    public void publishStatus(WorkflowSession session, Operation op) {
        toAll(session, ServerMessage.status(op), null);
    }

    public void publishConflict(WorkflowSession session, Conflict conflict) {
        toAll(session, ServerMessage.conflict(session.sessionId(), conflict), null);
    }

    public void toAll(WorkflowSession session, ServerMessage message, String excludeUserId) {
        session.channels().forEach((userId, channel) -> {
            if (!userId.equals(excludeUserId)) {
                channel.send(message);
            }
        });
    }

    public void sendTo(WorkflowSession session, String userId, ServerMessage message) {
        var channel = session.channels().get(userId);
        if (channel != null) {
            channel.send(message);
        }
    }
}
