package com.splitttr.flowcollab.presence;

import com.splitttr.flowcollab.broadcast.BroadcastCoordinator;
import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.session.WorkflowSession;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;

/**
 * Cursor, selection and online status of participants. Last write wins per user, by
 * {@code updatedAt}; updates bypass the commit pipeline and are never persisted.
 */
@ApplicationScoped
public class PresenceTracker {

    private final BroadcastCoordinator coordinator;
    private final Clock clock;

    @Inject
    public PresenceTracker(BroadcastCoordinator coordinator, Clock clock) {
        this.coordinator = coordinator;
        this.clock = clock;
    }

    /**
     * Records and broadcasts a presence update. Returns {@code false} when it was older than the
     * one already held for the user and has been dropped.
     */
    public boolean update(WorkflowSession session, String userId, Presence presence) {
        Presence incoming = presence.withIdentity(userId, clock.instant());
        Presence kept = session.presence().merge(userId, incoming,
            (current, next) -> next.updatedAt().isBefore(current.updatedAt()) ? current : next);
        if (kept != incoming) {
            return false;
        }
        coordinator.toAll(session, ServerMessage.presence(session.sessionId(), incoming), userId);
        return true;
    }

    public void markOffline(WorkflowSession session, String userId) {
        session.presence().remove(userId);
        coordinator.toAll(session, ServerMessage.presence(session.sessionId(),
            Presence.offline(userId, clock.instant())), userId);
    }
}
