package com.splitttr.flowcollab.session;

import com.splitttr.flowcollab.broadcast.BroadcastCoordinator;
import com.splitttr.flowcollab.broadcast.FanOutExecutor;
import com.splitttr.flowcollab.broadcast.MessageSink;
import com.splitttr.flowcollab.broadcast.OutboundChannel;
import com.splitttr.flowcollab.config.CollabConfig;
import com.splitttr.flowcollab.conflict.ConflictDetector;
import com.splitttr.flowcollab.error.ForbiddenException;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.error.SessionClosedException;
import com.splitttr.flowcollab.error.SessionNotFoundException;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.SessionStats;
import com.splitttr.flowcollab.model.SessionView;
import com.splitttr.flowcollab.store.CollaborationStore;
import com.splitttr.flowcollab.store.SessionDocument;
import com.splitttr.flowcollab.transform.TransformEngine;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Arena of collaboration sessions indexed by session id, with at most one active session per
 * workflow. A session is created by the first successful join and ends explicitly or once it has
 * been empty for the idle timeout; {@code ENDED} is terminal.
 */
@ApplicationScoped
public class SessionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int JOIN_ATTEMPTS = 3;

    private final ConcurrentHashMap<String, WorkflowSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> activeByWorkflow = new ConcurrentHashMap<>();

    private final CollabConfig config;
    private final Clock clock;
    private final CollaborationStore store;
    private final BroadcastCoordinator coordinator;
    private final Executor fanOut;
    private final ConflictDetector detector = new ConflictDetector();
    private final TransformEngine engine;

    @Inject
    public SessionRegistry(CollabConfig config, Clock clock, CollaborationStore store,
                           BroadcastCoordinator coordinator, FanOutExecutor fanOut) {
        this(config, clock, store, coordinator, (Executor) fanOut);
    }

    public SessionRegistry(CollabConfig config, Clock clock, CollaborationStore store,
                           BroadcastCoordinator coordinator, Executor fanOut) {
        this.config = config;
        this.clock = clock;
        this.store = store;
        this.coordinator = coordinator;
        this.fanOut = fanOut;
        this.engine = new TransformEngine(config.positionGap());
    }

    public record JoinResult(SessionView session, GraphSnapshot graph, boolean isNewSession, Participant participant) {}

    /**
     * Joins the active session of a workflow, creating it when there is none.
     *
     * @param requested settings for a newly created session; ignored when joining an existing one
     */
    public JoinResult join(String workflowId, Participant participant, MessageSink sink, SessionSettings requested) {
        for (int attempt = 1; ; attempt++) {
            boolean[] created = new boolean[1];
            WorkflowSession session = activeSession(workflowId, participant.userId(), requested, created);
            var channel = new OutboundChannel(participant.connectionId(), sink, fanOut);
            try {
                boolean[] added = new boolean[1];
                JoinResult result = session.pipeline().exclusive(() -> {
                    added[0] = session.admit(participant, channel);
                    Participant admitted = session.participant(participant.userId()).orElse(participant);
                    var joined = new JoinResult(session.view(), session.pipeline().snapshot(), created[0], admitted);
                    // queued ahead of any operation committed after the snapshot
                    coordinator.sendTo(session, admitted.userId(),
                        ServerMessage.joined(joined.session(), joined.graph(), joined.isNewSession()));
                    return joined;
                });
                if (created[0]) {
                    LOG.info("Created session {} for workflow {} by {}", session.sessionId(), workflowId,
                        participant.userId());
                    persist(session);
                }
                if (added[0]) {
                    coordinator.toAll(session,
                        ServerMessage.participantJoined(session.sessionId(), result.participant()),
                        participant.userId());
                }
                LOG.info("User {} joined session {} ({} participants)", participant.userId(),
                    session.sessionId(), session.participantCount());
                return result;
            } catch (SessionClosedException e) {
                // raced with an end; the next attempt starts a fresh session
                activeByWorkflow.remove(workflowId, session.sessionId());
                if (attempt >= JOIN_ATTEMPTS) {
                    throw e;
                }
            } catch (RuntimeException e) {
                if (created[0]) {
                    // a session nobody could join must not linger
                    end(session.sessionId());
                }
                throw e;
            }
        }
    }

    private WorkflowSession activeSession(String workflowId, String userId, SessionSettings requested,
                                          boolean[] created) {
        String sessionId = activeByWorkflow.compute(workflowId, (wf, existing) -> {
            if (existing != null) {
                WorkflowSession current = sessions.get(existing);
                if (current != null && current.isActive()) {
                    return existing;
                }
            }
            WorkflowSession fresh = create(wf, userId, requested);
            sessions.put(fresh.sessionId(), fresh);
            created[0] = true;
            return fresh.sessionId();
        });
        return sessions.get(sessionId);
    }

    private WorkflowSession create(String workflowId, String createdBy, SessionSettings requested) {
        SessionSettings settings = requested != null ? validated(requested) : config.defaultSettings();
        var session = new WorkflowSession("session_" + workflowId + "_" + UUID.randomUUID(), workflowId,
            createdBy, clock.instant(), settings);
        GraphSnapshot graph = store.loadGraph(workflowId);
        new SessionPipeline(session, graph, config, detector, engine, coordinator, store, fanOut);
        return session;
    }

    /**
     * Removes a participant. Any operation of theirs already accepted by the pipeline still commits.
     */
    public Optional<Participant> leave(String sessionId, String userId) {
        return remove(sessionId, userId, null);
    }

    /**
     * Removes a participant only if {@code connectionId} is still their current connection.
     */
    public Optional<Participant> disconnect(String sessionId, String userId, String connectionId) {
        return remove(sessionId, userId, connectionId);
    }

    private Optional<Participant> remove(String sessionId, String userId, String connectionId) {
        WorkflowSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        Optional<Participant> removed = session.remove(userId, connectionId, clock.instant());
        removed.ifPresent(p -> {
            coordinator.toAll(session, ServerMessage.participantLeft(sessionId, userId), null);
            LOG.info("User {} left session {} ({} participants)", userId, sessionId, session.participantCount());
        });
        return removed;
    }

    /**
     * Changes the settings of a session. Only its owner or an administrator may do so.
     */
    public SessionSettings updateSettings(String sessionId, String actorUserId, boolean actorIsAdmin,
                                          SessionSettings settings) {
        WorkflowSession session = require(sessionId);
        if (!session.isActive()) {
            throw new SessionClosedException(sessionId);
        }
        boolean owner = session.participant(actorUserId).map(p -> p.role() == Role.OWNER).orElse(false);
        if (!owner && !actorIsAdmin) {
            throw new ForbiddenException("Only the session owner or an administrator may change settings");
        }
        SessionSettings next = validated(settings);
        synchronized (session) {
            if (next.maxParticipants() < session.participantCount()) {
                throw new InvalidOperationException("maxParticipants " + next.maxParticipants()
                    + " is below the current participant count " + session.participantCount());
            }
            session.updateSettings(next);
        }
        coordinator.toAll(session, ServerMessage.settingsUpdated(sessionId, next), null);
        persist(session);
        LOG.info("Settings of session {} updated by {}", sessionId, actorUserId);
        return next;
    }

    /**
     * Ends a session. Idempotent: ending an ended or unknown session does nothing.
     */
    public void end(String sessionId) {
        WorkflowSession session = sessions.get(sessionId);
        if (session == null || !session.end(clock.instant())) {
            return;
        }
        activeByWorkflow.remove(session.workflowId(), sessionId);
        session.pipeline().close();
        coordinator.toAll(session, ServerMessage.ended(sessionId), null);
        session.closeChannels();
        persist(session);
        LOG.info("Ended session {} at version {}", sessionId, session.pipeline().headVersion());
    }

    /**
     * Ends sessions that have been empty for the idle timeout, and forgets sessions that ended
     * longer than the idle timeout ago.
     */
    public int expireIdle() {
        Instant cutoff = clock.instant().minus(config.idleTimeout());
        int expired = 0;
        for (WorkflowSession session : List.copyOf(sessions.values())) {
            if (session.idleSince(cutoff)) {
                LOG.info("Session {} idle for {}, ending", session.sessionId(), config.idleTimeout());
                end(session.sessionId());
                expired++;
            } else if (session.endedBefore(cutoff)) {
                sessions.remove(session.sessionId());
            }
        }
        return expired;
    }

    public SessionStats stats(String sessionId) {
        WorkflowSession session = require(sessionId);
        var log = session.pipeline().log();
        long minutes = Duration.between(session.createdAt(), clock.instant()).toMinutes();
        return new SessionStats(sessionId, session.participantCount(), log.effectiveCount(), log.rejectedCount(),
            log.headVersion(), minutes);
    }

    public Optional<WorkflowSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public WorkflowSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<WorkflowSession> activeForWorkflow(String workflowId) {
        return Optional.ofNullable(activeByWorkflow.get(workflowId)).map(sessions::get);
    }

    private SessionSettings validated(SessionSettings settings) {
        if (settings.maxParticipants() < 1) {
            throw new InvalidOperationException("maxParticipants must be at least 1");
        }
        return settings;
    }

    private void persist(WorkflowSession session) {
        var document = SessionDocument.of(session.view(), clock.instant());
        fanOut.execute(() -> store.saveSession(document));
    }

    @PreDestroy
    void shutdown() {
        List.copyOf(activeByWorkflow.values()).forEach(this::end);
    }
}
