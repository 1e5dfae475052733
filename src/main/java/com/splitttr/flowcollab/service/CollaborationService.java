package com.splitttr.flowcollab.service;

import com.splitttr.flowcollab.broadcast.MessageSink;
import com.splitttr.flowcollab.error.ForbiddenException;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.error.NotParticipantException;
import com.splitttr.flowcollab.error.RoleNotAllowedException;
import com.splitttr.flowcollab.message.MessageCodec;
import com.splitttr.flowcollab.message.OperationRequest;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.SessionStats;
import com.splitttr.flowcollab.model.SubmissionResult;
import com.splitttr.flowcollab.model.TargetKind;
import com.splitttr.flowcollab.presence.PresenceTracker;
import com.splitttr.flowcollab.security.Caller;
import com.splitttr.flowcollab.session.SessionRegistry;
import com.splitttr.flowcollab.session.WorkflowSession;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything a connected participant can do. Identity always comes from the
 * verified {@link Caller}, never from message content.
 */
@ApplicationScoped
public class CollaborationService {

    private final SessionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final Clock clock;

    @Inject
    public CollaborationService(SessionRegistry registry, PresenceTracker presenceTracker, Clock clock) {
        this.registry = registry;
        this.presenceTracker = presenceTracker;
        this.clock = clock;
    }

    /**
     * Joins (or creates) the active session of a workflow.
     *
     * @param requestedRole optional role to join with; it may lower the granted role but never raise it
     */
    public SessionRegistry.JoinResult join(String workflowId, Caller caller, String connectionId, Role requestedRole,
                                           SessionSettings settings, MessageSink sink) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new InvalidOperationException("workflowId is required");
        }
        Role role = effectiveRole(workflowId, caller, requestedRole);
        var participant = new Participant(caller.userId(), connectionId, role, clock.instant(), true);
        return registry.join(workflowId, participant, sink, settings);
    }

    private Role effectiveRole(String workflowId, Caller caller, Role requested) {
        Role granted = caller.role();
        if (granted == null) {
            // the user opening a workflow without an active session owns the session
            granted = registry.activeForWorkflow(workflowId).isPresent() ? Role.EDITOR : Role.OWNER;
        }
        if (requested != null && requested.ordinal() <= granted.ordinal()) {
            return requested;
        }
        return granted;
    }

    public void leave(String sessionId, String userId) {
        registry.leave(sessionId, userId)
            .ifPresent(p -> registry.find(sessionId).ifPresent(s -> presenceTracker.markOffline(s, userId)));
    }

    /**
     * Called when a connection goes away. Does nothing if the user has since reconnected.
     */
    public void disconnect(String sessionId, String userId, String connectionId) {
        registry.disconnect(sessionId, userId, connectionId)
            .ifPresent(p -> registry.find(sessionId).ifPresent(s -> presenceTracker.markOffline(s, userId)));
    }

    /**
     * Validates a submission and hands it to the session's commit pipeline.
     */
    public CompletableFuture<SubmissionResult> submit(String sessionId, Caller caller, OperationRequest request) {
        WorkflowSession session = registry.require(sessionId);
        Participant participant = member(session, caller.userId());
        if (!participant.role().canWrite()) {
            throw new RoleNotAllowedException("Role " + participant.role().wireName() + " cannot edit the workflow");
        }
        return session.pipeline().submit(toOperation(session, caller.userId(), request));
    }

    Operation toOperation(WorkflowSession session, String authorId, OperationRequest request) {
        if (request == null || request.type() == null || request.target() == null
            || request.target().id() == null || request.target().kind() == null) {
            throw new InvalidOperationException("operation type and target are required");
        }
        if (!kindMatches(request)) {
            throw new InvalidOperationException(request.type().wireName() + " cannot target a "
                + request.target().kind().wireName());
        }
        String id = request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id();
        Instant timestamp = request.timestamp() != null ? request.timestamp() : clock.instant();
        return new Operation(id, session.sessionId(), session.workflowId(), authorId, request.type(),
            request.target(), MessageCodec.decodePayload(request.type(), request.payload()),
            request.baseVersion(), null, OperationStatus.PENDING, timestamp, null, null);
    }

    private static boolean kindMatches(OperationRequest request) {
        TargetKind kind = request.target().kind();
        return switch (request.type()) {
            case NODE_ADD, NODE_UPDATE, NODE_DELETE -> kind == TargetKind.NODE;
            case EDGE_ADD, EDGE_UPDATE, EDGE_DELETE -> kind == TargetKind.EDGE;
            case PROPERTY_UPDATE -> true;
        };
    }

    public boolean updatePresence(String sessionId, String userId, Presence presence) {
        WorkflowSession session = registry.require(sessionId);
        member(session, userId);
        if (presence == null) {
            throw new InvalidOperationException("presence is required");
        }
        return presenceTracker.update(session, userId, presence);
    }

    /**
     * Committed operations between two versions, both inclusive. A missing upper bound means head.
     */
    public List<Operation> fetchOperations(String sessionId, String userId, long fromVersion, Long toVersion) {
        WorkflowSession session = registry.require(sessionId);
        member(session, userId);
        var log = session.pipeline().log();
        return log.range(fromVersion, toVersion != null ? toVersion : log.headVersion());
    }

    public List<Operation> operationsOn(String sessionId, TargetKind kind, String targetId) {
        return registry.require(sessionId).pipeline().log().byTarget(kind, targetId);
    }

    public SessionSettings updateSettings(String sessionId, Caller caller, SessionSettings settings) {
        if (settings == null) {
            throw new InvalidOperationException("settings are required");
        }
        return registry.updateSettings(sessionId, caller.userId(), caller.admin(), settings);
    }

    /**
     * Ends a session on behalf of its owner or an administrator.
     */
    public void end(String sessionId, Caller caller) {
        Optional<WorkflowSession> session = registry.find(sessionId);
        if (session.isEmpty() || !session.get().isActive()) {
            return;
        }
        boolean owner = session.get().participant(caller.userId()).map(p -> p.role() == Role.OWNER).orElse(false);
        if (!owner && !caller.admin()) {
            throw new ForbiddenException("Only the session owner or an administrator may end the session");
        }
        registry.end(sessionId);
    }

    public SessionStats stats(String sessionId) {
        return registry.stats(sessionId);
    }

    private static Participant member(WorkflowSession session, String userId) {
        return session.participant(userId).orElseThrow(() -> new NotParticipantException(session.sessionId(), userId));
    }
}
