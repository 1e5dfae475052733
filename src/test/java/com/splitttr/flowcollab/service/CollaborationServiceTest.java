package com.splitttr.flowcollab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.flowcollab.broadcast.BroadcastCoordinator;
import com.splitttr.flowcollab.error.ForbiddenException;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.error.NotParticipantException;
import com.splitttr.flowcollab.error.RoleNotAllowedException;
import com.splitttr.flowcollab.message.MessageCodec;
import com.splitttr.flowcollab.message.OperationRequest;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionState;
import com.splitttr.flowcollab.model.SubmissionResult;
import com.splitttr.flowcollab.model.Target;
import com.splitttr.flowcollab.model.TargetKind;
import com.splitttr.flowcollab.presence.PresenceTracker;
import com.splitttr.flowcollab.security.Caller;
import com.splitttr.flowcollab.session.SessionRegistry;
import com.splitttr.flowcollab.support.MutableClock;
import com.splitttr.flowcollab.support.RecordingSink;
import com.splitttr.flowcollab.support.RecordingStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.splitttr.flowcollab.support.Fixtures.*;

final class CollaborationServiceTest {

    private final MutableClock clock = new MutableClock(T0);
    private final BroadcastCoordinator coordinator = new BroadcastCoordinator();
    private final SessionRegistry registry = new SessionRegistry(config(), clock,
        new RecordingStore(graph("a", "b")), coordinator, Runnable::run);
    private final CollaborationService service =
        new CollaborationService(registry, new PresenceTracker(coordinator, clock), clock);

    private static Caller caller(String userId) {
        return new Caller(userId, null, false);
    }

    private SessionRegistry.JoinResult join(String userId, Role requested) {
        return service.join(WORKFLOW, caller(userId), "c-" + userId, requested, null, new RecordingSink());
    }

    private static OperationRequest moveRequest(String id, String nodeId, long baseVersion) {
        JsonNode payload = MessageCodec.mapper().valueToTree(Map.of(
            "bounds", Map.of("x", "a".equals(nodeId) ? 40 : 2040, "y", 40, "width", 100, "height", 50)));
        return new OperationRequest(id, OperationType.NODE_UPDATE, Target.node(nodeId), payload, baseVersion, null);
    }

    private SubmissionResult submit(String userId, OperationRequest request) throws Exception {
        return service.submit(join(userId, null).session().sessionId(), caller(userId), request)
            .get(5, TimeUnit.SECONDS);
    }

    @Test
    void openerOwnsTheSessionAndLaterJoinersEdit() {
        var first = join("alice", null);
        var second = join("bob", null);

        Assertions.assertEquals(Role.OWNER, first.participant().role());
        Assertions.assertEquals(Role.EDITOR, second.participant().role());
        Assertions.assertEquals(first.session().sessionId(), second.session().sessionId());
    }

    @Test
    void requestedRoleMayOnlyLowerTheGrant() {
        join("alice", null);

        Assertions.assertEquals(Role.VIEWER, join("bob", Role.VIEWER).participant().role());
        Assertions.assertEquals(Role.EDITOR, join("carol", Role.OWNER).participant().role());

        var tokenRole = service.join(WORKFLOW, new Caller("dave", Role.VIEWER, false), "c-dave", Role.EDITOR,
            null, new RecordingSink());
        Assertions.assertEquals(Role.VIEWER, tokenRole.participant().role());
    }

    @Test
    void blankWorkflowIsInvalid() {
        Assertions.assertThrows(InvalidOperationException.class,
            () -> service.join(" ", caller("alice"), "c-alice", null, null, new RecordingSink()));
    }

    @Test
    void viewersCannotSubmit() {
        String sessionId = join("alice", null).session().sessionId();
        join("vic", Role.VIEWER);

        Assertions.assertThrows(RoleNotAllowedException.class,
            () -> service.submit(sessionId, caller("vic"), moveRequest("op-1", "a", 0)));
    }

    @Test
    void strangersCannotSubmitOrFetch() {
        String sessionId = join("alice", null).session().sessionId();

        Assertions.assertThrows(NotParticipantException.class,
            () -> service.submit(sessionId, caller("mallory"), moveRequest("op-1", "a", 0)));
        Assertions.assertThrows(NotParticipantException.class,
            () -> service.fetchOperations(sessionId, "mallory", 1, null));
    }

    @Test
    void submissionWithoutIdOrTimestampIsCompleted() throws Exception {
        clock.advance(Duration.ofSeconds(7));

        SubmissionResult result = submit("alice", moveRequest(null, "a", 0));

        Assertions.assertTrue(result.wasCommitted());
        Operation op = result.operation();
        Assertions.assertFalse(op.id().isBlank());
        Assertions.assertEquals(at(7), op.timestamp());
        Assertions.assertEquals("alice", op.authorId());
        Assertions.assertEquals(OperationStatus.APPLIED, op.status());
        Assertions.assertEquals(1L, op.committedVersion());
    }

    @Test
    void operationTypeMustMatchTheTargetKind() {
        String sessionId = join("alice", null).session().sessionId();
        var edgeTargetedMove = new OperationRequest("op-1", OperationType.NODE_UPDATE, Target.edge("e1"), null, 0,
            null);
        var missingTarget = new OperationRequest("op-2", OperationType.NODE_DELETE, null, null, 0, null);

        Assertions.assertThrows(InvalidOperationException.class,
            () -> service.submit(sessionId, caller("alice"), edgeTargetedMove));
        Assertions.assertThrows(InvalidOperationException.class,
            () -> service.submit(sessionId, caller("alice"), missingTarget));
    }

    @Test
    void fetchReturnsTheRequestedRangeOfCommits() throws Exception {
        submit("alice", moveRequest("op-1", "a", 0));
        submit("alice", moveRequest("op-2", "b", 1));
        submit("alice", moveRequest("op-3", "a", 2));
        String sessionId = join("alice", null).session().sessionId();

        Assertions.assertEquals(List.of("op-2", "op-3"),
            service.fetchOperations(sessionId, "alice", 2, null).stream().map(Operation::id).toList());
        Assertions.assertEquals(List.of("op-1"),
            service.fetchOperations(sessionId, "alice", 1, 1L).stream().map(Operation::id).toList());
        Assertions.assertEquals(List.of("op-1", "op-3"),
            service.operationsOn(sessionId, TargetKind.NODE, "a").stream().map(Operation::id).toList());
    }

    @Test
    void onlyTheOwnerOrAnAdminEndsTheSession() {
        String sessionId = join("alice", null).session().sessionId();
        join("bob", null);

        Assertions.assertThrows(ForbiddenException.class, () -> service.end(sessionId, caller("bob")));

        service.end(sessionId, new Caller("root", null, true));
        Assertions.assertEquals(SessionState.ENDED, registry.require(sessionId).view().state());

        service.end(sessionId, caller("bob"));
    }

    @Test
    void leavingDropsTheParticipant() {
        String sessionId = join("alice", null).session().sessionId();
        join("bob", null);

        service.leave(sessionId, "bob");

        Assertions.assertTrue(registry.require(sessionId).participant("bob").isEmpty());
        Assertions.assertEquals(1, service.stats(sessionId).participants());
    }
}
