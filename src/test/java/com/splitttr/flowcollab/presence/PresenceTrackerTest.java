package com.splitttr.flowcollab.presence;

import com.splitttr.flowcollab.broadcast.BroadcastCoordinator;
import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.session.SessionRegistry;
import com.splitttr.flowcollab.session.WorkflowSession;
import com.splitttr.flowcollab.support.MutableClock;
import com.splitttr.flowcollab.support.RecordingSink;
import com.splitttr.flowcollab.support.RecordingStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.splitttr.flowcollab.support.Fixtures.*;

final class PresenceTrackerTest {

    private final MutableClock clock = new MutableClock(T0);
    private final BroadcastCoordinator coordinator = new BroadcastCoordinator();
    private final PresenceTracker tracker = new PresenceTracker(coordinator, clock);
    private final RecordingSink aliceSink = new RecordingSink();
    private final RecordingSink bobSink = new RecordingSink();
    private WorkflowSession session;

    @BeforeEach
    void joinTwoParticipants() {
        var registry = new SessionRegistry(config(), clock, new RecordingStore(), coordinator, Runnable::run);
        var joined = registry.join(WORKFLOW, new Participant("alice", "c-a", Role.OWNER, T0, true), aliceSink, null);
        registry.join(WORKFLOW, new Participant("bob", "c-b", Role.EDITOR, T0, true), bobSink, null);
        session = registry.require(joined.session().sessionId());
        aliceSink.clear();
        bobSink.clear();
    }

    private static Presence cursorAt(double x, int second) {
        return new Presence(null, true, new Presence.Cursor(x, 0, null),
            new Presence.Selection(List.of("a"), List.of()), at(second));
    }

    @Test
    void newerUpdateReplacesAndIsBroadcastToOthers() {
        Assertions.assertTrue(tracker.update(session, "alice", cursorAt(10, 1)));
        Assertions.assertTrue(tracker.update(session, "alice", cursorAt(20, 2)));

        Assertions.assertEquals(20, session.presence().get("alice").cursor().x());
        Assertions.assertTrue(aliceSink.messages().isEmpty());
        Assertions.assertEquals(List.of(ServerMessage.PRESENCE_UPDATE, ServerMessage.PRESENCE_UPDATE), bobSink.types());
        Assertions.assertEquals("alice", bobSink.messages().get(0).presence().userId());
    }

    @Test
    void olderUpdateIsDropped() {
        tracker.update(session, "alice", cursorAt(20, 5));

        Assertions.assertFalse(tracker.update(session, "alice", cursorAt(10, 3)));

        Assertions.assertEquals(20, session.presence().get("alice").cursor().x());
        Assertions.assertEquals(1, bobSink.messages().size());
    }

    @Test
    void missingTimestampIsStampedOnReceipt() {
        clock.advance(Duration.ofSeconds(30));

        tracker.update(session, "bob", new Presence("mallory", true, null, null, null));

        Presence stored = session.presence().get("bob");
        Assertions.assertEquals("bob", stored.userId());
        Assertions.assertEquals(at(30), stored.updatedAt());
    }

    @Test
    void markingOfflineForgetsTheUser() {
        tracker.update(session, "alice", cursorAt(10, 1));
        bobSink.clear();

        tracker.markOffline(session, "alice");

        Assertions.assertFalse(session.presence().containsKey("alice"));
        Assertions.assertFalse(bobSink.messages().get(0).presence().online());
    }
}
