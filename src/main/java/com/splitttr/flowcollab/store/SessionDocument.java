package com.splitttr.flowcollab.store;

import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.SessionState;
import com.splitttr.flowcollab.model.SessionView;

import java.time.Instant;
import java.util.List;

public record SessionDocument(
    String sessionId,
    String workflowId,
    String createdBy,
    Instant createdAt,
    List<Participant> participants,
    SessionSettings settings,
    SessionState state,
    long headVersion,
    Instant savedAt
) {
    public static SessionDocument of(SessionView view, Instant savedAt) {
        return new SessionDocument(view.sessionId(), view.workflowId(), view.createdBy(), view.createdAt(),
            view.participants(), view.settings(), view.state(), view.headVersion(), savedAt);
    }
}
