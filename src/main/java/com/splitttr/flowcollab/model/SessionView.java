package com.splitttr.flowcollab.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a session, safe to serialize and hand to other threads.
 */
public record SessionView(
    String sessionId,
    String workflowId,
    String createdBy,
    Instant createdAt,
    List<Participant> participants,
    SessionSettings settings,
    SessionState state,
    boolean isActive,
    long headVersion
) {}
