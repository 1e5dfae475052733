package com.splitttr.flowcollab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.SessionStats;
import com.splitttr.flowcollab.model.SessionView;
import com.splitttr.flowcollab.model.SubmissionResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    String sessionId,
    SessionView session,
    GraphSnapshot graph,
    Boolean isNewSession,
    Participant participant,
    String userId,
    Operation operation,
    SubmissionResult result,
    Conflict conflict,
    Presence presence,
    List<Operation> operations,
    SessionSettings settings,
    SessionStats stats,
    String code,
    String error
) {
    public static final String SESSION_JOINED = "session_joined";
    public static final String PARTICIPANT_JOINED = "participant_joined";
    public static final String PARTICIPANT_LEFT = "participant_left";
    public static final String OPERATION_COMMITTED = "operation_committed";
    public static final String SUBMISSION_RESULT = "submission_result";
    public static final String OPERATION_STATUS = "operation_status";
    public static final String CONFLICT_DETECTED = "conflict_detected";
    public static final String PRESENCE_UPDATE = "presence_update";
    public static final String OPERATIONS = "operations";
    public static final String SETTINGS_UPDATED = "settings_updated";
    public static final String SESSION_ENDED = "session_ended";
    public static final String SESSION_STATS = "session_stats";
    public static final String ERROR = "error";

    private static Builder of(String type, String sessionId) {
        return new Builder(type, sessionId);
    }

    public static ServerMessage joined(SessionView session, GraphSnapshot graph, boolean isNew) {
        return of(SESSION_JOINED, session.sessionId()).session(session).graph(graph).isNew(isNew).build();
    }

    public static ServerMessage participantJoined(String sessionId, Participant participant) {
        return of(PARTICIPANT_JOINED, sessionId).participant(participant).user(participant.userId()).build();
    }

    public static ServerMessage participantLeft(String sessionId, String userId) {
        return of(PARTICIPANT_LEFT, sessionId).user(userId).build();
    }

    public static ServerMessage committed(Operation op) {
        return of(OPERATION_COMMITTED, op.sessionId()).operation(op).user(op.authorId()).build();
    }

    public static ServerMessage submissionResult(SubmissionResult result) {
        var op = result.operation();
        return of(SUBMISSION_RESULT, op.sessionId()).operation(op).result(result).user(op.authorId()).build();
    }

    public static ServerMessage status(Operation op) {
        return of(OPERATION_STATUS, op.sessionId()).operation(op).user(op.authorId()).build();
    }

    public static ServerMessage conflict(String sessionId, Conflict conflict) {
        return of(CONFLICT_DETECTED, sessionId).conflict(conflict).build();
    }

    public static ServerMessage presence(String sessionId, Presence presence) {
        return of(PRESENCE_UPDATE, sessionId).presence(presence).user(presence.userId()).build();
    }

    public static ServerMessage operations(String sessionId, List<Operation> operations) {
        return of(OPERATIONS, sessionId).operations(operations).build();
    }

    public static ServerMessage settingsUpdated(String sessionId, SessionSettings settings) {
        return of(SETTINGS_UPDATED, sessionId).settings(settings).build();
    }

    public static ServerMessage ended(String sessionId) {
        return of(SESSION_ENDED, sessionId).build();
    }

    public static ServerMessage stats(SessionStats stats) {
        return of(SESSION_STATS, stats.sessionId()).stats(stats).build();
    }

    public static ServerMessage error(String code, String message) {
        return of(ERROR, null).error(code, message).build();
    }

    private static final class Builder {
        private final String type;
        private final String sessionId;
        private SessionView session;
        private GraphSnapshot graph;
        private Boolean isNewSession;
        private Participant participant;
        private String userId;
        private Operation operation;
        private SubmissionResult result;
        private Conflict conflict;
        private Presence presence;
        private List<Operation> operations;
        private SessionSettings settings;
        private SessionStats stats;
        private String code;
        private String error;

        Builder(String type, String sessionId) {
            this.type = type;
            this.sessionId = sessionId;
        }

        Builder session(SessionView v) { this.session = v; return this; }
        Builder graph(GraphSnapshot v) { this.graph = v; return this; }
        Builder isNew(boolean v) { this.isNewSession = v; return this; }
        Builder participant(Participant v) { this.participant = v; return this; }
        Builder user(String v) { this.userId = v; return this; }
        Builder operation(Operation v) { this.operation = v; return this; }
        Builder result(SubmissionResult v) { this.result = v; return this; }
        Builder conflict(Conflict v) { this.conflict = v; return this; }
        Builder presence(Presence v) { this.presence = v; return this; }
        Builder operations(List<Operation> v) { this.operations = v; return this; }
        Builder settings(SessionSettings v) { this.settings = v; return this; }
        Builder stats(SessionStats v) { this.stats = v; return this; }
        Builder error(String c, String e) { this.code = c; this.error = e; return this; }

        ServerMessage build() {
            return new ServerMessage(type, sessionId, session, graph, isNewSession, participant, userId,
                operation, result, conflict, presence, operations, settings, stats, code, error);
        }
    }
}
