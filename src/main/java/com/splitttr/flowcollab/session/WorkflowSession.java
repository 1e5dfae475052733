package com.splitttr.flowcollab.session;

import com.splitttr.flowcollab.broadcast.OutboundChannel;
import com.splitttr.flowcollab.error.CapacityExceededException;
import com.splitttr.flowcollab.error.RoleNotAllowedException;
import com.splitttr.flowcollab.error.SessionClosedException;
import com.splitttr.flowcollab.model.Participant;
import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.SessionState;
import com.splitttr.flowcollab.model.SessionView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One collaboration session on a workflow: its participants, their outbound channels and
 * presence, and the commit pipeline that owns the session's operation log.
 *
 * <p>Membership is guarded by the session's own monitor; nothing here is shared with other sessions.
 */
public class WorkflowSession {

    private final String sessionId;
    private final String workflowId;
    private final String createdBy;
    private final Instant createdAt;

    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private final Map<String, OutboundChannel> channels = new LinkedHashMap<>();
    private final Map<String, Presence> presence = new ConcurrentHashMap<>();

    private volatile SessionSettings settings;
    private volatile SessionState state = SessionState.CREATED;
    private Instant emptySince;
    private Instant endedAt;
    private SessionPipeline pipeline;

    public WorkflowSession(String sessionId, String workflowId, String createdBy, Instant createdAt,
                           SessionSettings settings) {
        this.sessionId = sessionId;
        this.workflowId = workflowId;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.settings = settings;
        this.emptySince = createdAt;
    }

    void attach(SessionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public String sessionId() {
        return sessionId;
    }

    public String workflowId() {
        return workflowId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public SessionPipeline pipeline() {
        return pipeline;
    }

    public SessionSettings settings() {
        return settings;
    }

    public SessionState state() {
        return state;
    }

    public boolean isActive() {
        return state != SessionState.ENDED;
    }

    /**
     * Adds a participant, or swaps the connection of one that is already present.
     * Capacity and role are checked atomically with the insertion.
     */
    synchronized boolean admit(Participant participant, OutboundChannel channel) {
        if (state == SessionState.ENDED) {
            throw new SessionClosedException(sessionId);
        }
        Participant existing = participants.get(participant.userId());
        if (existing == null && participants.size() >= settings.maxParticipants()) {
            throw new CapacityExceededException(sessionId, settings.maxParticipants());
        }
        if (!settings.allows(participant.role())) {
            throw new RoleNotAllowedException(
                "Role " + participant.role().wireName() + " may not join session " + sessionId);
        }
        if (existing != null) {
            participants.put(participant.userId(), new Participant(existing.userId(),
                participant.connectionId(), participant.role(), existing.joinedAt(), true));
            OutboundChannel previous = channels.put(participant.userId(), channel);
            if (previous != null) {
                previous.close();
            }
        } else {
            participants.put(participant.userId(), participant);
            channels.put(participant.userId(), channel);
        }
        state = SessionState.ACTIVE;
        emptySince = null;
        return existing == null;
    }

    /**
     * Removes a participant. With a non-null {@code connectionId} only that connection is removed,
     * so a stale disconnect cannot evict a newer connection of the same user.
     */
    synchronized Optional<Participant> remove(String userId, String connectionId, Instant now) {
        Participant current = participants.get(userId);
        if (current == null || connectionId != null && !connectionId.equals(current.connectionId())) {
            return Optional.empty();
        }
        participants.remove(userId);
        OutboundChannel channel = channels.remove(userId);
        if (channel != null) {
            channel.close();
        }
        presence.remove(userId);
        if (participants.isEmpty()) {
            emptySince = now;
        }
        return Optional.of(current);
    }

    synchronized boolean end(Instant now) {
        if (state == SessionState.ENDED) {
            return false;
        }
        state = SessionState.ENDED;
        endedAt = now;
        return true;
    }

    synchronized void closeChannels() {
        channels.values().forEach(OutboundChannel::close);
        channels.clear();
        participants.clear();
        presence.clear();
    }

    synchronized void updateSettings(SessionSettings newSettings) {
        this.settings = newSettings;
    }

    synchronized int participantCount() {
        return participants.size();
    }

    synchronized boolean idleSince(Instant cutoff) {
        return state != SessionState.ENDED && participants.isEmpty()
            && emptySince != null && !emptySince.isAfter(cutoff);
    }

    synchronized boolean endedBefore(Instant cutoff) {
        return state == SessionState.ENDED && endedAt != null && !endedAt.isAfter(cutoff);
    }

    public synchronized Optional<Participant> participant(String userId) {
        return Optional.ofNullable(participants.get(userId));
    }

    public synchronized List<Participant> participants() {
        return List.copyOf(participants.values());
    }

    /**
     * Outbound channels keyed by user id, in join order.
     */
    public synchronized Map<String, OutboundChannel> channels() {
        return new LinkedHashMap<>(channels);
    }

    public Map<String, Presence> presence() {
        return presence;
    }

    public synchronized SessionView view() {
        return new SessionView(sessionId, workflowId, createdBy, createdAt, new ArrayList<>(participants.values()),
            settings, state, state != SessionState.ENDED, pipeline != null ? pipeline.headVersion() : 0);
    }
}
