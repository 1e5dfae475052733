package com.splitttr.flowcollab.websocket;

import com.splitttr.flowcollab.error.CollabException;
import com.splitttr.flowcollab.error.ErrorCode;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.error.NotParticipantException;
import com.splitttr.flowcollab.message.ClientMessage;
import com.splitttr.flowcollab.message.MessageCodec;
import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.security.AuthService;
import com.splitttr.flowcollab.security.Caller;
import com.splitttr.flowcollab.service.CollaborationService;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for real-time collaborative workflow editing.
 * Requires JWT authentication - user identity and role are extracted from the token.
 */
@WebSocket(path = "/ws/workflows")
public class CollaborationSocket {

    private static final Logger LOG = LoggerFactory.getLogger(CollaborationSocket.class);

    @Inject
    CollaborationService collaborationService;

    @Inject
    AuthService authService;

    // Store connection state externally since the socket instance may not persist
    private static final Map<String, ConnectionState> connectionStates = new ConcurrentHashMap<>();

    record ConnectionState(String userId, String sessionId) {}

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        if (!authService.isAuthenticated()) {
            LOG.warn("Unauthenticated WebSocket connection attempt: {}", connection.id());
            connection.closeAndAwait(new CloseReason(1008, "Authentication required"));
            return;
        }
        LOG.debug("Authenticated WebSocket opened: {} (user: {})", connection.id(), authService.getCurrentUserId());
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        // token could expire mid-session
        if (!authService.isAuthenticated()) {
            LOG.warn("Authentication expired for connection: {}", connection.id());
            connection.closeAndAwait(new CloseReason(1008, "Authentication expired"));
            return;
        }

        try {
            ClientMessage msg = MessageCodec.readClientMessage(messageJson);
            Caller caller = authService.currentCaller();
            if (msg.type() == null) {
                throw new InvalidOperationException("Message type required");
            }
            LOG.debug("Received {} from {}", msg.type(), caller.userId());

            switch (msg.type()) {
                case "join_workflow" -> handleJoin(msg, connection, caller);
                case "leave_workflow" -> handleLeave(connection, caller);
                case "submit_operation" -> handleSubmit(msg, connection, caller);
                case "presence_update" -> collaborationService.updatePresence(joined(connection, caller).sessionId(),
                    caller.userId(), msg.presence());
                case "fetch_operations" -> handleFetch(msg, connection, caller);
                case "update_settings" -> collaborationService.updateSettings(joined(connection, caller).sessionId(),
                    caller, msg.settings());
                case "end_session" -> collaborationService.end(joined(connection, caller).sessionId(), caller);
                case "session_stats" -> send(connection,
                    ServerMessage.stats(collaborationService.stats(joined(connection, caller).sessionId())));
                default -> throw new InvalidOperationException("Unknown message type " + msg.type());
            }
        } catch (CollabException e) {
            LOG.debug("Request from {} failed: {} {}", connection.id(), e.code(), e.getMessage());
            sendError(connection, e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure handling message on {}", connection.id(), e);
            send(connection, ServerMessage.error(ErrorCode.INTERNAL.name(), "Internal error"));
        }
    }

    private void handleJoin(ClientMessage msg, WebSocketConnection connection, Caller caller) {
        ConnectionState previous = connectionStates.get(connection.id());
        if (previous != null) {
            collaborationService.leave(previous.sessionId(), previous.userId());
        }
        var result = collaborationService.join(msg.workflowId(), caller, connection.id(), msg.role(),
            msg.settings(), new WebSocketSink(connection));
        String sessionId = result.session().sessionId();
        connectionStates.put(connection.id(), new ConnectionState(caller.userId(), sessionId));
        LOG.debug("Connection {} bound to session {}", connection.id(), sessionId);
    }

    private void handleLeave(WebSocketConnection connection, Caller caller) {
        ConnectionState state = connectionStates.remove(connection.id());
        if (state == null) {
            return;
        }
        collaborationService.leave(state.sessionId(), caller.userId());
    }

    private void handleSubmit(ClientMessage msg, WebSocketConnection connection, Caller caller) {
        ConnectionState state = joined(connection, caller);
        // the outcome, or why it failed, reaches the author through the session's outbound channel
        collaborationService.submit(state.sessionId(), caller, msg.operation());
    }

    private void handleFetch(ClientMessage msg, WebSocketConnection connection, Caller caller) {
        ConnectionState state = joined(connection, caller);
        long from = msg.fromVersion() != null ? msg.fromVersion() : 1;
        var operations = collaborationService.fetchOperations(state.sessionId(), caller.userId(), from, msg.toVersion());
        send(connection, ServerMessage.operations(state.sessionId(), operations));
    }

    private ConnectionState joined(WebSocketConnection connection, Caller caller) {
        ConnectionState state = connectionStates.get(connection.id());
        if (state == null || !state.userId().equals(caller.userId())) {
            throw new NotParticipantException(state == null ? "-" : state.sessionId(), caller.userId());
        }
        return state;
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.debug("WebSocket closed: {}", connection.id());
        disconnect(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warn("WebSocket error on {}: {}", connection.id(), t.getMessage());
        disconnect(connection);
    }

    private void disconnect(WebSocketConnection connection) {
        ConnectionState state = connectionStates.remove(connection.id());
        if (state != null) {
            collaborationService.disconnect(state.sessionId(), state.userId(), connection.id());
        }
    }

    private void sendError(WebSocketConnection connection, CollabException e) {
        send(connection, ServerMessage.error(e.code().name(), e.getMessage()));
    }

    private void send(WebSocketConnection connection, ServerMessage message) {
        try {
            connection.sendTextAndAwait(MessageCodec.write(message));
        } catch (RuntimeException e) {
            LOG.warn("Could not send {} to {}: {}", message.type(), connection.id(), e.getMessage());
        }
    }
}
