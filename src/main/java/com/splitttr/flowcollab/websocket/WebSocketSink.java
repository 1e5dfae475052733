package com.splitttr.flowcollab.websocket;

import com.splitttr.flowcollab.broadcast.MessageSink;
import com.splitttr.flowcollab.message.MessageCodec;
import com.splitttr.flowcollab.message.ServerMessage;
import io.quarkus.websockets.next.WebSocketConnection;

/**
 * Writes server messages to one WebSocket connection. Called from the fan-out executor, one
 * message at a time per connection.
 */
class WebSocketSink implements MessageSink {

    private final WebSocketConnection connection;

    WebSocketSink(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public void deliver(ServerMessage message) {
        if (connection.isClosed()) {
            return;
        }
        connection.sendTextAndAwait(MessageCodec.write(message));
    }
}
