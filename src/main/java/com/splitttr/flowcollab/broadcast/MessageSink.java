package com.splitttr.flowcollab.broadcast;

import com.splitttr.flowcollab.message.ServerMessage;

/**
 * Transport end of one participant connection.
 */
public interface MessageSink {

    void deliver(ServerMessage message);
}
