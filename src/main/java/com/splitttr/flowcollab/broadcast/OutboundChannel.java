package com.splitttr.flowcollab.broadcast;

import com.splitttr.flowcollab.message.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FIFO mailbox in front of one participant connection. Writers never block; at most one drain
 * runs at a time, so messages reach the sink in the order they were sent.
 */
public class OutboundChannel {

    private static final Logger LOG = LoggerFactory.getLogger(OutboundChannel.class);

    private final String connectionId;
    private final MessageSink sink;
    private final Executor executor;
    private final Queue<ServerMessage> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean closed;

    public OutboundChannel(String connectionId, MessageSink sink, Executor executor) {
        this.connectionId = connectionId;
        this.sink = sink;
        this.executor = executor;
    }

    public String connectionId() {
        return connectionId;
    }

    public void send(ServerMessage message) {
        if (closed) {
            return;
        }
        queue.add(message);
        schedule();
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void schedule() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            ServerMessage next;
            while ((next = queue.poll()) != null) {
                deliver(next);
            }
        } finally {
            draining.set(false);
            if (!queue.isEmpty() && !closed) {
                schedule();
            }
        }
    }

    private void deliver(ServerMessage message) {
        try {
            sink.deliver(message);
        } catch (RuntimeException e) {
            LOG.warn("Dropping {} for connection {}: {}", message.type(), connectionId, e.getMessage());
        }
    }
}
