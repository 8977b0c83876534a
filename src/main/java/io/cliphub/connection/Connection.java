package io.cliphub.connection;

import io.cliphub.core.model.Source;
import io.cliphub.core.queue.DropOldestQueue;
import io.cliphub.protocol.Frame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An attached client: identity, outbound queue and the sender loop draining it.
 * <p>
 * The dispatcher enqueues broadcasts and the transport enqueues replies to the client's own
 * requests; the sender loop is the only consumer. Broadcasts are bounded: once {@code capacity} of
 * them are waiting, the oldest is evicted so a stalled client never blocks delivery to others.
 * Replies are never evicted, so every request id gets its answer.
 */
@Slf4j
public final class Connection implements Source {

    @Getter private final long id;
    private final FrameSink sink;
    private final DropOldestQueue<Frame> outbound;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Future<?> sender;

    public Connection(final long id, final FrameSink sink, final int capacity) {
        this.id = id;
        this.sink = sink;
        this.outbound = new DropOldestQueue<>(capacity, Frame.Broadcast.class::isInstance);
    }

    /**
     * Starts the sender loop on {@code executor}. Called once, right after attach.
     */
    public void start(final ExecutorService executor) {
        sender = executor.submit(new ConnectionSender(this, outbound, sink));
    }

    /**
     * Queues a frame for delivery. A broadcast arriving at a full queue evicts the oldest queued
     * broadcast.
     *
     * @return {@code false} if the connection is already closed
     */
    public boolean enqueue(final Frame frame) {
        if (closed.get()) return false;
        if (outbound.offer(frame)) {
            log.trace("Outbound queue full for connection {}; dropped oldest", id);
        }
        return true;
    }

    /**
     * Cancels the sender loop and discards anything still queued. Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        final Future<?> s = sender;
        if (s != null) s.cancel(true);
        outbound.clear();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isSending() {
        final Future<?> s = sender;
        return s != null && !s.isDone();
    }

    public int pending() {
        return outbound.size();
    }

    public long dropped() {
        return outbound.droppedCount();
    }

    @Override
    public String toString() {
        return "Connection#" + id;
    }
}
