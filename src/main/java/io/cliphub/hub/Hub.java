package io.cliphub.hub;

import io.cliphub.connection.Connection;
import io.cliphub.connection.FrameSink;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;
import io.cliphub.core.model.Source;
import io.cliphub.envelope.Envelopes;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point to the synchronization hub.
 * <p>
 * All producers (connections, the REST publish route, the selection engine, the upstream bridge)
 * submit onto one bounded bus; a single dispatcher thread drains it. Every method here is safe to
 * call from any thread.
 */
@Slf4j
public final class Hub implements BusPublisher, AutoCloseable {

    @Getter private final Envelopes envelopes;
    private final int outboundCapacity;

    private final BlockingQueue<BusCommand> bus;
    private final List<DispatchListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong connectionIds = new AtomicLong(1L);
    private final ExecutorService senders;
    private final Thread dispatcherThread;

    public Hub(final Envelopes envelopes, final int busCapacity, final int outboundCapacity) {
        if (busCapacity <= 0) throw new IllegalArgumentException("busCapacity must be > 0");
        if (outboundCapacity <= 0) throw new IllegalArgumentException("outboundCapacity must be > 0");

        this.envelopes = envelopes;
        this.outboundCapacity = outboundCapacity;
        this.bus = new LinkedBlockingQueue<>(busCapacity);

        final AtomicInteger senderSeq = new AtomicInteger();
        this.senders = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "hub-sender-" + senderSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.dispatcherThread = new Thread(new Dispatcher(bus, envelopes, listeners), "hub-dispatcher");
        this.dispatcherThread.setDaemon(true);
    }

    public void start() {
        dispatcherThread.start();
    }

    /**
     * Registers a hook. Listeners added after {@link #start()} see subsequent messages only.
     */
    public void addListener(final DispatchListener listener) {
        listeners.add(listener);
    }

    /**
     * Creates a connection for a newly attached client and starts its sender loop.
     */
    public Connection attach(final FrameSink sink) {
        final Connection conn = new Connection(connectionIds.getAndIncrement(), sink, outboundCapacity);
        conn.start(senders);
        log.debug("Attached {}", conn);
        return conn;
    }

    /**
     * Blocks while the bus is full. For background producers only, never for I/O threads.
     */
    @Override
    public void submit(final BusMessage message) throws InterruptedException {
        bus.put(new BusCommand.Publish(message));
    }

    /**
     * Non-blocking publish for I/O threads.
     *
     * @return {@code false} if the bus is full and the message was not accepted
     */
    public boolean publish(final Source source, final JSONObject meta, final List<DataItem> items) {
        return bus.offer(new BusCommand.Publish(new BusMessage(source, meta, items)));
    }

    public CompletableFuture<List<String>> subscribe(final Connection conn, final Collection<String> topics) {
        final CompletableFuture<List<String>> result = new CompletableFuture<>();
        enqueue(new BusCommand.Subscribe(conn, List.copyOf(topics), result), result);
        return result;
    }

    public CompletableFuture<List<String>> unsubscribe(final Connection conn, final Collection<String> topics) {
        final CompletableFuture<List<String>> result = new CompletableFuture<>();
        enqueue(new BusCommand.Unsubscribe(conn, List.copyOf(topics), result), result);
        return result;
    }

    /**
     * Removes the connection from every topic and cancels its sender loop, as one dispatcher step.
     *
     * @return the topics it was subscribed to
     */
    public CompletableFuture<List<String>> disconnect(final Connection conn) {
        final CompletableFuture<List<String>> result = new CompletableFuture<>();
        enqueue(new BusCommand.Disconnect(conn, result), result);
        return result;
    }

    /**
     * Current stored item for {@code topic}; reads are ordered with publishes on the bus.
     */
    public CompletableFuture<Optional<DataItem>> get(final String topic) {
        final CompletableFuture<Optional<DataItem>> result = new CompletableFuture<>();
        enqueue(new BusCommand.Get(topic, result), result);
        return result;
    }

    public CompletableFuture<HubSnapshot> snapshot() {
        final CompletableFuture<HubSnapshot> result = new CompletableFuture<>();
        enqueue(new BusCommand.Snapshot(result), result);
        return result;
    }

    /* never blocks: callers are mostly Netty event loops */
    private void enqueue(final BusCommand command, final CompletableFuture<?> result) {
        if (!bus.offer(command)) {
            result.completeExceptionally(new RejectedExecutionException("bus full"));
        }
    }

    @Override
    public void close() {
        dispatcherThread.interrupt();
        try {
            dispatcherThread.join(2_000L);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        senders.shutdownNow();
        log.info("Hub closed");
    }
}
