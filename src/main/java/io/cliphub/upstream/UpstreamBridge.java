package io.cliphub.upstream;

import io.cliphub.core.error.Result;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;
import io.cliphub.core.model.Source;
import io.cliphub.envelope.Envelopes;
import io.cliphub.envelope.FrameCodec;
import io.cliphub.hub.BusPublisher;
import io.cliphub.hub.DispatchListener;
import io.cliphub.protocol.Frame;
import io.cliphub.upstream.client.UpstreamConnector;
import io.cliphub.upstream.client.UpstreamSession;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one WebSocket link to a peer hub open and relays updates both ways.
 * <p>
 * Inbound broadcasts are injected on the local bus with source {@link Source#UPSTREAM}; every applied
 * message with any other source is forwarded as a {@code publish} call. Messages that came from the
 * peer are never sent back to it.
 * <p>
 * Inbound text arrives on the connector's I/O thread; injection onto the bus happens on a separate
 * ingest thread so a full bus never stalls the link itself.
 */
@Slf4j
public final class UpstreamBridge implements DispatchListener, AutoCloseable {

    private final BusPublisher bus;
    private final UpstreamConnector connector;
    private final Envelopes envelopes;
    private final FrameCodec codec;
    private final Settings settings;
    private final UpstreamLink link;
    private final ExecutorService ingest;

    private volatile UpstreamSession session;
    private volatile boolean running;
    private volatile Thread loop;

    public record Settings(boolean enabled,
                           URI url,
                           List<String> topics,
                           Duration retryDelay,
                           Duration connectTimeout) {

        public Settings {
            topics = List.copyOf(topics);
        }
    }

    public UpstreamBridge(final BusPublisher bus,
                          final UpstreamConnector connector,
                          final Envelopes envelopes,
                          final Settings settings) {
        this.bus = bus;
        this.connector = connector;
        this.envelopes = envelopes;
        this.codec = new FrameCodec(envelopes);
        this.settings = settings;
        this.link = new UpstreamLink(settings.url(), settings.topics());
        this.ingest = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "upstream-ingest");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!settings.enabled()) {
            log.info("Upstream bridge disabled");
            return;
        }

        running = true;
        final Thread t = new Thread(this::run, "upstream-bridge");
        t.setDaemon(true);
        loop = t;
        t.start();
        log.info("Upstream bridge started for {} topics {}", settings.url(), settings.topics());
    }

    private void run() {
        while (running) {
            try {
                connectOnce();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final IOException | RuntimeException e) {
                log.debug("Upstream {} unavailable: {}", settings.url(), e.toString());
            } finally {
                session = null;
                link.markDisconnected();
            }

            if (!running) break;
            try {
                Thread.sleep(settings.retryDelay().toMillis());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Upstream bridge stopped");
    }

    private void connectOnce() throws IOException, InterruptedException {
        try (final UpstreamSession s = connector.connect(settings.url(), this::onText, settings.connectTimeout())) {
            session = s;
            link.markConnected(envelopes.timestamp());
            log.info("Connected to upstream {}", settings.url());

            s.send(codec.encode(envelopes.subscribe(settings.topics())));
            s.awaitClose();
            log.info("Upstream {} closed the link", settings.url());
        }
    }

    /**
     * Inbound text from the peer. Only {@code broadcast}/{@code publish} frames are injected.
     */
    void onText(final String text) {
        final Result<Frame> decoded = codec.decode(text);
        if (!decoded.isOk()) {
            log.trace("Ignoring upstream frame: {}", decoded.error().message());
            return;
        }
        if (!(decoded.value() instanceof Frame.Broadcast broadcast)) return;

        final BusMessage message = new BusMessage(Source.UPSTREAM, broadcast.meta(), broadcast.data());
        try {
            ingest.execute(() -> inject(message));
        } catch (final RejectedExecutionException e) {
            log.trace("Bridge closed; dropping upstream broadcast {}", broadcast.id());
        }
    }

    private void inject(final BusMessage message) {
        try {
            bus.submit(message);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onMessageApplied(final BusMessage message) {
        forward(message);
    }

    /**
     * Sends the message to the peer as a {@code publish} call.
     *
     * @return {@code true} if a frame was written
     */
    boolean forward(final BusMessage message) {
        if (!settings.enabled() || message.source() == Source.UPSTREAM) return false;

        final UpstreamSession s = session;
        if (!link.isConnected() || s == null) return false;

        final JSONArray data = new JSONArray();
        for (final DataItem item : message.items()) data.put(item.toJson());

        try {
            s.send(codec.encode(envelopes.call("publish", new JSONObject().put("data", data), message.meta())));
            return true;
        } catch (final IOException e) {
            log.debug("Forward to upstream failed: {}", e.toString());
            return false;
        }
    }

    public boolean isConnected() {
        return link.isConnected();
    }

    public JSONObject status() {
        return new JSONObject()
                .put("enabled", settings.enabled())
                .put("url", String.valueOf(settings.url()))
                .put("topics", new JSONArray(settings.topics()))
                .put("connected", link.isConnected())
                .put("connectedSince", link.getConnectedSince() == null ? JSONObject.NULL : link.getConnectedSince());
    }

    @Override
    public void close() {
        running = false;
        final UpstreamSession s = session;
        if (s != null) s.close();

        final Thread t = loop;
        try {
            if (t != null) {
                t.interrupt();
                t.join(settings.connectTimeout().plusSeconds(2).toMillis());
            }
            ingest.shutdown();
            if (!ingest.awaitTermination(1, TimeUnit.SECONDS)) ingest.shutdownNow();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            ingest.shutdownNow();
        }
    }
}
