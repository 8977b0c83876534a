package io.cliphub.selection;

import io.cliphub.core.error.Result;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;
import io.cliphub.core.model.Source;
import io.cliphub.core.queue.DropOldestQueue;
import io.cliphub.envelope.DataItems;
import io.cliphub.envelope.Envelopes;
import io.cliphub.hub.BusPublisher;
import io.cliphub.hub.DispatchListener;
import io.cliphub.selection.buffer.SelectionBuffer;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors a fixed set of topics to and from the external selection buffers.
 * <p>
 * One loop handles both directions: it waits up to the poll interval for an update notification from
 * the dispatcher and writes it out, then polls every mirrored selection. A changed read is republished
 * on the bus unless it equals the last value the engine itself wrote, which is how writes coming back
 * through the selection are kept from looping.
 */
@Slf4j
public final class SelectionEngine implements DispatchListener, AutoCloseable {

    public static final String APP = "selection-engine";

    private final BusPublisher bus;
    private final SelectionBuffer buffer;
    private final Envelopes envelopes;
    private final Settings settings;

    private final Map<String, Selection> mirrored;
    private final Map<Selection, SlotState> slots = new EnumMap<>(Selection.class);
    private final DropOldestQueue<DataItem> notifications;

    private volatile boolean enabled;
    private volatile boolean running;
    private volatile String lastPollTs;
    private volatile SelectionHealth health;
    private volatile Thread loop;

    /**
     * @param enabled        operator switch; the tool must also be available
     * @param topics         topic to selection mapping, iteration order is poll order
     * @param pollInterval   wait for a notification before polling
     * @param readTimeout    hard deadline per read
     * @param writeTimeout   hard deadline per write
     * @param queueCapacity  notification queue bound, oldest dropped on overflow
     */
    public record Settings(boolean enabled,
                           Map<String, Selection> topics,
                           Duration pollInterval,
                           Duration readTimeout,
                           Duration writeTimeout,
                           int queueCapacity) {

        public Settings {
            topics = new LinkedHashMap<>(topics);
        }
    }

    public SelectionEngine(final BusPublisher bus,
                           final SelectionBuffer buffer,
                           final Envelopes envelopes,
                           final Settings settings) {
        this.bus = bus;
        this.buffer = buffer;
        this.envelopes = envelopes;
        this.settings = settings;
        this.mirrored = settings.topics();
        this.notifications = new DropOldestQueue<>(settings.queueCapacity());
        for (final Selection sel : mirrored.values()) slots.put(sel, new SlotState());
    }

    /**
     * Enables the engine when configured on and the tool is usable, then starts the loop and
     * a one-off health probe. A missing tool disables the engine without failing the hub.
     */
    public void start() {
        if (!activate()) return;

        running = true;
        final Thread t = new Thread(this::run, "selection-engine");
        t.setDaemon(true);
        loop = t;
        t.start();
        log.info("Selection engine mirroring {} via {}", mirrored.keySet(), buffer.location());
    }

    /**
     * Decides whether the engine runs at all and kicks off the health probe.
     *
     * @return {@code true} if update notifications will be accepted
     */
    boolean activate() {
        if (!settings.enabled()) {
            log.info("Selection engine disabled by configuration");
            return false;
        }

        probeHealth();
        if (!buffer.isAvailable()) {
            log.warn("Selection tool {} is missing or not executable; selection engine disabled", buffer.location());
            return false;
        }

        enabled = true;
        return true;
    }

    private void probeHealth() {
        CompletableFuture.supplyAsync(buffer::checkHealth)
                .whenComplete((h, ex) -> {
                    if (ex != null) {
                        log.warn("Selection health check failed", ex);
                        return;
                    }
                    health = h;
                    if (!h.ok()) log.warn("Selection health check failed: {}", h.toJson());
                });
    }

    /**
     * Dispatcher hook: queue the item for the loop if its topic is mirrored. Never blocks.
     */
    @Override
    public void onItemApplied(final DataItem item) {
        if (!enabled || item.topic() == null || !mirrored.containsKey(item.topic())) return;
        if (notifications.offer(item)) {
            log.trace("Selection notification queue full; dropped oldest");
        }
    }

    private void run() {
        while (running) {
            try {
                runOnce();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final RuntimeException e) {
                log.debug("Selection loop iteration failed", e);
            }
        }
        log.info("Selection engine stopped");
    }

    /**
     * One loop iteration: apply at most one notification, then poll every mirrored selection.
     */
    void runOnce() throws InterruptedException {
        final DataItem item = notifications.poll(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        if (item != null) {
            apply(item);
        } else {
            log.trace("No selection update within {}", settings.pollInterval());
        }
        poll();
    }

    private void apply(final DataItem item) {
        final Selection sel = mirrored.get(item.topic());
        if (sel == null) return;

        final byte[] data;
        try {
            data = toBytes(item);
        } catch (final IllegalArgumentException e) {
            log.debug("Cannot decode update for {}: {}", item.topic(), e.getMessage());
            return;
        }

        final Result<Void> written = buffer.write(sel, data, settings.writeTimeout());
        if (!written.isOk()) log.debug("Selection write to {} failed: {}", sel.label(), written.error().message());

        slots.get(sel).applied(data, envelopes.timestamp());
    }

    private void poll() throws InterruptedException {
        lastPollTs = envelopes.timestamp();

        for (final Map.Entry<String, Selection> e : mirrored.entrySet()) {
            final String topic = e.getKey();
            final Selection sel = e.getValue();
            final SlotState slot = slots.get(sel);

            final Result<byte[]> read = buffer.read(sel, settings.readTimeout());
            if (!read.isOk()) {
                log.debug("Selection read of {} failed: {}", sel.label(), read.error().message());
                continue;
            }

            final byte[] current = read.value();
            if (current.length == 0 || slot.isLastSeen(current)) continue;

            slot.seen(current, envelopes.timestamp());
            if (slot.isEcho(current)) continue;

            final DataItem changed = DataItem.binary(topic, Base64.getEncoder().encodeToString(current), DataItem.BASE64);
            bus.submit(new BusMessage(Source.NONE, new JSONObject().put("app", APP), List.of(changed)));
        }
    }

    /**
     * Bytes written to the selection for an item: decoded binary, UTF-8 text, or compact JSON.
     */
    static byte[] toBytes(final DataItem item) {
        if (item.isBinary()) return DataItems.decodeBinary(item);
        if (item.value() instanceof String text) return text.getBytes(StandardCharsets.UTF_8);
        return JSONObject.valueToString(item.value()).getBytes(StandardCharsets.UTF_8);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isHealthy() {
        final SelectionHealth h = health;
        return h != null && h.ok();
    }

    public JSONObject status() {
        final JSONObject seen = new JSONObject();
        final JSONObject applied = new JSONObject();
        mirrored.forEach((topic, sel) -> {
            final SlotState slot = slots.get(sel);
            if (slot.lastSeenTs() != null) seen.put(topic, slot.lastSeenTs());
            if (slot.lastAppliedTs() != null) applied.put(topic, slot.lastAppliedTs());
        });

        final SelectionHealth h = health;
        return new JSONObject()
                .put("enabled", enabled)
                .put("path", buffer.location())
                .put("intervalMs", settings.pollInterval().toMillis())
                .put("lastPollTs", lastPollTs == null ? JSONObject.NULL : lastPollTs)
                .put("lastSeenTs", seen)
                .put("lastAppliedTs", applied)
                .put("health", h == null ? JSONObject.NULL : h.toJson());
    }

    /**
     * Stops the loop after its current iteration; in-flight commands keep their own deadline.
     */
    @Override
    public void close() {
        running = false;
        enabled = false;
        final Thread t = loop;
        if (t == null) return;

        final long budget = settings.pollInterval().plus(settings.readTimeout().multipliedBy(mirrored.size()))
                .plus(settings.writeTimeout()).plusSeconds(2).toMillis();
        try {
            t.join(budget);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
