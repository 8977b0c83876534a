package io.cliphub.hub;

import io.cliphub.connection.Connection;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;
import io.cliphub.envelope.Envelopes;
import io.cliphub.protocol.Frame;
import io.cliphub.registry.SubscriptionRegistry;
import io.cliphub.registry.TopicStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;

/**
 * Sole consumer of the bus and sole owner of the {@link TopicStore} and {@link SubscriptionRegistry}.
 * <p>
 * Commands are processed one at a time to completion, so broadcasts are always computed against a
 * consistent subscriber set and no locks guard the state.
 */
@Slf4j
final class Dispatcher implements Runnable {

    private final BlockingQueue<BusCommand> bus;
    private final Envelopes envelopes;
    private final List<DispatchListener> listeners;

    private final TopicStore store = new TopicStore();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private long processed;
    private long malformed;

    Dispatcher(final BlockingQueue<BusCommand> bus,
               final Envelopes envelopes,
               final List<DispatchListener> listeners) {
        this.bus = bus;
        this.envelopes = envelopes;
        this.listeners = listeners;
    }

    @Override
    public void run() {
        log.info("Dispatcher started");
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final BusCommand command = bus.take();
                try {
                    process(command);
                } catch (final RuntimeException e) {
                    log.error("Dispatcher failed on {}", command.getClass().getSimpleName(), e);
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Dispatcher stopped");
    }

    private void process(final BusCommand command) {
        if (command instanceof BusCommand.Publish p) {
            apply(p.message());
        } else if (command instanceof BusCommand.Subscribe s) {
            if (s.connection().isClosed()) {
                s.result().complete(List.of());
                return;
            }
            s.result().complete(registry.subscribe(s.connection(), s.topics()));
        } else if (command instanceof BusCommand.Unsubscribe u) {
            u.result().complete(registry.unsubscribe(u.connection(), u.topics()));
        } else if (command instanceof BusCommand.Disconnect d) {
            /* registry removal and sender cancellation form one step */
            final List<String> dropped = registry.dropConnection(d.connection());
            d.connection().close();
            d.result().complete(dropped);
        } else if (command instanceof BusCommand.Get g) {
            g.result().complete(store.getTopic(g.topic()));
        } else if (command instanceof BusCommand.Snapshot s) {
            s.result().complete(new HubSnapshot(
                    registry.topics(),
                    registry.subscriptionCount(),
                    registry.connectionCount(),
                    store.size(),
                    processed,
                    malformed));
        }
    }

    private void apply(final BusMessage message) {
        processed++;

        for (final DataItem item : message.items()) {
            if (!item.hasTopic()) {
                malformed++;
                continue;
            }
            store.setTopic(item.topic(), item);

            final Set<Connection> subscribers = registry.subscribers(item.topic());
            if (subscribers.isEmpty()) continue;

            final Frame broadcast = envelopes.broadcast(item, message.meta());
            for (final Connection conn : subscribers) {
                // echo suppression applies to the originating connection only
                if (conn == message.source()) continue;
                conn.enqueue(broadcast);
            }
        }

        for (final DataItem item : message.items()) {
            for (final DispatchListener listener : listeners) {
                try {
                    listener.onItemApplied(item);
                } catch (final RuntimeException e) {
                    log.debug("Item hook {} failed for topic {}", listener.getClass().getSimpleName(), item.topic(), e);
                }
            }
        }

        for (final DispatchListener listener : listeners) {
            try {
                listener.onMessageApplied(message);
            } catch (final RuntimeException e) {
                log.debug("Message hook {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
