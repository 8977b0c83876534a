package io.cliphub.registry;

import io.cliphub.connection.Connection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topic to subscriber mapping, plus the reverse index used to tear a connection down in one step.
 * <p>
 * Topics with no remaining subscribers are removed. Not thread-safe: only the dispatcher thread
 * mutates or reads it.
 */
public final class SubscriptionRegistry {
    private final Map<String, Set<Connection>> subscribers = new HashMap<>();
    private final Map<Connection, Set<String>> byConnection = new HashMap<>();

    /**
     * Idempotent; topics the connection already follows are not reported again.
     *
     * @return topics newly subscribed, in request order
     */
    public List<String> subscribe(final Connection conn, final Collection<String> topics) {
        final List<String> added = new ArrayList<>();
        for (final String topic : topics) {
            if (subscribers.computeIfAbsent(topic, t -> new LinkedHashSet<>()).add(conn)) {
                byConnection.computeIfAbsent(conn, c -> new LinkedHashSet<>()).add(topic);
                added.add(topic);
            }
        }
        return added;
    }

    /**
     * Idempotent; topics the connection did not follow are ignored.
     *
     * @return topics actually removed, in request order
     */
    public List<String> unsubscribe(final Connection conn, final Collection<String> topics) {
        final List<String> removed = new ArrayList<>();
        for (final String topic : topics) {
            final Set<Connection> subs = subscribers.get(topic);
            if (subs == null || !subs.remove(conn)) continue;

            removed.add(topic);
            if (subs.isEmpty()) subscribers.remove(topic);
        }

        final Set<String> own = byConnection.get(conn);
        if (own != null) {
            own.removeAll(removed);
            if (own.isEmpty()) byConnection.remove(conn);
        }
        return removed;
    }

    /**
     * Removes {@code conn} from every topic it follows.
     *
     * @return the topics it was removed from
     */
    public List<String> dropConnection(final Connection conn) {
        final Set<String> own = byConnection.get(conn);
        if (own == null) return List.of();
        return unsubscribe(conn, new ArrayList<>(own));
    }

    public Set<Connection> subscribers(final String topic) {
        final Set<Connection> subs = subscribers.get(topic);
        return subs == null ? Set.of() : Collections.unmodifiableSet(subs);
    }

    public List<String> topics() {
        final List<String> names = new ArrayList<>(subscribers.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Sum of subscriber-set sizes across topics.
     */
    public int subscriptionCount() {
        int total = 0;
        for (final Set<Connection> subs : subscribers.values()) total += subs.size();
        return total;
    }

    public int connectionCount() {
        return byConnection.size();
    }
}
