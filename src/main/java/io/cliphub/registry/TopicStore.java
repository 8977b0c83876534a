package io.cliphub.registry;

import io.cliphub.core.model.DataItem;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest value per topic, last write wins. No history, no versioning.
 * <p>
 * Not thread-safe: only the dispatcher thread touches it.
 */
public final class TopicStore {
    private final Map<String, DataItem> values = new HashMap<>();

    /**
     * Overwrites the stored item; no merge.
     */
    public void setTopic(final String topic, final DataItem item) {
        values.put(topic, item);
    }

    public Optional<DataItem> getTopic(final String topic) {
        return Optional.ofNullable(values.get(topic));
    }

    public int size() {
        return values.size();
    }
}
