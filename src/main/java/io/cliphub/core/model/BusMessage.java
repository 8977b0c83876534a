package io.cliphub.core.model;

import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * Unit of work on the central bus. Consumed exactly once by the dispatcher, never persisted.
 */
public record BusMessage(Source source, JSONObject meta, List<DataItem> items) {

    public BusMessage {
        source = source == null ? Source.NONE : source;
        meta = meta == null ? new JSONObject() : meta;
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }
}
