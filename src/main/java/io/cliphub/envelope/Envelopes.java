package io.cliphub.envelope;

import io.cliphub.core.error.HubError;
import io.cliphub.core.model.DataItem;
import io.cliphub.protocol.Frame;
import io.cliphub.protocol.Frame.CallEvent;
import io.cliphub.protocol.Frame.SystemAction;
import io.cliphub.protocol.Frame.SystemEvent;
import lombok.Getter;
import org.json.JSONObject;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Builds outbound frames with allocated ids and UTC timestamps.
 * <p>
 * Responses reuse the id of the request they answer; every other frame gets a fresh id.
 */
public final class Envelopes {

    @Getter private final IdAllocator ids;
    private final Clock clock;

    public Envelopes() {
        this(new IdAllocator(), Clock.systemUTC());
    }

    public Envelopes(final IdAllocator ids, final Clock clock) {
        this.ids = ids;
        this.clock = clock;
    }

    public String timestamp() {
        return OffsetDateTime.now(clock)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public Frame.Broadcast broadcast(final DataItem item, final JSONObject meta) {
        return new Frame.Broadcast(ids.next(), List.of(item), meta, timestamp());
    }

    public Frame.SystemRequest subscribe(final List<String> topics) {
        return new Frame.SystemRequest(ids.next(), SystemAction.SUBSCRIBE, topics, timestamp());
    }

    public Frame.SystemRequest ping() {
        return new Frame.SystemRequest(ids.next(), SystemAction.PING, List.of(), timestamp());
    }

    public Frame.CallRequest call(final String method, final JSONObject params, final JSONObject meta) {
        return new Frame.CallRequest(ids.next(), method, params, meta, timestamp());
    }

    public Frame.SystemResponse systemResponse(final long requestId,
                                               final SystemEvent event,
                                               final List<String> topics) {
        return new Frame.SystemResponse(requestId, event, topics, timestamp());
    }

    public Frame.CallResponse returnValue(final long requestId, final String method, final Object value) {
        return new Frame.CallResponse(requestId, CallEvent.RETURN, method, value, null, timestamp());
    }

    public Frame.CallResponse error(final long requestId, final String method, final HubError error) {
        final JSONObject body = new JSONObject()
                .put("message", error.message())
                .put("code", error.kind().name().toLowerCase(Locale.ROOT));
        return new Frame.CallResponse(requestId, CallEvent.ERROR, method, null, body, timestamp());
    }
}
