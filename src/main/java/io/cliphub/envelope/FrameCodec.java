package io.cliphub.envelope;

import io.cliphub.core.error.ErrorKind;
import io.cliphub.core.error.HubError;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import io.cliphub.protocol.Frame;
import io.cliphub.protocol.Frame.CallEvent;
import io.cliphub.protocol.Frame.FrameType;
import io.cliphub.protocol.Frame.SystemAction;
import io.cliphub.protocol.Frame.SystemEvent;
import lombok.RequiredArgsConstructor;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON codec for {@link Frame}s.
 * <p>
 * Decoding rejects unknown {@code type}/{@code action} combinations explicitly. Missing ids are
 * allocated and missing timestamps are stamped with the current time.
 */
@RequiredArgsConstructor
public final class FrameCodec {

    private static final String CALL = "call";
    private static final String PUBLISH = "publish";

    private final Envelopes envelopes;

    public Result<JSONObject> parse(final String text) {
        try {
            final Object value = new JSONTokener(text).nextValue();
            if (value instanceof JSONObject json) return Result.ok(json);
            return Result.err(HubError.validation("frame must be a JSON object"));
        } catch (final JSONException e) {
            return Result.err(HubError.validation("invalid JSON: " + e.getMessage()));
        }
    }

    public Result<Frame> decode(final String text) {
        final Result<JSONObject> parsed = parse(text);
        if (!parsed.isOk()) return Result.err(parsed.error());
        return decode(parsed.value());
    }

    public Result<Frame> decode(final JSONObject json) {
        final String rawType = json.optString("type", "");
        final Optional<FrameType> type = FrameType.fromWire(rawType);
        if (type.isEmpty()) {
            return Result.err(ErrorKind.UNKNOWN_TYPE, "unknown message type: " + rawType);
        }

        final long id = envelopes.getIds().orNext(json.optLong("id", 0L));
        final String ts = json.optString("ts", "").isEmpty() ? envelopes.timestamp() : json.optString("ts");
        final String action = json.optString("action", "");

        switch (type.get()) {
            case SYSTEM_REQUEST -> {
                final Optional<SystemAction> a = SystemAction.fromWire(action);
                if (a.isEmpty()) return Result.err(ErrorKind.UNKNOWN_ACTION, "unknown system action: " + action);
                final Result<List<String>> topics = topics(json);
                if (!topics.isOk()) return Result.err(topics.error());
                return Result.ok(new Frame.SystemRequest(id, a.get(), topics.value(), ts));
            }
            case REQUEST -> {
                if (!CALL.equals(action)) return Result.err(ErrorKind.UNKNOWN_ACTION, "unknown request action: " + action);
                final String method = json.optString("method", "");
                return Result.ok(new Frame.CallRequest(id, method,
                        json.optJSONObject("params"), json.optJSONObject("meta"), ts));
            }
            case EVENT -> {
                return Result.ok(new Frame.ClientEvent(id, json, ts));
            }
            case SYSTEM_RESPONSE -> {
                final String raw = json.optString("event", "");
                final Optional<SystemEvent> e = SystemEvent.fromWire(raw);
                if (e.isEmpty()) return Result.err(ErrorKind.UNKNOWN_ACTION, "unknown system event: " + raw);
                final Result<List<String>> topics = topics(json);
                if (!topics.isOk()) return Result.err(topics.error());
                return Result.ok(new Frame.SystemResponse(id, e.get(), topics.value(), ts));
            }
            case RESPONSE -> {
                final String raw = json.optString("event", "");
                final Optional<CallEvent> e = CallEvent.fromWire(raw);
                if (e.isEmpty()) return Result.err(ErrorKind.UNKNOWN_ACTION, "unknown response event: " + raw);
                return Result.ok(new Frame.CallResponse(id, e.get(), json.optString("method", null),
                        json.opt("value"), json.optJSONObject("error"), ts));
            }
            case BROADCAST -> {
                if (!PUBLISH.equals(action)) return Result.err(ErrorKind.UNKNOWN_ACTION, "unknown broadcast action: " + action);
                final Result<List<DataItem>> items = DataItems.normalize(json.opt("data"), null);
                if (!items.isOk()) return Result.err(items.error());
                return Result.ok(new Frame.Broadcast(id, items.value(), json.optJSONObject("meta"), ts));
            }
            default -> {
                return Result.err(ErrorKind.UNKNOWN_TYPE, "unknown message type: " + rawType);
            }
        }
    }

    public String encode(final Frame frame) {
        return toJson(frame).toString();
    }

    public JSONObject toJson(final Frame frame) {
        final JSONObject json = new JSONObject()
                .put("type", frame.type().wire())
                .put("id", frame.id())
                .put("ts", frame.ts());

        if (frame instanceof Frame.SystemRequest r) {
            json.put("action", r.action().wire());
            if (r.action() != SystemAction.PING) json.put("topics", new JSONArray(r.topics()));
        } else if (frame instanceof Frame.CallRequest r) {
            json.put("action", CALL)
                    .put("method", r.method())
                    .put("params", r.params())
                    .put("meta", r.meta());
        } else if (frame instanceof Frame.ClientEvent e) {
            for (final String key : e.body().keySet()) {
                if (!json.has(key)) json.put(key, e.body().get(key));
            }
        } else if (frame instanceof Frame.SystemResponse r) {
            json.put("event", r.event().wire());
            if (r.event() != SystemEvent.PONG) json.put("topics", new JSONArray(r.topics()));
        } else if (frame instanceof Frame.CallResponse r) {
            json.put("event", r.event().wire()).put("method", r.method() == null ? JSONObject.NULL : r.method());
            if (r.isError()) json.put("error", r.error());
            else json.put("value", r.value() == null ? JSONObject.NULL : r.value());
        } else if (frame instanceof Frame.Broadcast b) {
            json.put("action", PUBLISH).put("meta", b.meta());
            if (b.data().size() == 1) {
                json.put("data", b.data().get(0).toJson());
            } else {
                final JSONArray data = new JSONArray();
                b.data().forEach(item -> data.put(item.toJson()));
                json.put("data", data);
            }
        }
        return json;
    }

    private static Result<List<String>> topics(final JSONObject json) {
        final Object raw = json.opt("topics");
        if (raw == null || JSONObject.NULL.equals(raw)) return Result.ok(List.of());
        if (!(raw instanceof JSONArray array)) {
            return Result.err(HubError.validation("topics must be an array of strings"));
        }
        final List<String> topics = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            if (!(array.opt(i) instanceof String topic) || topic.isEmpty()) {
                return Result.err(HubError.validation("topics must be an array of strings"));
            }
            topics.add(topic);
        }
        return Result.ok(topics);
    }
}
