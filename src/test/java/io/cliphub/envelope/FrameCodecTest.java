package io.cliphub.envelope;

import io.cliphub.core.error.ErrorKind;
import io.cliphub.core.error.HubError;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import io.cliphub.protocol.Frame;
import io.cliphub.protocol.Frame.SystemAction;
import io.cliphub.protocol.Frame.SystemEvent;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FrameCodecTest {

    private final Envelopes envelopes = new Envelopes(new IdAllocator(),
            Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC));
    private final FrameCodec codec = new FrameCodec(envelopes);

    @Test
    void decodesSubscribeRequest() {
        final Result<Frame> r = codec.decode("{\"type\":\"system-request\",\"action\":\"subscribe\",\"id\":7,\"topics\":[\"c\",\"p\"]}");

        final Frame.SystemRequest req = assertInstanceOf(Frame.SystemRequest.class, r.value());
        assertEquals(7L, req.id());
        assertEquals(SystemAction.SUBSCRIBE, req.action());
        assertEquals(List.of("c", "p"), req.topics());
    }

    @Test
    void allocatesIdAndTimestampWhenMissing() {
        final Frame frame = codec.decode("{\"type\":\"system-request\",\"action\":\"ping\"}").value();

        assertTrue(frame.id() > 0);
        assertEquals("2024-05-01T10:15:30Z", frame.ts());
    }

    @Test
    void rejectsUnknownTypeAndAction() {
        assertEquals(ErrorKind.UNKNOWN_TYPE, codec.decode("{\"type\":\"bogus\"}").error().kind());
        assertEquals("unknown message type: bogus", codec.decode("{\"type\":\"bogus\"}").error().message());
        assertEquals("unknown system action: jump",
                codec.decode("{\"type\":\"system-request\",\"action\":\"jump\"}").error().message());
        assertEquals(ErrorKind.UNKNOWN_ACTION,
                codec.decode("{\"type\":\"request\",\"action\":\"cast\"}").error().kind());
    }

    @Test
    void rejectsMalformedJsonAndNonObjects() {
        assertEquals(ErrorKind.VALIDATION, codec.decode("{not json").error().kind());
        assertEquals(ErrorKind.VALIDATION, codec.decode("[1,2]").error().kind());
        assertEquals(ErrorKind.VALIDATION,
                codec.decode("{\"type\":\"system-request\",\"action\":\"subscribe\",\"topics\":\"c\"}").error().kind());
    }

    @Test
    void decodesBroadcastWithSeveralItems() {
        final String text = new JSONObject()
                .put("type", "broadcast").put("action", "publish").put("id", 3)
                .put("data", new JSONArray()
                        .put(new JSONObject().put("topic", "c").put("value", "a"))
                        .put(new JSONObject().put("topic", "p").put("value", "b")))
                .toString();

        final Frame.Broadcast b = assertInstanceOf(Frame.Broadcast.class, codec.decode(text).value());

        assertEquals(List.of(DataItem.of("c", "a"), DataItem.of("p", "b")), b.data());
    }

    @Test
    void broadcastEncodesSingleItemAsObject() {
        final JSONObject json = codec.toJson(envelopes.broadcast(DataItem.of("c", "hello"), new JSONObject().put("app", "t")));

        assertEquals("broadcast", json.getString("type"));
        assertEquals("publish", json.getString("action"));
        assertEquals("hello", json.getJSONObject("data").getString("value"));
        assertEquals("t", json.getJSONObject("meta").getString("app"));
        assertTrue(json.getLong("id") > 0);
        assertEquals("2024-05-01T10:15:30Z", json.getString("ts"));
    }

    @Test
    void responsesReuseRequestId() {
        final JSONObject pong = codec.toJson(envelopes.systemResponse(41, SystemEvent.PONG, List.of()));
        final JSONObject err = codec.toJson(envelopes.error(42, "get", HubError.notFound("zz")));

        assertEquals(41L, pong.getLong("id"));
        assertEquals("pong", pong.getString("event"));
        assertFalse(pong.has("topics"));

        assertEquals(42L, err.getLong("id"));
        assertEquals("error", err.getString("event"));
        assertEquals("topic 'zz' not found", err.getJSONObject("error").getString("message"));
        assertEquals("not_found", err.getJSONObject("error").getString("code"));
    }

    @Test
    void encodedFramesDecodeBack() {
        final Frame.CallRequest call = envelopes.call("publish",
                new JSONObject().put("data", new JSONObject().put("topic", "c").put("value", 1)),
                new JSONObject().put("app", "bridge"));

        final Frame.CallRequest back = assertInstanceOf(Frame.CallRequest.class, codec.decode(codec.encode(call)).value());

        assertEquals(call.id(), back.id());
        assertEquals("publish", back.method());
        assertEquals("bridge", back.meta().getString("app"));
    }

    @Test
    void idsAreMonotonic() {
        final long a = envelopes.ping().id();
        final long b = envelopes.ping().id();
        assertTrue(b > a);
    }
}
