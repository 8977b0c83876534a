package io.cliphub.protocol;

import io.cliphub.core.model.DataItem;
import org.json.JSONObject;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of wire frames exchanged over a hub connection. Every frame carries an id and an
 * ISO-8601 UTC timestamp.
 */
public sealed interface Frame
        permits Frame.SystemRequest, Frame.CallRequest, Frame.ClientEvent,
        Frame.SystemResponse, Frame.CallResponse, Frame.Broadcast {

    long id();

    String ts();

    FrameType type();

    enum FrameType {
        SYSTEM_REQUEST("system-request"),
        REQUEST("request"),
        EVENT("event"),
        SYSTEM_RESPONSE("system-response"),
        RESPONSE("response"),
        BROADCAST("broadcast");

        private final String wire;

        FrameType(final String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static Optional<FrameType> fromWire(final String wire) {
            return Arrays.stream(values()).filter(t -> t.wire.equals(wire)).findFirst();
        }
    }

    enum SystemAction {
        SUBSCRIBE("subscribe"),
        UNSUBSCRIBE("unsubscribe"),
        PING("ping");

        private final String wire;

        SystemAction(final String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static Optional<SystemAction> fromWire(final String wire) {
            return Arrays.stream(values()).filter(a -> a.wire.equals(wire)).findFirst();
        }
    }

    enum SystemEvent {
        SUBSCRIBED("subscribed"),
        UNSUBSCRIBED("unsubscribed"),
        PONG("pong");

        private final String wire;

        SystemEvent(final String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static Optional<SystemEvent> fromWire(final String wire) {
            return Arrays.stream(values()).filter(e -> e.wire.equals(wire)).findFirst();
        }
    }

    enum CallEvent {
        RETURN("return"),
        ERROR("error");

        private final String wire;

        CallEvent(final String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static Optional<CallEvent> fromWire(final String wire) {
            return Arrays.stream(values()).filter(e -> e.wire.equals(wire)).findFirst();
        }
    }

    /** {@code system-request}: registry mutation or liveness probe. */
    record SystemRequest(long id, SystemAction action, List<String> topics, String ts) implements Frame {
        public SystemRequest {
            topics = topics == null ? List.of() : List.copyOf(topics);
        }

        @Override
        public FrameType type() {
            return FrameType.SYSTEM_REQUEST;
        }
    }

    /** {@code request} with {@code action:"call"}. */
    record CallRequest(long id, String method, JSONObject params, JSONObject meta, String ts) implements Frame {
        public CallRequest {
            params = params == null ? new JSONObject() : params;
            meta = meta == null ? new JSONObject() : meta;
        }

        @Override
        public FrameType type() {
            return FrameType.REQUEST;
        }
    }

    /** {@code event}: client notification, accepted and ignored by the hub. */
    record ClientEvent(long id, JSONObject body, String ts) implements Frame {
        @Override
        public FrameType type() {
            return FrameType.EVENT;
        }
    }

    /** {@code system-response}; {@code topics} is empty for {@code pong}. */
    record SystemResponse(long id, SystemEvent event, List<String> topics, String ts) implements Frame {
        public SystemResponse {
            topics = topics == null ? List.of() : List.copyOf(topics);
        }

        @Override
        public FrameType type() {
            return FrameType.SYSTEM_RESPONSE;
        }
    }

    /**
     * {@code response}; {@code value} is set for {@code return}, {@code error} for {@code error}.
     */
    record CallResponse(long id, CallEvent event, String method, Object value, JSONObject error, String ts)
            implements Frame {
        @Override
        public FrameType type() {
            return FrameType.RESPONSE;
        }

        public boolean isError() {
            return event == CallEvent.ERROR;
        }
    }

    /**
     * {@code broadcast} with {@code action:"publish"}. The hub always sends one item; peers may send several.
     */
    record Broadcast(long id, List<DataItem> data, JSONObject meta, String ts) implements Frame {
        public Broadcast {
            data = List.copyOf(data);
            meta = meta == null ? new JSONObject() : meta;
        }

        @Override
        public FrameType type() {
            return FrameType.BROADCAST;
        }
    }
}
