package io.cliphub.transport.impl;

import io.cliphub.connection.Connection;
import io.cliphub.core.error.ErrorKind;
import io.cliphub.core.error.HubError;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import io.cliphub.envelope.DataItems;
import io.cliphub.envelope.Envelopes;
import io.cliphub.envelope.FrameCodec;
import io.cliphub.hub.Hub;
import io.cliphub.protocol.Frame;
import io.cliphub.protocol.Frame.SystemEvent;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns inbound WebSocket text into hub operations and the frame to answer with.
 * <p>
 * Every malformed or unsupported frame is answered with an error response carrying the request id;
 * {@code event} frames get no answer.
 */
@Slf4j
public final class RequestRouter {

    static final String PUBLISH = "publish";
    static final String GET = "get";

    private final Hub hub;
    private final Envelopes envelopes;
    private final FrameCodec codec;

    public RequestRouter(final Hub hub) {
        this.hub = hub;
        this.envelopes = hub.getEnvelopes();
        this.codec = new FrameCodec(envelopes);
    }

    public CompletableFuture<Optional<Frame>> route(final Connection conn, final String text) {
        final Result<JSONObject> parsed = codec.parse(text);
        if (!parsed.isOk()) {
            return reply(envelopes.error(envelopes.getIds().next(), null, parsed.error()));
        }

        final JSONObject json = parsed.value();
        final Result<Frame> decoded = codec.decode(json);
        if (!decoded.isOk()) {
            final long id = envelopes.getIds().orNext(json.optLong("id", 0L));
            return reply(envelopes.error(id, json.optString("method", null), decoded.error()));
        }

        final Frame frame = decoded.value();
        log.trace("{} -> {}", conn, frame.type().wire());

        if (frame instanceof Frame.SystemRequest r) return system(conn, r);
        if (frame instanceof Frame.CallRequest r) return call(conn, r);
        if (frame instanceof Frame.ClientEvent) return CompletableFuture.completedFuture(Optional.empty());

        return reply(envelopes.error(frame.id(), null,
                HubError.of(ErrorKind.UNKNOWN_TYPE, "unknown message type: " + frame.type().wire())));
    }

    private CompletableFuture<Optional<Frame>> system(final Connection conn, final Frame.SystemRequest r) {
        switch (r.action()) {
            case SUBSCRIBE -> {
                return orOverloaded(hub.subscribe(conn, r.topics())
                        .thenApply(added -> Optional.of(envelopes.systemResponse(r.id(), SystemEvent.SUBSCRIBED, added))),
                        r.id(), null);
            }
            case UNSUBSCRIBE -> {
                return orOverloaded(hub.unsubscribe(conn, r.topics())
                        .thenApply(removed -> Optional.of(envelopes.systemResponse(r.id(), SystemEvent.UNSUBSCRIBED, removed))),
                        r.id(), null);
            }
            default -> {
                return reply(envelopes.systemResponse(r.id(), SystemEvent.PONG, List.of()));
            }
        }
    }

    private CompletableFuture<Optional<Frame>> call(final Connection conn, final Frame.CallRequest r) {
        if (PUBLISH.equals(r.method())) {
            final Result<List<DataItem>> items = DataItems.normalize(r.params().opt("data"), null);
            if (!items.isOk()) return reply(envelopes.error(r.id(), PUBLISH, items.error()));

            if (!hub.publish(conn, r.meta(), items.value())) {
                return reply(envelopes.error(r.id(), PUBLISH, HubError.overloaded()));
            }
            return reply(envelopes.returnValue(r.id(), PUBLISH, new JSONObject().put("published", items.value().size())));
        }

        if (GET.equals(r.method())) {
            final String topic = r.params().optString("topic", "");
            if (topic.isEmpty()) {
                return reply(envelopes.error(r.id(), GET, HubError.validation("params.topic is required")));
            }
            return orOverloaded(hub.get(topic).thenApply(item -> Optional.of(item
                    .<Frame>map(i -> envelopes.returnValue(r.id(), GET, i.toJson()))
                    .orElseGet(() -> envelopes.error(r.id(), GET, HubError.notFound(topic))))), r.id(), GET);
        }

        return reply(envelopes.error(r.id(), r.method(),
                HubError.of(ErrorKind.UNKNOWN_METHOD, "unknown method: " + r.method())));
    }

    /* a command the bus refused still gets an answer for its id */
    private CompletableFuture<Optional<Frame>> orOverloaded(final CompletableFuture<Optional<Frame>> pending,
                                                            final long id,
                                                            final String method) {
        return pending.exceptionally(ex -> {
            log.debug("Request {} not accepted: {}", id, ex.toString());
            return Optional.of(envelopes.error(id, method, HubError.overloaded()));
        });
    }

    private static CompletableFuture<Optional<Frame>> reply(final Frame frame) {
        return CompletableFuture.completedFuture(Optional.of(frame));
    }
}
