package io.cliphub.transport.impl;

import io.cliphub.core.error.HubError;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import io.cliphub.core.model.Source;
import io.cliphub.envelope.DataItems;
import io.cliphub.envelope.Envelopes;
import io.cliphub.envelope.FrameCodec;
import io.cliphub.hub.Hub;
import io.cliphub.selection.SelectionEngine;
import io.cliphub.upstream.UpstreamBridge;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Plain HTTP routes: health, status, topic listing, fetch and publish.
 * <p>
 * {@code ?response-type=json} switches fetch and publish to response envelopes; otherwise they answer
 * with plain text or an empty body.
 */
@Slf4j
public final class RestRouter {

    private static final String FETCH = "/fetch/";
    private static final String PUBLISH = "/publish/";

    private final Hub hub;
    private final SelectionEngine selection;
    private final UpstreamBridge upstream;
    private final Envelopes envelopes;
    private final FrameCodec codec;

    public RestRouter(final Hub hub, final SelectionEngine selection, final UpstreamBridge upstream) {
        this.hub = hub;
        this.selection = selection;
        this.upstream = upstream;
        this.envelopes = hub.getEnvelopes();
        this.codec = new FrameCodec(envelopes);
    }

    public CompletableFuture<RestResponse> route(final String method, final String uri, final String body) {
        final QueryStringDecoder query = new QueryStringDecoder(uri);
        final String path = query.path();
        final boolean json = "json".equals(param(query, "response-type"));

        if ("GET".equals(method)) {
            if ("/health".equals(path)) return health();
            if ("/status".equals(path)) return orOverloaded(status());
            if ("/topics".equals(path)) return orOverloaded(topics());
            if (path.startsWith(FETCH) && path.length() > FETCH.length()) {
                return orOverloaded(fetch(path.substring(FETCH.length()), json, param(query, "id")));
            }
        } else if ("POST".equals(method) && path.startsWith(PUBLISH) && path.length() > PUBLISH.length()) {
            return CompletableFuture.completedFuture(publish(path.substring(PUBLISH.length()), json, body));
        }

        return CompletableFuture.completedFuture(RestResponse.text(404, "not found"));
    }

    private CompletableFuture<RestResponse> health() {
        return CompletableFuture.completedFuture(RestResponse.json(200, new JSONObject()
                .put("ok", true)
                .put("selectionOk", selection.isHealthy())
                .put("upstreamConnected", upstream.isConnected())));
    }

    private CompletableFuture<RestResponse> status() {
        return hub.snapshot().thenApply(s -> RestResponse.json(200, new JSONObject()
                .put("ok", true)
                .put("topics", new JSONArray(s.topics()))
                .put("clients", s.subscriptions())
                .put("selection", selection.status())
                .put("upstream", upstream.status())));
    }

    private CompletableFuture<RestResponse> topics() {
        return hub.snapshot().thenApply(s ->
                RestResponse.json(200, new JSONObject().put("topics", new JSONArray(s.topics()))));
    }

    private CompletableFuture<RestResponse> fetch(final String topic, final boolean json, final String rawId) {
        final long id = envelopes.getIds().orNext(parseId(rawId));

        return hub.get(topic).thenApply(found -> {
            if (found.isEmpty()) {
                final HubError err = HubError.notFound(topic);
                return json
                        ? RestResponse.json(404, codec.toJson(envelopes.error(id, "get", err)))
                        : RestResponse.text(404, err.message());
            }

            final DataItem item = found.get();
            if (json) return RestResponse.json(200, codec.toJson(envelopes.returnValue(id, "get", item.toJson())));
            return RestResponse.text(200, item.value() instanceof String s ? s : JSONObject.valueToString(item.value()));
        });
    }

    private RestResponse publish(final String topic, final boolean json, final String body) {
        final Result<JSONObject> parsed = codec.parse(body == null || body.isBlank() ? "{}" : body);
        final JSONObject request = parsed.isOk() ? parsed.value() : new JSONObject();
        final long id = envelopes.getIds().orNext(request.optLong("id", 0L));

        if (!parsed.isOk()) return publishError(400, id, json, parsed.error());

        final Result<List<DataItem>> items = DataItems.normalize(request.opt("data"), topic);
        if (!items.isOk()) return publishError(400, id, json, items.error());

        if (!hub.publish(Source.NONE, request.optJSONObject("meta"), items.value())) {
            return publishError(503, id, json, HubError.overloaded());
        }

        if (!json) return RestResponse.empty(202);
        return RestResponse.json(200, codec.toJson(envelopes.returnValue(id, "publish",
                new JSONObject().put("published", items.value().size()))));
    }

    private RestResponse publishError(final int status, final long id, final boolean json, final HubError error) {
        log.debug("Rejected publish: {}", error.message());
        return json
                ? RestResponse.json(status, codec.toJson(envelopes.error(id, "publish", error)))
                : RestResponse.text(status, error.message());
    }

    private static CompletableFuture<RestResponse> orOverloaded(final CompletableFuture<RestResponse> pending) {
        return pending.exceptionally(ex -> RestResponse.text(503, HubError.overloaded().message()));
    }

    private static String param(final QueryStringDecoder query, final String name) {
        final List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static long parseId(final String raw) {
        if (raw == null) return 0L;
        try {
            return Long.parseLong(raw);
        } catch (final NumberFormatException e) {
            return 0L;
        }
    }
}
