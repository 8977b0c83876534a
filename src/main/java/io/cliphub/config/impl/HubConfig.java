package io.cliphub.config.impl;

import io.cliphub.selection.Selection;
import io.cliphub.selection.SelectionEngine;
import io.cliphub.upstream.UpstreamBridge;
import lombok.Getter;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable config holder loaded from cliphub.yaml, with {@code CLIPHUB_*} environment overrides.
 * Every key is optional.
 */
@Getter
public final class HubConfig {

    private String bindAddress = "127.0.0.1";
    private int bindPort = 8989;
    private String wsPath = "/ws";
    private int busCapacity = 1024;
    private int outboundQueueCapacity = 256;

    private boolean selectionEnabled = true;
    private String xselPath = "/usr/bin/xsel";
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration readTimeout = Duration.ofMillis(500);
    private Duration writeTimeout = Duration.ofMillis(500);
    private Duration killGrace = Duration.ofMillis(500);
    private int notificationQueueCapacity = 32;
    private Map<String, Selection> selectionTopics = defaultSelectionTopics();

    private boolean upstreamEnabled = false;
    private String upstreamHost = "127.0.0.1";
    private int upstreamPort = 8989;
    private String upstreamPath = "/ws";
    private List<String> upstreamTopics = List.of("c", "p", "s");
    private Duration upstreamRetryDelay = Duration.ofSeconds(1);
    private Duration upstreamConnectTimeout = Duration.ofSeconds(5);

    public static HubConfig defaults() {
        return new HubConfig();
    }

    /**
     * Builds a config from a parsed YAML document, then applies environment overrides.
     *
     * @param root the YAML root mapping, may be {@code null} for an empty document
     * @param env  environment lookup, usually {@code System::getenv}
     * @throws IllegalArgumentException on a value of the wrong type or out of range
     */
    @SuppressWarnings("unchecked")
    public static HubConfig from(final Map<String, Object> root, final Function<String, String> env) {
        final HubConfig cfg = new HubConfig();
        final Map<String, Object> m = root == null ? Map.of() : root;

        final Map<String, Object> bind = section(m, "bind");
        cfg.bindAddress = string(bind, "host", cfg.bindAddress);
        cfg.bindPort = integer(bind, "port", cfg.bindPort);
        cfg.wsPath = string(m, "wsPath", cfg.wsPath);
        cfg.busCapacity = integer(m, "busCapacity", cfg.busCapacity);
        cfg.outboundQueueCapacity = integer(m, "outboundQueueCapacity", cfg.outboundQueueCapacity);

        final Map<String, Object> sel = section(m, "selection");
        cfg.selectionEnabled = bool(sel, "enabled", cfg.selectionEnabled);
        cfg.xselPath = string(sel, "path", cfg.xselPath);
        cfg.pollInterval = millis(sel, "intervalMs", cfg.pollInterval);
        cfg.readTimeout = millis(sel, "readTimeoutMs", cfg.readTimeout);
        cfg.writeTimeout = millis(sel, "writeTimeoutMs", cfg.writeTimeout);
        cfg.killGrace = millis(sel, "killGraceMs", cfg.killGrace);
        cfg.notificationQueueCapacity = integer(sel, "queueCapacity", cfg.notificationQueueCapacity);
        if (sel.get("topics") instanceof Map<?, ?> topics) {
            final Map<String, Selection> mapping = new LinkedHashMap<>();
            ((Map<String, Object>) topics).forEach((topic, raw) -> mapping.put(topic,
                    Selection.parse(String.valueOf(raw)).orElseThrow(() ->
                            new IllegalArgumentException("Unknown selection '" + raw + "' for topic " + topic))));
            cfg.selectionTopics = mapping;
        }

        final Map<String, Object> up = section(m, "upstream");
        cfg.upstreamEnabled = bool(up, "enabled", cfg.upstreamEnabled);
        cfg.upstreamHost = string(up, "host", cfg.upstreamHost);
        cfg.upstreamPort = integer(up, "port", cfg.upstreamPort);
        cfg.upstreamPath = string(up, "path", cfg.upstreamPath);
        if (up.get("topics") instanceof List<?> topics) {
            cfg.upstreamTopics = topics.stream().map(String::valueOf).toList();
        }
        cfg.upstreamRetryDelay = millis(up, "retryDelayMs", cfg.upstreamRetryDelay);
        cfg.upstreamConnectTimeout = millis(up, "connectTimeoutMs", cfg.upstreamConnectTimeout);

        cfg.applyEnv(env);
        cfg.validate();
        return cfg;
    }

    private void applyEnv(final Function<String, String> env) {
        final String addr = env.apply("CLIPHUB_BIND_ADDR");
        if (present(addr)) bindAddress = addr;
        final String port = env.apply("CLIPHUB_BIND_PORT");
        if (present(port)) bindPort = parseInt("CLIPHUB_BIND_PORT", port);

        /* selection mirroring is on unless explicitly switched off */
        final String xsel = env.apply("CLIPHUB_XSEL");
        if (present(xsel)) selectionEnabled = !List.of("0", "false", "False").contains(xsel);
        final String xselPathEnv = env.apply("CLIPHUB_XSEL_PATH");
        if (present(xselPathEnv)) xselPath = xselPathEnv;
        final String interval = env.apply("CLIPHUB_XSEL_INTERVAL_MS");
        if (present(interval)) pollInterval = Duration.ofMillis(parseInt("CLIPHUB_XSEL_INTERVAL_MS", interval));

        /* the bridge is off unless explicitly switched on */
        final String proxy = env.apply("CLIPHUB_PROXY");
        if (present(proxy)) upstreamEnabled = List.of("1", "true", "True").contains(proxy);
        final String proxyAddr = env.apply("CLIPHUB_PROXY_ADDR");
        if (present(proxyAddr)) upstreamHost = proxyAddr;
        final String proxyPort = env.apply("CLIPHUB_PROXY_PORT");
        if (present(proxyPort)) upstreamPort = parseInt("CLIPHUB_PROXY_PORT", proxyPort);

        final String capacity = env.apply("CLIPHUB_OUTBOUND_QUEUE_CAPACITY");
        if (present(capacity)) outboundQueueCapacity = parseInt("CLIPHUB_OUTBOUND_QUEUE_CAPACITY", capacity);
    }

    private void validate() {
        if (bindPort < 0 || bindPort > 65_535) throw new IllegalArgumentException("bind.port out of range: " + bindPort);
        if (upstreamPort <= 0 || upstreamPort > 65_535) throw new IllegalArgumentException("upstream.port out of range: " + upstreamPort);
        if (busCapacity <= 0) throw new IllegalArgumentException("busCapacity must be > 0");
        if (outboundQueueCapacity <= 0) throw new IllegalArgumentException("outboundQueueCapacity must be > 0");
        if (notificationQueueCapacity <= 0) throw new IllegalArgumentException("selection.queueCapacity must be > 0");
        if (pollInterval.isNegative() || pollInterval.isZero()) throw new IllegalArgumentException("selection.intervalMs must be > 0");
        if (!wsPath.startsWith("/")) throw new IllegalArgumentException("wsPath must start with '/': " + wsPath);
    }

    public URI upstreamUrl() {
        final String path = upstreamPath.startsWith("/") ? upstreamPath : "/" + upstreamPath;
        return URI.create("ws://" + upstreamHost + ":" + upstreamPort + path);
    }

    public Path xsel() {
        return Path.of(xselPath);
    }

    public SelectionEngine.Settings selectionSettings() {
        return new SelectionEngine.Settings(selectionEnabled, selectionTopics, pollInterval,
                readTimeout, writeTimeout, notificationQueueCapacity);
    }

    public UpstreamBridge.Settings upstreamSettings() {
        return new UpstreamBridge.Settings(upstreamEnabled, upstreamUrl(), upstreamTopics,
                upstreamRetryDelay, upstreamConnectTimeout);
    }

    private static Map<String, Selection> defaultSelectionTopics() {
        final Map<String, Selection> topics = new LinkedHashMap<>();
        topics.put("c", Selection.CLIPBOARD);
        topics.put("p", Selection.PRIMARY);
        topics.put("s", Selection.SECONDARY);
        return topics;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> m, final String key) {
        final Object v = m.get(key);
        if (v == null) return Map.of();
        if (!(v instanceof Map)) throw new IllegalArgumentException(key + " must be a mapping");
        return (Map<String, Object>) v;
    }

    private static String string(final Map<String, Object> m, final String key, final String def) {
        final Object v = m.get(key);
        return v == null ? def : String.valueOf(v);
    }

    private static int integer(final Map<String, Object> m, final String key, final int def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        return parseInt(key, String.valueOf(v));
    }

    private static boolean bool(final Map<String, Object> m, final String key, final boolean def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Boolean b) return b;
        throw new IllegalArgumentException(key + " must be true or false, got: " + v);
    }

    private static Duration millis(final Map<String, Object> m, final String key, final Duration def) {
        final Object v = m.get(key);
        return v == null ? def : Duration.ofMillis(integer(m, key, 0));
    }

    private static int parseInt(final String key, final String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + raw, e);
        }
    }

    private static boolean present(final String v) {
        return v != null && !v.isEmpty();
    }
}
