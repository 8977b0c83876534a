package io.cliphub.upstream.client;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Dials a peer hub and completes the WebSocket handshake.
 */
@FunctionalInterface
public interface UpstreamConnector {

    /**
     * @param onText receives every inbound text frame, on the connector's I/O thread
     * @throws IOException if the connection or handshake fails or exceeds {@code timeout}
     */
    UpstreamSession connect(URI uri, Consumer<String> onText, Duration timeout)
            throws IOException, InterruptedException;
}
