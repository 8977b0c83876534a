package io.cliphub.upstream.client;

import java.io.IOException;

/**
 * An established text-frame link to a peer hub.
 */
public interface UpstreamSession extends AutoCloseable {

    /**
     * Queues a text frame for the peer; does not wait for the write to finish.
     *
     * @throws IOException if the link is already closed
     */
    void send(String text) throws IOException;

    /**
     * Blocks until the link closes for any reason.
     */
    void awaitClose() throws InterruptedException;

    @Override
    void close();
}
