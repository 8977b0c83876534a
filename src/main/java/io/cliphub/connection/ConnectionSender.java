package io.cliphub.connection;

import io.cliphub.core.queue.DropOldestQueue;
import io.cliphub.protocol.Frame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Send loop for one connection: dequeue, transmit, repeat, in FIFO order.
 * <p>
 * Terminates on the first transmit failure or on cancellation, without retry. Tearing the
 * connection out of the registry is left to whoever owns the connection lifecycle.
 */
@Slf4j
@RequiredArgsConstructor
final class ConnectionSender implements Runnable {

    private final Connection connection;
    private final DropOldestQueue<Frame> queue;
    private final FrameSink sink;

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final Frame frame = queue.take();
                sink.send(frame);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.trace("Sender for {} cancelled", connection);
        } catch (final IOException | RuntimeException e) {
            log.debug("Sender for {} stopped after transmit failure: {}", connection, e.toString());
        }
    }
}
