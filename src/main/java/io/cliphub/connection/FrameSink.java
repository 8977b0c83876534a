package io.cliphub.connection;

import io.cliphub.protocol.Frame;

import java.io.IOException;

/**
 * Transmits frames to one peer. Implementations block until the frame is written or fails.
 */
@FunctionalInterface
public interface FrameSink {
    void send(Frame frame) throws IOException, InterruptedException;
}
