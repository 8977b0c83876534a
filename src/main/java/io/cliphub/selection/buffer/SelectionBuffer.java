package io.cliphub.selection.buffer;

import io.cliphub.core.error.Result;
import io.cliphub.selection.Selection;
import io.cliphub.selection.SelectionHealth;

import java.time.Duration;

/**
 * Bytes-in/bytes-out access to the external selection buffers.
 * <p>
 * A missing display session is a successful no-op: reads return an empty array, writes do nothing.
 */
public interface SelectionBuffer {

    /**
     * @return current content, empty when unset; an error for timeouts or tool failures
     */
    Result<byte[]> read(Selection selection, Duration timeout);

    Result<Void> write(Selection selection, byte[] data, Duration timeout);

    /**
     * Whether the tool can be invoked at all. Checked once at engine startup.
     */
    boolean isAvailable();

    SelectionHealth checkHealth();

    String location();
}
