package io.cliphub.selection;

import java.util.Arrays;

/**
 * What the engine last wrote to a selection and what it last read back.
 * <p>
 * Written only by the engine thread; fields are volatile so status reads see recent values.
 */
final class SlotState {
    private volatile byte[] lastApplied;
    private volatile String lastAppliedTs;
    private volatile byte[] lastSeen;
    private volatile String lastSeenTs;

    void applied(final byte[] bytes, final String ts) {
        lastApplied = bytes;
        lastAppliedTs = ts;
        lastSeen = bytes;
        lastSeenTs = ts;
    }

    void seen(final byte[] bytes, final String ts) {
        lastSeen = bytes;
        lastSeenTs = ts;
    }

    boolean isLastSeen(final byte[] bytes) {
        return lastSeen != null && Arrays.equals(lastSeen, bytes);
    }

    /**
     * True when {@code bytes} is our own write coming back through the selection.
     */
    boolean isEcho(final byte[] bytes) {
        return lastApplied != null && Arrays.equals(lastApplied, bytes);
    }

    String lastAppliedTs() {
        return lastAppliedTs;
    }

    String lastSeenTs() {
        return lastSeenTs;
    }
}
