package io.cliphub.envelope;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic frame id source. One instance per hub; ids start at 1.
 */
public final class IdAllocator {
    private final AtomicLong next = new AtomicLong(1L);

    public long next() {
        return next.getAndIncrement();
    }

    /**
     * Returns {@code requested} when the peer supplied a positive id, otherwise allocates one.
     */
    public long orNext(final long requested) {
        return requested > 0 ? requested : next();
    }
}
