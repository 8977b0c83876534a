package io.cliphub.connection;

import io.cliphub.core.error.HubError;
import io.cliphub.core.model.DataItem;
import io.cliphub.envelope.Envelopes;
import io.cliphub.protocol.Frame;
import io.cliphub.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionTest {

    private final Envelopes envelopes = new Envelopes();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void deliversFramesInOrder() throws Exception {
        final RecordingSink sink = new RecordingSink();
        final Connection conn = new Connection(1, sink, 16);
        conn.start(executor);

        final List<Long> sent = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            final Frame f = envelopes.ping();
            sent.add(f.id());
            assertTrue(conn.enqueue(f));
        }

        final List<Long> received = new ArrayList<>();
        for (int i = 0; i < 5; i++) received.add(sink.next().id());
        assertEquals(sent, received);
    }

    private Frame broadcast(final int n) {
        return envelopes.broadcast(DataItem.of("c", "v" + n), null);
    }

    private static FrameSink stalledSink(final CountDownLatch firstTaken,
                                         final CountDownLatch release,
                                         final List<Long> delivered) {
        return frame -> {
            firstTaken.countDown();
            release.await();
            synchronized (delivered) {
                delivered.add(frame.id());
            }
        };
    }

    private static void awaitDrained(final Connection conn) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (conn.pending() > 0 && System.nanoTime() < deadline) Thread.sleep(5);
        Thread.sleep(20);
    }

    @Test
    void stalledClientDropsOldestBroadcastsAndKeepsNewest() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch firstTaken = new CountDownLatch(1);
        final List<Long> delivered = new ArrayList<>();

        final Connection conn = new Connection(1, stalledSink(firstTaken, release, delivered), 4);
        conn.start(executor);
        conn.enqueue(broadcast(0));
        assertTrue(firstTaken.await(2, TimeUnit.SECONDS));

        long last = 0;
        for (int i = 1; i <= 10; i++) {
            final Frame f = broadcast(i);
            last = f.id();
            conn.enqueue(f);
        }

        assertEquals(4, conn.pending());
        assertEquals(6, conn.dropped());

        release.countDown();
        awaitDrained(conn);
        synchronized (delivered) {
            assertEquals(5, delivered.size());
            assertEquals(last, delivered.get(delivered.size() - 1));
        }
    }

    @Test
    void replySurvivesBroadcastBurstToStalledClient() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch firstTaken = new CountDownLatch(1);
        final List<Long> delivered = new ArrayList<>();

        final Connection conn = new Connection(1, stalledSink(firstTaken, release, delivered), 2);
        conn.start(executor);
        conn.enqueue(broadcast(0));
        assertTrue(firstTaken.await(2, TimeUnit.SECONDS));

        final Frame reply = envelopes.returnValue(777, "get", DataItem.of("c", "v").toJson());
        conn.enqueue(reply);
        final List<Long> kept = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            final Frame f = broadcast(i);
            if (i > 1) kept.add(f.id());
            conn.enqueue(f);
        }

        assertEquals(1, conn.dropped());
        assertEquals(3, conn.pending());

        release.countDown();
        awaitDrained(conn);
        synchronized (delivered) {
            assertEquals(4, delivered.size());
            assertEquals(List.of(reply.id(), kept.get(0), kept.get(1)), delivered.subList(1, 4));
        }
    }

    @Test
    void errorRepliesAreNeverDropped() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch firstTaken = new CountDownLatch(1);
        final List<Long> delivered = new ArrayList<>();

        final Connection conn = new Connection(1, stalledSink(firstTaken, release, delivered), 1);
        conn.start(executor);
        conn.enqueue(broadcast(0));
        assertTrue(firstTaken.await(2, TimeUnit.SECONDS));

        final List<Long> errors = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            final Frame err = envelopes.error(100 + i, "publish", HubError.validation("bad " + i));
            errors.add(err.id());
            conn.enqueue(err);
            conn.enqueue(broadcast(i));
        }

        assertEquals(4, conn.dropped());

        release.countDown();
        awaitDrained(conn);
        synchronized (delivered) {
            assertTrue(delivered.containsAll(errors));
        }
    }

    @Test
    void senderStopsOnTransmitFailure() throws Exception {
        final AtomicInteger attempts = new AtomicInteger();
        final Connection conn = new Connection(1, frame -> {
            attempts.incrementAndGet();
            throw new IOException("peer gone");
        }, 4);
        conn.start(executor);

        conn.enqueue(envelopes.ping());
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (conn.isSending() && System.nanoTime() < deadline) Thread.sleep(5);

        assertFalse(conn.isSending());
        assertEquals(1, attempts.get());
    }

    @Test
    void closeCancelsSenderAndRejectsFrames() throws Exception {
        final Connection conn = new Connection(1, new RecordingSink(), 4);
        conn.start(executor);

        conn.close();
        conn.close();

        assertTrue(conn.isClosed());
        assertFalse(conn.enqueue(envelopes.ping()));
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (conn.isSending() && System.nanoTime() < deadline) Thread.sleep(5);
        assertFalse(conn.isSending());
    }
}
