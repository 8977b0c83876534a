package io.cliphub.core.queue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DropOldestQueueTest {

    @Test
    void keepsNewestElementsWhenFull() {
        final DropOldestQueue<Integer> q = new DropOldestQueue<>(3);

        for (int i = 1; i <= 5; i++) q.offer(i);

        final List<Integer> left = new ArrayList<>();
        Integer next;
        while ((next = q.poll()) != null) left.add(next);

        assertEquals(List.of(3, 4, 5), left);
        assertEquals(2, q.droppedCount());
    }

    @Test
    void offerReportsEviction() {
        final DropOldestQueue<String> q = new DropOldestQueue<>(1);

        assertFalse(q.offer("a"));
        assertTrue(q.offer("b"));
        assertEquals("b", q.poll());
    }

    @Test
    void pinnedElementsAreNeverEvictedAndKeepTheirPlace() {
        final DropOldestQueue<String> q = new DropOldestQueue<>(2, e -> !e.startsWith("reply"));

        q.offer("b1");
        q.offer("reply-7");
        q.offer("b2");
        q.offer("b3");
        q.offer("b4");

        final List<String> left = new ArrayList<>();
        String next;
        while ((next = q.poll()) != null) left.add(next);

        assertEquals(List.of("reply-7", "b3", "b4"), left);
        assertEquals(2, q.droppedCount());
    }

    @Test
    void pinnedElementsDoNotUseCapacity() {
        final DropOldestQueue<String> q = new DropOldestQueue<>(1, e -> !e.startsWith("reply"));

        assertFalse(q.offer("reply-1"));
        assertFalse(q.offer("reply-2"));
        assertFalse(q.offer("b1"));
        assertTrue(q.offer("b2"));

        assertEquals(3, q.size());
        assertEquals("reply-1", q.poll());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DropOldestQueue<>(0));
    }

    @Test
    void clearEmptiesWithoutCountingDrops() {
        final DropOldestQueue<String> q = new DropOldestQueue<>(4);
        q.offer("a");
        q.offer("b");

        q.clear();

        assertEquals(0, q.size());
        assertEquals(0, q.droppedCount());
        assertEquals(4, q.capacity());
    }
}
