package io.cliphub.core.queue;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * FIFO that never blocks producers: once {@code capacity} evictable elements are queued, the oldest
 * evictable one is dropped to make room for the newcomer.
 * <p>
 * Elements rejected by the {@code evictable} predicate are pinned: they are always accepted, never
 * dropped, and do not count against the capacity. Relative order of all elements is preserved.
 *
 * @param <E> element type
 */
public final class DropOldestQueue<E> {

    private final ArrayDeque<E> items = new ArrayDeque<>();
    private final Predicate<? super E> evictable;
    private final int capacity;
    private final AtomicLong dropped = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    /* evictable elements currently queued */
    private int bounded;

    public DropOldestQueue(final int capacity) {
        this(capacity, e -> true);
    }

    public DropOldestQueue(final int capacity, final Predicate<? super E> evictable) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.evictable = evictable;
    }

    /**
     * Enqueue, evicting the oldest evictable element if the bound is reached.
     *
     * @return {@code true} if an element was evicted to make room
     */
    public boolean offer(final E element) {
        lock.lock();
        try {
            boolean evicted = false;
            if (evictable.test(element)) {
                if (bounded == capacity) {
                    evictOldest();
                    evicted = true;
                }
                bounded++;
            }
            items.addLast(element);
            notEmpty.signal();
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    public E take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) notEmpty.await();
            return removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public E poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (nanos <= 0L) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public E poll() {
        lock.lock();
        try {
            return items.isEmpty() ? null : removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public void clear() {
        lock.lock();
        try {
            items.clear();
            bounded = 0;
        } finally {
            lock.unlock();
        }
    }

    private void evictOldest() {
        final Iterator<E> it = items.iterator();
        while (it.hasNext()) {
            if (evictable.test(it.next())) {
                it.remove();
                bounded--;
                dropped.incrementAndGet();
                return;
            }
        }
    }

    private E removeFirst() {
        final E head = items.removeFirst();
        if (evictable.test(head)) bounded--;
        return head;
    }
}
