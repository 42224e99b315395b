/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO hand-off between producers and a single consumer with a fixed capacity.
 *
 * <p>A submit on a full channel reports {@link ChannelEvent.Type#BLOCKING} and waits up to the
 * configured timeout. If no space frees up in time the item is <b>dropped</b>: the event handler
 * sees {@link ChannelEvent.Type#TIMEOUT}, {@link #dropped()} is incremented and
 * {@link SubmitResult#DROPPED} is returned. Backpressure never surfaces as an exception.</p>
 *
 * <p>After {@link #close()} no new items are accepted, but everything already queued is still
 * handed out by {@link #receive()}, which returns {@code null} once the channel is drained.</p>
 *
 * @param <T> item type
 */
public final class BoundedDeliveryChannel<T> implements AutoCloseable {

    private final String name;
    private final int capacity;
    private final long timeoutNanos;
    private final ChannelEventHandler eventHandler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> queue;

    private final LongAdder dropped = new LongAdder();
    private boolean closed;

    public BoundedDeliveryChannel(String name, int capacity, Duration timeout, ChannelEventHandler eventHandler) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity <= 0) throw new IllegalArgumentException("Channel capacity must be > 0");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) throw new IllegalArgumentException("Channel timeout must be >= 0");

        this.capacity = capacity;
        this.timeoutNanos = timeout.toNanos();
        this.eventHandler = (eventHandler != null) ? eventHandler : ChannelEventHandler.NOOP;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueues {@code item}, waiting up to the channel timeout while the channel is full.
     *
     * @throws ChannelClosedException if the channel was closed before the item could be enqueued
     */
    public SubmitResult submit(T item) {
        Objects.requireNonNull(item, "item");

        boolean enqueued = false;
        lock.lock();
        try {
            ensureOpen();
            if (queue.size() < capacity) {
                enqueue(item);
                enqueued = true;
            }
        } finally {
            lock.unlock();
        }

        // events are reported outside the lock, handlers may log
        if (enqueued) {
            fire(ChannelEvent.Type.SUBMITTED, 0L);
            return SubmitResult.SUBMITTED;
        }
        fire(ChannelEvent.Type.BLOCKING, 0L);

        final long start = System.nanoTime();
        boolean timedOut = false;
        lock.lock();
        try {
            long remaining = timeoutNanos;
            while (queue.size() >= capacity) {
                ensureOpen();
                if (remaining <= 0L) {
                    timedOut = true;
                    break;
                }
                remaining = notFull.awaitNanos(remaining);
            }
            if (timedOut) {
                dropped.increment();
            } else {
                ensureOpen();
                enqueue(item);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubmitResult.CANCELLED;
        } finally {
            lock.unlock();
        }

        final long waited = System.nanoTime() - start;
        if (timedOut) {
            fire(ChannelEvent.Type.TIMEOUT, waited);
            return SubmitResult.DROPPED;
        }
        fire(ChannelEvent.Type.SUBMITTED_AFTER_BLOCKING, waited);
        return SubmitResult.SUBMITTED_AFTER_BLOCKING;
    }

    /**
     * Blocks until an item is available.
     *
     * @return the next item, or {@code null} when the channel is closed and drained or the
     * calling thread was interrupted (the interrupt flag is preserved).
     */
    public T receive() {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed) return null;
                notEmpty.await();
            }
            final T item = queue.pollFirst();
            notFull.signal();
            return item;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting items and wakes every waiter. Idempotent.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    /**
     * @return number of items discarded because the channel stayed full past the timeout.
     */
    public long dropped() {
        return dropped.sum();
    }

    private void enqueue(T item) {
        queue.addLast(item);
        notEmpty.signal();
    }

    private void ensureOpen() {
        if (closed) throw new ChannelClosedException(name);
    }

    private void fire(ChannelEvent.Type type, long waitedNanos) {
        eventHandler.onEvent(new ChannelEvent(type, name, capacity, Duration.ofNanos(waitedNanos)));
    }
}
