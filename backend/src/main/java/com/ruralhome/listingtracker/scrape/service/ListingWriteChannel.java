package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.scrape.model.PendingListingWrite;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between the fetch workers and the single listing writer.
 * <p>
 * {@link #close()} replaces an end-of-stream marker: once closed, producers are rejected and the consumer drains
 * what is left before {@link #take()} reports the end.
 */
public class ListingWriteChannel {
    private final int capacity;
    private final Deque<PendingListingWrite> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public ListingWriteChannel(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * Blocks while the channel is full.
     *
     * @throws IllegalStateException when the channel is already closed
     */
    public void put(PendingListingWrite item) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new IllegalStateException("listing write channel is closed");
            }
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available. Empty once the channel is closed and drained.
     */
    public Optional<PendingListingWrite> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            PendingListingWrite item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return Optional.ofNullable(item);
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
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
}
