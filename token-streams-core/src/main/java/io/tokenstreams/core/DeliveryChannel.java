package io.tokenstreams.core;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-producer, single-consumer FIFO of batches between a poller and its consumer.
 *
 * <p>The producing side may block on a bounded channel; the consuming side never blocks beyond
 * the short critical section guarding the queue. Once the sending side is closed and the queue
 * has been drained, the channel is {@linkplain #isClosed() closed}.
 */
public final class DeliveryChannel<T> {

    /** Outcome of a {@link #send} call. */
    public enum SendResult {
        /** The batch was enqueued. */
        SENT,
        /** The stream was cancelled while waiting for capacity. */
        CANCELLED,
        /** Waiting for capacity exceeded the stall timeout. */
        STALLED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<Batch<T>> queue = new ArrayDeque<>();
    private final ChannelCapacity capacity;
    private volatile boolean sendClosed;
    private volatile boolean receiveClosed;

    public DeliveryChannel(ChannelCapacity capacity) {
        this.capacity = Objects.requireNonNull(capacity, "capacity");
    }

    public ChannelCapacity capacity() {
        return capacity;
    }

    /**
     * Enqueues a batch, waiting for capacity if the channel is bounded and full.
     *
     * @param batch the batch to deliver
     * @param token checked whenever the call would block
     * @param stallTimeout longest time to wait for capacity, or {@code null} to wait indefinitely
     * @return whether the batch was enqueued, and if not, why
     * @throws TokenStreamsException.ChannelClosed if the consumer has released the channel
     * @throws InterruptedException if the producing thread is interrupted while waiting
     */
    public SendResult send(Batch<T> batch, CancellationToken token, Duration stallTimeout) throws InterruptedException {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(token, "token");
        long remaining = stallTimeout == null ? Long.MAX_VALUE : stallTimeout.toNanos();

        lock.lockInterruptibly();
        try {
            while (true) {
                if (receiveClosed) throw new TokenStreamsException.ChannelClosed("consumer released the channel");
                if (sendClosed) throw new IllegalStateException("sending side already closed");
                if (!capacity.isBounded() || queue.size() < capacity.capacity()) {
                    queue.addLast(batch);
                    return SendResult.SENT;
                }
                if (token.isCancelled()) return SendResult.CANCELLED;
                if (stallTimeout == null) {
                    notFull.await();
                } else {
                    if (remaining <= 0) return SendResult.STALLED;
                    remaining = notFull.awaitNanos(remaining);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves every available batch into {@code sink}, oldest first. Never waits for new batches.
     *
     * @return number of batches moved
     */
    public int drainTo(Collection<? super Batch<T>> sink) {
        Objects.requireNonNull(sink, "sink");
        lock.lock();
        try {
            int n = queue.size();
            if (n == 0) return 0;
            sink.addAll(queue);
            queue.clear();
            notFull.signalAll();
            return n;
        } finally {
            lock.unlock();
        }
    }

    /** Wakes a producer blocked on capacity so it re-checks cancellation. */
    public void wakeProducer() {
        lock.lock();
        try {
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Called by the producer after its last batch. Idempotent. */
    public void closeSending() {
        sendClosed = true;
    }

    /** Called by the consumer when it stops listening. Pending batches are discarded. */
    public void closeReceiving() {
        lock.lock();
        try {
            receiveClosed = true;
            queue.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** @return whether the producer is done and every batch has been drained */
    public boolean isClosed() {
        if (receiveClosed) return true;
        if (!sendClosed) return false;
        lock.lock();
        try {
            return queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isReceiveClosed() {
        return receiveClosed;
    }

    /** @return number of batches waiting to be drained */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
