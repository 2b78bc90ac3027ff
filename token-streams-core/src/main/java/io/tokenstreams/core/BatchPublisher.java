package io.tokenstreams.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Flow.Publisher} view of a stream for consumers that are not bound to a UI scheduler.
 *
 * <p>A {@link ConsumerLoop} is ticked at a fixed frame interval on a scheduler thread and every
 * drained batch is republished through a {@link SubmissionPublisher}. Stream errors travel inside
 * the batches; the publisher itself completes normally once the stream is finished. When the last
 * subscriber goes away, or {@link #close()} is called, the stream is closed.
 *
 * <p>Ticking starts with the first subscription.
 */
public final class BatchPublisher<T> implements Flow.Publisher<Batch<T>>, AutoCloseable {

    private final StreamHandle<T> handle;
    private final SubmissionPublisher<Batch<T>> publisher = new SubmissionPublisher<>();
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration frameInterval;
    private final ConsumerLoop<T> loop;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile ScheduledFuture<?> ticks;

    public BatchPublisher(StreamHandle<T> handle, Duration frameInterval) {
        this(handle, Executors.newSingleThreadScheduledExecutor(new PollerThreads("token-streams-frames")), true, frameInterval);
    }

    public BatchPublisher(StreamHandle<T> handle, ScheduledExecutorService scheduler, Duration frameInterval) {
        this(handle, scheduler, false, frameInterval);
    }

    private BatchPublisher(StreamHandle<T> handle, ScheduledExecutorService scheduler, boolean ownsScheduler, Duration frameInterval) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.frameInterval = Objects.requireNonNull(frameInterval, "frameInterval");
        if (frameInterval.isNegative() || frameInterval.isZero()) {
            throw new IllegalArgumentException("frameInterval must be positive");
        }
        this.loop = new ConsumerLoop<>(handle, publisher::submit);
    }

    @Override
    public void subscribe(Flow.Subscriber<? super Batch<T>> subscriber) {
        publisher.subscribe(subscriber);
        if (started.compareAndSet(false, true)) {
            ticks = scheduler.scheduleAtFixedRate(this::frame, 0L, frameInterval.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    public StreamHandle<T> handle() {
        return handle;
    }

    /** @return delivery figures so far; only stable once the publisher has completed */
    public DeliveryStats stats() {
        return loop.stats();
    }

    private void frame() {
        if (stopped.get()) return;
        if (publisher.getNumberOfSubscribers() == 0) {
            close();
            return;
        }
        try {
            loop.tick();
            if (loop.isFinished()) {
                publisher.close();
                stop();
            }
        } catch (RuntimeException e) {
            publisher.closeExceptionally(e);
            handle.close();
            stop();
        }
    }

    @Override
    public void close() {
        handle.close();
        publisher.close();
        stop();
    }

    private void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        ScheduledFuture<?> current = ticks;
        if (current != null) current.cancel(false);
        if (ownsScheduler) scheduler.shutdown();
    }
}
