package io.tokenstreams.core;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Consumer-side loop, run from the host application's own scheduler.
 *
 * <p>Each {@link #tick()} drains <em>every</em> batch available at that moment and applies them in
 * order before returning, so a host that only gets a turn once per frame still keeps up with a
 * poller that produces far more often. A tick never waits for batches that have not arrived.
 *
 * <p>If the sink throws, the failing batch and those after it stay queued for the next tick.
 * Not thread-safe; call it from one scheduler only.
 */
public final class ConsumerLoop<T> {

    private final StreamHandle<T> handle;
    private final BatchSink<T> sink;
    private final LongSupplier clock;
    private final ArrayDeque<Batch<T>> backlog = new ArrayDeque<>();
    private final long createdNanos;
    private long firstEventNanos = -1;
    private long lastEventNanos = -1;
    private long events;
    private long batches;
    private int largestBatch;
    private boolean finishNotified;

    public ConsumerLoop(StreamHandle<T> handle, BatchSink<T> sink) {
        this(handle, sink, System::nanoTime);
    }

    ConsumerLoop(StreamHandle<T> handle, BatchSink<T> sink, LongSupplier clock) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdNanos = clock.getAsLong();
    }

    /**
     * Applies all currently available batches.
     *
     * @return number of batches applied during this tick
     */
    public int tick() {
        handle.drainTo(backlog);
        int applied = 0;
        while (!backlog.isEmpty()) {
            Batch<T> batch = backlog.peekFirst();
            sink.apply(batch);
            backlog.removeFirst();
            record(batch);
            applied++;
        }
        if (!finishNotified && handle.isFinished()) {
            finishNotified = true;
            sink.onFinished(handle.state());
        }
        return applied;
    }

    /** @return whether the stream is over and every batch has been applied */
    public boolean isFinished() {
        return backlog.isEmpty() && handle.isFinished();
    }

    public StreamHandle<T> handle() {
        return handle;
    }

    public DeliveryStats stats() {
        Duration ttfe = firstEventNanos < 0 ? null : Duration.ofNanos(firstEventNanos - createdNanos);
        Duration streaming = firstEventNanos < 0 ? Duration.ZERO : Duration.ofNanos(lastEventNanos - firstEventNanos);
        return new DeliveryStats(events, batches, largestBatch, ttfe, streaming);
    }

    /**
     * Ticks this loop at a fixed frame interval until the stream finishes.
     *
     * <p>The returned future completes with the final {@link StreamState}, or exceptionally if the
     * sink throws. A failing sink and a cancelled future both stop the ticks and close the stream,
     * since nothing drains it afterwards.
     */
    public CompletableFuture<StreamState> schedule(ScheduledExecutorService scheduler, Duration frameInterval) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(frameInterval, "frameInterval");
        if (frameInterval.isNegative() || frameInterval.isZero()) {
            throw new IllegalArgumentException("frameInterval must be positive");
        }

        CompletableFuture<StreamState> completion = new CompletableFuture<>();
        ScheduledFuture<?> ticks = scheduler.scheduleAtFixedRate(() -> {
            if (completion.isDone()) return;
            try {
                tick();
                if (isFinished()) completion.complete(handle.state());
            } catch (RuntimeException e) {
                completion.completeExceptionally(e);
            }
        }, 0L, frameInterval.toNanos(), TimeUnit.NANOSECONDS);

        completion.whenComplete((state, error) -> {
            ticks.cancel(false);
            if (error != null) handle.close();
        });
        return completion;
    }

    private void record(Batch<T> batch) {
        batches++;
        largestBatch = Math.max(largestBatch, batch.size());
        long now = clock.getAsLong();
        for (StreamOutcome<T> outcome : batch.outcomes()) {
            if (outcome instanceof StreamOutcome.Ok) {
                events++;
                if (firstEventNanos < 0) firstEventNanos = now;
                lastEventNanos = now;
            }
        }
    }
}
