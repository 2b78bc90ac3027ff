package io.tokenstreams.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Groups consecutive outcomes into batches bounded by size and age.
 *
 * <p>The batcher owns no threads and reads no clock: callers pass the current
 * {@link System#nanoTime()} reading with every call, which keeps the flushing rules testable.
 * <ul>
 *   <li>The first outcome of a stream is emitted on its own, immediately.</li>
 *   <li>Later outcomes accumulate until {@link Thresholds#maxBatchSize()} is reached or
 *       {@link Thresholds#maxBatchDelay()} has passed since the oldest pending outcome.</li>
 *   <li>A terminal outcome flushes what is pending, then is emitted alone. The batcher accepts
 *       nothing afterwards.</li>
 * </ul>
 *
 * <p>Not thread-safe; a stream's dispatcher is its only user.
 */
public final class Batcher<T> {

    private final int maxBatchSize;
    private final long maxBatchDelayNanos;
    private final List<StreamOutcome<T>> pending = new ArrayList<>();
    private long pendingSinceNanos;
    private long nextSequence;
    private boolean firstEmitted;
    private boolean terminated;

    public Batcher(Thresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds");
        this.maxBatchSize = thresholds.maxBatchSize();
        this.maxBatchDelayNanos = thresholds.maxBatchDelay().toNanos();
    }

    /**
     * Adds an outcome.
     *
     * @param outcome the next outcome in decode order
     * @param nowNanos current time
     * @return the batches that became ready, oldest first; usually empty
     * @throws IllegalStateException if a terminal outcome was already accepted
     */
    public List<Batch<T>> accept(StreamOutcome<T> outcome, long nowNanos) {
        Objects.requireNonNull(outcome, "outcome");
        if (terminated) throw new IllegalStateException("batcher already received a terminal outcome");

        List<Batch<T>> ready = new ArrayList<>(2);
        if (outcome.isTerminal()) {
            terminated = true;
            flush().ifPresent(ready::add);
            ready.add(emit(List.of(outcome)));
            return ready;
        }

        if (!firstEmitted) {
            ready.add(emit(List.of(outcome)));
            return ready;
        }

        flushIfDue(nowNanos).ifPresent(ready::add);
        if (pending.isEmpty()) {
            pendingSinceNanos = nowNanos;
        }
        pending.add(outcome);
        if (pending.size() >= maxBatchSize) {
            flush().ifPresent(ready::add);
        }
        return ready;
    }

    /**
     * Flushes the pending batch if its oldest outcome has waited for the full delay.
     */
    public Optional<Batch<T>> flushIfDue(long nowNanos) {
        if (nanosUntilDue(nowNanos) > 0) return Optional.empty();
        return flush();
    }

    /**
     * @return nanoseconds until the pending batch is due; {@code 0} if overdue, {@link Long#MAX_VALUE}
     *         if nothing is pending or the time threshold is disabled
     */
    public long nanosUntilDue(long nowNanos) {
        if (pending.isEmpty() || maxBatchDelayNanos == 0) return Long.MAX_VALUE;
        long waited = nowNanos - pendingSinceNanos;
        return Math.max(0L, maxBatchDelayNanos - waited);
    }

    /**
     * Flushes whatever is pending, regardless of thresholds.
     */
    public Optional<Batch<T>> flush() {
        if (pending.isEmpty()) return Optional.empty();
        Batch<T> batch = emit(pending);
        pending.clear();
        return Optional.of(batch);
    }

    /**
     * Drops the pending outcomes without emitting them.
     *
     * @return the number of outcomes dropped
     */
    public int discardPending() {
        int dropped = pending.size();
        pending.clear();
        return dropped;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /** @return number of batches emitted so far */
    public long emittedBatches() {
        return nextSequence;
    }

    private Batch<T> emit(List<StreamOutcome<T>> outcomes) {
        firstEmitted = true;
        return new Batch<>(nextSequence++, outcomes);
    }
}
