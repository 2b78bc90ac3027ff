package io.tokenstreams.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Batch flush thresholds, fixed for the lifetime of one stream.
 *
 * <p>A pending batch is flushed once it holds {@code maxBatchSize} outcomes or once
 * {@code maxBatchDelay} has elapsed since its first outcome, whichever comes first.
 * A zero delay disables the time threshold.
 *
 * @param maxBatchSize upper bound on outcomes per batch, at least 1
 * @param maxBatchDelay upper bound on how long an outcome waits for company, zero or positive
 */
public record Thresholds(int maxBatchSize, Duration maxBatchDelay) {

    public static final int DEFAULT_MAX_BATCH_SIZE = 64;
    public static final Duration DEFAULT_MAX_BATCH_DELAY = Duration.ofMillis(16);

    public Thresholds {
        if (maxBatchSize < 1) throw new IllegalArgumentException("maxBatchSize must be at least 1");
        Objects.requireNonNull(maxBatchDelay, "maxBatchDelay");
        if (maxBatchDelay.isNegative()) throw new IllegalArgumentException("maxBatchDelay must not be negative");
    }

    public static Thresholds defaults() {
        return new Thresholds(DEFAULT_MAX_BATCH_SIZE, DEFAULT_MAX_BATCH_DELAY);
    }

    /** Per-event delivery. */
    public static Thresholds unbatched() {
        return new Thresholds(1, Duration.ZERO);
    }

    public boolean timed() {
        return !maxBatchDelay.isZero();
    }
}
