package io.tokenstreams.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * What the poller does when it cannot make progress because the consumer is not draining.
 *
 * <p>By default the poller waits for capacity indefinitely; only an explicit cancel releases it.
 * With {@link #cancelOnStall(Duration)} the poller ends the stream once a single send has been
 * blocked on a full channel for longer than the timeout. It does so without cancelling the stream's
 * {@link CancellationToken}, which only the consumer writes; the handle then reports
 * {@link StreamState#CANCELLED}. Batches already queued remain deliverable.
 */
public final class CancellationPolicy {

    private static final CancellationPolicy NONE = new CancellationPolicy(null);

    private final Duration stallTimeout;

    private CancellationPolicy(Duration stallTimeout) {
        this.stallTimeout = stallTimeout;
    }

    public static CancellationPolicy none() {
        return NONE;
    }

    public static CancellationPolicy cancelOnStall(Duration stallTimeout) {
        Objects.requireNonNull(stallTimeout, "stallTimeout");
        if (stallTimeout.isNegative() || stallTimeout.isZero()) {
            throw new IllegalArgumentException("stallTimeout must be positive");
        }
        return new CancellationPolicy(stallTimeout);
    }

    public Optional<Duration> stallTimeout() {
        return Optional.ofNullable(stallTimeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CancellationPolicy other)) return false;
        return Objects.equals(stallTimeout, other.stallTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(stallTimeout);
    }

    @Override
    public String toString() {
        return stallTimeout == null ? "CancellationPolicy[none]" : "CancellationPolicy[cancelOnStall=" + stallTimeout + "]";
    }
}
