package io.tokenstreams.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Delivery figures observed by a {@link ConsumerLoop}.
 *
 * @param events events applied (errors excluded)
 * @param batches batches applied
 * @param largestBatch size of the largest batch applied
 * @param timeToFirstEvent time from loop creation to the first applied event, or {@code null} if none yet
 * @param streamingTime time between the first and the latest applied event
 */
public record DeliveryStats(long events, long batches, int largestBatch, Duration timeToFirstEvent, Duration streamingTime) {

    public Optional<Duration> firstEventLatency() {
        return Optional.ofNullable(timeToFirstEvent);
    }

    /** @return events per second over the streaming time, or {@code 0} with fewer than two events */
    public double eventsPerSecond() {
        if (events < 2 || streamingTime.isZero()) return 0.0;
        return (events - 1) / (streamingTime.toNanos() / 1_000_000_000.0);
    }

    public double averageBatchSize() {
        return batches == 0 ? 0.0 : (double) events / batches;
    }
}
