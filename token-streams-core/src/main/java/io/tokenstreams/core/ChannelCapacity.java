package io.tokenstreams.core;

/**
 * Capacity of the channel carrying batches to the consumer.
 *
 * <p>An unbounded channel never blocks the poller but grows without limit if the consumer stalls.
 * A bounded channel caps memory and blocks the poller once {@code capacity} batches are unconsumed.
 *
 * @param capacity maximum number of undelivered batches, or {@code 0} for unbounded
 */
public record ChannelCapacity(int capacity) {

    private static final ChannelCapacity UNBOUNDED = new ChannelCapacity(0);

    public ChannelCapacity {
        if (capacity < 0) throw new IllegalArgumentException("capacity must not be negative");
    }

    public static ChannelCapacity unbounded() {
        return UNBOUNDED;
    }

    public static ChannelCapacity bounded(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("bounded capacity must be at least 1");
        return new ChannelCapacity(capacity);
    }

    public boolean isBounded() {
        return capacity > 0;
    }
}
