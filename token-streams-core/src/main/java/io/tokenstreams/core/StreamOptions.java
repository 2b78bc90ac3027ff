package io.tokenstreams.core;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Immutable configuration for one stream.
 *
 * <p>Configure programmatically:
 * <pre>{@code
 * StreamOptions options = StreamOptions.builder()
 *     .thresholds(new Thresholds(100, Duration.ofMillis(4)))
 *     .channelCapacity(ChannelCapacity.bounded(8))
 *     .build();
 * }</pre>
 *
 * <p>or from properties:
 * <pre>
 * token-streams.max-batch-size=100
 * token-streams.max-batch-delay-ms=4
 * token-streams.channel-capacity=8
 * token-streams.stall-timeout-ms=30000
 * </pre>
 */
public final class StreamOptions {

    public static final String PREFIX = "token-streams.";
    public static final String MAX_BATCH_SIZE = PREFIX + "max-batch-size";
    public static final String MAX_BATCH_DELAY_MS = PREFIX + "max-batch-delay-ms";
    public static final String CHANNEL_CAPACITY = PREFIX + "channel-capacity";
    public static final String STALL_TIMEOUT_MS = PREFIX + "stall-timeout-ms";
    public static final String POLL_INTERVAL_MS = PREFIX + "poll-interval-ms";
    public static final String HANDOFF_CAPACITY = PREFIX + "handoff-capacity";
    public static final String THREAD_NAME_PREFIX = PREFIX + "thread-name-prefix";

    static final int DEFAULT_HANDOFF_CAPACITY = 256;
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(5);
    static final String DEFAULT_THREAD_NAME_PREFIX = "token-streams";

    private final Thresholds thresholds;
    private final ChannelCapacity channelCapacity;
    private final CancellationPolicy cancellationPolicy;
    private final int handoffCapacity;
    private final Duration pollInterval;
    private final String threadNamePrefix;
    private final Executor executor;

    private StreamOptions(Builder b) {
        this.thresholds = b.thresholds;
        this.channelCapacity = b.channelCapacity;
        this.cancellationPolicy = b.cancellationPolicy;
        this.handoffCapacity = b.handoffCapacity;
        this.pollInterval = b.pollInterval;
        this.threadNamePrefix = b.threadNamePrefix;
        this.executor = b.executor;
    }

    public static StreamOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from {@code token-streams.*} keys. Missing keys keep their defaults.
     *
     * @param properties flat key/value configuration
     * @return the parsed options
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static StreamOptions fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        Builder b = builder();

        int size = intValue(properties, MAX_BATCH_SIZE, Thresholds.DEFAULT_MAX_BATCH_SIZE);
        long delayMs = longValue(properties, MAX_BATCH_DELAY_MS, Thresholds.DEFAULT_MAX_BATCH_DELAY.toMillis());
        b.thresholds(new Thresholds(size, Duration.ofMillis(delayMs)));

        int capacity = intValue(properties, CHANNEL_CAPACITY, 0);
        b.channelCapacity(capacity == 0 ? ChannelCapacity.unbounded() : ChannelCapacity.bounded(capacity));

        long stallMs = longValue(properties, STALL_TIMEOUT_MS, 0L);
        if (stallMs > 0) b.cancellationPolicy(CancellationPolicy.cancelOnStall(Duration.ofMillis(stallMs)));

        b.pollInterval(Duration.ofMillis(longValue(properties, POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL.toMillis())));
        b.handoffCapacity(intValue(properties, HANDOFF_CAPACITY, DEFAULT_HANDOFF_CAPACITY));

        String prefix = properties.get(THREAD_NAME_PREFIX);
        if (prefix != null && !prefix.isBlank()) b.threadNamePrefix(prefix.trim());
        return b.build();
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    public ChannelCapacity channelCapacity() {
        return channelCapacity;
    }

    public CancellationPolicy cancellationPolicy() {
        return cancellationPolicy;
    }

    /** Number of decoded outcomes the decoder pump may run ahead of the dispatcher. */
    public int handoffCapacity() {
        return handoffCapacity;
    }

    /** Longest time either poller thread blocks before re-checking cancellation. */
    public Duration pollInterval() {
        return pollInterval;
    }

    public String threadNamePrefix() {
        return threadNamePrefix;
    }

    /** Executor shared by several streams; when empty, each stream gets its own threads. */
    public Optional<Executor> executor() {
        return Optional.ofNullable(executor);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.thresholds = thresholds;
        b.channelCapacity = channelCapacity;
        b.cancellationPolicy = cancellationPolicy;
        b.handoffCapacity = handoffCapacity;
        b.pollInterval = pollInterval;
        b.threadNamePrefix = threadNamePrefix;
        b.executor = executor;
        return b;
    }

    @Override
    public String toString() {
        return "StreamOptions{thresholds=" + thresholds
                + ", channelCapacity=" + channelCapacity
                + ", cancellationPolicy=" + cancellationPolicy
                + ", handoffCapacity=" + handoffCapacity
                + ", pollInterval=" + pollInterval
                + ", threadNamePrefix='" + threadNamePrefix + '\''
                + '}';
    }

    private static int intValue(Map<String, String> properties, String key, int fallback) {
        String raw = properties.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, e);
        }
    }

    private static long longValue(Map<String, String> properties, String key, long fallback) {
        String raw = properties.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, e);
        }
    }

    public static final class Builder {
        private Thresholds thresholds = Thresholds.defaults();
        private ChannelCapacity channelCapacity = ChannelCapacity.unbounded();
        private CancellationPolicy cancellationPolicy = CancellationPolicy.none();
        private int handoffCapacity = DEFAULT_HANDOFF_CAPACITY;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        private Executor executor;

        private Builder() {
        }

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
            return this;
        }

        public Builder channelCapacity(ChannelCapacity channelCapacity) {
            this.channelCapacity = Objects.requireNonNull(channelCapacity, "channelCapacity");
            return this;
        }

        public Builder cancellationPolicy(CancellationPolicy cancellationPolicy) {
            this.cancellationPolicy = Objects.requireNonNull(cancellationPolicy, "cancellationPolicy");
            return this;
        }

        public Builder handoffCapacity(int handoffCapacity) {
            if (handoffCapacity < 1) throw new IllegalArgumentException("handoffCapacity must be at least 1");
            this.handoffCapacity = handoffCapacity;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        /**
         * Runs the poller tasks of this stream on a shared executor. Each stream occupies two
         * tasks for its whole lifetime, so a fixed pool must hold at least two threads per
         * concurrent stream.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public StreamOptions build() {
            return new StreamOptions(this);
        }
    }
}
