package io.tokenstreams.core;

import java.util.Objects;

/**
 * Entry point for starting streams.
 *
 * <pre>{@code
 * StreamHandle<String> handle = TokenStreams.beginStream(decoder,
 *         new Thresholds(100, Duration.ofMillis(4)), CancellationPolicy.none());
 *
 * // on every frame:
 * for (Batch<String> batch : handle.pollBatches()) {
 *     render(batch);
 * }
 * }</pre>
 *
 * <p>Starting a stream never performs I/O on the calling thread; all decoder calls happen on the
 * stream's poller threads.
 */
public final class TokenStreams {

    private TokenStreams() {
    }

    public static <T> StreamHandle<T> beginStream(RecordDecoder<T> decoder) {
        return beginStream(decoder, StreamOptions.defaults());
    }

    /**
     * @throws TokenStreamsException.ResourceExhausted if the poller threads cannot be started
     */
    public static <T> StreamHandle<T> beginStream(RecordDecoder<T> decoder, Thresholds thresholds,
                                                  CancellationPolicy cancellationPolicy) {
        StreamOptions options = StreamOptions.builder()
                .thresholds(Objects.requireNonNull(thresholds, "thresholds"))
                .cancellationPolicy(Objects.requireNonNull(cancellationPolicy, "cancellationPolicy"))
                .build();
        return beginStream(decoder, options);
    }

    /**
     * @throws TokenStreamsException.ResourceExhausted if the poller threads cannot be started
     */
    public static <T> StreamHandle<T> beginStream(RecordDecoder<T> decoder, StreamOptions options) {
        return Poller.start(decoder, new CancellationToken(), options);
    }
}
