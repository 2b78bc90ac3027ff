package io.tokenstreams.client.reactor;

import io.tokenstreams.core.Batch;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOutcome;
import io.tokenstreams.reactive.FlowInterop;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Reactor adapter over a {@link StreamHandle}.
 */
public final class ReactorTokenStreams {
    private ReactorTokenStreams() {}

    /**
     * Emits the stream's batches, drained once per {@code frameInterval}. Cancelling the
     * subscription closes the stream.
     */
    public static <T> Flux<Batch<T>> batches(StreamHandle<T> handle, Duration frameInterval) {
        return Flux.from(FlowInterop.batches(handle, frameInterval))
                .doOnCancel(handle::close);
    }

    /**
     * Flattens {@link #batches} into outcomes, for consumers that do not care about batch boundaries.
     */
    public static <T> Flux<StreamOutcome<T>> outcomes(StreamHandle<T> handle, Duration frameInterval) {
        return batches(handle, frameInterval).concatMapIterable(Batch::outcomes);
    }
}
