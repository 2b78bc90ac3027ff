package io.tokenstreams.reactive;

import io.tokenstreams.core.Batch;
import io.tokenstreams.core.BatchPublisher;
import io.tokenstreams.core.StreamHandle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Interop utilities between token streams, Java {@link Flow} and Reactive Streams.
 */
public final class FlowInterop {
    private FlowInterop() {}

    public static <T> org.reactivestreams.Publisher<T> toReactiveStreams(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return org.reactivestreams.FlowAdapters.toPublisher(publisher);
    }

    public static <T> Flow.Publisher<T> toFlow(org.reactivestreams.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return org.reactivestreams.FlowAdapters.toFlowPublisher(publisher);
    }

    /**
     * Reactive Streams view of a running stream, drained once per {@code frameInterval} on a
     * dedicated scheduler thread. Completes when the stream is finished; stream errors arrive as
     * the last outcome of the last batch.
     */
    public static <T> org.reactivestreams.Publisher<Batch<T>> batches(StreamHandle<T> handle, Duration frameInterval) {
        return toReactiveStreams(new BatchPublisher<>(handle, frameInterval));
    }

    /**
     * Same as {@link #batches(StreamHandle, Duration)}, ticking on a caller-owned scheduler.
     */
    public static <T> org.reactivestreams.Publisher<Batch<T>> batches(StreamHandle<T> handle,
                                                                      ScheduledExecutorService scheduler,
                                                                      Duration frameInterval) {
        return toReactiveStreams(new BatchPublisher<>(handle, scheduler, frameInterval));
    }
}
