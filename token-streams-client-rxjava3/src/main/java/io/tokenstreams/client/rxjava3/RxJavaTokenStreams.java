package io.tokenstreams.client.rxjava3;

import io.reactivex.rxjava3.core.Flowable;
import io.tokenstreams.core.Batch;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOutcome;
import io.tokenstreams.reactive.FlowInterop;

import java.time.Duration;

/**
 * RxJava3 adapter over a {@link StreamHandle}.
 */
public final class RxJavaTokenStreams {
    private RxJavaTokenStreams() {}

    public static <T> Flowable<Batch<T>> batches(StreamHandle<T> handle, Duration frameInterval) {
        return Flowable.fromPublisher(FlowInterop.batches(handle, frameInterval))
                .doOnCancel(handle::close);
    }

    public static <T> Flowable<StreamOutcome<T>> outcomes(StreamHandle<T> handle, Duration frameInterval) {
        return batches(handle, frameInterval).concatMapIterable(Batch::outcomes);
    }
}
