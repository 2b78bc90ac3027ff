package io.tokenstreams.core;

/**
 * Applies delivered batches to consumer-side state, typically the model behind a UI.
 */
@FunctionalInterface
public interface BatchSink<T> {

    void apply(Batch<T> batch);

    /**
     * Called once, after the last batch has been applied.
     */
    default void onFinished(StreamState state) {
    }
}
