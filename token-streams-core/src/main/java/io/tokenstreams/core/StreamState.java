package io.tokenstreams.core;

/**
 * Lifecycle of a stream as seen from its consumer.
 */
public enum StreamState {
    /** Batches may still arrive. */
    RUNNING,
    /** Cancel was requested; the channel has not closed yet. */
    CANCELLING,
    /** The stream delivered its {@code done} event or its decoder was exhausted. */
    COMPLETED,
    /** The stream's last outcome was an error. */
    FAILED,
    /** The stream stopped because it was cancelled. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
