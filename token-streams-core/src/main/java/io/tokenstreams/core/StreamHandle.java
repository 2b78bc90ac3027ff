package io.tokenstreams.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The consumer's capability over one running stream.
 *
 * <p>Owns the stream's cancellation token, the receiving end of its delivery channel and a join
 * handle on its poller threads. Apart from {@link #cancel()}, which may be called from any thread,
 * a handle is meant to be used from the consumer's thread only.
 *
 * <p>{@link #close()} must be called when the consumer loses interest; it cancels the stream,
 * discards undelivered batches and closes the decoder so that no poller thread is left behind.
 */
public final class StreamHandle<T> implements AutoCloseable {

    private final long id;
    private final CancellationToken token;
    private final DeliveryChannel<T> channel;
    private final Poller<T> poller;
    private final List<Batch<T>> scratch = new ArrayList<>();
    private StreamOutcome<T> terminal;
    private boolean closed;

    StreamHandle(long id, CancellationToken token, DeliveryChannel<T> channel, Poller<T> poller) {
        this.id = id;
        this.token = Objects.requireNonNull(token, "token");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.poller = Objects.requireNonNull(poller, "poller");
    }

    public long id() {
        return id;
    }

    /**
     * Drains every batch currently available. Never blocks waiting for new ones.
     *
     * @return the batches in delivery order, possibly empty
     */
    public List<Batch<T>> pollBatches() {
        List<Batch<T>> out = new ArrayList<>();
        drainTo(out);
        return out;
    }

    /**
     * Non-allocating variant of {@link #pollBatches()}.
     *
     * @return number of batches added to {@code sink}
     */
    public int drainTo(Collection<? super Batch<T>> sink) {
        Objects.requireNonNull(sink, "sink");
        if (closed) return 0;
        scratch.clear();
        int n = channel.drainTo(scratch);
        for (Batch<T> batch : scratch) {
            if (batch.isTerminal()) terminal = batch.last();
        }
        sink.addAll(scratch);
        scratch.clear();
        return n;
    }

    /**
     * Requests cancellation. Batches already queued stay available; the channel closes within one
     * poller iteration. An in-flight read is not interrupted.
     *
     * @return {@code true} if this call cancelled the stream
     */
    public boolean cancel() {
        return token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /** @return whether the poller is done and every batch has been drained */
    public boolean isFinished() {
        return closed || channel.isClosed();
    }

    public StreamState state() {
        if (terminal != null) {
            return terminal instanceof StreamOutcome.Err ? StreamState.FAILED : StreamState.COMPLETED;
        }
        if (!isFinished()) {
            return token.isCancelled() ? StreamState.CANCELLING : StreamState.RUNNING;
        }
        return token.isCancelled() || poller.stalled() ? StreamState.CANCELLED : StreamState.COMPLETED;
    }

    /** @return the error that ended the stream, once it has been drained */
    public Optional<TokenStreamsException> failure() {
        if (terminal instanceof StreamOutcome.Err<T> err) {
            return Optional.of(err.error());
        }
        return Optional.empty();
    }

    /**
     * Waits for both poller threads to exit. Blocking; not for use on a host UI thread.
     *
     * @return {@code true} if the threads exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return poller.awaitExit(timeout);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        token.cancel();
        channel.closeReceiving();
        poller.closeDecoder();
    }

    @Override
    public String toString() {
        return "StreamHandle{id=" + id + ", state=" + state() + '}';
    }
}
