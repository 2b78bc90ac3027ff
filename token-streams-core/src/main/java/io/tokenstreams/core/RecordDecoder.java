package io.tokenstreams.core;

import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;

/**
 * Lazy source of decoded events, driven by the poller from its own thread.
 *
 * <p>The decoder is the only place that knows the payload format. Implementations need not be
 * thread-safe for {@link #next()}, which is always called from the same poller thread, but
 * {@link #close()} may be called from another thread to abort a blocked read.
 */
@FunctionalInterface
public interface RecordDecoder<T> extends AutoCloseable {

    /**
     * Advances the decoder.
     *
     * @return the next event, or {@code null} once the source is exhausted
     * @throws IOException if reading from the transport fails
     * @throws TokenStreamsException.Decode if a record is malformed
     */
    Event<T> next() throws IOException;

    @Override
    default void close() throws IOException {
    }

    /**
     * Adapts an iterator. Useful for replaying recorded streams.
     */
    static <T> RecordDecoder<T> fromIterator(Iterator<Event<T>> events) {
        Objects.requireNonNull(events, "events");
        return () -> events.hasNext() ? events.next() : null;
    }
}
