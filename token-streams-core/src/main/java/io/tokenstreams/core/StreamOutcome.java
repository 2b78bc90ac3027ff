package io.tokenstreams.core;

import java.util.Objects;

/**
 * Result of advancing a {@link RecordDecoder} once.
 *
 * <p>An {@link Err} is always terminal. An {@link Ok} is terminal when its event is {@code done}.
 */
public sealed interface StreamOutcome<T> permits StreamOutcome.Ok, StreamOutcome.Err {

    boolean isTerminal();

    static <T> StreamOutcome<T> ok(Event<T> event) {
        return new Ok<>(event);
    }

    static <T> StreamOutcome<T> err(TokenStreamsException error) {
        return new Err<>(error);
    }

    /**
     * A successfully decoded event.
     *
     * @param event the decoded event
     */
    record Ok<T>(Event<T> event) implements StreamOutcome<T> {
        public Ok {
            Objects.requireNonNull(event, "event");
        }

        @Override
        public boolean isTerminal() {
            return event.done();
        }
    }

    /**
     * A terminal failure. No further outcomes follow it in the same stream.
     *
     * @param error the failure
     */
    record Err<T>(TokenStreamsException error) implements StreamOutcome<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
