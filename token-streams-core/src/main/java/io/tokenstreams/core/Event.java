package io.tokenstreams.core;

import java.util.Objects;

/**
 * One unit of generated content.
 *
 * @param payload the decoded payload
 * @param done whether this event marks completion of the stream
 * @param <T> payload type
 */
public record Event<T>(T payload, boolean done) {
    public Event {
        Objects.requireNonNull(payload, "payload");
    }

    public static <T> Event<T> of(T payload) {
        return new Event<>(payload, false);
    }

    public static <T> Event<T> last(T payload) {
        return new Event<>(payload, true);
    }
}
