package io.tokenstreams.core;

/**
 * Turns one framed line into an event.
 */
@FunctionalInterface
public interface LineParser<T> {

    /**
     * @param line a trimmed, non-empty line
     * @return the decoded event
     * @throws TokenStreamsException.Decode if the line is not a valid record
     */
    Event<T> parse(String line);
}
