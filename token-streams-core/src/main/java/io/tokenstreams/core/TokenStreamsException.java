package io.tokenstreams.core;

/**
 * Base class for Token Streams errors.
 *
 * <p>Stream failures are delivered to the consumer as the final outcome of a stream, never thrown
 * across threads. Only {@link ResourceExhausted} is thrown directly, from the call that starts a stream.
 */
public abstract class TokenStreamsException extends RuntimeException {

    protected TokenStreamsException(String message) {
        super(message);
    }

    protected TokenStreamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the underlying connection cannot be opened or a read fails.
     */
    public static class Transport extends TokenStreamsException {
        public Transport(String message) {
            super(message);
        }

        public Transport(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a record cannot be decoded.
     */
    public static class Decode extends TokenStreamsException {
        public Decode(String message) {
            super(message);
        }

        public Decode(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised on the producing side once the consumer has released its end of the channel.
     */
    public static class ChannelClosed extends TokenStreamsException {
        public ChannelClosed(String message) {
            super(message);
        }
    }

    /**
     * Raised when the threads that drive a stream cannot be created.
     */
    public static class ResourceExhausted extends TokenStreamsException {
        public ResourceExhausted(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
