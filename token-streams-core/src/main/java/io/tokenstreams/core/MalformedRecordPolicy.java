package io.tokenstreams.core;

/**
 * How a {@link LineRecordDecoder} treats a line its parser rejects.
 */
public enum MalformedRecordPolicy {
    /** The decode error ends the stream. */
    FAIL,
    /** The line is logged and skipped; decoding continues with the next line. */
    SKIP
}
