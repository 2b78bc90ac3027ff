package io.tokenstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Decoder for newline-delimited records.
 *
 * <p>Lines are trimmed; blank lines are ignored. Unless disabled, lines made only of hexadecimal
 * digits are ignored as well: they are chunk-size markers left in the body when a chunked HTTP
 * response is read without de-chunking.
 */
public final class LineRecordDecoder<T> implements RecordDecoder<T> {

    private static final Logger log = LoggerFactory.getLogger(LineRecordDecoder.class);
    private static final int PREVIEW_LENGTH = 100;

    private final InputStream source;
    private final BufferedReader in;
    private final LineParser<T> parser;
    private final MalformedRecordPolicy malformedRecordPolicy;
    private final boolean skipChunkSizeLines;
    private long lineNumber;

    public LineRecordDecoder(InputStream in, LineParser<T> parser) {
        this(in, parser, MalformedRecordPolicy.FAIL, true);
    }

    public LineRecordDecoder(InputStream in, LineParser<T> parser, MalformedRecordPolicy malformedRecordPolicy) {
        this(in, parser, malformedRecordPolicy, true);
    }

    public LineRecordDecoder(InputStream in, LineParser<T> parser,
                             MalformedRecordPolicy malformedRecordPolicy, boolean skipChunkSizeLines) {
        this.source = Objects.requireNonNull(in, "in");
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.parser = Objects.requireNonNull(parser, "parser");
        this.malformedRecordPolicy = Objects.requireNonNull(malformedRecordPolicy, "malformedRecordPolicy");
        this.skipChunkSizeLines = skipChunkSizeLines;
    }

    @Override
    public Event<T> next() throws IOException {
        String raw;
        while ((raw = in.readLine()) != null) {
            lineNumber++;
            String line = raw.trim();
            if (line.isEmpty()) continue;
            if (skipChunkSizeLines && isHex(line)) continue;

            try {
                return parser.parse(line);
            } catch (TokenStreamsException.Decode e) {
                if (malformedRecordPolicy == MalformedRecordPolicy.FAIL) {
                    throw e;
                }
                log.debug("Skipping malformed line {}: {} ({})", lineNumber, e.getMessage(), preview(line));
            }
        }
        return null;
    }

    /**
     * Closes the underlying stream directly rather than the reader, so that a read blocked on
     * another thread is aborted instead of holding up the close.
     */
    @Override
    public void close() throws IOException {
        source.close();
    }

    static boolean isHex(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) return false;
        }
        return true;
    }

    private static String preview(String line) {
        return line.length() <= PREVIEW_LENGTH ? line : line.substring(0, PREVIEW_LENGTH) + "...";
    }
}
