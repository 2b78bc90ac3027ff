package io.tokenstreams.client;

import io.tokenstreams.core.Event;
import io.tokenstreams.core.LineParser;
import io.tokenstreams.core.LineRecordDecoder;
import io.tokenstreams.core.MalformedRecordPolicy;
import io.tokenstreams.core.RecordDecoder;
import io.tokenstreams.core.TokenStreamsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Record decoder over the newline-delimited body of an HTTP response.
 *
 * <p>The request is sent on the first call to {@link #next()}, that is on the poller's own thread,
 * so starting a stream never performs network I/O on the caller's thread. A non-2xx status ends
 * the stream with a {@link TokenStreamsException.Transport} carrying the status and the start of
 * the response body.
 *
 * <p>Bodies arrive already de-chunked from the transport, so every non-blank line is a record;
 * a line such as {@code 42} is never mistaken for a chunk-size line.
 *
 * <p>{@link #close()} may be called from any thread. It aborts a read in progress, and interrupts
 * the poller thread while it is still waiting for the response headers.
 */
public final class HttpRecordDecoder<T> implements RecordDecoder<T> {

    private static final Logger log = LoggerFactory.getLogger(HttpRecordDecoder.class);
    private static final int ERROR_PREVIEW_BYTES = 512;

    private final StreamTransport transport;
    private final TransportRequest request;
    private final LineParser<T> parser;
    private final MalformedRecordPolicy malformedRecordPolicy;
    private final Object lock = new Object();
    private LineRecordDecoder<T> lines;
    private InputStream body;
    private Thread opening;
    private boolean closed;

    public HttpRecordDecoder(StreamTransport transport, TransportRequest request, LineParser<T> parser,
                             MalformedRecordPolicy malformedRecordPolicy) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.request = Objects.requireNonNull(request, "request");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.malformedRecordPolicy = Objects.requireNonNull(malformedRecordPolicy, "malformedRecordPolicy");
    }

    @Override
    public Event<T> next() throws IOException {
        LineRecordDecoder<T> current;
        synchronized (lock) {
            current = lines;
        }
        if (current == null) {
            current = open();
        }
        return current.next();
    }

    private LineRecordDecoder<T> open() throws IOException {
        synchronized (lock) {
            if (closed) throw new IOException("decoder closed before " + request.url() + " was opened");
            opening = Thread.currentThread();
        }
        TransportResponse<InputStream> resp;
        try {
            resp = transport.open(request);
        } catch (IOException e) {
            throw e;
        } catch (InterruptedException e) {
            if (finishOpening()) {
                throw new IOException("decoder closed while opening " + request.url());
            }
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while opening " + request.url());
        } catch (Exception e) {
            throw new IOException("cannot open " + request.url() + ": " + e.getMessage(), e);
        } finally {
            finishOpening();
        }
        log.debug("{} {} answered {}", request.method(), request.url(), resp.status());

        InputStream in = resp.body() == null ? InputStream.nullInputStream() : resp.body();
        if (!resp.isSuccessful()) {
            String preview = preview(in);
            throw new TokenStreamsException.Transport(
                    request.method() + " " + request.url() + " failed with status " + resp.status()
                            + (preview.isEmpty() ? "" : ": " + preview));
        }

        synchronized (lock) {
            if (closed) {
                in.close();
                throw new IOException("decoder closed while opening " + request.url());
            }
            body = in;
            lines = new LineRecordDecoder<>(in, parser, malformedRecordPolicy, false);
            return lines;
        }
    }

    /**
     * Leaves the opening phase. An interrupt sent by {@link #close()} is consumed here so it does
     * not outlive the request on a pooled thread.
     *
     * @return whether the decoder was closed meanwhile
     */
    private boolean finishOpening() {
        synchronized (lock) {
            if (opening == Thread.currentThread()) {
                opening = null;
                if (closed) Thread.interrupted();
            }
            return closed;
        }
    }

    @Override
    public void close() throws IOException {
        InputStream current;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            current = body;
            if (opening != null) opening.interrupt();
        }
        if (current != null) {
            current.close();
        }
    }

    private static String preview(InputStream in) {
        try (in) {
            byte[] head = in.readNBytes(ERROR_PREVIEW_BYTES);
            return new String(head, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.debug("Could not read error body", e);
            return "";
        }
    }

    @Override
    public String toString() {
        return "HttpRecordDecoder{" + request.method() + " " + request.url() + '}';
    }
}
