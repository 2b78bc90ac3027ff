package io.tokenstreams.client;

import java.io.InputStream;

/**
 * Opens the response body of a streaming request.
 *
 * <p>Implementations return as soon as the status line and headers are available; the body is
 * read incrementally by the caller. Closing the returned stream must abort the exchange.
 */
public interface StreamTransport {
    TransportResponse<InputStream> open(TransportRequest request) throws Exception;
}
