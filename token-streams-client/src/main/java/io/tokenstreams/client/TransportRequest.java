package io.tokenstreams.client;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * @param timeout time allowed until response headers arrive, or {@code null} for none; never
 *                applied to the body, which may stream for as long as the server keeps generating
 */
public record TransportRequest(
        String method,
        URI url,
        Map<String, ? extends Iterable<String>> headers,
        byte[] body,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        if (headers == null) {
            headers = Map.<String, Iterable<String>>of();
        }
    }

    public static TransportRequest get(URI url) {
        return new TransportRequest("GET", url, Map.of(), null, null);
    }

    /**
     * A POST with a JSON body, the shape of a generate or chat call to a local model server.
     */
    public static TransportRequest postJson(URI url, String json) {
        Objects.requireNonNull(json, "json");
        return new TransportRequest("POST", url,
                Map.of("Content-Type", List.of("application/json"), "Accept", List.of("application/x-ndjson")),
                json.getBytes(StandardCharsets.UTF_8), null);
    }

    public TransportRequest withTimeout(Duration timeout) {
        return new TransportRequest(method, url, headers, body, timeout);
    }
}
