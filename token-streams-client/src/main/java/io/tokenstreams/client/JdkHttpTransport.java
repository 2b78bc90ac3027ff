package io.tokenstreams.client;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 *
 * <p>The body is exposed through {@link HttpResponse.BodyHandlers#ofInputStream()}; closing it
 * cancels the exchange, which also releases a thread blocked reading it. The request is sent
 * asynchronously so that interrupting a thread still waiting for the headers aborts the exchange.
 */
public final class JdkHttpTransport implements StreamTransport {
    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<InputStream> open(TransportRequest request) throws Exception {
        CompletableFuture<HttpResponse<InputStream>> exchange =
                http.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        HttpResponse<InputStream> resp;
        try {
            resp = exchange.get();
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof Exception other) throw other;
            throw e;
        }
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body());
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), body);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        for (Map.Entry<String, ? extends Iterable<String>> entry : request.headers().entrySet()) {
            String name = entry.getKey();
            Iterable<String> values = entry.getValue();
            if (name == null || values == null) {
                continue;
            }
            for (String value : values) {
                if (value != null) {
                    builder.header(name, value);
                }
            }
        }

        return builder.build();
    }
}
