package io.tokenstreams.client;

import io.tokenstreams.core.LineParser;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOptions;

/**
 * Starts decoupled, batched streams over newline-delimited HTTP responses.
 *
 * <pre>{@code
 * TokenStreamsClient client = TokenStreamsClient.create();
 * StreamHandle<String> handle = client.stream(
 *         TransportRequest.postJson(URI.create("http://localhost:11434/api/generate"), body),
 *         JacksonLineParser.of(String.class).withPayloadAt("/response"));
 * }</pre>
 */
public interface TokenStreamsClient {

    /**
     * Starts a stream with the client's default options. Returns immediately; the request is sent
     * from the stream's poller thread.
     */
    <T> StreamHandle<T> stream(TransportRequest request, LineParser<T> parser);

    <T> StreamHandle<T> stream(TransportRequest request, LineParser<T> parser, StreamOptions options);

    static TokenStreamsClient create() {
        return builder().build();
    }

    static TokenStreamsClient create(java.net.http.HttpClient httpClient) {
        return builder().jdkHttpClient(httpClient).build();
    }

    static TokenStreamsClientBuilder builder() {
        return new TokenStreamsClientBuilder();
    }
}
