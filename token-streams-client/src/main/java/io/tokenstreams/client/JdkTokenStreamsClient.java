package io.tokenstreams.client;

import io.tokenstreams.core.LineParser;
import io.tokenstreams.core.MalformedRecordPolicy;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOptions;
import io.tokenstreams.core.TokenStreams;

import java.net.http.HttpClient;
import java.util.Objects;

public final class JdkTokenStreamsClient implements TokenStreamsClient {

    private final StreamTransport transport;
    private final StreamOptions defaultOptions;
    private final MalformedRecordPolicy malformedRecordPolicy;

    public JdkTokenStreamsClient(HttpClient http) {
        this(new JdkHttpTransport(http), StreamOptions.defaults(), MalformedRecordPolicy.SKIP);
    }

    public JdkTokenStreamsClient(StreamTransport transport, StreamOptions defaultOptions,
                                 MalformedRecordPolicy malformedRecordPolicy) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.malformedRecordPolicy = Objects.requireNonNull(malformedRecordPolicy, "malformedRecordPolicy");
    }

    @Override
    public <T> StreamHandle<T> stream(TransportRequest request, LineParser<T> parser) {
        return stream(request, parser, defaultOptions);
    }

    @Override
    public <T> StreamHandle<T> stream(TransportRequest request, LineParser<T> parser, StreamOptions options) {
        Objects.requireNonNull(options, "options");
        HttpRecordDecoder<T> decoder = new HttpRecordDecoder<>(transport, request, parser, malformedRecordPolicy);
        return TokenStreams.beginStream(decoder, options);
    }

    public StreamOptions defaultOptions() {
        return defaultOptions;
    }
}
