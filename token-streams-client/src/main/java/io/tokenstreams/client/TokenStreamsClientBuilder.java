package io.tokenstreams.client;

import io.tokenstreams.core.MalformedRecordPolicy;
import io.tokenstreams.core.StreamOptions;

import java.net.http.HttpClient;
import java.util.Objects;

public final class TokenStreamsClientBuilder {
    private StreamTransport transport;
    private StreamOptions defaultOptions = StreamOptions.defaults();
    private MalformedRecordPolicy malformedRecordPolicy = MalformedRecordPolicy.SKIP;

    public TokenStreamsClientBuilder transport(StreamTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public TokenStreamsClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public TokenStreamsClientBuilder defaultOptions(StreamOptions options) {
        this.defaultOptions = Objects.requireNonNull(options, "options");
        return this;
    }

    /**
     * What to do with a line the parser rejects. Defaults to {@link MalformedRecordPolicy#SKIP}.
     */
    public TokenStreamsClientBuilder malformedRecords(MalformedRecordPolicy policy) {
        this.malformedRecordPolicy = Objects.requireNonNull(policy, "policy");
        return this;
    }

    public TokenStreamsClient build() {
        StreamTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        return new JdkTokenStreamsClient(resolved, defaultOptions, malformedRecordPolicy);
    }
}
