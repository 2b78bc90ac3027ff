package io.tokenstreams.client;

import io.tokenstreams.core.Batch;
import io.tokenstreams.core.MalformedRecordPolicy;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOptions;
import io.tokenstreams.core.StreamOutcome;
import io.tokenstreams.core.StreamState;
import io.tokenstreams.core.TokenStreamsException;
import io.tokenstreams.json.jackson.JacksonLineParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TokenStreamsClientBuilderTest {

    private static final URI GENERATE = URI.create("http://localhost:11434/api/generate");
    private static final JacksonLineParser<String> RESPONSE = JacksonLineParser.of(String.class).withPayloadAt("/response");

    @Test
    void builderUsesCustomTransport() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), ndjson(
                "{\"response\":\"Hel\",\"done\":false}",
                "{\"response\":\"lo\",\"done\":false}",
                "{\"response\":\"\",\"done\":true}")));

        TokenStreamsClient client = TokenStreamsClient.builder()
                .transport(transport)
                .build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{\"model\":\"llama3\"}"), RESPONSE);
        List<String> payloads = payloads(drain(handle));

        assertThat(payloads).containsExactly("Hel", "lo", "");
        assertThat(handle.state()).isEqualTo(StreamState.COMPLETED);
        assertThat(transport.lastRequest.method()).isEqualTo("POST");
        assertThat(firstHeader(transport.lastRequest.headers(), "Content-Type")).isEqualTo("application/json");
    }

    @Test
    void requestIsSentFromThePollerThread() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), ndjson("{\"response\":\"x\",\"done\":true}")));
        TokenStreamsClient client = TokenStreamsClient.builder()
                .transport(transport)
                .defaultOptions(StreamOptions.builder().threadNamePrefix("ollama").build())
                .build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{}"), RESPONSE);
        drain(handle);

        assertThat(transport.openedOn).startsWith("ollama-").endsWith("-pump");
    }

    @Test
    void nonSuccessStatusEndsStreamWithTransportError() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(404, Map.of(), ndjson("{\"error\":\"model 'llama9' not found\"}")));
        TokenStreamsClient client = TokenStreamsClient.builder().transport(transport).build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{}"), RESPONSE);
        List<Batch<String>> batches = drain(handle);

        assertThat(batches).singleElement().satisfies(b -> assertThat(b.isTerminal()).isTrue());
        assertThat(handle.state()).isEqualTo(StreamState.FAILED);
        assertThat(handle.failure()).hasValueSatisfying(e -> {
            assertThat(e).isInstanceOf(TokenStreamsException.Transport.class);
            assertThat(e).hasMessageContaining("404").hasMessageContaining("not found");
        });
    }

    @Test
    void connectFailureEndsStreamWithTransportError() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.failWith(new ConnectException("Connection refused"));
        TokenStreamsClient client = TokenStreamsClient.builder().transport(transport).build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{}"), RESPONSE);
        drain(handle);

        assertThat(handle.failure()).hasValueSatisfying(e -> {
            assertThat(e).isInstanceOf(TokenStreamsException.Transport.class);
            assertThat(e).hasRootCauseInstanceOf(ConnectException.class);
        });
    }

    @Test
    void malformedLinesAreSkippedByDefault() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), ndjson(
                "{\"response\":\"a\",\"done\":false}",
                "{\"response\":",
                "{\"response\":\"b\",\"done\":true}")));
        TokenStreamsClient client = TokenStreamsClient.builder().transport(transport).build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{}"), RESPONSE);

        assertThat(payloads(drain(handle))).containsExactly("a", "b");
        assertThat(handle.state()).isEqualTo(StreamState.COMPLETED);
    }

    @Test
    void malformedLinesCanFailTheStream() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), ndjson(
                "{\"response\":\"a\",\"done\":false}",
                "{\"response\":",
                "{\"response\":\"b\",\"done\":true}")));
        TokenStreamsClient client = TokenStreamsClient.builder()
                .transport(transport)
                .malformedRecords(MalformedRecordPolicy.FAIL)
                .build();

        StreamHandle<String> handle = client.stream(TransportRequest.postJson(GENERATE, "{}"), RESPONSE);

        assertThat(payloads(drain(handle))).containsExactly("a");
        assertThat(handle.state()).isEqualTo(StreamState.FAILED);
        assertThat(handle.failure()).containsInstanceOf(TokenStreamsException.Decode.class);
    }

    static List<Batch<String>> drain(StreamHandle<String> handle) throws InterruptedException {
        List<Batch<String>> batches = new ArrayList<>();
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!handle.isFinished()) {
            if (System.nanoTime() > deadline) throw new AssertionError("stream did not finish: " + handle);
            batches.addAll(handle.pollBatches());
            Thread.sleep(1);
        }
        batches.addAll(handle.pollBatches());
        return batches;
    }

    static List<String> payloads(List<Batch<String>> batches) {
        List<String> out = new ArrayList<>();
        for (Batch<String> batch : batches) {
            for (StreamOutcome<String> outcome : batch.outcomes()) {
                if (outcome instanceof StreamOutcome.Ok<String> ok) out.add(ok.event().payload());
            }
        }
        return out;
    }

    private static InputStream ndjson(String... lines) {
        return new ByteArrayInputStream((String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private static String firstHeader(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null) return null;
        Iterable<String> values = headers.get(name);
        if (values == null) return null;
        for (String v : values) {
            return v;
        }
        return null;
    }

    private static final class RecordingTransport implements StreamTransport {
        private TransportResponse<InputStream> next;
        private Exception failure;
        private volatile TransportRequest lastRequest;
        private volatile String openedOn;

        void enqueue(TransportResponse<InputStream> response) {
            this.next = response;
        }

        void failWith(Exception failure) {
            this.failure = failure;
        }

        @Override
        public TransportResponse<InputStream> open(TransportRequest request) throws Exception {
            lastRequest = request;
            openedOn = Thread.currentThread().getName();
            if (failure != null) throw failure;
            return next;
        }
    }
}
