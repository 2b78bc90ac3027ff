package io.tokenstreams.client.rxjava3;

import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import io.tokenstreams.core.Batch;
import io.tokenstreams.core.Event;
import io.tokenstreams.core.RecordDecoder;
import io.tokenstreams.core.StreamHandle;
import io.tokenstreams.core.StreamOutcome;
import io.tokenstreams.core.StreamState;
import io.tokenstreams.core.TokenStreams;
import io.tokenstreams.core.TokenStreamsException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RxJavaTokenStreamsTest {

    @Test
    void flowableEmitsEveryEventThenCompletes() throws Exception {
        StreamHandle<String> handle = TokenStreams.beginStream(tokens(30));

        TestSubscriber<Batch<String>> subscriber = RxJavaTokenStreams.batches(handle, Duration.ofMillis(5)).test();

        assertThat(subscriber.await(10, TimeUnit.SECONDS)).isTrue();
        subscriber.assertComplete().assertNoErrors();
        List<String> payloads = new ArrayList<>();
        for (Batch<String> batch : subscriber.values()) {
            for (StreamOutcome<String> outcome : batch.outcomes()) {
                if (outcome instanceof StreamOutcome.Ok<String> ok) payloads.add(ok.event().payload());
            }
        }
        assertThat(payloads).hasSize(30).startsWith("t1").endsWith("t30");
        assertThat(handle.state()).isEqualTo(StreamState.COMPLETED);
    }

    @Test
    void decodeFailureArrivesAsLastOutcomeNotAsOnError() throws Exception {
        Iterator<String> lines = List.of("t1", "t2", "!").iterator();
        RecordDecoder<String> decoder = () -> {
            if (!lines.hasNext()) return null;
            String line = lines.next();
            if (line.equals("!")) throw new TokenStreamsException.Decode("unexpected character");
            return Event.of(line);
        };
        StreamHandle<String> handle = TokenStreams.beginStream(decoder);

        TestSubscriber<StreamOutcome<String>> subscriber = RxJavaTokenStreams.outcomes(handle, Duration.ofMillis(5)).test();

        assertThat(subscriber.await(10, TimeUnit.SECONDS)).isTrue();
        subscriber.assertComplete().assertNoErrors().assertValueCount(3);
        assertThat(subscriber.values().get(2)).isInstanceOf(StreamOutcome.Err.class);
        assertThat(handle.state()).isEqualTo(StreamState.FAILED);
    }

    @Test
    void disposingTheSubscriptionClosesTheStream() throws Exception {
        CountDownLatch closed = new CountDownLatch(1);
        RecordDecoder<String> decoder = new RecordDecoder<>() {
            private boolean first = true;

            @Override
            public Event<String> next() throws IOException {
                if (first) {
                    first = false;
                    return Event.of("t1");
                }
                try {
                    closed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IOException("closed");
            }

            @Override
            public void close() {
                closed.countDown();
            }
        };
        StreamHandle<String> handle = TokenStreams.beginStream(decoder);
        CountDownLatch firstBatch = new CountDownLatch(1);

        Disposable subscription = RxJavaTokenStreams.batches(handle, Duration.ofMillis(5))
                .subscribe(batch -> firstBatch.countDown());
        assertThat(firstBatch.await(10, TimeUnit.SECONDS)).isTrue();
        subscription.dispose();

        assertThat(closed.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.awaitTermination(Duration.ofSeconds(10))).isTrue();
    }

    private static RecordDecoder<String> tokens(int n) {
        List<Event<String>> events = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            events.add(new Event<>("t" + i, i == n));
        }
        return RecordDecoder.fromIterator(events.iterator());
    }
}
