package io.tokenstreams.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryChannelTest {

    private final CancellationToken token = new CancellationToken();

    @Test
    void drainsInFifoOrderAndClosesOnceEmpty() throws Exception {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.unbounded());
        channel.send(batch(0, "a"), token, null);
        channel.send(batch(1, "b"), token, null);
        channel.closeSending();

        assertThat(channel.isClosed()).isFalse();
        List<Batch<String>> out = new ArrayList<>();
        assertThat(channel.drainTo(out)).isEqualTo(2);

        assertThat(out).extracting(Batch::sequence).containsExactly(0L, 1L);
        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.drainTo(out)).isZero();
    }

    @Test
    void boundedChannelBlocksSenderUntilDrained() throws Exception {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.bounded(2));
        channel.send(batch(0, "a"), token, null);
        channel.send(batch(1, "b"), token, null);

        CompletableFuture<DeliveryChannel.SendResult> third = CompletableFuture.supplyAsync(() -> send(channel, batch(2, "c"), null));
        Thread.sleep(50);
        assertThat(third).isNotDone();
        assertThat(channel.size()).isEqualTo(2);

        List<Batch<String>> out = new ArrayList<>();
        channel.drainTo(out);

        assertThat(third.get(1, TimeUnit.SECONDS)).isEqualTo(DeliveryChannel.SendResult.SENT);
        channel.drainTo(out);
        assertThat(out).extracting(Batch::sequence).containsExactly(0L, 1L, 2L);
    }

    @Test
    void cancellationReleasesBlockedSender() throws Exception {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.bounded(1));
        token.onCancel(channel::wakeProducer);
        channel.send(batch(0, "a"), token, null);

        CompletableFuture<DeliveryChannel.SendResult> blocked = CompletableFuture.supplyAsync(() -> send(channel, batch(1, "b"), null));
        Thread.sleep(30);
        token.cancel();

        assertThat(blocked.get(1, TimeUnit.SECONDS)).isEqualTo(DeliveryChannel.SendResult.CANCELLED);
        assertThat(channel.size()).isEqualTo(1);
    }

    @Test
    void stallTimeoutIsReportedWhenConsumerDoesNotDrain() throws Exception {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.bounded(1));
        channel.send(batch(0, "a"), token, null);

        DeliveryChannel.SendResult result = channel.send(batch(1, "b"), token, Duration.ofMillis(20));

        assertThat(result).isEqualTo(DeliveryChannel.SendResult.STALLED);
    }

    @Test
    void sendingAfterConsumerReleasedChannelFails() {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.unbounded());
        channel.closeReceiving();

        assertThat(channel.isClosed()).isTrue();
        assertThatThrownBy(() -> channel.send(batch(0, "a"), token, null))
                .isInstanceOf(TokenStreamsException.ChannelClosed.class);
    }

    @Test
    void releasingChannelUnblocksSenderWithChannelClosed() throws Exception {
        DeliveryChannel<String> channel = new DeliveryChannel<>(ChannelCapacity.bounded(1));
        channel.send(batch(0, "a"), token, null);

        CompletableFuture<DeliveryChannel.SendResult> blocked = CompletableFuture.supplyAsync(() -> send(channel, batch(1, "b"), null));
        Thread.sleep(30);
        channel.closeReceiving();

        assertThatThrownBy(() -> blocked.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TokenStreamsException.ChannelClosed.class);
    }

    @Test
    void rejectsInvalidCapacity() {
        assertThatThrownBy(() -> ChannelCapacity.bounded(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChannelCapacity(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ChannelCapacity.unbounded().isBounded()).isFalse();
    }

    private DeliveryChannel.SendResult send(DeliveryChannel<String> channel, Batch<String> batch, Duration stall) {
        try {
            return channel.send(batch, token, stall);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static Batch<String> batch(long sequence, String payload) {
        return new Batch<>(sequence, List.of(StreamOutcome.ok(Event.of(payload))));
    }
}
