package io.tokenstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a {@link RecordDecoder} on threads of its own and delivers batches to a {@link DeliveryChannel}.
 *
 * <p>Each stream runs two tasks:
 * <ul>
 *   <li>the <em>pump</em> calls {@link RecordDecoder#next()} back to back, as fast as the transport
 *       delivers, and hands each outcome over a bounded queue;</li>
 *   <li>the <em>dispatcher</em> feeds those outcomes to a {@link Batcher}, flushes batches when they
 *       fill up or age out, and sends them to the consumer.</li>
 * </ul>
 * Splitting the two lets a batch age out while the pump is parked in a read. A full channel blocks
 * the dispatcher; a full hand-off queue then blocks the pump, so a slow consumer pushes back on the
 * transport instead of losing data.
 *
 * <p>Streams are started through {@link TokenStreams}, which gives each one a token of its own.
 */
final class Poller<T> {

    private static final Logger log = LoggerFactory.getLogger(Poller.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final RecordDecoder<T> decoder;
    private final CancellationToken token;
    private final StreamOptions options;
    private final Batcher<T> batcher;
    private final DeliveryChannel<T> channel;
    private final BlockingQueue<Slot<T>> handoff;
    private final long pollNanos;
    private final Duration stallTimeout;
    private final CountDownLatch exited = new CountDownLatch(2);
    private final AtomicBoolean decoderClosed = new AtomicBoolean();
    private volatile boolean dispatcherExited;
    private volatile boolean stalled;
    private volatile boolean launchFailed;

    private Poller(RecordDecoder<T> decoder, CancellationToken token, StreamOptions options) {
        this.id = IDS.incrementAndGet();
        this.decoder = decoder;
        this.token = token;
        this.options = options;
        this.batcher = new Batcher<>(options.thresholds());
        this.channel = new DeliveryChannel<>(options.channelCapacity());
        this.handoff = new ArrayBlockingQueue<>(options.handoffCapacity());
        this.pollNanos = options.pollInterval().toNanos();
        this.stallTimeout = options.cancellationPolicy().stallTimeout().orElse(null);
    }

    /**
     * Starts polling {@code decoder}.
     *
     * @return the consumer's handle on the new stream
     * @throws TokenStreamsException.ResourceExhausted if the poller threads cannot be started
     */
    static <T> StreamHandle<T> start(RecordDecoder<T> decoder, CancellationToken token, StreamOptions options) {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(options, "options");

        Poller<T> poller = new Poller<>(decoder, token, options);
        token.onCancel(poller.channel::wakeProducer);
        poller.launch();
        log.debug("Stream {} started with {}", poller.id, options);
        return new StreamHandle<>(poller.id, token, poller.channel, poller);
    }

    private void launch() {
        Optional<Executor> shared = options.executor();
        int started = 0;
        try {
            if (shared.isPresent()) {
                shared.get().execute(this::dispatch);
                started++;
                shared.get().execute(this::pump);
                started++;
            } else {
                PollerThreads threads = new PollerThreads(options.threadNamePrefix() + "-" + id);
                Thread dispatcher = threads.newThread(this::dispatch, "dispatch");
                Thread pump = threads.newThread(this::pump, "pump");
                dispatcher.start();
                started++;
                pump.start();
                started++;
            }
        } catch (RejectedExecutionException | OutOfMemoryError e) {
            // a dispatcher that did start sees this flag on its next poll and exits
            launchFailed = true;
            for (int i = started; i < 2; i++) {
                exited.countDown();
            }
            closeDecoder();
            throw new TokenStreamsException.ResourceExhausted("cannot start poller for stream " + id, e);
        }
    }

    private void pump() {
        try {
            while (!token.isCancelled() && !dispatcherExited && !launchFailed) {
                StreamOutcome<T> outcome;
                try {
                    Event<T> event = decoder.next();
                    if (event == null) {
                        handOff(Slot.end());
                        return;
                    }
                    outcome = StreamOutcome.ok(event);
                } catch (IOException e) {
                    if (token.isCancelled() || decoderClosed.get()) {
                        return;
                    }
                    outcome = StreamOutcome.err(new TokenStreamsException.Transport("read failed: " + e.getMessage(), e));
                } catch (TokenStreamsException e) {
                    outcome = StreamOutcome.err(e);
                } catch (RuntimeException e) {
                    log.warn("Stream {} decoder failed unexpectedly", id, e);
                    outcome = StreamOutcome.err(new TokenStreamsException.Decode("decoder failed: " + e, e));
                }

                if (!handOff(new Slot<>(outcome)) || outcome.isTerminal()) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closeDecoder();
            exited.countDown();
        }
    }

    private boolean handOff(Slot<T> slot) throws InterruptedException {
        while (!handoff.offer(slot, pollNanos, TimeUnit.NANOSECONDS)) {
            if (token.isCancelled() || dispatcherExited) {
                return false;
            }
        }
        return true;
    }

    private void dispatch() {
        String reason = "cancelled";
        // the token is only read here; a stall ends the stream without cancelling it
        try {
            while (!token.isCancelled()) {
                if (launchFailed) {
                    reason = "launch failed";
                    return;
                }
                Optional<Batch<T>> due = batcher.flushIfDue(System.nanoTime());
                if (due.isPresent() && !deliver(due.get())) {
                    reason = exitReason();
                    return;
                }

                long wait = Math.min(batcher.nanosUntilDue(System.nanoTime()), pollNanos);
                Slot<T> slot = handoff.poll(wait, TimeUnit.NANOSECONDS);
                if (slot == null) {
                    continue;
                }

                if (slot.isEnd()) {
                    Optional<Batch<T>> rest = batcher.flush();
                    if (rest.isPresent() && !deliver(rest.get())) {
                        reason = exitReason();
                        return;
                    }
                    reason = "decoder exhausted";
                    return;
                }

                for (Batch<T> batch : batcher.accept(slot.outcome(), System.nanoTime())) {
                    if (!deliver(batch)) {
                        reason = exitReason();
                        return;
                    }
                }
                if (batcher.isTerminated()) {
                    reason = slot.outcome() instanceof StreamOutcome.Err ? "terminal error" : "done";
                    return;
                }
            }
        } catch (TokenStreamsException.ChannelClosed e) {
            reason = "consumer released the channel";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = "interrupted";
        } catch (RuntimeException e) {
            log.warn("Stream {} dispatcher failed", id, e);
            reason = "dispatcher failure";
        } finally {
            dispatcherExited = true;
            int dropped = batcher.discardPending() + handoff.size();
            handoff.clear();
            channel.closeSending();
            exited.countDown();
            if (dropped > 0) {
                log.debug("Stream {} discarded {} undelivered outcomes", id, dropped);
            }
            log.debug("Stream {} closed after {} batches: {}", id, batcher.emittedBatches(), reason);
        }
    }

    private String exitReason() {
        return stalled ? "consumer stalled" : "cancelled";
    }

    private boolean deliver(Batch<T> batch) throws InterruptedException {
        DeliveryChannel.SendResult result = channel.send(batch, token, stallTimeout);
        switch (result) {
            case SENT:
                return true;
            case STALLED:
                log.warn("Stream {} stopped: consumer did not drain for {}", id, stallTimeout);
                stalled = true;
                return false;
            case CANCELLED:
            default:
                return false;
        }
    }

    void closeDecoder() {
        if (!decoderClosed.compareAndSet(false, true)) {
            return;
        }
        try {
            decoder.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Stream {} decoder did not close cleanly", id, e);
        }
    }

    /** @return whether the dispatcher gave up on a consumer that stopped draining */
    boolean stalled() {
        return stalled;
    }

    boolean awaitExit(Duration timeout) throws InterruptedException {
        return exited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private record Slot<T>(StreamOutcome<T> outcome) {
        private static final Slot<?> END = new Slot<>(null);

        @SuppressWarnings("unchecked")
        static <T> Slot<T> end() {
            return (Slot<T>) END;
        }

        boolean isEnd() {
            return outcome == null;
        }
    }
}
