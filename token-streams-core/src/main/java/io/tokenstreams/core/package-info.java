/**
 * Stream-decoupling and event-batching core for Token Streams.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>The stream model ({@link io.tokenstreams.core.Event}, {@link io.tokenstreams.core.StreamOutcome},
 *       {@link io.tokenstreams.core.Batch})</li>
 *   <li>The poller that drives a {@link io.tokenstreams.core.RecordDecoder} on its own threads</li>
 *   <li>The batcher, the delivery channel and the cancellation token joining the two scheduling domains</li>
 *   <li>The consumer-side draining loop used from a host scheduler</li>
 * </ul>
 *
 * <p>HTTP transports, JSON decoding and reactive bindings live in other modules.
 */
package io.tokenstreams.core;
