/**
 * Deferred delivery registry and timer.
 *
 * <p>{@link io.retrygate.redelivery.RedeliveryScheduler} fires each
 * {@link io.retrygate.redelivery.DeferredDelivery} once; repeated attempts are explicit
 * reschedules, and shutdown cancels everything still waiting.
 */
package io.retrygate.redelivery;
