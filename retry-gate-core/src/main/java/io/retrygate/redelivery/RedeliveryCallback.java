package io.retrygate.redelivery;

/**
 * Invoked on the timer thread when a {@link DeferredDelivery} becomes due.
 */
@FunctionalInterface
public interface RedeliveryCallback {

  void onDue(DeferredDelivery delivery);
}
