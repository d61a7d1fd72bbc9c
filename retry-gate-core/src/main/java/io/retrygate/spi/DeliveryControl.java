package io.retrygate.spi;

import io.retrygate.GateMessage;

/**
 * Broker-side handle for one prospective outbound delivery attempt.
 *
 * <p>Only valid for the duration of the outbound call it was passed to.
 */
public interface DeliveryControl {

  /**
   * Returns the routing key of the message about to be delivered. Called on every attempt,
   * so adapters should answer it without copying the payload.
   *
   * @return the routing key
   */
  default String topic() {
    return message().topic();
  }

  /**
   * Returns the message about to be delivered. Only called when the attempt is deferred.
   *
   * @return the message (topic, payload, quality level, retain flag)
   */
  GateMessage message();

  /**
   * Tells the broker not to perform this delivery attempt.
   *
   * @throws RuntimeException if the broker refuses the request
   */
  void suppressDelivery();
}
