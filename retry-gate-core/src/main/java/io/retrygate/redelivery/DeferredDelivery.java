package io.retrygate.redelivery;

import io.retrygate.GateMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * A suppressed normal message waiting on the redelivery timer.
 *
 * @param taskId  identifier of the timer task, unique per {@link RedeliveryScheduler}
 * @param message snapshot taken when the delivery was suppressed
 * @param dueAt   when the task fires
 * @param attempt 1 for the first deferral, incremented on every requeue
 */
public record DeferredDelivery(long taskId, GateMessage message, Instant dueAt, int attempt) {

  public DeferredDelivery {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(dueAt, "dueAt");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }
}
