package io.retrygate.spi;

/**
 * Observability hook for exporting gate counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of retry messages accepted inbound.
   */
  void incrementRetryAccepted();

  /**
   * Increments the count of retry messages that completed an outbound delivery.
   */
  void incrementRetryDelivered();

  /**
   * Increments the count of decrements attempted while the pending count was already zero.
   */
  void incrementCounterUnderflow();

  /**
   * Increments the count of normal messages delivered without deferral.
   */
  void incrementNormalDelivered();

  /**
   * Increments the count of normal delivery attempts suppressed and deferred.
   */
  void incrementDeferred();

  /**
   * Increments the count of deferred messages put back on the timer because retries
   * were still pending when they fired.
   */
  void incrementRequeued();

  /**
   * Increments the count of deferred messages handed back to the broker.
   */
  void incrementRedelivered();

  /**
   * Increments the count of deferred messages lost because the broker's publish failed.
   */
  void incrementRedeliveryFailed();

  /**
   * Adds to the count of deferred messages discarded at shutdown.
   *
   * @param count number of tasks cancelled
   */
  default void incrementCancelled(int count) {
  }

  /**
   * Records the current pending-retry count.
   *
   * @param pending pending retries (never negative)
   */
  void recordPendingRetries(int pending);

  /**
   * Records the number of deferred deliveries currently waiting on the timer.
   *
   * @param deferred outstanding deferred deliveries
   */
  default void recordDeferredPending(int deferred) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementRetryAccepted() {
    }

    @Override
    public void incrementRetryDelivered() {
    }

    @Override
    public void incrementCounterUnderflow() {
    }

    @Override
    public void incrementNormalDelivered() {
    }

    @Override
    public void incrementDeferred() {
    }

    @Override
    public void incrementRequeued() {
    }

    @Override
    public void incrementRedelivered() {
    }

    @Override
    public void incrementRedeliveryFailed() {
    }

    @Override
    public void recordPendingRetries(int pending) {
    }
  }
}
