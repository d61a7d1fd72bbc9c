package io.retrygate.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.retrygate.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code retry.gate.retry.accepted}: retry messages counted inbound</li>
 *   <li>{@code retry.gate.retry.delivered}: retry messages counted down outbound</li>
 *   <li>{@code retry.gate.counter.underflow}: decrements clamped at zero</li>
 *   <li>{@code retry.gate.normal.delivered}: normal messages delivered without deferral</li>
 *   <li>{@code retry.gate.normal.deferred}: normal deliveries suppressed and scheduled</li>
 *   <li>{@code retry.gate.normal.requeued}: deferred messages put back on the timer</li>
 *   <li>{@code retry.gate.normal.redelivered}: deferred messages handed back to the broker</li>
 *   <li>{@code retry.gate.normal.redelivery.failed}: deferred messages lost to a failed publish</li>
 *   <li>{@code retry.gate.deferred.cancelled}: deferred messages discarded at shutdown</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code retry.gate.retry.pending}: current pending-retry count</li>
 *   <li>{@code retry.gate.deferred.pending}: deferred deliveries waiting on the timer</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "retry.gate";

  private final MeterRegistry registry;
  private final Counter retryAccepted;
  private final Counter retryDelivered;
  private final Counter counterUnderflow;
  private final Counter normalDelivered;
  private final Counter deferred;
  private final Counter requeued;
  private final Counter redelivered;
  private final Counter redeliveryFailed;
  private final Counter cancelled;
  private final Gauge pendingRetriesGauge;
  private final Gauge deferredPendingGauge;

  private final AtomicInteger pendingRetries = new AtomicInteger();
  private final AtomicInteger deferredPending = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for every meter name, e.g. {@code "broker-a.retry.gate"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.retryAccepted = counter(namePrefix + ".retry.accepted", "Retry messages counted inbound");
    this.retryDelivered = counter(namePrefix + ".retry.delivered", "Retry messages counted down outbound");
    this.counterUnderflow = counter(namePrefix + ".counter.underflow",
        "Outbound retry deliveries seen while the pending count was already zero");
    this.normalDelivered = counter(namePrefix + ".normal.delivered", "Normal messages delivered without deferral");
    this.deferred = counter(namePrefix + ".normal.deferred", "Normal deliveries suppressed and scheduled");
    this.requeued = counter(namePrefix + ".normal.requeued", "Deferred messages requeued while retries were pending");
    this.redelivered = counter(namePrefix + ".normal.redelivered", "Deferred messages republished to the broker");
    this.redeliveryFailed = counter(namePrefix + ".normal.redelivery.failed",
        "Deferred messages dropped after a failed republish");
    this.cancelled = counter(namePrefix + ".deferred.cancelled", "Deferred messages discarded at shutdown");

    this.pendingRetriesGauge = Gauge.builder(namePrefix + ".retry.pending", pendingRetries, AtomicInteger::get)
        .description("Retry messages accepted but not yet delivered")
        .register(registry);
    this.deferredPendingGauge = Gauge.builder(namePrefix + ".deferred.pending", deferredPending, AtomicInteger::get)
        .description("Deferred deliveries waiting on the timer")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementRetryAccepted() {
    if (closed) return;
    retryAccepted.increment();
  }

  @Override
  public void incrementRetryDelivered() {
    if (closed) return;
    retryDelivered.increment();
  }

  @Override
  public void incrementCounterUnderflow() {
    if (closed) return;
    counterUnderflow.increment();
  }

  @Override
  public void incrementNormalDelivered() {
    if (closed) return;
    normalDelivered.increment();
  }

  @Override
  public void incrementDeferred() {
    if (closed) return;
    deferred.increment();
  }

  @Override
  public void incrementRequeued() {
    if (closed) return;
    requeued.increment();
  }

  @Override
  public void incrementRedelivered() {
    if (closed) return;
    redelivered.increment();
  }

  @Override
  public void incrementRedeliveryFailed() {
    if (closed) return;
    redeliveryFailed.increment();
  }

  @Override
  public void incrementCancelled(int count) {
    if (closed || count <= 0) return;
    cancelled.increment(count);
  }

  @Override
  public void recordPendingRetries(int pending) {
    if (closed) return;
    pendingRetries.set(pending);
  }

  @Override
  public void recordDeferredPending(int deferredCount) {
    if (closed) return;
    deferredPending.set(deferredCount);
  }

  /**
   * Removes every meter this exporter registered. The gate calls this on
   * {@link io.retrygate.RetryGate#close()}; later updates are ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(retryAccepted, retryDelivered, counterUnderflow,
        normalDelivered, deferred, requeued, redelivered, redeliveryFailed, cancelled,
        pendingRetriesGauge, deferredPendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
