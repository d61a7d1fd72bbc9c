package io.retrygate;

import io.retrygate.classify.TopicClassifier;
import io.retrygate.counter.PendingRetryCounter;
import io.retrygate.hook.InboundHook;
import io.retrygate.hook.OutboundGate;
import io.retrygate.redelivery.RedeliveryScheduler;
import io.retrygate.spi.BrokerPublisher;
import io.retrygate.spi.DeliveryControl;
import io.retrygate.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the classifier, pending-retry counter, both broker
 * hooks and the redelivery scheduler into one {@link AutoCloseable} unit.
 *
 * <p>One instance per broker-extension lifecycle: {@link Builder#build()} starts it with
 * a zero count, {@link #close()} stops it, cancels every deferred delivery without running
 * it and resets the count. Instances share nothing, so several can run side by side.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (RetryGate gate = RetryGate.builder()
 *     .publisher(message -> broker.publish(message))
 *     .redeliveryDelay(Duration.ofSeconds(2))
 *     .build()) {
 *   // inbound path
 *   gate.onInbound(message.topic());
 *   // outbound path
 *   if (gate.onOutbound(deliveryControl) == GateDecision.SUPPRESSED) { ... }
 * }
 * }</pre>
 *
 * @see InboundHook
 * @see OutboundGate
 * @see RedeliveryScheduler
 */
public final class RetryGate implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryGate.class.getName());

  /** Delay between re-evaluations of a deferred delivery unless configured otherwise. */
  public static final Duration DEFAULT_REDELIVERY_DELAY = Duration.ofSeconds(2);

  private final TopicClassifier classifier;
  private final PendingRetryCounter counter;
  private final RedeliveryScheduler scheduler;
  private final InboundHook inboundHook;
  private final OutboundGate outboundGate;
  private final MetricsExporter metrics;
  private final AtomicBoolean running = new AtomicBoolean(true);

  private RetryGate(Builder builder) {
    BrokerPublisher publisher = Objects.requireNonNull(builder.publisher, "publisher");
    Duration delay = builder.redeliveryDelay != null ? builder.redeliveryDelay : DEFAULT_REDELIVERY_DELAY;
    if (delay.isZero() || delay.isNegative()) {
      throw new IllegalArgumentException("redeliveryDelay must be positive");
    }
    this.classifier = builder.classifier != null ? builder.classifier : TopicClassifier.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.counter = new PendingRetryCounter();
    this.scheduler = builder.timer != null
        ? new RedeliveryScheduler(builder.timer) : new RedeliveryScheduler();
    this.inboundHook = new InboundHook(classifier, counter, metrics);
    this.outboundGate = new OutboundGate(classifier, counter, scheduler, publisher, delay, metrics);

    metrics.recordPendingRetries(0);
    metrics.recordDeferredPending(0);
    logger.log(Level.INFO, "Retry gate started ({0}, redeliveryDelay={1})",
        new Object[]{classifier, delay});
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Inbound path: records an accepted message by routing key. Nothing is counted once the
   * gate is stopped.
   *
   * @param topic routing key of the accepted message
   * @return the message's class
   */
  public MessageClass onInbound(String topic) {
    if (!running.get()) {
      return classifier.classify(topic);
    }
    MessageClass messageClass = inboundHook.onInbound(topic);
    if (messageClass == MessageClass.RETRY && !running.get()) {
      // close() reset the count between the check above and the increment
      counter.decrement();
    }
    return messageClass;
  }

  /**
   * Inbound path: records an accepted message. Nothing is counted once the gate is stopped.
   *
   * @param message the accepted message
   * @return the message's class
   */
  public MessageClass onInbound(GateMessage message) {
    Objects.requireNonNull(message, "message");
    return onInbound(message.topic());
  }

  /**
   * Outbound path: evaluates one delivery attempt. Always {@link GateDecision#DELIVER}
   * once the gate is stopped.
   *
   * @param delivery the broker's handle for the attempt
   * @return the decision taken
   */
  public GateDecision onOutbound(DeliveryControl delivery) {
    if (!running.get()) {
      return GateDecision.DELIVER;
    }
    return outboundGate.onOutbound(delivery);
  }

  public InboundHook inboundHook() {
    return inboundHook;
  }

  public OutboundGate outboundGate() {
    return outboundGate;
  }

  public TopicClassifier classifier() {
    return classifier;
  }

  public int pendingRetries() {
    return counter.get();
  }

  public int deferredCount() {
    return scheduler.pendingCount();
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Stops the gate: cancels every deferred delivery (those messages are lost), shuts down
   * the private timer if there is one and resets the pending-retry count to zero.
   * Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    RuntimeException first = null;
    int cancelled = scheduler.cancelAll();
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    int discarded = counter.reset();
    metrics.incrementCancelled(cancelled);
    metrics.recordPendingRetries(0);
    metrics.recordDeferredPending(0);
    logger.log(Level.INFO, "Retry gate stopped; cancelled {0} deferred deliveries, discarded {1} pending retries",
        new Object[]{cancelled, discarded});

    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link RetryGate}. */
  public static final class Builder {
    private BrokerPublisher publisher;
    private TopicClassifier classifier;
    private Duration redeliveryDelay;
    private ScheduledExecutorService timer;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the broker's general publish entry point used to reinject deferred messages.
     *
     * <p><b>Required.</b>
     *
     * @param publisher the publish entry point
     * @return this builder
     */
    public Builder publisher(BrokerPublisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /**
     * Sets the routing-key classifier.
     *
     * <p>Optional. Defaults to {@link TopicClassifier#defaults()}.
     *
     * @param classifier the classifier
     * @return this builder
     */
    public Builder classifier(TopicClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the delay between re-evaluations of a deferred delivery.
     *
     * <p>Optional. Defaults to {@link RetryGate#DEFAULT_REDELIVERY_DELAY}. Must be positive.
     *
     * @param redeliveryDelay the delay
     * @return this builder
     */
    public Builder redeliveryDelay(Duration redeliveryDelay) {
      this.redeliveryDelay = redeliveryDelay;
      return this;
    }

    /**
     * Runs redeliveries on a caller-owned executor instead of a private daemon thread.
     * The gate never shuts this executor down.
     *
     * <p>Optional.
     *
     * @param timer the executor
     * @return this builder
     */
    public Builder timer(ScheduledExecutorService timer) {
      this.timer = timer;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds and starts the gate.
     *
     * @return a running gate
     * @throws NullPointerException if no publisher was set
     * @throws IllegalArgumentException if the redelivery delay is not positive
     * @throws IllegalStateException if this builder was already used
     */
    public RetryGate build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new RetryGate(this);
    }
  }
}
