package io.retrygate.hook;

import io.retrygate.GateDecision;
import io.retrygate.GateMessage;
import io.retrygate.MessageClass;
import io.retrygate.classify.TopicClassifier;
import io.retrygate.counter.PendingRetryCounter;
import io.retrygate.redelivery.DeferredDelivery;
import io.retrygate.redelivery.RedeliveryScheduler;
import io.retrygate.spi.BrokerPublisher;
import io.retrygate.spi.DeliveryControl;
import io.retrygate.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Broker callback invoked right before a message is handed to a subscriber.
 *
 * <p>Decision per attempt, from a single read of the pending-retry count:
 * <ul>
 *   <li>retry message: deliver, and count one pending retry down (clamped at zero)</li>
 *   <li>normal message, no pending retries: deliver</li>
 *   <li>normal message, pending retries: suppress the attempt, snapshot the message and
 *       schedule a redelivery after the configured delay</li>
 * </ul>
 *
 * <p>When a deferred delivery fires the count is read again. At zero the snapshot is
 * published through the broker's general publish entry point; otherwise it goes back
 * on the timer with the same delay. Deferred messages are re-evaluated independently,
 * so no order is kept between them, and they wait for as long as retry traffic keeps
 * arriving.
 *
 * <p>No exception raised here reaches the broker: failures are logged and the attempt
 * is delivered unless it was already suppressed.
 *
 * <p>This class is thread-safe.
 */
public final class OutboundGate {
  private static final Logger logger = Logger.getLogger(OutboundGate.class.getName());

  private final TopicClassifier classifier;
  private final PendingRetryCounter counter;
  private final RedeliveryScheduler scheduler;
  private final BrokerPublisher publisher;
  private final Duration redeliveryDelay;
  private final MetricsExporter metrics;

  public OutboundGate(TopicClassifier classifier, PendingRetryCounter counter,
      RedeliveryScheduler scheduler, BrokerPublisher publisher,
      Duration redeliveryDelay, MetricsExporter metrics) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.counter = Objects.requireNonNull(counter, "counter");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.redeliveryDelay = Objects.requireNonNull(redeliveryDelay, "redeliveryDelay");
    if (redeliveryDelay.isZero() || redeliveryDelay.isNegative()) {
      throw new IllegalArgumentException("redeliveryDelay must be positive");
    }
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Evaluates one prospective delivery attempt.
   *
   * @param delivery the broker's handle for the attempt; not retained after return
   * @return {@link GateDecision#SUPPRESSED} if the attempt was suppressed and deferred,
   *     otherwise {@link GateDecision#DELIVER}
   */
  public GateDecision onOutbound(DeliveryControl delivery) {
    Objects.requireNonNull(delivery, "delivery");
    String topic;
    try {
      topic = delivery.topic();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Could not read outbound topic; delivering unchanged", e);
      return GateDecision.DELIVER;
    }

    try {
      MessageClass messageClass = classifier.classify(topic);
      int pending = counter.get();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Outbound " + messageClass + " on " + topic + " (pending retries=" + pending + ")");
      }

      if (messageClass == MessageClass.RETRY) {
        releaseRetry(topic);
        return GateDecision.DELIVER;
      }
      if (pending == 0) {
        metrics.incrementNormalDelivered();
        return GateDecision.DELIVER;
      }
      return defer(topic, delivery, pending);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Outbound evaluation failed for " + topic + "; delivering unchanged", e);
      return GateDecision.DELIVER;
    }
  }

  private void releaseRetry(String topic) {
    PendingRetryCounter.Decrement result = counter.decrement();
    if (result.underflow()) {
      metrics.incrementCounterUnderflow();
      logger.warning("Retry delivery on " + topic + " with no pending retries recorded; count held at 0");
    } else {
      metrics.incrementRetryDelivered();
    }
    metrics.recordPendingRetries(result.remaining());
  }

  private GateDecision defer(String topic, DeliveryControl delivery, int pending) {
    if (!scheduler.isAccepting()) {
      logger.fine("Redelivery scheduler closed; delivering " + topic + " unchanged");
      metrics.incrementNormalDelivered();
      return GateDecision.DELIVER;
    }
    // Snapshot before suppressing: an unreadable message is still delivered by the broker.
    GateMessage message = delivery.message();
    try {
      delivery.suppressDelivery();
    } catch (RuntimeException e) {
      // The broker will deliver this attempt itself; scheduling would duplicate it.
      logger.log(Level.WARNING, "Broker refused to suppress delivery on " + topic + "; delivering now", e);
      metrics.incrementNormalDelivered();
      return GateDecision.DELIVER;
    }

    // From here on the broker will not deliver this attempt.
    long taskId;
    try {
      taskId = scheduler.schedule(message, redeliveryDelay, this::onDue);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Suppressed message on " + topic + " dropped: could not schedule redelivery", e);
      return GateDecision.SUPPRESSED;
    }
    try {
      metrics.incrementDeferred();
      metrics.recordDeferredPending(scheduler.pendingCount());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics update failed for deferred task " + taskId, e);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Deferred " + topic + " as task " + taskId + " (pending retries=" + pending
          + ", delay=" + redeliveryDelay + ", payload=" + message.payloadText() + ")");
    }
    return GateDecision.SUPPRESSED;
  }

  /**
   * Fired-task logic: publish the snapshot if retries have drained, otherwise requeue it.
   *
   * @param delivery the deferred delivery that became due
   */
  void onDue(DeferredDelivery delivery) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Trying to redeliver task " + delivery.taskId()
          + " (attempt " + delivery.attempt() + ") on " + delivery.message().topic());
    }
    if (counter.get() > 0) {
      requeue(delivery);
    } else {
      redeliver(delivery);
    }
    metrics.recordDeferredPending(scheduler.pendingCount());
  }

  private void requeue(DeferredDelivery delivery) {
    try {
      long taskId = scheduler.reschedule(delivery, redeliveryDelay, this::onDue);
      metrics.incrementRequeued();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Retries still pending; task " + delivery.taskId() + " requeued as " + taskId);
      }
    } catch (IllegalStateException e) {
      logger.fine("Task " + delivery.taskId() + " dropped at shutdown");
    }
  }

  private void redeliver(DeferredDelivery delivery) {
    CompletionStage<Void> published;
    try {
      published = Objects.requireNonNull(publisher.publish(delivery.message()),
          "BrokerPublisher returned null");
    } catch (RuntimeException e) {
      redeliveryFailed(delivery, e);
      return;
    }
    published.whenComplete((ignored, error) -> {
      if (error != null) {
        redeliveryFailed(delivery, error);
      } else {
        metrics.incrementRedelivered();
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Redelivered task " + delivery.taskId() + " on " + delivery.message().topic());
        }
      }
    });
  }

  private void redeliveryFailed(DeferredDelivery delivery, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause() : error;
    metrics.incrementRedeliveryFailed();
    logger.log(Level.SEVERE, "Redelivery of task " + delivery.taskId() + " on "
        + delivery.message().topic() + " failed; message dropped", cause);
  }

  public Duration redeliveryDelay() {
    return redeliveryDelay;
  }
}
