package io.retrygate.hook;

import io.retrygate.GateMessage;
import io.retrygate.MessageClass;
import io.retrygate.classify.TopicClassifier;
import io.retrygate.counter.PendingRetryCounter;
import io.retrygate.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Broker callback for messages entering the broker.
 *
 * <p>Counts retry traffic and nothing else: the message is never rejected, changed or
 * delayed, and the only work done on the caller's thread is one atomic increment.
 *
 * <p>This class is thread-safe.
 */
public final class InboundHook {
  private static final Logger logger = Logger.getLogger(InboundHook.class.getName());

  private final TopicClassifier classifier;
  private final PendingRetryCounter counter;
  private final MetricsExporter metrics;

  public InboundHook(TopicClassifier classifier, PendingRetryCounter counter, MetricsExporter metrics) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.counter = Objects.requireNonNull(counter, "counter");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Records an accepted message.
   *
   * @param message the message the broker has just accepted
   * @return the message's class
   */
  public MessageClass onInbound(GateMessage message) {
    Objects.requireNonNull(message, "message");
    return onInbound(message.topic());
  }

  /**
   * Records an accepted message by routing key alone, for adapters that want to avoid
   * copying the payload.
   *
   * @param topic the routing key of the accepted message
   * @return the message's class
   */
  public MessageClass onInbound(String topic) {
    MessageClass messageClass = classifier.classify(topic);
    if (messageClass == MessageClass.RETRY) {
      int pending = counter.increment();
      metrics.incrementRetryAccepted();
      metrics.recordPendingRetries(pending);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Inbound retry on " + topic + ", pending retries now " + pending);
      }
    } else if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Inbound normal on " + topic + ", pending retries " + counter.get());
    }
    return messageClass;
  }
}
