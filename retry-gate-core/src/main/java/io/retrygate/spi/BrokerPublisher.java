package io.retrygate.spi;

import io.retrygate.GateMessage;

import java.util.concurrent.CompletionStage;

/**
 * The broker's general-purpose publish entry point.
 *
 * <p>Used to reinject a previously suppressed message. The publish is not tied to
 * any client or session; the broker fans it out to whichever subscribers match at
 * that moment. Implementations may fail either by throwing or by completing the
 * returned stage exceptionally.
 */
@FunctionalInterface
public interface BrokerPublisher {

  /**
   * Publishes a message as if a client had sent it.
   *
   * @param message the message to publish
   * @return a stage that completes once the broker has accepted the message
   */
  CompletionStage<Void> publish(GateMessage message);
}
