package io.retrygate;

/**
 * The two traffic classes distinguished by the gate.
 *
 * @see io.retrygate.classify.TopicClassifier
 */
public enum MessageClass {
  /** Retry traffic; takes priority over everything else. */
  RETRY,
  /** Everything that is not retry traffic. */
  NORMAL
}
