package io.retrygate;

/**
 * Result of evaluating one outbound delivery attempt.
 */
public enum GateDecision {
  /** The broker proceeds with its own delivery. */
  DELIVER,
  /** The attempt was suppressed and a redelivery has been scheduled. */
  SUPPRESSED
}
