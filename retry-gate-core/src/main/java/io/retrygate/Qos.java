package io.retrygate;

/**
 * Delivery-quality level carried by a {@link GateMessage}.
 *
 * <p>Codes follow the MQTT numbering so broker adapters can map them directly.
 */
public enum Qos {
  AT_MOST_ONCE(0),
  AT_LEAST_ONCE(1),
  EXACTLY_ONCE(2);

  private final int code;

  Qos(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Resolves a numeric quality level.
   *
   * @param code 0, 1 or 2
   * @return the matching level
   * @throws IllegalArgumentException if {@code code} is not a known level
   */
  public static Qos fromCode(int code) {
    for (Qos qos : values()) {
      if (qos.code == code) {
        return qos;
      }
    }
    throw new IllegalArgumentException("Unknown QoS code: " + code);
  }
}
