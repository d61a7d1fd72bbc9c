package io.retrygate.counter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free count of retry messages accepted inbound but not yet delivered outbound.
 *
 * <p>The value never goes below zero: a decrement at zero is reported as an
 * {@linkplain Decrement#underflow() underflow} and leaves the count at zero.
 * Reads, increments and decrements are single atomic operations; callers must not
 * assume that a value they read is still current when they act on it.
 *
 * <p>This class is thread-safe.
 */
public final class PendingRetryCounter {
  private final AtomicInteger pending = new AtomicInteger();

  /**
   * @return the count after the increment
   */
  public int increment() {
    return pending.incrementAndGet();
  }

  /**
   * Decrements the count, clamping at zero.
   *
   * @return the outcome, including whether the decrement would have gone negative
   */
  public Decrement decrement() {
    while (true) {
      int current = pending.get();
      if (current <= 0) {
        return new Decrement(0, true);
      }
      if (pending.compareAndSet(current, current - 1)) {
        return new Decrement(current - 1, false);
      }
    }
  }

  public int get() {
    return pending.get();
  }

  public boolean isDrained() {
    return pending.get() == 0;
  }

  /**
   * Drops the count back to zero.
   *
   * @return the count before the reset
   */
  public int reset() {
    return pending.getAndSet(0);
  }

  @Override
  public String toString() {
    return "PendingRetryCounter{pending=" + pending.get() + '}';
  }

  /**
   * Outcome of {@link #decrement()}.
   *
   * @param remaining count after the decrement (never negative)
   * @param underflow {@code true} if the count was already zero
   */
  public record Decrement(int remaining, boolean underflow) {
  }
}
