package io.retrygate.redelivery;

import io.retrygate.GateMessage;
import io.retrygate.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of deferred deliveries plus the timer that fires them.
 *
 * <p>Each {@link #schedule} call creates one one-shot timer task. When the task fires
 * it is removed from the registry and handed to its {@link RedeliveryCallback}; a
 * callback that wants another attempt calls {@link #reschedule}, which registers a
 * fresh task instead of re-entering the original call chain. The registry exists only
 * so that {@link #cancelAll()} can discard everything at shutdown; individual tasks
 * are never cancelled.
 *
 * <p>The timer is either supplied by the host (for example a broker-managed executor,
 * which this class never shuts down) or a private single daemon thread created here
 * and shut down by {@link #close()}.
 *
 * <p>This class is thread-safe. Once closed it rejects new tasks for good.
 */
public final class RedeliveryScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RedeliveryScheduler.class.getName());

  private final Map<Long, ScheduledDelivery> registry = new ConcurrentHashMap<>();
  private final AtomicLong taskIds = new AtomicLong();
  private final ScheduledExecutorService timer;
  private final boolean ownsTimer;
  private volatile boolean closed;

  /**
   * Creates a scheduler with its own single daemon timer thread.
   */
  public RedeliveryScheduler() {
    this.timer = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("retry-gate-redelivery-"));
    this.ownsTimer = true;
  }

  /**
   * Creates a scheduler on top of an executor owned by the caller.
   *
   * @param timer the executor that runs redelivery tasks; not shut down by {@link #close()}
   */
  public RedeliveryScheduler(ScheduledExecutorService timer) {
    this.timer = Objects.requireNonNull(timer, "timer");
    this.ownsTimer = false;
  }

  /**
   * Registers a first deferral of {@code message}.
   *
   * @param message  the snapshot to redeliver
   * @param delay    time until the task fires; must be positive
   * @param callback invoked once when the task fires
   * @return the task identifier
   * @throws IllegalStateException if the scheduler has been closed
   */
  public long schedule(GateMessage message, Duration delay, RedeliveryCallback callback) {
    return register(message, delay, 1, callback);
  }

  /**
   * Registers another attempt for a delivery that has just fired.
   *
   * @param previous the delivery that fired
   * @param delay    time until the new task fires; must be positive
   * @param callback invoked once when the new task fires
   * @return the identifier of the new task
   * @throws IllegalStateException if the scheduler has been closed
   */
  public long reschedule(DeferredDelivery previous, Duration delay, RedeliveryCallback callback) {
    Objects.requireNonNull(previous, "previous");
    return register(previous.message(), delay, previous.attempt() + 1, callback);
  }

  private long register(GateMessage message, Duration delay, int attempt, RedeliveryCallback callback) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(callback, "callback");
    if (delay.isZero() || delay.isNegative()) {
      throw new IllegalArgumentException("delay must be positive");
    }
    if (closed) {
      throw new IllegalStateException("RedeliveryScheduler has been closed");
    }

    long taskId = taskIds.incrementAndGet();
    ScheduledDelivery task = new ScheduledDelivery(
        new DeferredDelivery(taskId, message, Instant.now().plus(delay), attempt), callback);
    // Registered before the timer sees it, so a very short delay cannot fire first.
    registry.put(taskId, task);
    try {
      task.attach(timer.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS));
    } catch (RejectedExecutionException e) {
      registry.remove(taskId);
      throw new IllegalStateException("Redelivery timer rejected task " + taskId, e);
    } catch (RuntimeException e) {
      registry.remove(taskId);
      throw e;
    }
    if (closed && registry.remove(taskId, task)) {
      // cancelAll() ran between the check above and the put
      task.cancel();
      throw new IllegalStateException("RedeliveryScheduler has been closed");
    }
    return taskId;
  }

  /**
   * Stops accepting tasks and cancels every registered one without running it.
   *
   * @return the number of tasks cancelled
   */
  public int cancelAll() {
    closed = true;
    int cancelled = 0;
    for (Map.Entry<Long, ScheduledDelivery> entry : registry.entrySet()) {
      if (registry.remove(entry.getKey(), entry.getValue())) {
        entry.getValue().cancel();
        cancelled++;
      }
    }
    return cancelled;
  }

  /**
   * Returns {@code true} until {@link #cancelAll()} or {@link #close()} is called.
   */
  public boolean isAccepting() {
    return !closed;
  }

  public int pendingCount() {
    return registry.size();
  }

  /**
   * Returns the deliveries currently waiting, ordered by task id.
   *
   * @return a point-in-time copy
   */
  public List<DeferredDelivery> pending() {
    List<DeferredDelivery> snapshot = new ArrayList<>(registry.size());
    for (ScheduledDelivery task : registry.values()) {
      snapshot.add(task.delivery);
    }
    snapshot.sort(Comparator.comparingLong(DeferredDelivery::taskId));
    return snapshot;
  }

  /**
   * Cancels all pending tasks and, if the timer was created here, shuts it down.
   */
  @Override
  public void close() {
    int cancelled = cancelAll();
    if (cancelled > 0) {
      logger.log(Level.INFO, "Cancelled {0} deferred deliveries at shutdown", cancelled);
    }
    if (ownsTimer) {
      timer.shutdownNow();
      try {
        if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Redelivery timer did not terminate within 5 seconds");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private final class ScheduledDelivery implements Runnable {
    private final DeferredDelivery delivery;
    private final RedeliveryCallback callback;
    private volatile ScheduledFuture<?> future;
    private volatile boolean cancelled;

    private ScheduledDelivery(DeferredDelivery delivery, RedeliveryCallback callback) {
      this.delivery = delivery;
      this.callback = callback;
    }

    void attach(ScheduledFuture<?> scheduled) {
      this.future = scheduled;
      if (cancelled) {
        scheduled.cancel(false);
      }
    }

    void cancel() {
      cancelled = true;
      ScheduledFuture<?> scheduled = future;
      if (scheduled != null) {
        scheduled.cancel(false);
      }
    }

    @Override
    public void run() {
      // Whoever removes the entry owns it: either this firing or cancelAll().
      if (cancelled || !registry.remove(delivery.taskId(), this) || closed) {
        return;
      }
      try {
        callback.onDue(delivery);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Redelivery task " + delivery.taskId() + " failed", e);
      }
    }
  }
}
