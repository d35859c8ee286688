package microbatch.scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic, restartable time source that runs a flush callback once per period.
 *
 * <p>{@link #reset()} cancels the pending schedule and starts a fresh one, so the next
 * tick is a full period away. The callback runs on the timer's own thread; a failure
 * inside it is logged and does not stop later ticks.
 *
 * <p>{@link #start()}, {@link #reset()} and {@link #close()} are synchronized to keep
 * lifecycle transitions ordered.
 */
public final class FlushTimer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FlushTimer.class.getName());

  private final long periodNanos;
  private final Runnable onTick;
  private final ScheduledThreadPoolExecutor scheduler;

  private ScheduledFuture<?> tickTask;
  private boolean closed;

  /**
   * Creates a stopped timer.
   *
   * @param period        time between ticks, must be positive
   * @param onTick        callback run at every tick
   * @param threadFactory factory for the timer thread
   */
  public FlushTimer(Duration period, Runnable onTick, ThreadFactory threadFactory) {
    Objects.requireNonNull(period, "period");
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("period must be > 0");
    }
    this.periodNanos = period.toNanos();
    this.onTick = Objects.requireNonNull(onTick, "onTick");
    this.scheduler = new ScheduledThreadPoolExecutor(1,
        Objects.requireNonNull(threadFactory, "threadFactory"));
    // reset() cancels on every size flush; cancelled ticks must not pile up in the queue
    this.scheduler.setRemoveOnCancelPolicy(true);
  }

  /**
   * Starts ticking; the first tick is one period away. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the timer has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("FlushTimer has been closed");
    }
    if (tickTask != null) {
      return;
    }
    schedule();
  }

  /**
   * Restarts the countdown so the next tick is one full period from now. Has no effect
   * before {@link #start()} or after {@link #close()}.
   */
  public synchronized void reset() {
    if (closed || tickTask == null) {
      return;
    }
    tickTask.cancel(false);
    schedule();
  }

  public synchronized boolean isRunning() {
    return tickTask != null && !closed;
  }

  // number of ticks waiting in the executor queue
  int pendingTicks() {
    return scheduler.getQueue().size();
  }

  private void schedule() {
    tickTask = scheduler.scheduleAtFixedRate(this::tick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
  }

  private void tick() {
    try {
      onTick.run();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Timer flush failed", t);
    }
  }

  /**
   * Cancels the schedule and stops the timer thread, letting a tick that is already
   * running complete. Calling it again has no effect.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Timer thread did not stop within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
