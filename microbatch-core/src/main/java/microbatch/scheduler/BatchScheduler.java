package microbatch.scheduler;

import microbatch.FlushTrigger;
import microbatch.dispatch.BatchDispatcher;
import microbatch.queue.Flush;
import microbatch.queue.JobQueue;
import microbatch.spi.MetricsExporter;
import microbatch.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The batcher's control loop: decides when a batch leaves the {@link JobQueue}.
 *
 * <p>Two triggers feed the {@link BatchDispatcher}:
 * <ul>
 *   <li><b>Size</b>: the scheduler thread parks on the queue until at least
 *       {@code batchSize} jobs are queued, extracts exactly {@code batchSize} of them,
 *       dispatches them and restarts the {@link FlushTimer} so a timer flush never
 *       follows a size flush immediately.</li>
 *   <li><b>Time</b>: every {@code frequency} the timer thread flushes the entire queue,
 *       even when it is empty.</li>
 * </ul>
 *
 * <p>When the queue is sealed the loop extracts whatever is left, dispatches it as a
 * {@link FlushTrigger#SHUTDOWN} batch, stops the timer and terminates. That final drain
 * is the loop's only exit.
 */
public final class BatchScheduler<A, B> {
  private static final Logger logger = Logger.getLogger(BatchScheduler.class.getName());

  private final JobQueue<A, B> queue;
  private final BatchDispatcher<A, B> dispatcher;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final FlushTimer timer;
  private final Thread loopThread;
  private final CountDownLatch terminated = new CountDownLatch(1);

  /**
   * Creates a scheduler; nothing runs until {@link #start()} or {@link #drainNow()}.
   *
   * @param queue        the job queue to watch
   * @param dispatcher   receives every extracted batch
   * @param metrics      metrics sink
   * @param batchSize    size threshold, must be &gt; 0
   * @param frequency    time between timer flushes, must be positive
   * @param threadPrefix name prefix for the scheduler and timer threads
   */
  public BatchScheduler(JobQueue<A, B> queue, BatchDispatcher<A, B> dispatcher,
      MetricsExporter metrics, int batchSize, Duration frequency, String threadPrefix) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
    this.timer = new FlushTimer(frequency, this::flushOnTimer,
        new DaemonThreadFactory(threadPrefix + "timer-"));
    this.loopThread = new DaemonThreadFactory(threadPrefix + "scheduler-").newThread(this::runLoop);
  }

  /**
   * Starts the timer and the scheduler thread. Must be called at most once.
   */
  public void start() {
    timer.start();
    loopThread.start();
    logger.log(Level.FINE, "Scheduler started: batchSize={0}", batchSize);
  }

  /**
   * Runs the final drain on the calling thread. Used when the batcher is shut down
   * without ever having been started; the queue must already be sealed.
   */
  public void drainNow() {
    try {
      dispatch(new Flush<>(FlushTrigger.SHUTDOWN, queue.drain()));
    } finally {
      timer.close();
      terminated.countDown();
    }
  }

  private void runLoop() {
    try {
      while (true) {
        Flush<A, B> flush = queue.awaitFlush(batchSize);
        dispatch(flush);
        if (flush.trigger() == FlushTrigger.SHUTDOWN) {
          logger.log(Level.FINE, "Final drain dispatched {0} jobs", flush.size());
          return;
        }
        timer.reset();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warning("Scheduler interrupted; draining remaining jobs");
      queue.seal();
      dispatch(new Flush<>(FlushTrigger.SHUTDOWN, queue.drain()));
    } finally {
      timer.close();
      terminated.countDown();
    }
  }

  private void flushOnTimer() {
    dispatch(new Flush<>(FlushTrigger.TIMER, queue.drain()));
  }

  private void dispatch(Flush<A, B> flush) {
    dispatcher.dispatch(flush);
    metrics.recordQueueDepth(queue.size());
  }

  /**
   * Waits for the final drain to complete.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the scheduler terminated, {@code false} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public boolean isTerminated() {
    return terminated.getCount() == 0;
  }

  boolean isTimerRunning() {
    return timer.isRunning();
  }

  int pendingTimerTicks() {
    return timer.pendingTicks();
  }
}
