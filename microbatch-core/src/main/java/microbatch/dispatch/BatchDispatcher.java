package microbatch.dispatch;

import microbatch.JobProcessor;
import microbatch.queue.Flush;
import microbatch.queue.QueuedJob;
import microbatch.spi.MetricsExporter;
import microbatch.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans each extracted batch out to worker threads, one task per job.
 *
 * <p>Each task calls the {@link JobProcessor} with the job's payload and resolves the
 * job's {@link microbatch.JobResult} with the output. Tasks from the same batch are
 * independent: there is no batch-level join and they may complete in any order.
 *
 * <p>With {@code workerCount == 0} the worker pool is unbounded (a cached pool), so
 * every job of every batch runs immediately. A positive {@code workerCount} caps the
 * number of concurrently running processors; excess jobs wait in the pool's queue.
 *
 * <p>A processor that throws is logged and counted; the job's result stays
 * unresolved and the worker survives.
 *
 * <p>This class is thread-safe.
 */
public final class BatchDispatcher<A, B> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchDispatcher.class.getName());

  private final JobProcessor<A, B> processor;
  private final ExecutorService workers;
  private final MetricsExporter metrics;
  private final Duration drainTimeout;
  private final AtomicInteger inFlight = new AtomicInteger();

  /**
   * Creates a dispatcher and its worker pool.
   *
   * @param processor    the job processor
   * @param workerCount  {@code 0} for an unbounded pool, otherwise the fixed pool size
   * @param threadPrefix name prefix for worker threads
   * @param metrics      metrics sink
   * @param drainTimeout how long {@link #close()} waits for in-flight jobs
   */
  public BatchDispatcher(JobProcessor<A, B> processor, int workerCount, String threadPrefix,
      MetricsExporter metrics, Duration drainTimeout) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    DaemonThreadFactory threadFactory = new DaemonThreadFactory(threadPrefix);
    this.workers = workerCount == 0
        ? Executors.newCachedThreadPool(threadFactory)
        : Executors.newFixedThreadPool(workerCount, threadFactory);
  }

  /**
   * Records the flush and submits one processing task per job. Returns without waiting
   * for any of them.
   *
   * @param flush the extracted batch, possibly empty
   */
  public void dispatch(Flush<A, B> flush) {
    metrics.recordFlush(flush.trigger(), flush.size());
    if (flush.isEmpty()) {
      return;
    }
    logger.log(Level.FINE, "Dispatching {0} batch of {1} jobs",
        new Object[]{flush.trigger(), flush.size()});
    for (QueuedJob<A, B> queued : flush.jobs()) {
      inFlight.incrementAndGet();
      try {
        workers.execute(() -> process(queued));
      } catch (RejectedExecutionException e) {
        inFlight.decrementAndGet();
        metrics.incrementJobsFailed();
        logger.log(Level.SEVERE, "Worker pool closed; jobId=" + queued.job().id()
            + " was not dispatched", e);
      }
    }
  }

  private void process(QueuedJob<A, B> queued) {
    long startNanos = System.nanoTime();
    metrics.recordQueueWaitMs(
        Math.max(0L, TimeUnit.NANOSECONDS.toMillis(startNanos - queued.enqueuedAtNanos())));
    try {
      B output = processor.process(queued.job().data());
      queued.result().complete(output);
      metrics.incrementJobsProcessed();
    } catch (RuntimeException e) {
      metrics.incrementJobsFailed();
      logger.log(Level.SEVERE, "Processor failed for jobId=" + queued.job().id()
          + "; its result will not be resolved", e);
    } finally {
      metrics.recordProcessingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      inFlight.decrementAndGet();
    }
  }

  /**
   * Returns the number of jobs handed to workers whose processor has not yet returned.
   *
   * @return in-flight job count
   */
  public int inFlight() {
    return inFlight.get();
  }

  /**
   * Stops accepting batches and waits up to the drain timeout for in-flight jobs.
   *
   * <p>Running processors are never interrupted. If they outlive the drain timeout a
   * warning is logged and they are left to finish on their daemon threads.
   */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; {0} jobs still in flight",
            inFlight.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
