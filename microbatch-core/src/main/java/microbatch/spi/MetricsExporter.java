package microbatch.spi;

import microbatch.FlushTrigger;

/**
 * Observability hook for exporting batcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Methods are
 * called from submitter, scheduler, timer and worker threads, so implementations
 * must be thread-safe.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of jobs admitted to the queue.
   */
  void incrementJobsSubmitted();

  /**
   * Increments the count of jobs rejected because the batcher was shutting down.
   */
  void incrementJobsRejected();

  /**
   * Records one flush of the queue.
   *
   * @param trigger   what caused the flush
   * @param batchSize number of jobs in the flushed batch (may be zero for timer flushes)
   */
  void recordFlush(FlushTrigger trigger, int batchSize);

  /**
   * Increments the count of jobs whose output was delivered.
   */
  void incrementJobsProcessed();

  /**
   * Increments the count of jobs whose processor threw.
   */
  void incrementJobsFailed();

  /**
   * Records the current number of queued, not yet flushed jobs.
   *
   * @param depth queue length
   */
  void recordQueueDepth(int depth);

  /**
   * Records the time a job spent queued before its processor started.
   *
   * @param waitMs wait in milliseconds (always non-negative)
   */
  default void recordQueueWaitMs(long waitMs) {
  }

  /**
   * Records the time spent in the processor for one job.
   *
   * @param durationMs processor execution time in milliseconds (always non-negative)
   */
  default void recordProcessingTimeMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementJobsSubmitted() {
    }

    @Override
    public void incrementJobsRejected() {
    }

    @Override
    public void recordFlush(FlushTrigger trigger, int batchSize) {
    }

    @Override
    public void incrementJobsProcessed() {
    }

    @Override
    public void incrementJobsFailed() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }
  }
}
