package microbatch;

import microbatch.dispatch.BatchDispatcher;
import microbatch.queue.JobQueue;
import microbatch.queue.QueuedJob;
import microbatch.scheduler.BatchScheduler;
import microbatch.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Micro-batching engine: groups submitted jobs into batches and hands each job of a
 * batch to a {@link JobProcessor}, delivering each output through the {@link JobResult}
 * returned at submission.
 *
 * <p>A batch leaves the queue when either trigger fires:
 * <ul>
 *   <li><b>size</b>: as soon as {@code batchSize} jobs are queued, exactly that many are
 *       flushed and the flush timer restarts;</li>
 *   <li><b>time</b>: every {@code frequency} the entire queue is flushed, even if empty,
 *       which bounds the wait of any job to one period.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * JobProcessor<String, String> upper = s -> s.toUpperCase(Locale.ROOT);
 * try (MicroBatcher<String, String> batcher = MicroBatcher.builder(upper)
 *     .batchSize(100)
 *     .frequency(Duration.ofMillis(50))
 *     .build()) {
 *   batcher.start();
 *   JobResult<String> result = batcher.addJob(Job.of(1, "hello"));
 *   String output = result.get();
 * }
 * }</pre>
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #start()} launches the scheduler and timer threads; a second call is a
 * no-op and a call after {@link #shutdown()} throws. Jobs may be submitted before
 * {@code start()}: they wait in the queue. {@link #shutdown()} stops admission and
 * requests a final drain without waiting for it; it is idempotent and safe to call
 * concurrently. If the batcher was never started, shutdown drains the queue on the
 * calling thread. {@link #close()} additionally waits for the drain and for in-flight
 * jobs. A batcher cannot be restarted.
 *
 * <p>This class is thread-safe.
 *
 * @param <A> payload type
 * @param <B> output type
 * @see MicroBatcher.Builder
 */
public final class MicroBatcher<A, B> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MicroBatcher.class.getName());

  private final String name;
  private final int batchSize;
  private final Duration frequency;
  private final Duration drainTimeout;
  private final MetricsExporter metrics;

  private final JobQueue<A, B> queue = new JobQueue<>();
  private final BatchDispatcher<A, B> dispatcher;
  private final BatchScheduler<A, B> scheduler;
  private final AtomicBoolean shuttingDown = new AtomicBoolean();
  private boolean started;

  private MicroBatcher(Builder<A, B> builder) {
    JobProcessor<A, B> processor = Objects.requireNonNull(builder.processor, "processor");
    Duration frequency = Objects.requireNonNull(builder.frequency, "frequency");
    Duration drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    String name = Objects.requireNonNull(builder.name, "name");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (frequency.isZero() || frequency.isNegative()) {
      throw new IllegalArgumentException("frequency must be > 0");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }

    this.name = name;
    this.batchSize = builder.batchSize;
    this.frequency = frequency;
    this.drainTimeout = drainTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.dispatcher = new BatchDispatcher<>(processor, builder.workerCount,
        name + "-worker-", metrics, drainTimeout);
    this.scheduler = new BatchScheduler<>(queue, dispatcher, metrics, batchSize, frequency, name + "-");
  }

  /**
   * Starts a builder for a batcher running {@code processor}.
   *
   * @param processor the function applied to each job's payload
   * @param <A>       payload type
   * @param <B>       output type
   * @return a new builder
   */
  public static <A, B> Builder<A, B> builder(JobProcessor<A, B> processor) {
    return new Builder<A, B>().processor(processor);
  }

  /**
   * Queues a job for the next batch.
   *
   * <p>Never blocks and never rejects because of queue length; the queue is unbounded.
   *
   * @param job the job to submit
   * @return an unresolved handle that will carry the job's output
   * @throws SubmissionRejectedException if the batcher is shutting down
   * @throws NullPointerException        if {@code job} is null
   */
  public JobResult<B> addJob(Job<A> job) {
    Objects.requireNonNull(job, "job");
    QueuedJob<A, B> queued = QueuedJob.of(job);
    if (shuttingDown.get() || !queue.offer(queued)) {
      metrics.incrementJobsRejected();
      throw new SubmissionRejectedException(job.id());
    }
    metrics.incrementJobsSubmitted();
    metrics.recordQueueDepth(queue.size());
    return queued.result();
  }

  /**
   * Starts the scheduler and flush timer threads. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if {@link #shutdown()} has already been called
   */
  public synchronized void start() {
    if (shuttingDown.get()) {
      throw new IllegalStateException("MicroBatcher '" + name + "' has been shut down");
    }
    if (started) {
      return;
    }
    started = true;
    scheduler.start();
    logger.log(Level.INFO, "MicroBatcher ''{0}'' started: batchSize={1}, frequency={2}",
        new Object[]{name, batchSize, frequency});
  }

  /**
   * Stops admitting jobs and requests a final flush of everything still queued.
   *
   * <p>Returns without waiting for the drain; use {@link #awaitTermination(Duration)} or
   * {@link #close()} to wait. Jobs already dispatched keep running. Repeated calls are
   * no-ops.
   */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    boolean drainHere;
    synchronized (this) {
      queue.seal();
      drainHere = !started;
    }
    logger.log(Level.INFO, "MicroBatcher ''{0}'' shutting down with {1} queued jobs",
        new Object[]{name, queue.size()});
    if (drainHere) {
      scheduler.drainNow();
    }
  }

  /**
   * Waits for the final drain triggered by {@link #shutdown()} to complete.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the drain completed, {@code false} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    return scheduler.awaitTermination(timeout);
  }

  public boolean isShutdown() {
    return shuttingDown.get();
  }

  /**
   * Returns {@code true} once the final drain has been dispatched. In-flight jobs may
   * still be running.
   *
   * @return whether the scheduler has terminated
   */
  public boolean isTerminated() {
    return scheduler.isTerminated();
  }

  /**
   * Returns the number of jobs queued and not yet flushed.
   *
   * @return current queue length
   */
  public int queueSize() {
    return queue.size();
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration frequency() {
    return frequency;
  }

  public String name() {
    return name;
  }

  /**
   * Shuts down, waits up to the drain timeout for the final drain, then stops the
   * worker pool, waiting up to the drain timeout again for in-flight jobs.
   */
  @Override
  public void close() {
    shutdown();
    try {
      if (!scheduler.awaitTermination(drainTimeout)) {
        logger.log(Level.WARNING, "MicroBatcher ''{0}'' final drain did not finish within {1}",
            new Object[]{name, drainTimeout});
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    dispatcher.close();
  }

  /** Builder for {@link MicroBatcher}. */
  public static final class Builder<A, B> {
    private JobProcessor<A, B> processor;
    private Duration frequency;
    private int batchSize;
    private int workerCount = 0;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private MetricsExporter metrics;
    private String name = "microbatch";

    private Builder() {}

    /**
     * Sets the function applied to each job's payload.
     *
     * <p><b>Required.</b>
     *
     * @param processor the job processor
     * @return this builder
     */
    public Builder<A, B> processor(JobProcessor<A, B> processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Sets the interval between timer-triggered flushes of the whole queue.
     *
     * <p><b>Required.</b> Must be positive.
     *
     * @param frequency flush interval
     * @return this builder
     */
    public Builder<A, B> frequency(Duration frequency) {
      this.frequency = frequency;
      return this;
    }

    /**
     * Sets the queue length at which a size-triggered flush of exactly that many jobs
     * happens.
     *
     * <p><b>Required.</b> Must be &gt; 0.
     *
     * @param batchSize size threshold
     * @return this builder
     */
    public Builder<A, B> batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Caps the number of processors running at once.
     *
     * <p>Optional. Defaults to {@code 0}, meaning unbounded: every job starts as soon
     * as its batch is flushed. Must be &ge; 0.
     *
     * @param workerCount maximum concurrent processors, or {@code 0} for no limit
     * @return this builder
     */
    public Builder<A, B> workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long {@link MicroBatcher#close()} waits for the final drain and, again,
     * for in-flight jobs.
     *
     * <p>Optional. Defaults to 5 seconds. Must be &ge; 0.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder<A, B> drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder<A, B> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the batcher name used in log messages and as the thread name prefix.
     *
     * <p>Optional. Defaults to {@code "microbatch"}.
     *
     * @param name batcher name
     * @return this builder
     */
    public Builder<A, B> name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Builds the batcher. Call {@link MicroBatcher#start()} to begin flushing.
     *
     * @return a new {@link MicroBatcher}
     * @throws NullPointerException     if {@code processor}, {@code frequency},
     *     {@code drainTimeout} or {@code name} is null
     * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code frequency} is not
     *     positive, {@code workerCount < 0}, {@code drainTimeout} is negative or
     *     {@code name} is empty
     */
    public MicroBatcher<A, B> build() {
      return new MicroBatcher<>(this);
    }
  }
}
