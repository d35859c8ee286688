package microbatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-assignment handle for the output of one submitted {@link Job}.
 *
 * <p>Created unresolved by {@link MicroBatcher#addJob(Job)} and resolved exactly once
 * by the worker that processes the job. Any number of threads may read it; every read
 * after resolution returns the same value.
 *
 * <p>If the {@link JobProcessor} throws for this job, the result is never resolved.
 * Use {@link #get(Duration)} to bound the wait.
 *
 * @param <B> output type
 */
public final class JobResult<B> {

  private final long jobId;
  private final CountDownLatch resolved = new CountDownLatch(1);
  private final AtomicBoolean written = new AtomicBoolean();
  private volatile B value;

  public JobResult(long jobId) {
    this.jobId = jobId;
  }

  /**
   * Returns the id of the job this result belongs to.
   *
   * @return the job id
   */
  public long jobId() {
    return jobId;
  }

  /**
   * Returns the output, blocking until the job has been processed.
   *
   * @return the processor's output for this job (may be null if the processor returned null)
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public B get() throws InterruptedException {
    resolved.await();
    return value;
  }

  /**
   * Returns the output, blocking at most {@code timeout} for the job to be processed.
   *
   * @param timeout maximum time to wait
   * @return the processor's output for this job
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws TimeoutException     if the output is not available within {@code timeout}
   */
  public B get(Duration timeout) throws InterruptedException, TimeoutException {
    Objects.requireNonNull(timeout, "timeout");
    if (!resolved.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      throw new TimeoutException("Result of job " + jobId + " not available after " + timeout);
    }
    return value;
  }

  /**
   * Returns {@code true} once the output has been delivered.
   *
   * @return whether {@link #get()} would return without blocking
   */
  public boolean isDone() {
    return resolved.getCount() == 0;
  }

  /**
   * Delivers the output. Only the first call has an effect.
   *
   * @param output the processor's output
   * @return {@code true} if this call resolved the result, {@code false} if it was already resolved
   */
  public boolean complete(B output) {
    if (!written.compareAndSet(false, true)) {
      return false;
    }
    this.value = output;
    resolved.countDown();
    return true;
  }

  @Override
  public String toString() {
    return "JobResult{jobId=" + jobId + ", done=" + isDone() + '}';
  }
}
