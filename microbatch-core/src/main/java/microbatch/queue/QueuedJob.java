package microbatch.queue;

import microbatch.Job;
import microbatch.JobResult;

/**
 * Pairs a submitted {@link Job} with the {@link JobResult} that will carry its output.
 *
 * <p>Owned by the {@link JobQueue} until extracted into a batch, then by the worker
 * that processes it.
 *
 * @param job             the submitted job
 * @param result          the handle returned to the submitter
 * @param enqueuedAtNanos {@link System#nanoTime()} at submission, for queue-wait metrics
 */
public record QueuedJob<A, B>(Job<A> job, JobResult<B> result, long enqueuedAtNanos) {

  /**
   * Creates a queued job with a fresh, unresolved result stamped with the current time.
   *
   * @param job the submitted job
   * @param <A> payload type
   * @param <B> output type
   * @return the queued job
   */
  public static <A, B> QueuedJob<A, B> of(Job<A> job) {
    return new QueuedJob<>(job, new JobResult<>(job.id()), System.nanoTime());
  }
}
