package microbatch;

/**
 * Thrown by {@link MicroBatcher#addJob(Job)} when the engine is shutting down and no
 * longer admits jobs.
 *
 * <p>Jobs admitted before the shutdown are unaffected: they are still flushed and
 * their results delivered.
 */
public class SubmissionRejectedException extends RuntimeException {

  private final long jobId;

  /**
   * Creates a new instance for the rejected job.
   *
   * @param jobId id of the job that was not admitted
   */
  public SubmissionRejectedException(long jobId) {
    super("Job " + jobId + " rejected: batcher is shutting down");
    this.jobId = jobId;
  }

  /**
   * Returns the id of the job that was not admitted.
   *
   * @return the rejected job's id
   */
  public long jobId() {
    return jobId;
  }
}
