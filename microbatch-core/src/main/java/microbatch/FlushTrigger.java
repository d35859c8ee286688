package microbatch;

/** Reason a batch was extracted from the job queue. */
public enum FlushTrigger {
  /** The queue reached the configured batch size. */
  SIZE,
  /** The flush interval elapsed; the whole queue is flushed, even if empty. */
  TIMER,
  /** Final drain after shutdown was requested. */
  SHUTDOWN
}
