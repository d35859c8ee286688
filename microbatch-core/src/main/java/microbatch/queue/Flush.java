package microbatch.queue;

import microbatch.FlushTrigger;

import java.util.List;
import java.util.Objects;

/**
 * A batch extracted from the {@link JobQueue}, in submission order.
 *
 * @param trigger what caused the extraction
 * @param jobs    the extracted jobs; empty for a timer or shutdown flush of an empty queue
 */
public record Flush<A, B>(FlushTrigger trigger, List<QueuedJob<A, B>> jobs) {

  public Flush {
    Objects.requireNonNull(trigger, "trigger");
    jobs = List.copyOf(jobs);
  }

  public int size() {
    return jobs.size();
  }

  public boolean isEmpty() {
    return jobs.isEmpty();
  }
}
