package microbatch.queue;

import microbatch.FlushTrigger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO of submitted-but-not-yet-dispatched jobs, guarded by a single lock.
 *
 * <p>Besides plain extraction the queue offers {@link #awaitFlush(int)}, which parks the
 * scheduler thread until either the size threshold is reached or the queue is
 * {@linkplain #seal() sealed}. Submissions and sealing signal the waiting thread, so
 * the scheduler never spins.
 *
 * <p>Sealing is the queue's half of shutdown: once sealed, {@link #offer} refuses new
 * jobs. The admission check and the append happen under the same lock as the final
 * drain, so no job can be admitted after the drain has taken the queue's contents.
 *
 * <p>This class is thread-safe.
 */
public final class JobQueue<A, B> {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final ArrayDeque<QueuedJob<A, B>> jobs = new ArrayDeque<>();
  private boolean sealed;

  /**
   * Appends a job to the tail of the queue.
   *
   * @param job the job to enqueue
   * @return {@code true} if admitted, {@code false} if the queue is sealed
   */
  public boolean offer(QueuedJob<A, B> job) {
    lock.lock();
    try {
      if (sealed) {
        return false;
      }
      jobs.addLast(job);
      changed.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until a flush is due and extracts it.
   *
   * <p>Returns a {@link FlushTrigger#SHUTDOWN} flush of the entire queue once the queue
   * is sealed (this takes priority), or a {@link FlushTrigger#SIZE} flush of exactly the
   * first {@code batchSize} jobs once at least that many are queued.
   *
   * @param batchSize size threshold, must be &gt; 0
   * @return the extracted batch
   * @throws InterruptedException if interrupted while waiting
   */
  public Flush<A, B> awaitFlush(int batchSize) throws InterruptedException {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    lock.lockInterruptibly();
    try {
      while (!sealed && jobs.size() < batchSize) {
        changed.await();
      }
      if (sealed) {
        return new Flush<>(FlushTrigger.SHUTDOWN, takeFirst(jobs.size()));
      }
      return new Flush<>(FlushTrigger.SIZE, takeFirst(batchSize));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns every queued job, in submission order.
   *
   * @return the former contents of the queue; empty if there were none
   */
  public List<QueuedJob<A, B>> drain() {
    lock.lock();
    try {
      return takeFirst(jobs.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Refuses further submissions and wakes the scheduler so it can run the final drain.
   * Calling it again has no effect.
   */
  public void seal() {
    lock.lock();
    try {
      sealed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isSealed() {
    lock.lock();
    try {
      return sealed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return jobs.size();
    } finally {
      lock.unlock();
    }
  }

  // caller holds the lock
  private List<QueuedJob<A, B>> takeFirst(int count) {
    List<QueuedJob<A, B>> batch = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      batch.add(jobs.pollFirst());
    }
    return batch;
  }
}
