/**
 * Size- and time-triggered flushing of the job queue.
 *
 * <p>{@link microbatch.scheduler.BatchScheduler} owns the control loop that performs
 * size flushes and the shutdown drain; {@link microbatch.scheduler.FlushTimer} drives
 * the periodic whole-queue flush.
 */
package microbatch.scheduler;
