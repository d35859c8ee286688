/**
 * The guarded job queue and the batches extracted from it.
 *
 * @see microbatch.queue.JobQueue
 * @see microbatch.queue.Flush
 */
package microbatch.queue;
