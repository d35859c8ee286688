/**
 * Per-job fan-out of extracted batches to worker threads.
 *
 * @see microbatch.dispatch.BatchDispatcher
 */
package microbatch.dispatch;
