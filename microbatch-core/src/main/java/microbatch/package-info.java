/**
 * Root API of the micro-batching engine.
 *
 * <h2>Core Design</h2>
 * <p>Submitters hand {@linkplain microbatch.Job jobs} to a {@link microbatch.MicroBatcher}
 * and immediately get back a {@link microbatch.JobResult}. Jobs wait in a FIFO
 * {@linkplain microbatch.queue.JobQueue queue} until a batch is flushed, either because
 * {@code batchSize} jobs are queued (size trigger) or because {@code frequency} has
 * elapsed since the last flush (time trigger). Each job of a flushed batch runs on its
 * own worker; its output resolves its result.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>microbatch-core</b>: engine, queue, scheduler, dispatcher (zero external deps)</li>
 *   <li><b>microbatch-micrometer</b>: {@link microbatch.spi.MetricsExporter} backed by Micrometer</li>
 *   <li><b>microbatch-spring-boot-starter</b>: auto-configuration and {@code microbatch.*} properties</li>
 * </ul>
 *
 * @see microbatch.MicroBatcher
 * @see microbatch.JobProcessor
 */
package microbatch;
