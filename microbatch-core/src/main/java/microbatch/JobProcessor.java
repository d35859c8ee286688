package microbatch;

/**
 * Caller-supplied function that turns one job's payload into its output.
 *
 * <h2>Execution Model</h2>
 * <p>Processors are invoked <b>synchronously</b> on worker threads, once per job.
 * Jobs from the same batch run concurrently and may finish in any order, so
 * implementations must be thread-safe.
 *
 * <h2>Error Handling</h2>
 * <p>The engine has no failure channel: a processor is expected to be total. If it
 * throws anyway, the failure is logged, the job's {@link JobResult} is left
 * unresolved and nothing is retried. Callers that need failure semantics should
 * encode them in the output type, for example:
 * <pre>{@code
 * record Result(String output, String error) {}
 *
 * JobProcessor<String, Result> processor = in -> {
 *   try {
 *     return new Result(translate(in), null);
 *   } catch (TranslationException e) {
 *     return new Result(null, e.getMessage());
 *   }
 * };
 * }</pre>
 *
 * @param <A> payload type
 * @param <B> output type
 */
@FunctionalInterface
public interface JobProcessor<A, B> {

  /**
   * Processes one job payload.
   *
   * @param data the job payload, never null
   * @return the output delivered to the job's {@link JobResult}
   */
  B process(A data);
}
