package microbatch.demo;

import microbatch.Job;
import microbatch.JobProcessor;
import microbatch.JobResult;
import microbatch.MicroBatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Simple demo showing micro-batching without Spring.
 *
 * <p>Two jobs with a batch size of two fill a batch immediately, so both results arrive
 * long before the five-second periodic flush.
 *
 * Run with: mvn -pl samples/microbatch-demo exec:java
 */
public final class MicroBatchDemo {

  private static final Logger log = LoggerFactory.getLogger(MicroBatchDemo.class);

  public static void main(String[] args) throws Exception {
    // Failures travel inside the output type; the batcher itself never builds error results
    JobProcessor<String, Result> processor = input -> {
      if (input.isBlank()) {
        return new Result(null, "blank input");
      }
      return new Result(input.toUpperCase(Locale.ROOT), null);
    };

    try (MicroBatcher<String, Result> batcher = MicroBatcher.builder(processor)
        .name("demo")
        .batchSize(2)
        .frequency(Duration.ofSeconds(5))
        .build()) {
      batcher.start();

      JobResult<Result> first = batcher.addJob(Job.of(1, "input"));
      JobResult<Result> second = batcher.addJob(Job.of(2, "another input"));

      report(first);
      report(second);
    }

    log.info("Batcher closed");
  }

  private static void report(JobResult<Result> handle) throws Exception {
    Result result = handle.get(Duration.ofSeconds(10));
    if (result.error() != null) {
      log.error("Job {} failed: {}", handle.jobId(), result.error());
    } else {
      log.info("Job {} -> {}", handle.jobId(), result.output());
    }
  }

  /** Processor output carrying either a value or an error message. */
  public record Result(String output, String error) {
  }
}
