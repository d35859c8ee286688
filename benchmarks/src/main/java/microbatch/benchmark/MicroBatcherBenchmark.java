package microbatch.benchmark;

import microbatch.Job;
import microbatch.JobResult;
import microbatch.MicroBatcher;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures submit-to-result latency of a full size-triggered batch.
 *
 * <p>The periodic flush is set far beyond the measurement window, so every batch is
 * released by the size threshold alone.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar MicroBatcherBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class MicroBatcherBenchmark {

  @Param({"1", "10", "100"})
  private int batchSize;

  @Param({"0", "4"})
  private int workerCount;

  private MicroBatcher<Long, Long> batcher;
  private final AtomicLong ids = new AtomicLong();

  @Setup(Level.Trial)
  public void setup() {
    batcher = MicroBatcher.<Long, Long>builder(x -> x + 1)
        .name("bench-size")
        .batchSize(batchSize)
        .frequency(Duration.ofHours(1))
        .workerCount(workerCount)
        .build();
    batcher.start();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    batcher.close();
  }

  @Benchmark
  public long submitFullBatch() throws Exception {
    List<JobResult<Long>> results = new ArrayList<>(batchSize);
    for (int i = 0; i < batchSize; i++) {
      long id = ids.incrementAndGet();
      results.add(batcher.addJob(Job.of(id, id)));
    }
    long sum = 0;
    for (JobResult<Long> result : results) {
      sum += result.get(Duration.ofSeconds(5));
    }
    return sum;
  }
}
