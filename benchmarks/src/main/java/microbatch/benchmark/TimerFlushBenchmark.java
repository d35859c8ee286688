package microbatch.benchmark;

import microbatch.Job;
import microbatch.MicroBatcher;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures submit-to-result latency of a lone job released by the periodic flush.
 *
 * <p>The batch size is never reached, so latency is bounded by the flush frequency plus
 * dispatch overhead.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar TimerFlushBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 2, time = 3)
@Measurement(iterations = 3, time = 5)
@Fork(1)
public class TimerFlushBenchmark {

  @Param({"5", "20"})
  private int frequencyMs;

  private MicroBatcher<Long, Long> batcher;
  private final AtomicLong ids = new AtomicLong();

  @Setup(Level.Trial)
  public void setup() {
    batcher = MicroBatcher.<Long, Long>builder(x -> x * 2)
        .name("bench-timer")
        .batchSize(Integer.MAX_VALUE)
        .frequency(Duration.ofMillis(frequencyMs))
        .build();
    batcher.start();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    batcher.close();
  }

  @Benchmark
  public long submitSingleJob() throws Exception {
    long id = ids.incrementAndGet();
    return batcher.addJob(Job.of(id, id)).get(Duration.ofSeconds(5));
  }
}
