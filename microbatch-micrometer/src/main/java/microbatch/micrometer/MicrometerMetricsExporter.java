package microbatch.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import microbatch.FlushTrigger;
import microbatch.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and timers with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code microbatch.jobs.submitted}: jobs admitted to the queue</li>
 *   <li>{@code microbatch.jobs.rejected}: jobs rejected during shutdown</li>
 *   <li>{@code microbatch.jobs.processed}: jobs whose output was delivered</li>
 *   <li>{@code microbatch.jobs.failed}: jobs whose processor threw</li>
 *   <li>{@code microbatch.flush}: flushes, tagged {@code trigger=size|timer|shutdown}</li>
 *   <li>{@code microbatch.flush.jobs}: jobs flushed, tagged {@code trigger}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code microbatch.queue.depth}: jobs queued and not yet flushed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code microbatch.job.queue.wait}: time from submission to processor start</li>
 *   <li>{@code microbatch.job.processing}: time spent in the processor</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter submitted;
  private final Counter rejected;
  private final Counter processed;
  private final Counter failed;
  private final Map<FlushTrigger, Counter> flushes = new EnumMap<>(FlushTrigger.class);
  private final Map<FlushTrigger, Counter> flushedJobs = new EnumMap<>(FlushTrigger.class);
  private final Gauge queueDepthGauge;
  private final Timer queueWait;
  private final Timer processing;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "microbatch"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "microbatch");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.batcher"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.submitted = Counter.builder(namePrefix + ".jobs.submitted")
        .description("Jobs admitted to the queue")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".jobs.rejected")
        .description("Jobs rejected because the batcher was shutting down")
        .register(registry);
    this.processed = Counter.builder(namePrefix + ".jobs.processed")
        .description("Jobs whose output was delivered")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".jobs.failed")
        .description("Jobs whose processor threw")
        .register(registry);
    for (FlushTrigger trigger : FlushTrigger.values()) {
      String tag = trigger.name().toLowerCase(Locale.ROOT);
      flushes.put(trigger, Counter.builder(namePrefix + ".flush")
          .description("Batches flushed from the queue")
          .tag("trigger", tag)
          .register(registry));
      flushedJobs.put(trigger, Counter.builder(namePrefix + ".flush.jobs")
          .description("Jobs flushed from the queue")
          .tag("trigger", tag)
          .register(registry));
    }

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Jobs queued and not yet flushed")
        .register(registry);
    this.queueWait = Timer.builder(namePrefix + ".job.queue.wait")
        .description("Time from submission to processor start")
        .register(registry);
    this.processing = Timer.builder(namePrefix + ".job.processing")
        .description("Time spent in the processor")
        .register(registry);
  }

  @Override
  public void incrementJobsSubmitted() {
    if (closed) return;
    submitted.increment();
  }

  @Override
  public void incrementJobsRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void recordFlush(FlushTrigger trigger, int batchSize) {
    if (closed) return;
    flushes.get(trigger).increment();
    flushedJobs.get(trigger).increment(batchSize);
  }

  @Override
  public void incrementJobsProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementJobsFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordQueueWaitMs(long waitMs) {
    if (closed) return;
    queueWait.record(waitMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordProcessingTimeMs(long durationMs) {
    if (closed) return;
    processing.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link microbatch.MicroBatcher} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(submitted, rejected, processed, failed,
        queueDepthGauge, queueWait, processing));
    meters.addAll(flushes.values());
    meters.addAll(flushedJobs.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
