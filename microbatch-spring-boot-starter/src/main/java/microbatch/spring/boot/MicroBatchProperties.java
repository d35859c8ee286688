package microbatch.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the micro-batching engine.
 *
 * @see MicroBatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "microbatch")
public class MicroBatchProperties {

  /**
   * Whether to create and start a {@code MicroBatcher} bean.
   */
  private boolean enabled = true;

  /**
   * Batcher name, used for thread names and log messages.
   */
  private String name = "microbatch";

  /**
   * Number of queued jobs that triggers an immediate flush.
   */
  private int batchSize = 10;

  /**
   * Interval of the periodic flush.
   */
  private Duration frequency = Duration.ofSeconds(1);

  /**
   * Worker threads running the processor; 0 runs every job on its own thread.
   */
  private int workerCount = 0;

  /**
   * How long close waits for the final drain and for in-flight jobs.
   */
  private Duration drainTimeout = Duration.ofSeconds(5);

  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getFrequency() {
    return frequency;
  }

  public void setFrequency(Duration frequency) {
    this.frequency = frequency;
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public void setWorkerCount(int workerCount) {
    this.workerCount = workerCount;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public void setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "microbatch";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
