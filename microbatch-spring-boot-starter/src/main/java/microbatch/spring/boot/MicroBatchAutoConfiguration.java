package microbatch.spring.boot;

import microbatch.JobProcessor;
import microbatch.MicroBatcher;
import microbatch.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the micro-batching engine.
 *
 * <p>Builds a {@link MicroBatcher} around the application's single {@link JobProcessor}
 * bean using {@link MicroBatchProperties}, starts it, and closes it when the context
 * shuts down. A {@link MetricsExporter} bean is picked up when present.
 *
 * @see MicroBatchProperties
 * @see MicroBatchMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(MicroBatcher.class)
@ConditionalOnBean(JobProcessor.class)
@ConditionalOnProperty(prefix = "microbatch", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MicroBatchProperties.class)
public class MicroBatchAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MicroBatcher<?, ?> microBatcher(MicroBatchProperties props,
      JobProcessor<?, ?> processor,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MicroBatcher<?, ?> batcher = build(processor, props, metricsProvider.getIfAvailable());
    batcher.start();
    return batcher;
  }

  private static <A, B> MicroBatcher<A, B> build(JobProcessor<A, B> processor,
      MicroBatchProperties props, MetricsExporter metrics) {
    var builder = MicroBatcher.builder(processor)
        .name(props.getName())
        .batchSize(props.getBatchSize())
        .frequency(props.getFrequency())
        .workerCount(props.getWorkerCount())
        .drainTimeout(props.getDrainTimeout());
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
