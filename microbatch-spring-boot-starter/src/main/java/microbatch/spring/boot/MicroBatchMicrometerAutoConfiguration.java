package microbatch.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import microbatch.micrometer.MicrometerMetricsExporter;
import microbatch.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code microbatch.metrics.enabled} is true
 * (default).
 *
 * <p>Runs after the actuator's meter registry auto-configuration, so the registry bean
 * it creates is visible to the condition, and before {@link MicroBatchAutoConfiguration}
 * so the {@link MetricsExporter} bean is available for injection into the batcher.
 */
@AutoConfiguration(
    before = MicroBatchAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "microbatch.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MicroBatchProperties.class)
public class MicroBatchMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MicroBatchProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
