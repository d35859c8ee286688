/**
 * Micrometer bridge for exporting batcher metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link microbatch.micrometer.MicrometerMetricsExporter} implements the
 * {@link microbatch.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see microbatch.micrometer.MicrometerMetricsExporter
 */
package microbatch.micrometer;
