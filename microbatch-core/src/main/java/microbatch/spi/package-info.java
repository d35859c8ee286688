/**
 * Service Provider Interfaces (SPI) for extending the batcher.
 *
 * @see microbatch.spi.MetricsExporter
 */
package microbatch.spi;
