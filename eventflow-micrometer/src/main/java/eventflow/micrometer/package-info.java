/**
 * Micrometer bridge for exporting event store, outbox and saga metrics.
 *
 * <p>{@link eventflow.micrometer.MicrometerMetricsExporter} implements the
 * {@link eventflow.spi.MetricsExporter} SPI with Micrometer counters and a lag gauge.
 */
package eventflow.micrometer;
