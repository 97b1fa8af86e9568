/**
 * Micrometer bridge for exporting consumer metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.xqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.xqueue.spi.MetricsExporter} SPI using Micrometer counters and a distribution summary,
 * tagged per queue.
 *
 * @see io.xqueue.micrometer.MicrometerMetricsExporter
 */
package io.xqueue.micrometer;
