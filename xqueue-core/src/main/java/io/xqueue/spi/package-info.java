/**
 * Service Provider Interfaces (SPI) for plugging the consumer into its surroundings.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in connection provisioning, persistence, and metrics.
 *
 * @see io.xqueue.spi.ConnectionProvider
 * @see io.xqueue.spi.SubmissionStore
 * @see io.xqueue.spi.MetricsExporter
 */
package io.xqueue.spi;
