package io.xqueue.spi;

/**
 * Observability hook for exporting consumer counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Every call carries
 * the queue name so exporters can tag per queue.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of submissions leased by a push worker.
     */
    void incrementLeased(String queueName);

    /**
     * Increments the count of submissions the grader accepted (HTTP 200).
     */
    void incrementGradingSuccess(String queueName);

    /**
     * Increments the count of submissions whose grading call failed.
     */
    void incrementGradingFailure(String queueName);

    /**
     * Increments the count of grading calls that took longer than the grading timeout.
     */
    default void incrementGradingSlow(String queueName) {
    }

    /**
     * Increments the count of results acknowledged by the origin system.
     */
    void incrementNotifyAck(String queueName);

    /**
     * Increments the count of results the origin system never acknowledged after all attempts.
     */
    void incrementNotifyExhausted(String queueName);

    /**
     * Records the wall-clock duration of one grading call.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordGradingDurationMs(String queueName, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementLeased(String queueName) {
        }

        @Override
        public void incrementGradingSuccess(String queueName) {
        }

        @Override
        public void incrementGradingFailure(String queueName) {
        }

        @Override
        public void incrementNotifyAck(String queueName) {
        }

        @Override
        public void incrementNotifyExhausted(String queueName) {
        }
    }
}
