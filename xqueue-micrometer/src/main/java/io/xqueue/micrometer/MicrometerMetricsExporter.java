package io.xqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.xqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily, once per queue, and tagged {@code queue=<name>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code xqueue.lease.acquired}: submissions leased by push workers</li>
 *   <li>{@code xqueue.grading.success}: grader answered HTTP 200</li>
 *   <li>{@code xqueue.grading.failure}: grader call failed</li>
 *   <li>{@code xqueue.grading.slow}: grader call took longer than the grading timeout</li>
 *   <li>{@code xqueue.notify.ack}: origin acknowledged the result</li>
 *   <li>{@code xqueue.notify.exhausted}: origin never acknowledged</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code xqueue.grading.duration.ms}: wall-clock duration of grader calls</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String QUEUE_TAG = "queue";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, QueueMeters> byQueue = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "xqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "xqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "campus.xqueue"})
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
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementLeased(String queueName) {
    if (closed) return;
    meters(queueName).leased.increment();
  }

  @Override
  public void incrementGradingSuccess(String queueName) {
    if (closed) return;
    meters(queueName).gradingSuccess.increment();
  }

  @Override
  public void incrementGradingFailure(String queueName) {
    if (closed) return;
    meters(queueName).gradingFailure.increment();
  }

  @Override
  public void incrementGradingSlow(String queueName) {
    if (closed) return;
    meters(queueName).gradingSlow.increment();
  }

  @Override
  public void incrementNotifyAck(String queueName) {
    if (closed) return;
    meters(queueName).notifyAck.increment();
  }

  @Override
  public void incrementNotifyExhausted(String queueName) {
    if (closed) return;
    meters(queueName).notifyExhausted.increment();
  }

  @Override
  public void recordGradingDurationMs(String queueName, long durationMs) {
    if (closed) return;
    meters(queueName).gradingDuration.record(durationMs);
  }

  private QueueMeters meters(String queueName) {
    return byQueue.computeIfAbsent(queueName, q -> new QueueMeters(registry, namePrefix, q));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.xqueue.XQueueConsumer} is closed) to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (QueueMeters meters : byQueue.values()) {
      for (Meter meter : meters.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    byQueue.clear();
    if (first != null) throw first;
  }

  private static final class QueueMeters {
    final Counter leased;
    final Counter gradingSuccess;
    final Counter gradingFailure;
    final Counter gradingSlow;
    final Counter notifyAck;
    final Counter notifyExhausted;
    final DistributionSummary gradingDuration;

    QueueMeters(MeterRegistry registry, String prefix, String queueName) {
      leased = counter(registry, prefix + ".lease.acquired", "Submissions leased by push workers", queueName);
      gradingSuccess = counter(registry, prefix + ".grading.success", "Grader answered HTTP 200", queueName);
      gradingFailure = counter(registry, prefix + ".grading.failure", "Grader call failed", queueName);
      gradingSlow = counter(registry, prefix + ".grading.slow", "Grader call exceeded the grading timeout", queueName);
      notifyAck = counter(registry, prefix + ".notify.ack", "Results acknowledged by the origin", queueName);
      notifyExhausted = counter(registry, prefix + ".notify.exhausted",
          "Results the origin never acknowledged", queueName);
      gradingDuration = DistributionSummary.builder(prefix + ".grading.duration.ms")
          .description("Wall-clock duration of grader calls")
          .baseUnit("milliseconds")
          .tag(QUEUE_TAG, queueName)
          .register(registry);
    }

    List<Meter> all() {
      return List.of(leased, gradingSuccess, gradingFailure, gradingSlow,
          notifyAck, notifyExhausted, gradingDuration);
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String queueName) {
      return Counter.builder(name)
          .description(description)
          .tag(QUEUE_TAG, queueName)
          .register(registry);
    }
  }
}
