package io.xqueue.jdbc;

import io.xqueue.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

final class RecordingMetrics implements MetricsExporter {
  final AtomicInteger leased = new AtomicInteger();
  final AtomicInteger gradingSuccess = new AtomicInteger();
  final AtomicInteger gradingFailure = new AtomicInteger();
  final AtomicInteger gradingSlow = new AtomicInteger();
  final AtomicInteger notifyAck = new AtomicInteger();
  final AtomicInteger notifyExhausted = new AtomicInteger();
  final AtomicLong lastGradingMs = new AtomicLong(-1);

  @Override
  public void incrementLeased(String queueName) {
    leased.incrementAndGet();
  }

  @Override
  public void incrementGradingSuccess(String queueName) {
    gradingSuccess.incrementAndGet();
  }

  @Override
  public void incrementGradingFailure(String queueName) {
    gradingFailure.incrementAndGet();
  }

  @Override
  public void incrementGradingSlow(String queueName) {
    gradingSlow.incrementAndGet();
  }

  @Override
  public void incrementNotifyAck(String queueName) {
    notifyAck.incrementAndGet();
  }

  @Override
  public void incrementNotifyExhausted(String queueName) {
    notifyExhausted.incrementAndGet();
  }

  @Override
  public void recordGradingDurationMs(String queueName, long durationMs) {
    lastGradingMs.set(durationMs);
  }
}
