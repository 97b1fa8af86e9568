package io.xqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.xqueue.micrometer.MicrometerMetricsExporter;
import io.xqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code xqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link XQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the consumer.
 */
@AutoConfiguration(before = XQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "xqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(XQueueProperties.class)
public class XQueueMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, XQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
