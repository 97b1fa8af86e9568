package io.xqueue.spring.boot;

import io.xqueue.BasicCredentials;
import io.xqueue.QueueBinding;
import io.xqueue.XQueueConfig;
import io.xqueue.XQueueConsumer;
import io.xqueue.http.DeliveryClient;
import io.xqueue.http.HttpDeliveryClient;
import io.xqueue.jdbc.DataSourceConnectionProvider;
import io.xqueue.jdbc.store.AbstractJdbcSubmissionStore;
import io.xqueue.jdbc.store.JdbcSubmissionStores;
import io.xqueue.spi.ConnectionProvider;
import io.xqueue.spi.MetricsExporter;
import io.xqueue.worker.PullConsumer;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Auto-configuration for the xqueue consumer.
 *
 * <p>Wires an {@link XQueueConsumer} from a {@link DataSource} and {@link XQueueProperties},
 * with one binding per entry of {@code xqueue.queues}, and starts its push workers unless
 * {@code xqueue.consumer.enabled=false}.
 *
 * @see XQueueProperties
 * @see XQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(XQueueConsumer.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(XQueueProperties.class)
public class XQueueAutoConfiguration {
  private static final Logger logger = Logger.getLogger(XQueueAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcSubmissionStore submissionStore(DataSource dataSource, XQueueProperties props) {
    return JdbcSubmissionStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public XQueueConfig xqueueConfig(XQueueProperties props) {
    XQueueConfig.Builder builder = XQueueConfig.builder()
        .submissionProcessingDelay(props.getSubmissionProcessingDelay())
        .consumerDelay(props.getConsumerDelay())
        .gradingTimeout(props.getGradingTimeout())
        .requestsTimeout(props.getRequestsTimeout())
        .verifyTls(props.isVerifyTls())
        .callbackEncoding(props.getCallbackEncoding());
    String username = props.getBasicAuth().getUsername();
    if (username != null && !username.isEmpty()) {
      String password = props.getBasicAuth().getPassword();
      builder.basicAuth(new BasicCredentials(username, password == null ? "" : password));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(DeliveryClient.class)
  public HttpDeliveryClient deliveryClient(XQueueConfig config) {
    return new HttpDeliveryClient(config);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public XQueueConsumer xqueueConsumer(XQueueProperties props,
      XQueueConfig config,
      ConnectionProvider connectionProvider,
      AbstractJdbcSubmissionStore submissionStore,
      DeliveryClient deliveryClient,
      ObjectProvider<MetricsExporter> metricsProvider) {
    XQueueConsumer.Builder builder = XQueueConsumer.builder()
        .connectionProvider(connectionProvider)
        .submissionStore(submissionStore)
        .config(config)
        .deliveryClient(deliveryClient)
        .bindings(bindings(props));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    XQueueConsumer consumer = builder.build();
    if (props.getConsumer().isEnabled()) {
      consumer.start();
    } else {
      logger.info("xqueue.consumer.enabled=false; push workers not started");
    }
    return consumer;
  }

  @Bean
  @ConditionalOnMissingBean
  public PullConsumer pullConsumer(XQueueConsumer consumer) {
    return consumer.pullConsumer();
  }

  static List<QueueBinding> bindings(XQueueProperties props) {
    List<QueueBinding> bindings = new ArrayList<>();
    for (Map.Entry<String, String> queue : props.getQueues().entrySet()) {
      String url = queue.getValue();
      if (url == null || url.isBlank()) {
        bindings.add(QueueBinding.pullOnly(queue.getKey()));
      } else {
        bindings.add(QueueBinding.push(queue.getKey(), url.trim(), props.getWorkersPerQueue()));
      }
    }
    return bindings;
  }
}
