package io.xqueue.spring.boot;

import io.xqueue.CallbackEncoding;
import io.xqueue.XQueueConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the xqueue consumer.
 *
 * <pre>
 * xqueue.queues.python=http://grader-python:1710/
 * xqueue.queues.manual=
 * xqueue.workers-per-queue=2
 * xqueue.grading-timeout=45s
 * </pre>
 *
 * @see XQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "xqueue")
public class XQueueProperties {

    /**
     * Queue name to grader url. An empty url makes the queue pull-only.
     */
    private Map<String, String> queues = new LinkedHashMap<>();

    /**
     * Push workers started for every queue with a grader url.
     */
    private int workersPerQueue = 1;

    /**
     * Lease age after which a submission may be leased again.
     */
    private Duration submissionProcessingDelay = XQueueConfig.DEFAULT_SUBMISSION_PROCESSING_DELAY;

    /**
     * Pause between two iterations of one push worker.
     */
    private Duration consumerDelay = XQueueConfig.DEFAULT_CONSUMER_DELAY;

    /**
     * Timeout of one grader call.
     */
    private Duration gradingTimeout = XQueueConfig.DEFAULT_GRADING_TIMEOUT;

    /**
     * Timeout of one callback call to the origin.
     */
    private Duration requestsTimeout = XQueueConfig.DEFAULT_REQUESTS_TIMEOUT;

    /**
     * Whether TLS certificates of graders and origins are verified.
     */
    private boolean verifyTls = false;

    /**
     * Encoding of result notifications.
     */
    private CallbackEncoding callbackEncoding = CallbackEncoding.JSON;

    /**
     * Database table holding submissions.
     */
    private String tableName = "xqueue_submission";

    private final BasicAuth basicAuth = new BasicAuth();
    private final Consumer consumer = new Consumer();
    private final Metrics metrics = new Metrics();

    public Map<String, String> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, String> queues) {
        this.queues = queues;
    }

    public int getWorkersPerQueue() {
        return workersPerQueue;
    }

    public void setWorkersPerQueue(int workersPerQueue) {
        this.workersPerQueue = workersPerQueue;
    }

    public Duration getSubmissionProcessingDelay() {
        return submissionProcessingDelay;
    }

    public void setSubmissionProcessingDelay(Duration submissionProcessingDelay) {
        this.submissionProcessingDelay = submissionProcessingDelay;
    }

    public Duration getConsumerDelay() {
        return consumerDelay;
    }

    public void setConsumerDelay(Duration consumerDelay) {
        this.consumerDelay = consumerDelay;
    }

    public Duration getGradingTimeout() {
        return gradingTimeout;
    }

    public void setGradingTimeout(Duration gradingTimeout) {
        this.gradingTimeout = gradingTimeout;
    }

    public Duration getRequestsTimeout() {
        return requestsTimeout;
    }

    public void setRequestsTimeout(Duration requestsTimeout) {
        this.requestsTimeout = requestsTimeout;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public void setVerifyTls(boolean verifyTls) {
        this.verifyTls = verifyTls;
    }

    public CallbackEncoding getCallbackEncoding() {
        return callbackEncoding;
    }

    public void setCallbackEncoding(CallbackEncoding callbackEncoding) {
        this.callbackEncoding = callbackEncoding;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public BasicAuth getBasicAuth() {
        return basicAuth;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class BasicAuth {
        /**
         * User name sent with every grader and callback request. Unset disables basic auth.
         */
        private String username;
        private String password = "";

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Consumer {
        /**
         * Whether push workers start with the application context.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "xqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
