package io.xqueue;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings shared by workers, the result notifier and the delivery client.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} returns the stock settings.
 */
public final class XQueueConfig {
    public static final Duration DEFAULT_SUBMISSION_PROCESSING_DELAY = Duration.ofMinutes(1);
    public static final Duration DEFAULT_CONSUMER_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_GRADING_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_REQUESTS_TIMEOUT = Duration.ofSeconds(5);

    private final Duration submissionProcessingDelay;
    private final Duration consumerDelay;
    private final Duration gradingTimeout;
    private final Duration requestsTimeout;
    private final BasicCredentials basicAuth;
    private final boolean verifyTls;
    private final CallbackEncoding callbackEncoding;

    private XQueueConfig(Builder builder) {
        this.submissionProcessingDelay = requireNonNegative(
            builder.submissionProcessingDelay, "submissionProcessingDelay");
        this.consumerDelay = requirePositive(builder.consumerDelay, "consumerDelay");
        this.gradingTimeout = requirePositive(builder.gradingTimeout, "gradingTimeout");
        this.requestsTimeout = requirePositive(builder.requestsTimeout, "requestsTimeout");
        this.basicAuth = builder.basicAuth;
        this.verifyTls = builder.verifyTls;
        this.callbackEncoding = Objects.requireNonNull(builder.callbackEncoding, "callbackEncoding");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static XQueueConfig defaults() {
        return builder().build();
    }

    /** Age after which a lease is considered stale and the submission may be leased again. */
    public Duration submissionProcessingDelay() {
        return submissionProcessingDelay;
    }

    /** Pause between two iterations of a push worker. */
    public Duration consumerDelay() {
        return consumerDelay;
    }

    /** Timeout for one grader call. */
    public Duration gradingTimeout() {
        return gradingTimeout;
    }

    /** Timeout for one origin callback call. */
    public Duration requestsTimeout() {
        return requestsTimeout;
    }

    /** Basic credentials for outbound requests, or {@code null}. */
    public BasicCredentials basicAuth() {
        return basicAuth;
    }

    /** Whether TLS certificates and host names of graders and callbacks are verified. */
    public boolean verifyTls() {
        return verifyTls;
    }

    public CallbackEncoding callbackEncoding() {
        return callbackEncoding;
    }

    @Override
    public String toString() {
        return "XQueueConfig{submissionProcessingDelay=" + submissionProcessingDelay
            + ", consumerDelay=" + consumerDelay
            + ", gradingTimeout=" + gradingTimeout
            + ", requestsTimeout=" + requestsTimeout
            + ", basicAuth=" + basicAuth
            + ", verifyTls=" + verifyTls
            + ", callbackEncoding=" + callbackEncoding + '}';
    }

    // Schedulers and HTTP timeouts work in whole milliseconds, where 0 means no timeout
    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.toMillis() < 1) {
            throw new IllegalArgumentException(name + " must be at least 1ms");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }

    /**
     * Builder for {@link XQueueConfig}.
     */
    public static final class Builder {
        private Duration submissionProcessingDelay = DEFAULT_SUBMISSION_PROCESSING_DELAY;
        private Duration consumerDelay = DEFAULT_CONSUMER_DELAY;
        private Duration gradingTimeout = DEFAULT_GRADING_TIMEOUT;
        private Duration requestsTimeout = DEFAULT_REQUESTS_TIMEOUT;
        private BasicCredentials basicAuth;
        private boolean verifyTls;
        private CallbackEncoding callbackEncoding = CallbackEncoding.JSON;

        private Builder() {
        }

        /**
         * Sets the visibility timeout of a lease.
         *
         * <p>Optional. Defaults to 1 minute. Must be &ge; 0.
         *
         * @param submissionProcessingDelay lease age after which a submission may be leased again
         * @return this builder
         */
        public Builder submissionProcessingDelay(Duration submissionProcessingDelay) {
            this.submissionProcessingDelay = submissionProcessingDelay;
            return this;
        }

        /**
         * Sets the pause between worker iterations.
         *
         * <p>Optional. Defaults to 10 seconds. Must be at least 1 millisecond.
         *
         * @param consumerDelay delay between two lease attempts of one worker
         * @return this builder
         */
        public Builder consumerDelay(Duration consumerDelay) {
            this.consumerDelay = consumerDelay;
            return this;
        }

        /**
         * Sets the grader call timeout.
         *
         * <p>Optional. Defaults to 30 seconds. Must be at least 1 millisecond.
         *
         * @param gradingTimeout timeout for one grader POST
         * @return this builder
         */
        public Builder gradingTimeout(Duration gradingTimeout) {
            this.gradingTimeout = gradingTimeout;
            return this;
        }

        /**
         * Sets the origin callback timeout.
         *
         * <p>Optional. Defaults to 5 seconds. Must be at least 1 millisecond.
         *
         * @param requestsTimeout timeout for one callback POST
         * @return this builder
         */
        public Builder requestsTimeout(Duration requestsTimeout) {
            this.requestsTimeout = requestsTimeout;
            return this;
        }

        /**
         * Sets basic credentials applied to every outbound request.
         *
         * <p>Optional. Defaults to none.
         *
         * @param basicAuth the credentials, or {@code null}
         * @return this builder
         */
        public Builder basicAuth(BasicCredentials basicAuth) {
            this.basicAuth = basicAuth;
            return this;
        }

        /**
         * Enables TLS certificate and host name verification.
         *
         * <p>Optional. Defaults to {@code false}: graders are trusted private endpoints
         * and are often served with self-signed certificates.
         *
         * @param verifyTls whether to verify
         * @return this builder
         */
        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        /**
         * Sets how result notifications are encoded.
         *
         * <p>Optional. Defaults to {@link CallbackEncoding#JSON}.
         *
         * @param callbackEncoding the encoding
         * @return this builder
         */
        public Builder callbackEncoding(CallbackEncoding callbackEncoding) {
            this.callbackEncoding = callbackEncoding;
            return this;
        }

        public XQueueConfig build() {
            return new XQueueConfig(this);
        }
    }
}
