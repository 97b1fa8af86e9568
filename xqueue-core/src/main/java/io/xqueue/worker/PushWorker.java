package io.xqueue.worker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xqueue.XQueueConfig;
import io.xqueue.http.DeliveryClient;
import io.xqueue.http.DeliveryResult;
import io.xqueue.http.Payload;
import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;
import io.xqueue.notify.ResultNotifier;
import io.xqueue.spi.ConnectionProvider;
import io.xqueue.spi.MetricsExporter;
import io.xqueue.spi.SubmissionStore;
import io.xqueue.util.DaemonThreadFactory;
import io.xqueue.util.JsonCodec;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-running consumer bound to one queue and one grader endpoint.
 *
 * <p>Each iteration leases the oldest eligible submission of the queue, posts it to the grader,
 * reports the outcome to the origin callback and retires the submission. Iterations are
 * separated by {@link XQueueConfig#consumerDelay()}; one iteration handles at most one
 * submission.
 *
 * <p>A pushed submission gets exactly one grading attempt. Whether the grader answers, fails or
 * times out, and whether the origin acknowledges or not, the submission is retired at the end of
 * the iteration. The only way a submission is delivered twice is a worker dying between lease
 * and retirement: the lease then goes stale after
 * {@link XQueueConfig#submissionProcessingDelay()} and another worker picks it up.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()} methods
 * are synchronized; {@link #processNext()} must not be called concurrently on one instance.
 *
 * @see WorkerState
 */
public final class PushWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PushWorker.class.getName());

    private final String queueName;
    private final String graderUrl;
    private final ConnectionProvider connectionProvider;
    private final SubmissionStore submissionStore;
    private final DeliveryClient deliveryClient;
    private final ResultNotifier resultNotifier;
    private final XQueueConfig config;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;
    private volatile WorkerState state = WorkerState.IDLE;

    private PushWorker(Builder builder) {
        this.queueName = Objects.requireNonNull(builder.queueName, "queueName");
        this.graderUrl = Objects.requireNonNull(builder.graderUrl, "graderUrl");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.submissionStore = Objects.requireNonNull(builder.submissionStore, "submissionStore");
        this.deliveryClient = Objects.requireNonNull(builder.deliveryClient, "deliveryClient");
        this.config = builder.config != null ? builder.config : XQueueConfig.defaults();
        this.resultNotifier = builder.resultNotifier != null
            ? builder.resultNotifier
            : new ResultNotifier(deliveryClient, config);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String queueName() {
        return queueName;
    }

    public String graderUrl() {
        return graderUrl;
    }

    public WorkerState state() {
        return state;
    }

    /**
     * Whether the iteration schedule is active.
     */
    public boolean isRunning() {
        return pollTask != null && !closed;
    }

    /**
     * Starts the iteration schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("PushWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        logger.info("Starting consumer for queue " + queueName + " (grader " + graderUrl + ")");
        scheduler = Executors.newSingleThreadScheduledExecutor(
            new DaemonThreadFactory("xqueue-" + queueName + "-"));
        long delayMs = config.consumerDelay().toMillis();
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one scheduled iteration. Never throws: failures are logged and the next iteration
     * starts from a fresh connection.
     */
    public void poll() {
        if (closed) {
            return;
        }
        try {
            processNext();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Consumer iteration failed for queue " + queueName, t);
        } finally {
            state = WorkerState.IDLE;
        }
    }

    /**
     * Runs one iteration synchronously: lease, deliver, notify, retire.
     *
     * @return true if a submission was leased and processed, false if none was eligible
     * @throws SQLException if a connection cannot be obtained or the lease transaction fails
     */
    public boolean processNext() throws SQLException {
        state = WorkerState.LEASED;
        Optional<Submission> leased = lease();
        if (leased.isEmpty()) {
            state = WorkerState.IDLE;
            return false;
        }
        metrics.incrementLeased(queueName);
        deliver(leased.get());
        state = WorkerState.IDLE;
        return true;
    }

    private Optional<Submission> lease() throws SQLException {
        // Truncate to millis so the stamped value matches what the database keeps
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        LeaseCriteria criteria = LeaseCriteria.push(queueName, now, config.submissionProcessingDelay());
        return StoreTransactions.claim(connectionProvider, submissionStore, criteria, graderUrl);
    }

    private void deliver(Submission submission) throws SQLException {
        state = WorkerState.DELIVERING;
        ObjectNode request = JsonCodec.newObject();
        request.put("xqueue_body", submission.xqueueBody());
        request.put("xqueue_files", submission.urls());

        long start = System.nanoTime();
        DeliveryResult grading = deliveryClient.post(
            graderUrl, Payload.json(JsonCodec.toJson(request)), config.gradingTimeout());
        Duration gradingTime = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordGradingDurationMs(queueName, gradingTime.toMillis());
        if (gradingTime.compareTo(config.gradingTimeout()) > 0) {
            metrics.incrementGradingSlow(queueName);
            logger.severe("Grading time above " + config.gradingTimeout() + " for submission "
                + submission.id() + ". grading_time: " + gradingTime.toMillis() + "ms body: "
                + submission.xqueueBody() + " files: " + submission.urls());
        }
        Instant returnTime = clock.instant();

        state = WorkerState.NOTIFYING;
        String graderReply = submission.graderReply();
        int numFailures = submission.numFailures();
        boolean lmsAck;
        if (grading.success()) {
            metrics.incrementGradingSuccess(queueName);
            graderReply = grading.message();
            lmsAck = resultNotifier.notify(submission.xqueueHeader(), graderReply);
        } else {
            metrics.incrementGradingFailure(queueName);
            logger.severe("Submission " + submission.id() + " to grader " + graderUrl
                + " failure: Reply: " + grading.message());
            numFailures++;
            lmsAck = resultNotifier.notifyFailure(submission.xqueueHeader());
        }
        if (lmsAck) {
            metrics.incrementNotifyAck(queueName);
        } else {
            metrics.incrementNotifyExhausted(queueName);
        }

        // One grading attempt per pushed submission: retire regardless of outcome
        state = WorkerState.DONE;
        SubmissionResult result = new SubmissionResult(
            submission.id(), graderReply, numFailures, returnTime, lmsAck, true);
        if (StoreTransactions.recordResult(connectionProvider, submissionStore, result) == 0) {
            logger.warning("Submission " + submission.id() + " no longer exists; result not recorded");
        }
        logger.fine("Retired submission " + submission.id() + " of queue " + queueName
            + " (grading " + (grading.success() ? "succeeded" : "failed") + ", lms_ack=" + lmsAck + ")");
    }

    /**
     * Cancels the schedule and shuts down the worker thread. An iteration in flight is
     * interrupted only between blocking calls; its HTTP calls end at their timeouts.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            logger.info("Consumer for queue " + queueName + " stopped");
        }
    }

    /**
     * Builder for {@link PushWorker}.
     */
    public static final class Builder {
        private String queueName;
        private String graderUrl;
        private ConnectionProvider connectionProvider;
        private SubmissionStore submissionStore;
        private DeliveryClient deliveryClient;
        private ResultNotifier resultNotifier;
        private XQueueConfig config;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the queue this worker consumes.
         *
         * <p><b>Required.</b>
         *
         * @param queueName the queue name
         * @return this builder
         */
        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        /**
         * Sets the grader endpoint. It is also recorded as {@code grader_id} on every lease.
         *
         * <p><b>Required.</b>
         *
         * @param graderUrl the grader url
         * @return this builder
         */
        public Builder graderUrl(String graderUrl) {
            this.graderUrl = graderUrl;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder submissionStore(SubmissionStore submissionStore) {
            this.submissionStore = submissionStore;
            return this;
        }

        /**
         * Sets the client used for the grader call and, unless a notifier is given, the
         * callback calls.
         *
         * <p><b>Required.</b>
         *
         * @param deliveryClient the HTTP client
         * @return this builder
         */
        public Builder deliveryClient(DeliveryClient deliveryClient) {
            this.deliveryClient = deliveryClient;
            return this;
        }

        /**
         * Optional. Defaults to a {@link ResultNotifier} over the delivery client.
         */
        public Builder resultNotifier(ResultNotifier resultNotifier) {
            this.resultNotifier = resultNotifier;
            return this;
        }

        /**
         * Optional. Defaults to {@link XQueueConfig#defaults()}.
         */
        public Builder config(XQueueConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for lease and return timestamps.
         *
         * <p>Optional. Defaults to the UTC system clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the worker. Call {@link PushWorker#start()} to begin consuming.
         *
         * @return a new worker
         * @throws NullPointerException if a required setting is missing
         */
        public PushWorker build() {
            return new PushWorker(this);
        }
    }
}
