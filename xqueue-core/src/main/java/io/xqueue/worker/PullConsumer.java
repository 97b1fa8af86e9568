package io.xqueue.worker;

import io.xqueue.XQueueConfig;
import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.spi.ConnectionProvider;
import io.xqueue.spi.SubmissionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Leasing on behalf of external graders that fetch work themselves.
 *
 * <p>Pull leases use {@code pull_time} and never retire a submission; the external grader
 * reports its result through a separate path. A pull lease goes stale after the same
 * {@link XQueueConfig#submissionProcessingDelay()} as a push lease.
 */
public final class PullConsumer {
    private final ConnectionProvider connectionProvider;
    private final SubmissionStore submissionStore;
    private final XQueueConfig config;
    private final Clock clock;

    public PullConsumer(ConnectionProvider connectionProvider, SubmissionStore submissionStore,
                        XQueueConfig config, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.submissionStore = Objects.requireNonNull(submissionStore, "submissionStore");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Leases the oldest submission of {@code queueName} for an external grader.
     *
     * @param queueName the queue
     * @param graderId  identifier of the pulling grader
     * @return the leased submission, or empty if the queue has nothing eligible
     * @throws SQLException if the lease transaction fails
     */
    public Optional<Submission> pull(String queueName, String graderId) throws SQLException {
        LeaseCriteria criteria = criteria(queueName);
        return StoreTransactions.claim(connectionProvider, submissionStore, criteria, graderId);
    }

    /**
     * Returns the submission {@link #pull} would lease next, without leasing it.
     */
    public Optional<Submission> peek(String queueName) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            return submissionStore.findNext(conn, criteria(queueName));
        }
    }

    /**
     * Number of unretired submissions in {@code queueName}.
     */
    public int queueLength(String queueName) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            return submissionStore.countQueued(conn, queueName);
        }
    }

    private LeaseCriteria criteria(String queueName) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return LeaseCriteria.pull(queueName, now, config.submissionProcessingDelay());
    }
}
