package io.xqueue.spi;

import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence contract for queued submissions.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations that need no connection (the in-memory
 * store) ignore it. Implementations never delete rows.
 *
 * @see io.xqueue.jdbc.store.AbstractJdbcSubmissionStore
 * @see io.xqueue.store.InMemorySubmissionStore
 */
public interface SubmissionStore {

    /**
     * Inserts a new, unleased, unretired submission.
     *
     * @param conn       the JDBC connection
     * @param submission the submission to persist
     */
    void insertNew(Connection conn, Submission submission);

    /**
     * Returns the submission eligible under {@code criteria} with the oldest arrival time,
     * without leasing it.
     *
     * @param conn     the JDBC connection
     * @param criteria queue, time and lease field to select on
     * @return the oldest eligible submission, if any
     */
    Optional<Submission> findNext(Connection conn, LeaseCriteria criteria);

    /**
     * Selects and leases the oldest eligible submission as one atomic step.
     *
     * <p>The lease column named by {@link LeaseCriteria#field()} is set to
     * {@link LeaseCriteria#now()} and {@code grader_id} to {@code graderId}. Two callers
     * racing for the same row must never both receive it: implementations re-check the
     * eligibility predicate in the same statement that writes the lease, or lock the row.
     *
     * @param conn     the JDBC connection (may be in a transaction the caller commits)
     * @param criteria queue, time and lease field to select on
     * @param graderId identifier of the leasing grader
     * @return the leased submission with its lease fields already stamped, if any
     */
    Optional<Submission> claimNext(Connection conn, LeaseCriteria criteria, String graderId);

    /**
     * Writes the outcome of a delivery attempt in a single update.
     *
     * @param conn   the JDBC connection
     * @param result the fields to write
     * @return the number of rows updated (0 or 1)
     */
    int recordResult(Connection conn, SubmissionResult result);

    /**
     * Looks up a submission by id.
     *
     * @param conn         the JDBC connection
     * @param submissionId the submission id
     * @return the submission, if it exists
     */
    Optional<Submission> findById(Connection conn, String submissionId);

    /**
     * Counts unretired submissions in a queue, leased or not.
     *
     * @param conn      the JDBC connection
     * @param queueName the queue
     * @return the queue length
     */
    int countQueued(Connection conn, String queueName);
}
