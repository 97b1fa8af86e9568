package io.xqueue.model;

import java.time.Instant;

/**
 * The two lease timestamps a submission carries, one per delivery style.
 *
 * <p>Both are leased with the same eligibility rule; only the column differs.
 */
public enum LeaseField {
    /** Lease taken by an external grader pulling work. */
    PULL_TIME("pull_time"),
    /** Lease taken by a {@link io.xqueue.worker.PushWorker} pushing work to its grader. */
    PUSH_TIME("push_time");

    private final String column;

    LeaseField(String column) {
        this.column = column;
    }

    /**
     * Store column holding this lease timestamp.
     *
     * @return the column name
     */
    public String column() {
        return column;
    }

    /**
     * Reads this lease timestamp from a submission.
     *
     * @param submission the submission
     * @return the lease time, or {@code null} if never leased this way
     */
    public Instant leasedAt(Submission submission) {
        return this == PULL_TIME ? submission.pullTime() : submission.pushTime();
    }
}
