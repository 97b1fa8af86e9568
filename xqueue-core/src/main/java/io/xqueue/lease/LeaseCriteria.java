package io.xqueue.lease;

import io.xqueue.model.LeaseField;
import io.xqueue.model.Submission;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Eligibility rule for leasing a submission from one queue.
 *
 * <p>A submission is eligible when it is not retired, belongs to {@code queueName}, and its
 * {@code field} lease is either unset or no later than {@link #cutoff()}. The delay acts as a
 * visibility timeout: a lease younger than {@code delay} hides the submission from everyone else.
 *
 * @param queueName the queue to lease from
 * @param now       the time the lease is evaluated at (and stamped with, when claimed)
 * @param delay     the processing delay after which a lease goes stale
 * @param field     the lease timestamp to evaluate
 */
public record LeaseCriteria(String queueName, Instant now, Duration delay, LeaseField field) {

    public LeaseCriteria {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(field, "field");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }

    /**
     * Criteria for the push path ({@link LeaseField#PUSH_TIME}).
     */
    public static LeaseCriteria push(String queueName, Instant now, Duration delay) {
        return new LeaseCriteria(queueName, now, delay, LeaseField.PUSH_TIME);
    }

    /**
     * Criteria for the pull path ({@link LeaseField#PULL_TIME}).
     */
    public static LeaseCriteria pull(String queueName, Instant now, Duration delay) {
        return new LeaseCriteria(queueName, now, delay, LeaseField.PULL_TIME);
    }

    /**
     * Latest lease time that counts as stale.
     *
     * @return {@code now - delay}
     */
    public Instant cutoff() {
        return now.minus(delay);
    }

    /**
     * Evaluates the eligibility predicate against one submission.
     *
     * @param submission the candidate
     * @return true if the submission may be leased under these criteria
     */
    public boolean matches(Submission submission) {
        if (submission.retired() || !queueName.equals(submission.queueName())) {
            return false;
        }
        Instant leasedAt = field.leasedAt(submission);
        return leasedAt == null || !leasedAt.isAfter(cutoff());
    }
}
