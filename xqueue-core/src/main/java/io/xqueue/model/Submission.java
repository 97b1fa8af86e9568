package io.xqueue.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * A queued grading submission, as stored in and read from the queue store.
 *
 * <p>{@code xqueueHeader}, {@code xqueueBody} and {@code urls} are opaque to the consumer.
 * Only {@link io.xqueue.notify.ResultNotifier} looks into the header, and only for the
 * callback address.
 *
 * <p>Once {@code retired} is true the submission is never leased again.
 */
public record Submission(
    String id,
    String queueName,
    String xqueueHeader,
    String xqueueBody,
    String urls,
    Instant arrivalTime,
    Instant pullTime,
    Instant pushTime,
    String graderId,
    String graderReply,
    int numFailures,
    Instant returnTime,
    boolean lmsAck,
    boolean retired
) {

    public Submission {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(arrivalTime, "arrivalTime");
    }

    /**
     * Starts a new, never-leased submission for the given queue.
     *
     * @param queueName logical queue the submission belongs to
     * @return a builder
     */
    public static Builder builder(String queueName) {
        return new Builder(queueName);
    }

    /**
     * Returns a copy stamped with a new lease of the given kind.
     *
     * @param field    which lease timestamp to set
     * @param leasedAt the lease time
     * @param graderId the grader taking the lease
     * @return the leased copy
     */
    public Submission withLease(LeaseField field, Instant leasedAt, String graderId) {
        return new Submission(id, queueName, xqueueHeader, xqueueBody, urls, arrivalTime,
            field == LeaseField.PULL_TIME ? leasedAt : pullTime,
            field == LeaseField.PUSH_TIME ? leasedAt : pushTime,
            graderId, graderReply, numFailures, returnTime, lmsAck, retired);
    }

    /**
     * Returns a copy carrying the outcome of a delivery attempt.
     *
     * @param result the recorded outcome
     * @return the updated copy
     */
    public Submission withResult(SubmissionResult result) {
        return new Submission(id, queueName, xqueueHeader, xqueueBody, urls, arrivalTime,
            pullTime, pushTime, graderId, result.graderReply(), result.numFailures(),
            result.returnTime(), result.lmsAck(), result.retired());
    }

    /**
     * Builder for submissions entering the queue.
     */
    public static final class Builder {
        private final String queueName;
        private String id;
        private String xqueueHeader;
        private String xqueueBody;
        private String urls;
        private Instant arrivalTime;

        private Builder(String queueName) {
            this.queueName = Objects.requireNonNull(queueName, "queueName");
            if (queueName.isEmpty()) {
                throw new IllegalArgumentException("queueName cannot be empty");
            }
        }

        /** Optional. Defaults to a new ULID. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder xqueueHeader(String xqueueHeader) {
            this.xqueueHeader = xqueueHeader;
            return this;
        }

        public Builder xqueueBody(String xqueueBody) {
            this.xqueueBody = xqueueBody;
            return this;
        }

        public Builder urls(String urls) {
            this.urls = urls;
            return this;
        }

        /** Optional. Defaults to now. */
        public Builder arrivalTime(Instant arrivalTime) {
            this.arrivalTime = arrivalTime;
            return this;
        }

        public Submission build() {
            Objects.requireNonNull(xqueueHeader, "xqueueHeader");
            Objects.requireNonNull(xqueueBody, "xqueueBody");
            return new Submission(
                id == null ? UlidCreator.getMonotonicUlid().toString() : id,
                queueName,
                xqueueHeader,
                xqueueBody,
                urls == null ? "" : urls,
                arrivalTime == null ? Instant.now() : arrivalTime,
                null,
                null,
                null,
                null,
                0,
                null,
                false,
                false);
        }
    }
}
