package io.xqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Fields written back by a push worker when a delivery attempt completes.
 *
 * <p>Persisted as one update. {@code graderReply} is {@code null} when grading failed.
 */
public record SubmissionResult(
    String submissionId,
    String graderReply,
    int numFailures,
    Instant returnTime,
    boolean lmsAck,
    boolean retired
) {
    public SubmissionResult {
        Objects.requireNonNull(submissionId, "submissionId");
        Objects.requireNonNull(returnTime, "returnTime");
        if (numFailures < 0) {
            throw new IllegalArgumentException("numFailures must be >= 0");
        }
    }
}
