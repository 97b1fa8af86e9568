package io.xqueue.lease;

import io.xqueue.model.LeaseField;
import io.xqueue.model.Submission;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaseCriteriaTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration DELAY = Duration.ofMinutes(1);

    private static Submission submission(String queue) {
        return Submission.builder(queue)
            .xqueueHeader("{}")
            .xqueueBody("body")
            .arrivalTime(NOW.minusSeconds(600))
            .build();
    }

    @Test
    void cutoffIsNowMinusDelay() {
        assertEquals(NOW.minusSeconds(60), LeaseCriteria.push("q", NOW, DELAY).cutoff());
    }

    @Test
    void neverLeasedSubmissionMatches() {
        assertTrue(LeaseCriteria.push("q", NOW, DELAY).matches(submission("q")));
    }

    @Test
    void otherQueueDoesNotMatch() {
        assertFalse(LeaseCriteria.push("q", NOW, DELAY).matches(submission("other")));
    }

    @Test
    void freshLeaseHidesSubmission() {
        Submission leased = submission("q").withLease(LeaseField.PUSH_TIME, NOW.minusSeconds(10), "g");

        assertFalse(LeaseCriteria.push("q", NOW, DELAY).matches(leased));
    }

    @Test
    void leaseExactlyAtCutoffIsStale() {
        Submission leased = submission("q").withLease(LeaseField.PUSH_TIME, NOW.minus(DELAY), "g");

        assertTrue(LeaseCriteria.push("q", NOW, DELAY).matches(leased));
    }

    @Test
    void pushAndPullLeasesAreIndependent() {
        Submission pulled = submission("q").withLease(LeaseField.PULL_TIME, NOW, "external");

        assertTrue(LeaseCriteria.push("q", NOW, DELAY).matches(pulled));
        assertFalse(LeaseCriteria.pull("q", NOW, DELAY).matches(pulled));
    }

    @Test
    void zeroDelayMakesEveryLeaseStale() {
        Submission leased = submission("q").withLease(LeaseField.PUSH_TIME, NOW, "g");

        assertTrue(LeaseCriteria.push("q", NOW, Duration.ZERO).matches(leased));
    }

    @Test
    void rejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class,
            () -> LeaseCriteria.push("q", NOW, Duration.ofSeconds(-1)));
    }
}
