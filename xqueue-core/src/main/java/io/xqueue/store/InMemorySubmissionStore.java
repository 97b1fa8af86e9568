package io.xqueue.store;

import io.xqueue.lease.LeaseCriteria;
import io.xqueue.lease.LeaseSelector;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;
import io.xqueue.spi.SubmissionStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed {@link SubmissionStore} for embedding and tests.
 *
 * <p>The connection argument is ignored; pair it with {@link io.xqueue.spi.ConnectionProvider#NONE}
 * when running workers over it. Every method locks the store, so a claim is atomic
 * with respect to every other call. Contents are lost with the instance.
 */
public final class InMemorySubmissionStore implements SubmissionStore {
    private final Map<String, Submission> submissions = new LinkedHashMap<>();

    @Override
    public synchronized void insertNew(Connection conn, Submission submission) {
        Objects.requireNonNull(submission, "submission");
        if (submissions.containsKey(submission.id())) {
            throw new IllegalArgumentException("Duplicate submission id " + submission.id());
        }
        submissions.put(submission.id(), submission);
    }

    @Override
    public synchronized Optional<Submission> findNext(Connection conn, LeaseCriteria criteria) {
        return LeaseSelector.selectNext(submissions.values(), criteria);
    }

    @Override
    public synchronized Optional<Submission> claimNext(Connection conn, LeaseCriteria criteria, String graderId) {
        Optional<Submission> next = LeaseSelector.selectNext(submissions.values(), criteria);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Submission leased = next.get().withLease(criteria.field(), criteria.now(), graderId);
        submissions.put(leased.id(), leased);
        return Optional.of(leased);
    }

    @Override
    public synchronized int recordResult(Connection conn, SubmissionResult result) {
        Submission current = submissions.get(result.submissionId());
        if (current == null) {
            return 0;
        }
        submissions.put(current.id(), current.withResult(result));
        return 1;
    }

    @Override
    public synchronized Optional<Submission> findById(Connection conn, String submissionId) {
        return Optional.ofNullable(submissions.get(submissionId));
    }

    @Override
    public synchronized int countQueued(Connection conn, String queueName) {
        int count = 0;
        for (Submission submission : submissions.values()) {
            if (!submission.retired() && submission.queueName().equals(queueName)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Snapshot of every stored submission in insertion order.
     */
    public synchronized List<Submission> all() {
        return new ArrayList<>(submissions.values());
    }
}
