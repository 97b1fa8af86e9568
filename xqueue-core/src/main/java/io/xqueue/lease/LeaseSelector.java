package io.xqueue.lease;

import io.xqueue.model.Submission;

import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the next submission to lease: the eligible one that arrived first.
 *
 * <p>Arrival ties are broken by id so the choice is deterministic. JDBC stores express the
 * same rule as {@code ORDER BY arrival_time, id}.
 */
public final class LeaseSelector {

    /** Oldest arrival first, then id. */
    public static final Comparator<Submission> FIFO =
        Comparator.comparing(Submission::arrivalTime).thenComparing(Submission::id);

    private LeaseSelector() {
    }

    /**
     * Selects the next submission to lease among {@code candidates}.
     *
     * @param candidates submissions to choose from (any queue, any state)
     * @param criteria   the eligibility rule
     * @return the oldest eligible submission, or empty if none is eligible
     */
    public static Optional<Submission> selectNext(Iterable<Submission> candidates, LeaseCriteria criteria) {
        Submission best = null;
        for (Submission candidate : candidates) {
            if (!criteria.matches(candidate)) {
                continue;
            }
            if (best == null || FIFO.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
