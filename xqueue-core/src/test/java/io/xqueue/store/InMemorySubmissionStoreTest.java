package io.xqueue.store;

import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySubmissionStoreTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration DELAY = Duration.ofMinutes(1);

    private final InMemorySubmissionStore store = new InMemorySubmissionStore();

    private Submission insert(String id, String queue, Instant arrival) {
        Submission submission = Submission.builder(queue)
            .id(id)
            .xqueueHeader("{\"lms_callback_url\":\"http://lms/cb\"}")
            .xqueueBody("body-" + id)
            .arrivalTime(arrival)
            .build();
        store.insertNew(null, submission);
        return submission;
    }

    @Test
    void claimStampsPushLeaseAndGrader() {
        insert("a", "q", NOW.minusSeconds(30));

        Submission claimed = store.claimNext(null, LeaseCriteria.push("q", NOW, DELAY), "http://grader").orElseThrow();

        assertEquals("a", claimed.id());
        assertEquals(NOW, claimed.pushTime());
        assertEquals("http://grader", claimed.graderId());
        assertEquals(claimed, store.findById(null, "a").orElseThrow());
        assertTrue(store.claimNext(null, LeaseCriteria.push("q", NOW, DELAY), "g2").isEmpty());
    }

    @Test
    void findNextDoesNotLease() {
        insert("a", "q", NOW.minusSeconds(30));

        assertEquals("a", store.findNext(null, LeaseCriteria.pull("q", NOW, DELAY)).orElseThrow().id());
        assertEquals(null, store.findById(null, "a").orElseThrow().pullTime());
    }

    @Test
    void retiredSubmissionIsNeverLeasedAgain() {
        insert("a", "q", NOW.minusSeconds(30));
        store.claimNext(null, LeaseCriteria.push("q", NOW, DELAY), "g");
        assertEquals(1, store.recordResult(null, new SubmissionResult("a", "reply", 0, NOW, true, true)));

        Instant muchLater = NOW.plus(Duration.ofDays(1));
        assertTrue(store.claimNext(null, LeaseCriteria.push("q", muchLater, DELAY), "g").isEmpty());
        assertTrue(store.claimNext(null, LeaseCriteria.pull("q", muchLater, DELAY), "g").isEmpty());
        assertEquals(0, store.countQueued(null, "q"));
    }

    @Test
    void recordResultOnUnknownIdUpdatesNothing() {
        assertEquals(0, store.recordResult(null, new SubmissionResult("missing", null, 1, NOW, false, true)));
    }

    @Test
    void duplicateIdIsRejected() {
        insert("a", "q", NOW);
        assertThrows(IllegalArgumentException.class, () -> insert("a", "q", NOW));
    }

    @Test
    void countQueuedIncludesLeasedButNotOtherQueues() {
        insert("a", "q", NOW.minusSeconds(3));
        insert("b", "q", NOW.minusSeconds(2));
        insert("c", "other", NOW.minusSeconds(1));
        store.claimNext(null, LeaseCriteria.push("q", NOW, DELAY), "g");

        assertEquals(2, store.countQueued(null, "q"));
        assertEquals(1, store.countQueued(null, "other"));
    }

    @Test
    void concurrentClaimersNeverShareASubmission() throws Exception {
        int submissions = 200;
        for (int i = 0; i < submissions; i++) {
            insert(String.format("s%04d", i), "q", NOW.minusSeconds(submissions - i));
        }

        int threads = 8;
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ConcurrentHashMap<String, Boolean> duplicates = new ConcurrentHashMap<>();
        for (int t = 0; t < threads; t++) {
            String grader = "g" + t;
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                Optional<Submission> next;
                while ((next = store.claimNext(null, LeaseCriteria.push("q", NOW, DELAY), grader)).isPresent()) {
                    if (!claimed.add(next.get().id())) {
                        duplicates.put(next.get().id(), true);
                    }
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(submissions, claimed.size());
        assertFalse(duplicates.keySet().iterator().hasNext());
    }
}
