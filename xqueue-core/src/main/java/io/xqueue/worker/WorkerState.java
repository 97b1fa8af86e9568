package io.xqueue.worker;

/**
 * Where a {@link PushWorker} is within one iteration.
 *
 * <p>An iteration runs {@code IDLE → LEASED → DELIVERING → NOTIFYING → DONE} and returns to
 * {@code IDLE}; it goes straight back to {@code IDLE} when nothing could be leased.
 */
public enum WorkerState {
    /** Waiting for the next iteration. */
    IDLE,
    /** Claiming the oldest eligible submission. */
    LEASED,
    /** Posting the submission to the grader. */
    DELIVERING,
    /** Reporting the outcome to the origin callback. */
    NOTIFYING,
    /** Retiring the submission and persisting the outcome. */
    DONE
}
