package io.xqueue;

import java.util.Objects;

/**
 * Binds a queue to the grader endpoint its push workers deliver to.
 *
 * <p>A binding without a grader url describes a pull-only queue: external graders fetch
 * from it and no push worker is started.
 *
 * @param queueName   the queue
 * @param graderUrl   the grader endpoint, or {@code null} for a pull-only queue
 * @param workerCount push workers to run for this queue
 */
public record QueueBinding(String queueName, String graderUrl, int workerCount) {

    public QueueBinding {
        Objects.requireNonNull(queueName, "queueName");
        if (queueName.isEmpty()) {
            throw new IllegalArgumentException("queueName cannot be empty");
        }
        if (graderUrl != null && graderUrl.isBlank()) {
            graderUrl = null;
        }
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
    }

    /**
     * Push binding with the given number of workers.
     */
    public static QueueBinding push(String queueName, String graderUrl, int workerCount) {
        return new QueueBinding(queueName, Objects.requireNonNull(graderUrl, "graderUrl"), workerCount);
    }

    /**
     * Pull-only binding.
     */
    public static QueueBinding pullOnly(String queueName) {
        return new QueueBinding(queueName, null, 0);
    }

    public boolean isPush() {
        return graderUrl != null && workerCount > 0;
    }
}
