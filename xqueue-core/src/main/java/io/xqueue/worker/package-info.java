/**
 * Push workers and pull leasing.
 *
 * <p>{@link io.xqueue.worker.PushWorker} drives one queue against one grader endpoint;
 * {@link io.xqueue.worker.PullConsumer} hands submissions to graders that fetch work.
 */
package io.xqueue.worker;
