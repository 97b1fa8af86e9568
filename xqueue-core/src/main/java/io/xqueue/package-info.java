/**
 * Consumer and delivery core of a grading submission queue.
 *
 * <p>Submissions wait in a {@link io.xqueue.spi.SubmissionStore}. A
 * {@link io.xqueue.worker.PushWorker} per queue (or several) leases the oldest eligible
 * submission, posts it to a grader through a {@link io.xqueue.http.DeliveryClient}, reports the
 * outcome with a {@link io.xqueue.notify.ResultNotifier} and retires it.
 * {@link io.xqueue.XQueueConsumer} wires and runs the workers of every configured queue.
 *
 * <p>Leases are timestamps, not locks: a lease younger than
 * {@link io.xqueue.XQueueConfig#submissionProcessingDelay()} hides a submission, an older one is
 * stale and the submission can be leased again. Delivery is therefore at least once.
 */
package io.xqueue;
