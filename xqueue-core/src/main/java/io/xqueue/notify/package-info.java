/**
 * Result notification to the origin system.
 *
 * @see io.xqueue.notify.ResultNotifier
 * @see io.xqueue.notify.XQueueHeader
 */
package io.xqueue.notify;
