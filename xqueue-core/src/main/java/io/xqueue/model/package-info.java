/**
 * Submission data model: the queued row, its lease timestamps and the delivery outcome.
 */
package io.xqueue.model;
