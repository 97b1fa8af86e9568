/**
 * Non-JDBC {@link io.xqueue.spi.SubmissionStore} implementations.
 */
package io.xqueue.store;
