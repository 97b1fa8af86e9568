package io.xqueue.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link io.xqueue.jdbc.store.AbstractJdbcSubmissionStore}
 * and its subclasses.
 */
public final class SubmissionStoreException extends RuntimeException {
  public SubmissionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
