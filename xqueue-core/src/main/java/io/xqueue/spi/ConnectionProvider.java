package io.xqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for worker lease and result updates.
 *
 * <p>Callers are responsible for closing the returned connection. {@link #NONE} serves stores
 * that keep no JDBC state, such as {@link io.xqueue.store.InMemorySubmissionStore}; workers
 * skip transaction handling when the provider returns {@code null}.
 *
 * @see io.xqueue.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /** Provider for connection-less stores; always returns {@code null}. */
    ConnectionProvider NONE = () -> null;

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection the caller must close, or {@code null} for connection-less stores
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
