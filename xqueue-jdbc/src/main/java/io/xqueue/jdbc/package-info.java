/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.xqueue.jdbc.JdbcTemplate} provides lightweight JDBC helpers.
 * {@link io.xqueue.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.xqueue.spi.ConnectionProvider} SPI.
 *
 * <p>{@code io.xqueue.jdbc.store} holds the {@link io.xqueue.spi.SubmissionStore}
 * implementations; DDL for each supported database ships under {@code schema/} on the classpath.
 *
 * @see io.xqueue.jdbc.JdbcTemplate
 * @see io.xqueue.jdbc.DataSourceConnectionProvider
 */
package io.xqueue.jdbc;
