/**
 * JDBC-based {@link io.xqueue.spi.SubmissionStore} implementations.
 *
 * <p>{@link io.xqueue.jdbc.store.AbstractJdbcSubmissionStore} provides shared SQL and row mapping;
 * subclasses supply database-specific claim strategies: H2 (compare-and-set),
 * MySQL ({@code SELECT ... FOR UPDATE SKIP LOCKED} then {@code UPDATE}), and PostgreSQL
 * ({@code UPDATE ... FOR UPDATE SKIP LOCKED ... RETURNING}).
 *
 * @see io.xqueue.jdbc.store.JdbcSubmissionStores
 */
package io.xqueue.jdbc.store;
