package io.xqueue.jdbc.store;

import io.xqueue.jdbc.JdbcTemplate;
import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL submission store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim.
 */
public final class PostgresSubmissionStore extends AbstractJdbcSubmissionStore {

  public PostgresSubmissionStore() {
    super();
  }

  public PostgresSubmissionStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcSubmissionStore withTableName(String tableName) {
    return new PostgresSubmissionStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public Optional<Submission> claimNext(Connection conn, LeaseCriteria criteria, String graderId) {
    String sql = "UPDATE " + tableName()
        + " SET " + criteria.field().column() + "=?, grader_id=?"
        + " WHERE id = (SELECT id FROM " + tableName()
        + " WHERE " + eligible(criteria) + " ORDER BY arrival_time, id LIMIT 1"
        + " FOR UPDATE SKIP LOCKED)"
        + " RETURNING " + COLUMNS;
    return first(JdbcTemplate.updateReturning(conn, sql, SUBMISSION_ROW_MAPPER,
        Timestamp.from(criteria.now()), graderId, criteria.queueName(), timestamp(criteria.cutoff())));
  }
}
