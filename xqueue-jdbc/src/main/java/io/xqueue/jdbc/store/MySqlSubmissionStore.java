package io.xqueue.jdbc.store;

import io.xqueue.jdbc.JdbcTemplate;
import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * MySQL submission store. Also used for MariaDB.
 *
 * <p>Locks the candidate row with {@code SELECT ... FOR UPDATE SKIP LOCKED} (MySQL 8.0+,
 * MariaDB 10.6+) and stamps the lease in the same transaction. The caller must run
 * {@link #claimNext} with auto-commit off; the lock is released on commit.
 */
public final class MySqlSubmissionStore extends AbstractJdbcSubmissionStore {

  public MySqlSubmissionStore() {
    super();
  }

  public MySqlSubmissionStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcSubmissionStore withTableName(String tableName) {
    return new MySqlSubmissionStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public Optional<Submission> claimNext(Connection conn, LeaseCriteria criteria, String graderId) {
    String lockSql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE " + eligible(criteria) + " ORDER BY arrival_time, id LIMIT 1 FOR UPDATE SKIP LOCKED";
    Optional<Submission> locked = first(JdbcTemplate.query(conn, lockSql, SUBMISSION_ROW_MAPPER,
        criteria.queueName(), timestamp(criteria.cutoff())));
    if (locked.isEmpty()) {
      return Optional.empty();
    }
    String claimSql = "UPDATE " + tableName()
        + " SET " + criteria.field().column() + "=?, grader_id=? WHERE id=?";
    JdbcTemplate.update(conn, claimSql, Timestamp.from(criteria.now()), graderId, locked.get().id());
    return Optional.of(locked.get().withLease(criteria.field(), criteria.now(), graderId));
  }
}
