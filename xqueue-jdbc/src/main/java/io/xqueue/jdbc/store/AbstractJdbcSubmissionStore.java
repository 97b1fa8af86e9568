package io.xqueue.jdbc.store;

import io.xqueue.jdbc.JdbcTemplate;
import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;
import io.xqueue.spi.SubmissionStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC submission store with standard SQL implementations.
 *
 * <p>The default {@link #claimNext} is a compare-and-set: select the oldest eligible id, then
 * update that row only if it is still eligible. A caller that loses the race moves on to the
 * next candidate. Subclasses override it with database-specific row locking. Register custom
 * implementations via {@code META-INF/services/io.xqueue.jdbc.store.AbstractJdbcSubmissionStore}.
 *
 * @see JdbcSubmissionStores
 */
public abstract class AbstractJdbcSubmissionStore implements SubmissionStore {
  protected static final String DEFAULT_TABLE = "xqueue_submission";

  protected static final String COLUMNS = "id, queue_name, xqueue_header, xqueue_body, urls, "
      + "arrival_time, pull_time, push_time, grader_id, grader_reply, num_failures, "
      + "return_time, lms_ack, retired";

  protected static final JdbcTemplate.RowMapper<Submission> SUBMISSION_ROW_MAPPER = rs -> new Submission(
      rs.getString("id"),
      rs.getString("queue_name"),
      rs.getString("xqueue_header"),
      rs.getString("xqueue_body"),
      rs.getString("urls"),
      instant(rs, "arrival_time"),
      instant(rs, "pull_time"),
      instant(rs, "push_time"),
      rs.getString("grader_id"),
      rs.getString("grader_reply"),
      rs.getInt("num_failures"),
      instant(rs, "return_time"),
      rs.getBoolean("lms_ack"),
      rs.getBoolean("retired"));

  private final String tableName;

  protected AbstractJdbcSubmissionStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcSubmissionStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this submission store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this submission store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind bound to another table.
   *
   * @param tableName the table name
   * @return a new store instance
   */
  public abstract AbstractJdbcSubmissionStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public void insertNew(Connection conn, Submission submission) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        submission.id(), submission.queueName(), submission.xqueueHeader(),
        submission.xqueueBody(), submission.urls(),
        timestamp(submission.arrivalTime()), timestamp(submission.pullTime()),
        timestamp(submission.pushTime()), submission.graderId(), submission.graderReply(),
        submission.numFailures(), timestamp(submission.returnTime()),
        submission.lmsAck(), submission.retired());
  }

  @Override
  public Optional<Submission> findNext(Connection conn, LeaseCriteria criteria) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE " + eligible(criteria) + " ORDER BY arrival_time, id LIMIT 1";
    return first(JdbcTemplate.query(conn, sql, SUBMISSION_ROW_MAPPER,
        criteria.queueName(), timestamp(criteria.cutoff())));
  }

  @Override
  public Optional<Submission> claimNext(Connection conn, LeaseCriteria criteria, String graderId) {
    String candidateSql = "SELECT id FROM " + tableName()
        + " WHERE " + eligible(criteria) + " ORDER BY arrival_time, id LIMIT 1";
    // Re-checking eligibility in the UPDATE makes it a compare-and-set
    String claimSql = "UPDATE " + tableName()
        + " SET " + criteria.field().column() + "=?, grader_id=?"
        + " WHERE id=? AND " + eligible(criteria);
    Timestamp cutoff = timestamp(criteria.cutoff());
    while (true) {
      Optional<String> candidate = first(JdbcTemplate.query(conn, candidateSql,
          rs -> rs.getString(1), criteria.queueName(), cutoff));
      if (candidate.isEmpty()) {
        return Optional.empty();
      }
      int updated = JdbcTemplate.update(conn, claimSql,
          timestamp(criteria.now()), graderId, candidate.get(), criteria.queueName(), cutoff);
      if (updated == 1) {
        return findById(conn, candidate.get());
      }
    }
  }

  @Override
  public int recordResult(Connection conn, SubmissionResult result) {
    // retired never flips back to false
    String sql = "UPDATE " + tableName()
        + " SET grader_reply=?, num_failures=?, return_time=?, lms_ack=?, retired=(retired OR ?)"
        + " WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        result.graderReply(), result.numFailures(), timestamp(result.returnTime()),
        result.lmsAck(), result.retired(), result.submissionId());
  }

  @Override
  public Optional<Submission> findById(Connection conn, String submissionId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, SUBMISSION_ROW_MAPPER, submissionId));
  }

  @Override
  public int countQueued(Connection conn, String queueName) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE queue_name=? AND retired=FALSE";
    return JdbcTemplate.queryForInt(conn, sql, queueName);
  }

  /**
   * Eligibility predicate of {@code criteria}. Binds two parameters: queue name, then cutoff.
   */
  protected static String eligible(LeaseCriteria criteria) {
    String column = criteria.field().column();
    return "queue_name=? AND retired=FALSE AND (" + column + " IS NULL OR " + column + " <= ?)";
  }

  protected static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  protected static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }
}
