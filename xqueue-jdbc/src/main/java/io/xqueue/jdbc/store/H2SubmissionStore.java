package io.xqueue.jdbc.store;

import java.util.List;

/**
 * H2 submission store. Primarily for testing and single-process deployments.
 *
 * <p>Uses the default compare-and-set claim from {@link AbstractJdbcSubmissionStore}.
 */
public final class H2SubmissionStore extends AbstractJdbcSubmissionStore {

  public H2SubmissionStore() {
    super();
  }

  public H2SubmissionStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcSubmissionStore withTableName(String tableName) {
    return new H2SubmissionStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
