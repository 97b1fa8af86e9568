package io.xqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.xqueue.jdbc.store.AbstractJdbcSubmissionStore;
import io.xqueue.jdbc.store.PostgresSubmissionStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;

@DockerAvailable
@Testcontainers
class PostgresSubmissionStoreIntegrationTest extends AbstractSubmissionStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("xqueue_test");

  private static final PostgresSubmissionStore STORE = new PostgresSubmissionStore();
  private static HikariDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgres.getJdbcUrl());
    config.setUsername(postgres.getUsername());
    config.setPassword(postgres.getPassword());
    config.setMaximumPoolSize(4);
    dataSource = new HikariDataSource(config);
    Schemas.apply(dataSource, "/schema/postgresql.sql");
  }

  @AfterAll
  static void closePool() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("TRUNCATE TABLE xqueue_submission");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcSubmissionStore store() {
    return STORE;
  }
}
