package io.xqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DataSourceConnectionProviderTest {

  @Test
  void delegatesToDataSource() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:provider_" + UUID.randomUUID());

    try (Connection conn = new DataSourceConnectionProvider(ds).getConnection()) {
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
