package io.xqueue.worker;

import io.xqueue.lease.LeaseCriteria;
import io.xqueue.model.Submission;
import io.xqueue.model.SubmissionResult;
import io.xqueue.spi.ConnectionProvider;
import io.xqueue.spi.SubmissionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Lease and result transactions shared by {@link PushWorker} and {@link PullConsumer}.
 *
 * <p>A {@code null} connection from the provider means the store needs none; the store is then
 * called directly.
 */
final class StoreTransactions {

    private StoreTransactions() {
    }

    static Optional<Submission> claim(ConnectionProvider connectionProvider, SubmissionStore store,
                                      LeaseCriteria criteria, String graderId) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            if (conn == null) {
                return store.claimNext(null, criteria, graderId);
            }
            conn.setAutoCommit(false);
            try {
                Optional<Submission> claimed = store.claimNext(conn, criteria, graderId);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    static int recordResult(ConnectionProvider connectionProvider, SubmissionStore store,
                            SubmissionResult result) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            if (conn != null) {
                conn.setAutoCommit(true);
            }
            return store.recordResult(conn, result);
        }
    }
}
