package bugtrail.jdbc.tx;

import bugtrail.jdbc.StoreException;
import bugtrail.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs multi-statement repository work (archive copy plus hard delete, metadata
 * read-modify-write) on one connection with auto-commit disabled.
 *
 * <pre>{@code
 * List<ReportRef> removed = txManager.inTransaction(conn -> {
 *   List<ReportRef> refs = JdbcTemplate.query(conn, selectSql, mapper, ids);
 *   JdbcTemplate.update(conn, deleteSql, ids);
 *   return refs;
 * });
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Unit of work run by {@link #inTransaction(TransactionCallback)}.
   */
  @FunctionalInterface
  public interface TransactionCallback<T> {
    T doInTransaction(Connection conn) throws SQLException;
  }

  /**
   * Runs the callback and commits. Any exception rolls the work back; the original error
   * is rethrown, with checked SQL errors wrapped in {@link StoreException} and rollback
   * failures attached as suppressed.
   */
  public <T> T inTransaction(TransactionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = callback.doInTransaction(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException | Error e) {
        rollback(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } catch (SQLException e) {
      throw new StoreException("Transaction failed", e);
    }
  }

  private static void rollback(Connection conn, Throwable cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      // The connection is closed right after; a pool resets it on return.
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    }
  }
}
