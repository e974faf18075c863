package bugtrail.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the bugtrail JDBC stores and
 * repositories.
 */
public final class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * SQLState of the wrapped {@link SQLException}, or {@code null}.
   */
  public String sqlState() {
    return getCause() instanceof SQLException sql ? sql.getSQLState() : null;
  }

  /**
   * Whether the wrapped error is an integrity constraint violation (SQLState class 23).
   */
  public boolean isConstraintViolation() {
    String state = sqlState();
    return state != null && state.startsWith("23");
  }
}
