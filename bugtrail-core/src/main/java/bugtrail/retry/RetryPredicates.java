package bugtrail.retry;

import bugtrail.spi.StorageException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Retryability predicates for {@link RetryConfig}.
 *
 * <p>The database and storage predicates walk the cause chain, so a driver exception
 * wrapped in a store exception is still recognised.
 */
public final class RetryPredicates {

  private static final Set<String> TRANSIENT_SQL_STATES = Set.of("57P01", "57P02", "57P03");

  private static final List<String> TRANSIENT_MESSAGES = List.of(
      "connection terminated",
      "server closed the connection",
      "connection reset",
      "socket hang up",
      "broken pipe",
      "connection refused");

  private static final int MAX_CAUSE_DEPTH = 16;

  private RetryPredicates() {}

  public static Predicate<Throwable> always() {
    return error -> true;
  }

  public static Predicate<Throwable> never() {
    return error -> false;
  }

  /**
   * Matches connection-level database failures: transient and recoverable SQL exceptions,
   * SQLState class {@code 08} (connection exception), PostgreSQL shutdown states
   * {@code 57P01}-{@code 57P03}, network exceptions and well-known connection-loss messages.
   */
  public static Predicate<Throwable> transientDatabaseError() {
    return error -> anyCause(error, RetryPredicates::isTransientDatabaseCause);
  }

  /**
   * Matches storage failures worth retrying: {@link StorageException}s with a 5xx or 429
   * status, and network-level I/O failures.
   */
  public static Predicate<Throwable> storageError() {
    return error -> anyCause(error, RetryPredicates::isTransientStorageCause);
  }

  private static boolean isTransientDatabaseCause(Throwable t) {
    if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
      return true;
    }
    if (t instanceof SQLException sql) {
      String state = sql.getSQLState();
      if (state != null && (state.startsWith("08") || TRANSIENT_SQL_STATES.contains(state))) {
        return true;
      }
    }
    return isNetworkFailure(t) || hasTransientMessage(t);
  }

  private static boolean isTransientStorageCause(Throwable t) {
    if (t instanceof StorageException storage && storage.isRetryableStatus()) {
      return true;
    }
    return isNetworkFailure(t) || hasTransientMessage(t);
  }

  private static boolean isNetworkFailure(Throwable t) {
    return t instanceof ConnectException
        || t instanceof SocketTimeoutException
        || t instanceof NoRouteToHostException
        || t instanceof UnknownHostException
        || t instanceof SocketException
        || t.getClass() == InterruptedIOException.class;
  }

  private static boolean hasTransientMessage(Throwable t) {
    String message = t.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String candidate : TRANSIENT_MESSAGES) {
      if (lower.contains(candidate)) {
        return true;
      }
    }
    return false;
  }

  private static boolean anyCause(Throwable error, Predicate<Throwable> test) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      if (test.test(current)) {
        return true;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }
}
