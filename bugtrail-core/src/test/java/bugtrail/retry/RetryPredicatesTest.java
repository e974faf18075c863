package bugtrail.retry;

import bugtrail.spi.StorageException;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class RetryPredicatesTest {

  private final Predicate<Throwable> db = RetryPredicates.transientDatabaseError();
  private final Predicate<Throwable> storage = RetryPredicates.storageError();

  @Test
  void connectionSqlStatesAreTransient() {
    assertTrue(db.test(new SQLException("lost", "08006")));
    assertTrue(db.test(new SQLException("admin shutdown", "57P01")));
    assertTrue(db.test(new SQLTransientConnectionException("timeout")));
  }

  @Test
  void constraintViolationIsNotTransient() {
    assertFalse(db.test(new SQLException("duplicate key", "23505")));
    assertFalse(db.test(new IllegalArgumentException("bad input")));
  }

  @Test
  void wrappedCausesAreFound() {
    RuntimeException wrapped = new RuntimeException("store failed",
        new SQLException("Connection terminated unexpectedly"));
    assertTrue(db.test(wrapped));
    assertTrue(db.test(new RuntimeException(new ConnectException("refused"))));
  }

  @Test
  void storageRetriesServerErrorsAndThrottling() {
    assertTrue(storage.test(new StorageException("unavailable", 503, null)));
    assertTrue(storage.test(new StorageException("slow down", 429, null)));
    assertFalse(storage.test(new StorageException("not found", 404, null)));
    assertFalse(storage.test(new StorageException("unknown")));
  }

  @Test
  void storageRetriesNetworkFailures() {
    assertTrue(storage.test(new StorageException("upload failed", new ConnectException("refused"))));
    assertTrue(storage.test(new RuntimeException("socket hang up")));
  }

  @Test
  void alwaysAndNever() {
    assertTrue(RetryPredicates.always().test(new Error()));
    assertFalse(RetryPredicates.never().test(new RuntimeException()));
  }
}
