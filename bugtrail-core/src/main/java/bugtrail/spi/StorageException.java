package bugtrail.spi;

/**
 * Unchecked exception raised by {@link StorageService} implementations.
 *
 * <p>{@link #statusCode()} carries the backend's HTTP-style status when known, so retry
 * predicates can tell throttling and server errors from permanent failures.
 */
public class StorageException extends RuntimeException {
  public static final int UNKNOWN_STATUS = -1;

  private final int statusCode;

  public StorageException(String message) {
    this(message, UNKNOWN_STATUS, null);
  }

  public StorageException(String message, Throwable cause) {
    this(message, UNKNOWN_STATUS, cause);
  }

  public StorageException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }

  /**
   * Returns {@code true} for server-side (5xx) and throttling (429) statuses.
   */
  public boolean isRetryableStatus() {
    return statusCode >= 500 || statusCode == 429;
  }
}
