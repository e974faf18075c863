package bugtrail.retry;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an operation until it succeeds, its attempts are exhausted, or it fails with an
 * error the configured predicate does not consider retryable.
 *
 * <p>The last error is rethrown unchanged, so callers see the same exception type they
 * would without retries. Backoff delays block the calling thread via the configured
 * {@link Sleeper}.
 *
 * <pre>{@code
 * var retry = new RetryExecutor(RetryConfig.builder()
 *     .maxAttempts(5)
 *     .retryable(RetryPredicates.storageError())
 *     .build());
 * StoredObject stored = retry.execute(() -> storage.upload(key, bytes, "image/jpeg"));
 * }</pre>
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final RetryConfig config;

  public RetryExecutor(RetryConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Convenience form of {@code new RetryExecutor(config).execute(operation)}.
   */
  public static <T, E extends Exception> T executeWithRetry(RetryableOperation<T, E> operation,
      RetryConfig config) throws E {
    return new RetryExecutor(config).execute(operation);
  }

  public RetryConfig config() {
    return config;
  }

  /**
   * Executes the operation with retries.
   *
   * @return the first successful result
   * @throws E the error of the last attempt, or of the first non-retryable attempt
   */
  public <T, E extends Exception> T execute(RetryableOperation<T, E> operation) throws E {
    Objects.requireNonNull(operation, "operation");
    int attempt = 1;
    while (true) {
      try {
        return operation.execute();
      } catch (Exception e) {
        if (attempt >= config.maxAttempts()) {
          throw RetryExecutor.<E>rethrow(e);
        }
        if (!config.retryable().test(e)) {
          throw RetryExecutor.<E>rethrow(e);
        }
        long delayMs = config.backoff().computeDelayMs(attempt);
        logger.log(Level.WARNING, "Operation failed, retrying (attempt {0}/{1}) in {2} ms: {3}",
            new Object[]{attempt, config.maxAttempts(), delayMs, e.getMessage()});
        notifyListener(e, attempt, delayMs);
        try {
          config.sleeper().sleep(delayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw RetryExecutor.<E>rethrow(e);
        }
        attempt++;
      }
    }
  }

  private void notifyListener(Exception error, int attempt, long delayMs) {
    RetryListener listener = config.listener();
    if (listener == null) {
      return;
    }
    try {
      listener.onRetry(error, attempt, delayMs);
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "Retry listener failed", ex);
    }
  }

  // The operation declares E; any checked exception it throws is an E.
  @SuppressWarnings("unchecked")
  private static <E extends Exception> E rethrow(Exception e) {
    return (E) e;
  }
}
