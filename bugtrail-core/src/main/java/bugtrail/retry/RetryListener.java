package bugtrail.retry;

/**
 * Callback invoked after a retryable failure, before the executor sleeps.
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * @param error   the failure of the attempt
   * @param attempt the 1-based number of the attempt that failed
   * @param delayMs the delay before the next attempt
   */
  void onRetry(Throwable error, int attempt, long delayMs);
}
