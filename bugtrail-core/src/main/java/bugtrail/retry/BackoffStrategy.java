package bugtrail.retry;

/**
 * Maps a retry attempt number to the delay before the next attempt.
 *
 * @see ExponentialBackoffStrategy
 * @see LinearBackoffStrategy
 * @see FixedBackoffStrategy
 */
@FunctionalInterface
public interface BackoffStrategy {

  /**
   * Computes the delay before the retry that follows the given failed attempt.
   *
   * @param attempt the 1-based number of the attempt that just failed
   * @return delay in milliseconds (never negative)
   */
  long computeDelayMs(int attempt);
}
