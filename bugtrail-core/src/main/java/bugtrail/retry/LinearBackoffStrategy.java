package bugtrail.retry;

/**
 * Linear backoff: {@code min(baseDelay * attempt, maxDelay)}.
 */
public final class LinearBackoffStrategy implements BackoffStrategy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public LinearBackoffStrategy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    if (baseDelayMs != 0 && attempt > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * attempt);
  }
}
