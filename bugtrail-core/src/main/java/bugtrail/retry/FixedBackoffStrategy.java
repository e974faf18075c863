package bugtrail.retry;

/**
 * Constant delay between attempts.
 */
public final class FixedBackoffStrategy implements BackoffStrategy {
  private final long delayMs;

  public FixedBackoffStrategy(long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    this.delayMs = delayMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    return attempt <= 0 ? 0L : delayMs;
  }
}
