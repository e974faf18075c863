package bugtrail.queue;

import bugtrail.retry.BackoffStrategy;
import bugtrail.retry.BackoffType;

import java.time.Duration;
import java.util.Objects;

/**
 * Job-level backoff between failed attempts.
 *
 * <p>Unlike the in-process retry engine this curve carries no jitter: the delay after the
 * n-th failed attempt is {@code delay} (fixed) or {@code delay * 2^(n-1)} (exponential),
 * capped at one day.
 *
 * @param type    curve type
 * @param delayMs base delay in milliseconds, &ge; 0
 */
public record Backoff(BackoffType type, long delayMs) {
  static final long MAX_DELAY_MS = Duration.ofDays(1).toMillis();

  public Backoff {
    Objects.requireNonNull(type, "type");
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0");
    }
  }

  public static Backoff fixed(long delayMs) {
    return new Backoff(BackoffType.FIXED, delayMs);
  }

  public static Backoff exponential(long delayMs) {
    return new Backoff(BackoffType.EXPONENTIAL, delayMs);
  }

  /**
   * Delay before the next attempt after {@code attemptsMade} failed attempts.
   */
  public long delayFor(int attemptsMade) {
    BackoffStrategy strategy = type.create(delayMs, Math.max(delayMs, MAX_DELAY_MS), 0.0);
    return strategy.computeDelayMs(attemptsMade);
  }
}
