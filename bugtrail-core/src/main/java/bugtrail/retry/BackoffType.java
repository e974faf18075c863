package bugtrail.retry;

import java.util.Locale;

/**
 * Named backoff strategies, used where a strategy is chosen by configuration.
 */
public enum BackoffType {
  FIXED,
  LINEAR,
  EXPONENTIAL;

  /**
   * Creates a strategy of this type.
   *
   * @param baseDelayMs  base delay in milliseconds
   * @param maxDelayMs   cap for linear and exponential delays
   * @param jitterFactor jitter for exponential delays, ignored otherwise
   */
  public BackoffStrategy create(long baseDelayMs, long maxDelayMs, double jitterFactor) {
    return switch (this) {
      case FIXED -> new FixedBackoffStrategy(baseDelayMs);
      case LINEAR -> new LinearBackoffStrategy(baseDelayMs, maxDelayMs);
      case EXPONENTIAL -> new ExponentialBackoffStrategy(baseDelayMs, maxDelayMs, jitterFactor);
    };
  }

  /**
   * Parses a case-insensitive type name such as {@code "exponential"}.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static BackoffType fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Backoff type must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown backoff type: " + value, e);
    }
  }
}
