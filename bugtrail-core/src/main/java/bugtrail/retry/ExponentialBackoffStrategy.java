package bugtrail.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with proportional jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * 2^(attempt-1) * (1 + jitterFactor * random()), maxDelay)}
 * where {@code random()} is uniform in [0, 1). A jitter factor of {@code 0} yields a
 * deterministic curve.
 */
public final class ExponentialBackoffStrategy implements BackoffStrategy {
  public static final double DEFAULT_JITTER_FACTOR = 0.5;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitterFactor;
  private final DoubleSupplier random;

  public ExponentialBackoffStrategy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_JITTER_FACTOR);
  }

  public ExponentialBackoffStrategy(long baseDelayMs, long maxDelayMs, double jitterFactor) {
    this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param baseDelayMs  delay after the first failed attempt (milliseconds)
   * @param maxDelayMs   upper bound for any computed delay (milliseconds)
   * @param jitterFactor fraction of the exponential delay added at random, &ge; 0
   * @param random       source of values in [0, 1)
   */
  public ExponentialBackoffStrategy(long baseDelayMs, long maxDelayMs, double jitterFactor,
      DoubleSupplier random) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitterFactor < 0 || Double.isNaN(jitterFactor)) {
      throw new IllegalArgumentException("jitterFactor must be >= 0, got: " + jitterFactor);
    }
    if (random == null) {
      throw new NullPointerException("random");
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterFactor = jitterFactor;
    this.random = random;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (attempt >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      // Cap before multiplying so the product cannot overflow
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    if (expDelay >= maxDelayMs) {
      return maxDelayMs;
    }
    double jittered = expDelay * (1.0 + jitterFactor * random.getAsDouble());
    return Math.min(maxDelayMs, Math.max(0L, (long) jittered));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitterFactor() {
    return jitterFactor;
  }
}
