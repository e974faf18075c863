package bugtrail.retry;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable settings for {@link RetryExecutor}.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class RetryConfig {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_BASE_DELAY_MS = 1000;
  public static final long DEFAULT_MAX_DELAY_MS = 30_000;

  private final int maxAttempts;
  private final BackoffStrategy backoff;
  private final Predicate<Throwable> retryable;
  private final RetryListener listener;
  private final Sleeper sleeper;

  private RetryConfig(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.backoff = builder.backoff != null
        ? builder.backoff
        : builder.backoffType.create(builder.baseDelayMs, builder.maxDelayMs,
            ExponentialBackoffStrategy.DEFAULT_JITTER_FACTOR);
    this.retryable = Objects.requireNonNull(builder.retryable, "retryable");
    this.listener = builder.listener;
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Three attempts, exponential backoff from 1s capped at 30s, every error retryable.
   */
  public static RetryConfig defaults() {
    return builder().build();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public BackoffStrategy backoff() {
    return backoff;
  }

  public Predicate<Throwable> retryable() {
    return retryable;
  }

  public RetryListener listener() {
    return listener;
  }

  public Sleeper sleeper() {
    return sleeper;
  }

  /** Builder for {@link RetryConfig}. */
  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
    private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
    private BackoffType backoffType = BackoffType.EXPONENTIAL;
    private BackoffStrategy backoff;
    private Predicate<Throwable> retryable = RetryPredicates.always();
    private RetryListener listener;
    private Sleeper sleeper = Sleeper.THREAD_SLEEP;

    private Builder() {}

    /**
     * Sets the total number of attempts, including the first one.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the base delay used by the named backoff type.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Ignored when {@link #backoff(BackoffStrategy)} is set.
     */
    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    /**
     * Sets the delay cap used by the named backoff type.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Ignored when {@link #backoff(BackoffStrategy)} is set.
     */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /**
     * Selects a named backoff curve.
     *
     * <p>Optional. Defaults to {@link BackoffType#EXPONENTIAL}.
     */
    public Builder backoffType(BackoffType backoffType) {
      this.backoffType = Objects.requireNonNull(backoffType, "backoffType");
      return this;
    }

    /**
     * Sets an explicit backoff strategy, overriding the named type and delays.
     */
    public Builder backoff(BackoffStrategy backoff) {
      this.backoff = backoff;
      return this;
    }

    /**
     * Sets the predicate deciding whether a failure may be retried.
     *
     * <p>Optional. Defaults to {@link RetryPredicates#always()}.
     */
    public Builder retryable(Predicate<Throwable> retryable) {
      this.retryable = retryable;
      return this;
    }

    /**
     * Sets a callback invoked before each backoff sleep.
     *
     * <p>Optional.
     */
    public Builder listener(RetryListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Replaces the blocking sleep between attempts.
     *
     * <p>Optional. Defaults to {@link Thread#sleep(long)}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code maxAttempts < 1} or the delays are invalid
     * @throws NullPointerException     if the predicate or sleeper is null
     */
    public RetryConfig build() {
      return new RetryConfig(this);
    }
  }
}
