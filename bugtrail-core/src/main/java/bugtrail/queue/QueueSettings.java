package bugtrail.queue;

import java.time.Duration;

/**
 * Queue-wide defaults and housekeeping limits.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class QueueSettings {
  private final int maxRetries;
  private final long backoffDelayMs;
  private final long jobTimeoutMs;
  private final Duration retention;
  private final int completedKeep;
  private final int failedKeep;

  private QueueSettings(Builder builder) {
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.backoffDelayMs < 0) {
      throw new IllegalArgumentException("backoffDelayMs must be >= 0");
    }
    if (builder.jobTimeoutMs < 1000) {
      throw new IllegalArgumentException("jobTimeoutMs must be >= 1000");
    }
    if (builder.retention == null || builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.completedKeep < 0 || builder.failedKeep < 0) {
      throw new IllegalArgumentException("keep counts must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    this.backoffDelayMs = builder.backoffDelayMs;
    this.jobTimeoutMs = builder.jobTimeoutMs;
    this.retention = builder.retention;
    this.completedKeep = builder.completedKeep;
    this.failedKeep = builder.failedKeep;
  }

  public static QueueSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxRetries() {
    return maxRetries;
  }

  public long backoffDelayMs() {
    return backoffDelayMs;
  }

  /**
   * Maximum time a job may stay ACTIVE before its lock expires and it can be claimed again.
   */
  public long jobTimeoutMs() {
    return jobTimeoutMs;
  }

  public Duration retention() {
    return retention;
  }

  public int completedKeep() {
    return completedKeep;
  }

  public int failedKeep() {
    return failedKeep;
  }

  /**
   * Attempts given to a job that does not set its own.
   */
  int defaultAttempts() {
    return Math.max(1, maxRetries);
  }

  /** Builder for {@link QueueSettings}. */
  public static final class Builder {
    private int maxRetries = 3;
    private long backoffDelayMs = 5000;
    private long jobTimeoutMs = 300_000;
    private Duration retention = Duration.ofDays(7);
    private int completedKeep = 1000;
    private int failedKeep = 5000;

    private Builder() {}

    /**
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Base delay of the default exponential job backoff.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder backoffDelayMs(long backoffDelayMs) {
      this.backoffDelayMs = backoffDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 300000} ms (5 minutes). Must be &ge; 1000.
     */
    public Builder jobTimeoutMs(long jobTimeoutMs) {
      this.jobTimeoutMs = jobTimeoutMs;
      return this;
    }

    /**
     * How long finished jobs are kept before reaping.
     *
     * <p>Optional. Defaults to {@code 7 days}.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000} completed jobs per queue.
     */
    public Builder completedKeep(int completedKeep) {
      this.completedKeep = completedKeep;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} failed jobs per queue.
     */
    public Builder failedKeep(int failedKeep) {
      this.failedKeep = failedKeep;
      return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public QueueSettings build() {
      return new QueueSettings(this);
    }
  }
}
