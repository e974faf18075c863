package bugtrail.retention;

/**
 * Settings for one retention sweep.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class RetentionOptions {
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final int MAX_BATCH_SIZE = 1000;
  public static final double DEFAULT_MAX_ERROR_RATE = 5.0;
  public static final long DEFAULT_DELAY_MS = 100;

  private final boolean dryRun;
  private final int batchSize;
  private final double maxErrorRate;
  private final long delayMs;

  private RetentionOptions(Builder builder) {
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.maxErrorRate < 0 || builder.maxErrorRate > 100) {
      throw new IllegalArgumentException("maxErrorRate must be between 0 and 100");
    }
    if (builder.delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0");
    }
    this.dryRun = builder.dryRun;
    this.batchSize = Math.min(builder.batchSize, MAX_BATCH_SIZE);
    this.maxErrorRate = builder.maxErrorRate;
    this.delayMs = builder.delayMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static RetentionOptions defaults() {
    return builder().build();
  }

  public boolean dryRun() {
    return dryRun;
  }

  public int batchSize() {
    return batchSize;
  }

  /**
   * Error percentage above which a sweep is aborted.
   */
  public double maxErrorRate() {
    return maxErrorRate;
  }

  public long delayMs() {
    return delayMs;
  }

  /** Builder for {@link RetentionOptions}. */
  public static final class Builder {
    private boolean dryRun;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private double maxErrorRate = DEFAULT_MAX_ERROR_RATE;
    private long delayMs = DEFAULT_DELAY_MS;

    private Builder() {}

    /**
     * Counts eligible reports without deleting, archiving or auditing.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    /**
     * Sets the number of reports handled per storage/soft-delete batch.
     *
     * <p>Optional. Defaults to {@code 100}. Values above {@code 1000} are clamped.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the error percentage that aborts the sweep once more than ten reports and
     * errors have been counted.
     *
     * <p>Optional. Defaults to {@code 5}.
     */
    public Builder maxErrorRate(double maxErrorRate) {
      this.maxErrorRate = maxErrorRate;
      return this;
    }

    /**
     * Sets the pause between projects.
     *
     * <p>Optional. Defaults to {@code 100} ms.
     */
    public Builder delayMs(long delayMs) {
      this.delayMs = delayMs;
      return this;
    }

    public RetentionOptions build() {
      return new RetentionOptions(this);
    }
  }
}
