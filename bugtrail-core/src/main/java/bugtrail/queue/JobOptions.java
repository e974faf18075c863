package bugtrail.queue;

/**
 * Per-job enqueue options. Unset values fall back to the queue's {@link QueueSettings}.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class JobOptions {
  private static final JobOptions DEFAULTS = builder().build();

  private final int priority;
  private final long delayMs;
  private final Integer attempts;
  private final Backoff backoff;
  private final boolean removeOnComplete;
  private final boolean removeOnFail;
  private final String jobId;

  private JobOptions(Builder builder) {
    if (builder.priority < 0) {
      throw new IllegalArgumentException("priority must be >= 0");
    }
    if (builder.delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0");
    }
    if (builder.attempts != null && builder.attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
    if (builder.jobId != null && builder.jobId.isBlank()) {
      throw new IllegalArgumentException("jobId must not be blank");
    }
    this.priority = builder.priority;
    this.delayMs = builder.delayMs;
    this.attempts = builder.attempts;
    this.backoff = builder.backoff;
    this.removeOnComplete = builder.removeOnComplete;
    this.removeOnFail = builder.removeOnFail;
    this.jobId = builder.jobId;
  }

  public static JobOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int priority() {
    return priority;
  }

  public long delayMs() {
    return delayMs;
  }

  /**
   * Total attempts, or {@code null} to use the queue default.
   */
  public Integer attempts() {
    return attempts;
  }

  /**
   * Backoff curve, or {@code null} to use the queue default.
   */
  public Backoff backoff() {
    return backoff;
  }

  public boolean removeOnComplete() {
    return removeOnComplete;
  }

  public boolean removeOnFail() {
    return removeOnFail;
  }

  /**
   * Caller-chosen job id, or {@code null} to generate one.
   */
  public String jobId() {
    return jobId;
  }

  /** Builder for {@link JobOptions}. */
  public static final class Builder {
    private int priority;
    private long delayMs;
    private Integer attempts;
    private Backoff backoff;
    private boolean removeOnComplete;
    private boolean removeOnFail;
    private String jobId;

    private Builder() {}

    /**
     * Sets the job priority. {@code 0} means no priority; otherwise lower values are
     * dispatched first.
     *
     * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
     */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Delays the first dispatch.
     *
     * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
     */
    public Builder delayMs(long delayMs) {
      this.delayMs = delayMs;
      return this;
    }

    /**
     * Sets the total number of attempts.
     *
     * <p>Optional. Defaults to {@link QueueSettings#maxRetries()}. Must be &ge; 1.
     */
    public Builder attempts(int attempts) {
      this.attempts = attempts;
      return this;
    }

    /**
     * <p>Optional. Defaults to exponential with {@link QueueSettings#backoffDelayMs()}.
     */
    public Builder backoff(Backoff backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder removeOnComplete(boolean removeOnComplete) {
      this.removeOnComplete = removeOnComplete;
      return this;
    }

    public Builder removeOnFail(boolean removeOnFail) {
      this.removeOnFail = removeOnFail;
      return this;
    }

    /**
     * Uses a caller-chosen job id. A job with this id that already exists is not enqueued
     * again.
     */
    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    public JobOptions build() {
      return new JobOptions(this);
    }
  }
}
