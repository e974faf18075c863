package bugtrail.retention;

import bugtrail.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link RetentionService#applyRetentionPolicies(RetentionOptions)} once a day.
 *
 * <p>At most one sweep runs at a time: a scheduled or manual run that finds another one
 * active is skipped. Each outcome is handed to the {@link RetentionNotifier}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetentionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionScheduler.class.getName());

  private final RetentionService retentionService;
  private final RetentionOptions options;
  private final LocalTime runTime;
  private final ZoneId zone;
  private final RetentionNotifier notifier;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> nextRun;
  private volatile Instant nextRunAt;
  private volatile boolean closed;

  private RetentionScheduler(Builder builder) {
    this.retentionService = Objects.requireNonNull(builder.retentionService, "retentionService");
    this.options = builder.options != null ? builder.options : RetentionOptions.defaults();
    this.runTime = Objects.requireNonNull(builder.runTime, "runTime");
    this.zone = Objects.requireNonNull(builder.zone, "zone");
    this.notifier = builder.notifier != null ? builder.notifier : new LoggingRetentionNotifier();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules the daily sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionScheduler has been closed");
    }
    if (scheduler != null) {
      logger.log(Level.WARNING, "RetentionScheduler already started");
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bugtrail-retention-"));
    scheduleNext();
    logger.log(Level.INFO, "Retention scheduler started, daily at {0} {1}, next run {2}",
        new Object[]{runTime, zone, nextRunAt});
  }

  private synchronized void scheduleNext() {
    if (closed || scheduler == null) {
      return;
    }
    Instant now = clock.instant();
    Instant next = computeNextRun(now);
    long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
    nextRunAt = next;
    nextRun = scheduler.schedule(this::runScheduled, delayMs, TimeUnit.MILLISECONDS);
  }

  private void runScheduled() {
    try {
      runOnce();
    } finally {
      scheduleNext();
    }
  }

  /**
   * Executes one sweep in the calling thread. May be invoked directly for testing.
   *
   * @return the sweep result, or {@code null} when skipped or failed
   */
  public RetentionResult runOnce() {
    if (closed) {
      return null;
    }
    if (!running.compareAndSet(false, true)) {
      logger.log(Level.WARNING, "Retention sweep already running, skipping this execution");
      return null;
    }
    long start = System.nanoTime();
    try {
      RetentionResult result = retentionService.applyRetentionPolicies(options);
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      notifyCompleted(result, durationMs);
      return result;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retention sweep failed", t);
      notifyFailed(t);
      return null;
    } finally {
      running.set(false);
    }
  }

  /**
   * Runs a sweep now in the calling thread.
   *
   * @return false if a sweep was already running
   */
  public boolean triggerManual() {
    if (running.get()) {
      logger.log(Level.WARNING, "Cannot trigger manual retention sweep, one is already running");
      return false;
    }
    logger.log(Level.INFO, "Manually triggered retention sweep");
    runOnce();
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Time of the next scheduled sweep, or {@code null} when not started.
   */
  public Instant nextRunTime() {
    return scheduler == null || closed ? null : nextRunAt;
  }

  /**
   * Next occurrence of the run time strictly after {@code now}.
   */
  Instant computeNextRun(Instant now) {
    ZonedDateTime local = now.atZone(zone);
    ZonedDateTime candidate = local.toLocalDate().atTime(runTime).atZone(zone);
    if (!candidate.isAfter(local)) {
      candidate = local.toLocalDate().plusDays(1).atTime(runTime).atZone(zone);
    }
    return candidate.toInstant();
  }

  private void notifyCompleted(RetentionResult result, long durationMs) {
    try {
      notifier.onCompleted(result, durationMs);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Retention notifier failed", e);
    }
  }

  private void notifyFailed(Throwable error) {
    try {
      notifier.onFailed(error);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Retention notifier failed", e);
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. A running sweep finishes. */
  @Override
  public synchronized void close() {
    closed = true;
    if (nextRun != null) {
      nextRun.cancel(false);
      nextRun = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionScheduler}. */
  public static final class Builder {
    private RetentionService retentionService;
    private RetentionOptions options;
    private LocalTime runTime = LocalTime.of(2, 0);
    private ZoneId zone = ZoneOffset.UTC;
    private RetentionNotifier notifier;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder retentionService(RetentionService retentionService) {
      this.retentionService = retentionService;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link RetentionOptions#defaults()}.
     */
    public Builder options(RetentionOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Sets the daily run time.
     *
     * <p>Optional. Defaults to {@code 02:00}.
     */
    public Builder runTime(LocalTime runTime) {
      this.runTime = runTime;
      return this;
    }

    /**
     * Sets the time zone of the run time.
     *
     * <p>Optional. Defaults to UTC.
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link LoggingRetentionNotifier}.
     */
    public Builder notifier(RetentionNotifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RetentionScheduler build() {
      return new RetentionScheduler(this);
    }
  }
}
