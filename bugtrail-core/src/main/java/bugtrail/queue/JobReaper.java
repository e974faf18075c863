package bugtrail.queue;

import bugtrail.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that removes finished jobs via {@link JobQueue#reapFinished()}.
 *
 * <p>Retention age and keep counts come from the queue's {@link QueueSettings}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JobReaper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobReaper.class.getName());

  private final JobQueue jobQueue;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reapTask;
  private volatile boolean closed;

  private JobReaper(Builder builder) {
    this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules {@link #runOnce()} every {@code intervalSeconds}, first after one interval.
   * Calling it again while started has no effect.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobReaper has been closed");
    }
    if (reapTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bugtrail-reaper-"));
    reapTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Reaps every queue once. Skipped once the reaper is closed or the queue has been shut
   * down, since finished jobs may still be written during the queue's drain.
   *
   * @return number of jobs deleted across all queues
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    if (jobQueue.isShutdown()) {
      logger.fine("Job queue is shut down; skipping reap cycle");
      return 0;
    }
    try {
      int deleted = jobQueue.reapFinished();
      if (deleted > 0) {
        logger.log(Level.INFO, "Reaped {0} finished jobs", deleted);
      }
      return deleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reap cycle failed", t);
      return 0;
    }
  }

  /** Cancels the reap schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reapTask != null) {
      reapTask.cancel(false);
      reapTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link JobReaper}. */
  public static final class Builder {
    private JobQueue jobQueue;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param jobQueue the queue whose finished jobs are reaped
     * @return this builder
     */
    public Builder jobQueue(JobQueue jobQueue) {
      this.jobQueue = jobQueue;
      return this;
    }

    /**
     * Sets the interval in seconds between reap cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds reap interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public JobReaper build() {
      return new JobReaper(this);
    }
  }
}
