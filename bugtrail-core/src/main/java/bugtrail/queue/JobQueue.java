package bugtrail.queue;

import bugtrail.model.JobRecord;
import bugtrail.model.JobState;
import bugtrail.spi.ConnectionProvider;
import bugtrail.spi.JobStore;
import bugtrail.spi.MetricsExporter;
import bugtrail.util.JsonCodec;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable job queues backed by a relational job table.
 *
 * <p>Producers call {@link #addJob}; workers claim jobs with {@link #claimJobs} and report
 * outcomes with {@link #completeJob}, {@link #failJob} and {@link #updateProgress}. This
 * class is the only writer of job rows.
 *
 * <p>A claimed job holds a lock for {@link QueueSettings#jobTimeoutMs()}. If its worker
 * dies, the job becomes claimable again once the lock expires.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see JobQueue.Builder
 * @see JobReaper
 */
public final class JobQueue {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  private static final long IDLE_CHECK_INTERVAL_MS = 50;
  private static final int REAP_BATCH_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final QueueSettings settings;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final long shutdownTimeoutMs;

  private final Map<String, String> inFlight = new ConcurrentHashMap<>();
  private final AtomicBoolean shutdownStarted = new AtomicBoolean();
  private volatile boolean accepting = true;

  private JobQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    if (builder.shutdownTimeoutMs < 0) {
      throw new IllegalArgumentException("shutdownTimeoutMs must be >= 0");
    }
    this.settings = builder.settings != null ? builder.settings : QueueSettings.defaults();
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public QueueSettings settings() {
    return settings;
  }

  public JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Verifies that the job store is reachable.
   *
   * @throws JobQueueException if no valid connection can be obtained
   */
  public void initialize() {
    try (Connection conn = connectionProvider.getConnection()) {
      if (!conn.isValid(5)) {
        throw new JobQueueException("Job store connection is not valid", null);
      }
    } catch (SQLException e) {
      throw new JobQueueException("Failed to connect to job store", e);
    }
    logger.log(Level.INFO, "Job queue initialized with queues {0}", List.of(QueueName.values()));
  }

  /**
   * Pings the job store.
   *
   * @return {@code true} if a valid connection could be obtained
   */
  public boolean healthCheck() {
    try (Connection conn = connectionProvider.getConnection()) {
      return conn.isValid(5);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Job queue health check failed", e);
      return false;
    }
  }

  /**
   * Enqueues a job.
   *
   * @param queueName queue to add to, e.g. {@code "screenshots"}
   * @param jobName   job name
   * @param payload   payload, serialized with the {@link JsonCodec}
   * @param options   enqueue options, or {@code null} for defaults
   * @return the job id; for a caller-chosen id that already exists, that id
   * @throws IllegalArgumentException if the queue does not exist
   * @throws IllegalStateException    after {@link #shutdown()}
   * @throws JobQueueException        if the job store fails
   */
  public String addJob(String queueName, String jobName, Object payload, JobOptions options) {
    QueueName queue = QueueName.of(queueName);
    Objects.requireNonNull(jobName, "jobName");
    if (!accepting) {
      throw new IllegalStateException("JobQueue has been shut down");
    }
    JobOptions opts = options != null ? options : JobOptions.defaults();
    String jobId = opts.jobId() != null ? opts.jobId() : queue.jobIdPrefix() + UUID.randomUUID();
    Backoff backoff = opts.backoff() != null
        ? opts.backoff() : Backoff.exponential(settings.backoffDelayMs());
    int attempts = opts.attempts() != null ? opts.attempts() : settings.defaultAttempts();

    Instant now = Instant.now();
    JobState state;
    if (opts.delayMs() > 0) {
      state = JobState.DELAYED;
    } else if (opts.priority() > 0) {
      state = JobState.PRIORITIZED;
    } else {
      state = JobState.WAITING;
    }
    JobRecord job = new JobRecord(jobId, queue.value(), jobName, jsonCodec.toJson(payload), state,
        opts.priority(), 0, attempts, backoff.type(), backoff.delayMs(),
        opts.removeOnComplete(), opts.removeOnFail(), null, null, null, null,
        now, now.plusMillis(opts.delayMs()), null, null);

    boolean inserted = inConnection("add job to " + queueName, conn -> jobStore.insert(conn, job));
    if (inserted) {
      metrics.incrementJobEnqueued(queue.value());
      logger.log(Level.FINE, "Job {0} added to queue {1}", new Object[]{jobId, queueName});
    } else {
      logger.log(Level.FINE, "Job {0} already exists in queue {1}", new Object[]{jobId, queueName});
    }
    return jobId;
  }

  /**
   * Returns the status of a job, or {@code null} if the queue has no such job.
   *
   * @throws IllegalArgumentException if the queue does not exist
   */
  public JobStatus getJobStatus(String queueName, String jobId) {
    QueueName queue = QueueName.of(queueName);
    JobRecord job = inConnection("load job " + jobId, conn -> jobStore.findById(conn, queue.value(), jobId));
    if (job == null) {
      return null;
    }
    JobState state = job.state();
    if ((state == JobState.WAITING || state == JobState.PRIORITIZED)
        && job.availableAt() != null && job.availableAt().isAfter(Instant.now())) {
      state = JobState.DELAYED;
    }
    return new JobStatus(job.jobId(), job.name(), job.payloadJson(), job.progressJson(),
        job.resultJson(), job.failedReason(), job.stacktrace(), job.attemptsMade(),
        job.createdAt(), job.processedOn(), job.finishedOn(), state);
  }

  /**
   * Returns job counts for a queue.
   *
   * @throws IllegalArgumentException if the queue does not exist
   */
  public QueueMetrics getQueueMetrics(String queueName) {
    QueueName queue = QueueName.of(queueName);
    return inConnection("read metrics of " + queueName, conn -> {
      Map<JobState, Long> counts = jobStore.countByState(conn, queue.value());
      return new QueueMetrics(
          count(counts, JobState.WAITING) + count(counts, JobState.PRIORITIZED),
          count(counts, JobState.ACTIVE),
          count(counts, JobState.COMPLETED),
          count(counts, JobState.FAILED),
          count(counts, JobState.DELAYED),
          jobStore.isPaused(conn, queue.value()));
    });
  }

  private static long count(Map<JobState, Long> counts, JobState state) {
    Long value = counts.get(state);
    return value == null ? 0L : value;
  }

  /**
   * Stops handing out jobs of a queue. Queued jobs are kept.
   */
  public void pauseQueue(String queueName) {
    QueueName queue = QueueName.of(queueName);
    inConnection("pause " + queueName, conn -> {
      jobStore.setPaused(conn, queue.value(), true);
      return null;
    });
    logger.log(Level.INFO, "Queue {0} paused", queueName);
  }

  public void resumeQueue(String queueName) {
    QueueName queue = QueueName.of(queueName);
    inConnection("resume " + queueName, conn -> {
      jobStore.setPaused(conn, queue.value(), false);
      return null;
    });
    logger.log(Level.INFO, "Queue {0} resumed", queueName);
  }

  public boolean isPaused(String queueName) {
    QueueName queue = QueueName.of(queueName);
    return inConnection("read pause flag of " + queueName, conn -> jobStore.isPaused(conn, queue.value()));
  }

  /**
   * Claims up to {@code limit} jobs for a worker. Returns an empty list when the queue is
   * paused, after shutdown, or when the store cannot be reached.
   */
  public List<JobRecord> claimJobs(String queueName, String ownerId, int limit) {
    QueueName queue = QueueName.of(queueName);
    Objects.requireNonNull(ownerId, "ownerId");
    if (!accepting || limit <= 0) {
      return List.of();
    }
    Instant now = Instant.now();
    Instant lockExpiry = now.minusMillis(settings.jobTimeoutMs());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (jobStore.isPaused(conn, queue.value())) {
        return List.of();
      }
      // Claim (UPDATE then SELECT) must run in a single transaction
      conn.setAutoCommit(false);
      List<JobRecord> claimed;
      try {
        claimed = jobStore.claim(conn, queue.value(), ownerId, now, lockExpiry, limit);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
      for (JobRecord job : claimed) {
        inFlight.put(key(job), ownerId);
      }
      return claimed;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim jobs from queue " + queueName, e);
      return List.of();
    }
  }

  /**
   * Marks a claimed job COMPLETED and stores its result.
   *
   * @return {@code false} if the job's lock was lost or the store failed
   */
  public boolean completeJob(JobRecord job, Object result) {
    String owner = inFlight.get(key(job));
    if (owner == null) {
      logger.log(Level.WARNING, "Job {0} is not claimed by this queue; completion ignored", job.jobId());
      return false;
    }
    try {
      String resultJson = jsonCodec.toJson(result);
      Boolean updated = withConnection("mark COMPLETED", job.jobId(), conn -> {
        int rows = jobStore.markCompleted(conn, job.queueName(), job.jobId(), owner, resultJson, Instant.now());
        if (rows > 0 && job.removeOnComplete()) {
          jobStore.delete(conn, job.queueName(), job.jobId());
        }
        return rows > 0;
      });
      if (Boolean.TRUE.equals(updated)) {
        metrics.incrementJobCompleted(job.queueName());
        return true;
      }
      if (updated != null) {
        logger.log(Level.WARNING, "Lost lock on job {0} before completion", job.jobId());
      }
      return false;
    } finally {
      inFlight.remove(key(job));
    }
  }

  /**
   * Records a failed attempt. The job is re-queued as DELAYED with backoff while attempts
   * remain, otherwise it is marked FAILED.
   *
   * @return the job's new state, or {@link JobState#UNKNOWN} if the lock was lost or the
   *     store failed
   */
  public JobState failJob(JobRecord job, Throwable error) {
    String owner = inFlight.get(key(job));
    if (owner == null) {
      logger.log(Level.WARNING, "Job {0} is not claimed by this queue; failure ignored", job.jobId());
      return JobState.UNKNOWN;
    }
    try {
      int attemptsMade = job.attemptsMade() + 1;
      String message = messageOf(error);
      String stacktrace = stackTraceOf(error);
      Instant now = Instant.now();
      boolean retry = attemptsMade < job.maxAttempts();
      Boolean updated = withConnection(retry ? "mark DELAYED" : "mark FAILED", job.jobId(), conn -> {
        if (retry) {
          long delayMs = new Backoff(job.backoffType(), job.backoffDelayMs()).delayFor(attemptsMade);
          return jobStore.markRetry(conn, job.queueName(), job.jobId(), owner, attemptsMade,
              now.plusMillis(delayMs), message, stacktrace) > 0;
        }
        int rows = jobStore.markFailed(conn, job.queueName(), job.jobId(), owner, attemptsMade,
            message, stacktrace, now);
        if (rows > 0 && job.removeOnFail()) {
          jobStore.delete(conn, job.queueName(), job.jobId());
        }
        return rows > 0;
      });
      if (!Boolean.TRUE.equals(updated)) {
        if (updated != null) {
          logger.log(Level.WARNING, "Lost lock on job {0} before recording failure", job.jobId());
        }
        return JobState.UNKNOWN;
      }
      if (retry) {
        metrics.incrementJobRetried(job.queueName());
        return JobState.DELAYED;
      }
      metrics.incrementJobFailed(job.queueName());
      logger.log(Level.WARNING, "Job {0} in queue {1} failed after {2} attempts: {3}",
          new Object[]{job.jobId(), job.queueName(), attemptsMade, message});
      return JobState.FAILED;
    } finally {
      inFlight.remove(key(job));
    }
  }

  /**
   * Stores progress of a claimed job. Failures are logged, not thrown.
   */
  public void updateProgress(JobRecord job, Object progress) {
    String progressJson = jsonCodec.toJson(progress);
    withConnection("update progress", job.jobId(),
        conn -> jobStore.updateProgress(conn, job.queueName(), job.jobId(), progressJson));
  }

  /**
   * Deletes finished jobs older than the retention period and beyond the per-queue keep
   * counts. Failures of one queue do not stop the others.
   *
   * @return number of jobs deleted
   */
  public int reapFinished() {
    Instant cutoff = Instant.now().minus(settings.retention());
    int total = 0;
    for (QueueName queue : QueueName.values()) {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        total += reap(conn, queue.value(), JobState.COMPLETED, cutoff, settings.completedKeep());
        total += reap(conn, queue.value(), JobState.FAILED, cutoff, settings.failedKeep());
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to reap finished jobs of queue " + queue, e);
      }
    }
    return total;
  }

  private int reap(Connection conn, String queueName, JobState state, Instant cutoff, int keep) {
    int total = 0;
    int deleted;
    do {
      deleted = jobStore.purgeFinishedBefore(conn, queueName, state, cutoff, REAP_BATCH_SIZE);
      total += deleted;
    } while (deleted >= REAP_BATCH_SIZE);
    return total + jobStore.trimFinished(conn, queueName, state, keep);
  }

  /**
   * Number of jobs claimed through this instance whose outcome has not been reported yet.
   */
  public int inFlightCount() {
    return inFlight.size();
  }

  public boolean isShutdown() {
    return shutdownStarted.get();
  }

  /**
   * Stops handing out and accepting jobs, then waits up to the shutdown timeout for
   * in-flight jobs to report their outcome. Jobs still running afterwards keep their lock
   * and are re-delivered once it expires.
   *
   * <p>Only the first call does any work; later calls log a warning and return.
   */
  public void shutdown() {
    if (!shutdownStarted.compareAndSet(false, true)) {
      logger.warning("JobQueue shutdown already in progress or completed");
      return;
    }
    accepting = false;
    long deadline = System.currentTimeMillis() + shutdownTimeoutMs;
    try {
      while (!inFlight.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(IDLE_CHECK_INTERVAL_MS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (!inFlight.isEmpty()) {
      logger.log(Level.WARNING, "Shutdown timeout exceeded with {0} jobs in flight; "
          + "they will be re-delivered after their lock expires", inFlight.size());
    }
    logger.info("Job queue shut down");
  }

  private static String key(JobRecord job) {
    return job.queueName() + ':' + job.jobId();
  }

  private static String messageOf(Throwable error) {
    if (error == null) {
      return null;
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
  }

  private static String stackTraceOf(Throwable error) {
    if (error == null) {
      return null;
    }
    StringWriter out = new StringWriter();
    error.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  private <T> T inConnection(String action, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw new JobQueueException("Failed to " + action, e);
    }
  }

  /**
   * Runs a store update, logging instead of throwing. Returns {@code null} on failure.
   */
  private <T> T withConnection(String action, String jobId, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobId=" + jobId, e);
      return null;
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Builder for {@link JobQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private QueueSettings settings;
    private JsonCodec jsonCodec;
    private MetricsExporter metrics;
    private long shutdownTimeoutMs = 30_000;

    private Builder() {}

    /**
     * Sets the connection provider for the job table.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the job store implementation.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the persistence backend
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link QueueSettings#defaults()}.
     *
     * @param settings queue defaults and housekeeping limits
     * @return this builder
     */
    public Builder settings(QueueSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the codec used for payloads, results and progress.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the JSON codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link JobQueue#shutdown()} waits for in-flight jobs.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
     *
     * @param shutdownTimeoutMs wait in milliseconds
     * @return this builder
     */
    public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
      this.shutdownTimeoutMs = shutdownTimeoutMs;
      return this;
    }

    /**
     * @return a new {@link JobQueue}
     * @throws NullPointerException     if {@code connectionProvider} or {@code jobStore} is null
     * @throws IllegalArgumentException if {@code shutdownTimeoutMs < 0}
     */
    public JobQueue build() {
      return new JobQueue(this);
    }
  }
}
