package bugtrail.worker;

import bugtrail.model.JobRecord;
import bugtrail.queue.JobQueue;
import bugtrail.queue.QueueName;
import bugtrail.spi.MetricsExporter;
import bugtrail.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes one queue with a bounded number of concurrent jobs.
 *
 * <p>A single scheduler thread polls {@link JobQueue#claimJobs} for as many jobs as there
 * are free slots and hands them to a fixed pool sized to the concurrency limit. Each job's
 * payload is decoded into {@code D}, passed to the {@link JobHandler}, and the outcome is
 * reported back to the queue and to the {@link WorkerListener}.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 *
 * @param <D> payload type
 * @param <R> result type
 */
public final class QueueWorker<D, R> implements Worker {
  private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());

  private final String name;
  private final QueueName queue;
  private final JobQueue jobQueue;
  private final Class<D> payloadType;
  private final JobHandler<D, R> handler;
  private final int concurrency;
  private final long pollIntervalMs;
  private final long drainTimeoutMs;
  private final WorkerListener listener;
  private final MetricsExporter metrics;
  private final String ownerId;
  private final Semaphore slots;

  private ScheduledExecutorService scheduler;
  private ExecutorService pool;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean paused;
  private volatile boolean closed;

  private QueueWorker(Builder<D, R> builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");
    this.payloadType = Objects.requireNonNull(builder.payloadType, "payloadType");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    if (builder.pollIntervalMs <= 0L) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0L) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.concurrency = builder.concurrency;
    this.pollIntervalMs = builder.pollIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.listener = builder.listener != null ? builder.listener : WorkerListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ownerId = name + "-" + UUID.randomUUID().toString().substring(0, 8);
    this.slots = new Semaphore(concurrency);
  }

  public static <D, R> Builder<D, R> builder() {
    return new Builder<>();
  }

  @Override
  public String name() {
    return name;
  }

  public QueueName queue() {
    return queue;
  }

  public int concurrency() {
    return concurrency;
  }

  @Override
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Worker " + name + " has been closed");
    }
    if (pollTask != null) {
      return;
    }
    pool = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("bugtrail-" + name + "-"));
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("bugtrail-" + name + "-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Worker {0} started on queue {1} with concurrency {2}",
        new Object[]{name, queue, concurrency});
  }

  /**
   * Executes a single poll cycle. Called by the scheduler.
   */
  void poll() {
    if (closed || paused) {
      return;
    }
    try {
      int free = slots.availablePermits();
      if (free <= 0) {
        return;
      }
      List<JobRecord> jobs = jobQueue.claimJobs(queue.value(), ownerId, free);
      for (JobRecord job : jobs) {
        if (!slots.tryAcquire()) {
          // Unreachable while this thread is the only acquirer; the lock expires if it happens
          logger.log(Level.WARNING, "No free slot for claimed job {0}", job.jobId());
          continue;
        }
        submit(job);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed for worker " + name, t);
    }
  }

  private void submit(JobRecord job) {
    try {
      pool.execute(() -> {
        try {
          process(job);
        } finally {
          slots.release();
        }
      });
    } catch (RejectedExecutionException e) {
      slots.release();
      logger.log(Level.WARNING, "Worker " + name + " rejected job " + job.jobId()
          + "; it will be re-delivered after its lock expires", e);
    }
  }

  private void process(JobRecord job) {
    long startNanos = System.nanoTime();
    R result;
    try {
      D data = jobQueue.jsonCodec().fromJson(job.payloadJson(), payloadType);
      JobContext<D> context = new JobContext<>(job, data, progress -> jobQueue.updateProgress(job, progress));
      result = handler.handle(context);
    } catch (Throwable t) {
      // Errors are reported too; otherwise the job would stay in flight until its lock expires
      logger.log(t instanceof Exception ? Level.WARNING : Level.SEVERE, "Job " + job.jobId()
          + " failed in worker " + name + " (attempt " + (job.attemptsMade() + 1) + "/"
          + job.maxAttempts() + ")", t);
      jobQueue.failJob(job, t);
      notifyFailed(job, t);
      return;
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    jobQueue.completeJob(job, result);
    metrics.recordJobDurationMs(queue.value(), elapsedMs);
    notifyCompleted(job, elapsedMs);
  }

  private void notifyCompleted(JobRecord job, long elapsedMs) {
    try {
      listener.onCompleted(name, job, elapsedMs);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Worker listener onCompleted failed for job " + job.jobId(), e);
    }
  }

  private void notifyFailed(JobRecord job, Throwable error) {
    try {
      listener.onFailed(name, job, error);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Worker listener onFailed failed for job " + job.jobId(), e);
    }
  }

  @Override
  public void pause() {
    paused = true;
    logger.log(Level.INFO, "Worker {0} paused", name);
  }

  @Override
  public void resume() {
    paused = false;
    logger.log(Level.INFO, "Worker {0} resumed", name);
  }

  public boolean isPaused() {
    return paused;
  }

  @Override
  public boolean isRunning() {
    return pollTask != null && !closed;
  }

  /**
   * Stops polling, then waits for in-flight jobs within the drain timeout before forcing
   * the pool down.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    if (pool != null) {
      pool.shutdown();
      try {
        if (!pool.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded for worker {0}; forcing shutdown", name);
          pool.shutdownNow();
          pool.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        pool.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    logger.log(Level.INFO, "Worker {0} closed", name);
  }

  /** Builder for {@link QueueWorker}. */
  public static final class Builder<D, R> {
    private String name;
    private QueueName queue;
    private JobQueue jobQueue;
    private Class<D> payloadType;
    private JobHandler<D, R> handler;
    private int concurrency = 1;
    private long pollIntervalMs = 1000;
    private long drainTimeoutMs = 30_000;
    private WorkerListener listener;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder<D, R> name(String name) {
      this.name = name;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<D, R> queue(QueueName queue) {
      this.queue = queue;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<D, R> jobQueue(JobQueue jobQueue) {
      this.jobQueue = jobQueue;
      return this;
    }

    /**
     * Type the JSON payload is decoded into.
     *
     * <p><b>Required.</b>
     */
    public Builder<D, R> payloadType(Class<D> payloadType) {
      this.payloadType = payloadType;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<D, R> handler(JobHandler<D, R> handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Maximum number of jobs processed at the same time.
     *
     * <p>Optional. Defaults to {@code 1}. Must be &gt; 0.
     */
    public Builder<D, R> concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     */
    public Builder<D, R> pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Grace period for in-flight jobs on {@link QueueWorker#close()}.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
     */
    public Builder<D, R> drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link WorkerListener#NOOP}.
     */
    public Builder<D, R> listener(WorkerListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<D, R> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public QueueWorker<D, R> build() {
      return new QueueWorker<>(this);
    }
  }
}
