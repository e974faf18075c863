package bugtrail.worker;

import bugtrail.model.JobRecord;
import bugtrail.queue.JobQueue;
import bugtrail.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the enabled workers, tracks their metrics and shuts everything down.
 *
 * <p>The manager registers itself as the {@link WorkerListener} of every worker it starts.
 * Metrics are kept per worker and never reset.
 *
 * <p>Lifecycle: {@link State#UNINITIALIZED} &rarr; {@link State#STARTED} &rarr;
 * {@link State#SHUTTING_DOWN} &rarr; {@link State#SHUT_DOWN}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WorkerManager implements WorkerListener {
  private static final Logger logger = Logger.getLogger(WorkerManager.class.getName());

  /** Manager lifecycle states. */
  public enum State {
    UNINITIALIZED,
    STARTED,
    SHUTTING_DOWN,
    SHUT_DOWN
  }

  private final JobQueue jobQueue;
  private final WorkerDependencies dependencies;
  private final WorkerSettings settings;
  private final Map<WorkerName, WorkerFactory> factories;

  private final Map<WorkerName, Worker> workers = new LinkedHashMap<>();
  private final Map<String, WorkerStats> stats = new ConcurrentHashMap<>();
  private volatile State state = State.UNINITIALIZED;
  private volatile Instant startedAt;

  private WorkerManager(Builder builder) {
    this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");
    this.dependencies = Objects.requireNonNull(builder.dependencies, "dependencies");
    this.settings = builder.settings != null ? builder.settings : WorkerSettings.defaults();
    Map<WorkerName, WorkerFactory> merged = WorkerFactories.defaults();
    merged.putAll(builder.factories);
    this.factories = merged;
  }

  public static Builder builder() {
    return new Builder();
  }

  public State state() {
    return state;
  }

  /**
   * Initializes the job queue and starts every enabled worker.
   *
   * @throws IllegalStateException if already started, or if the integration worker is
   *     enabled without a plugin registry
   */
  public synchronized void start() {
    if (state != State.UNINITIALIZED) {
      throw new IllegalStateException("WorkerManager already started");
    }
    if (settings.isEnabled(WorkerName.INTEGRATION) && dependencies.pluginRegistry() == null) {
      throw new IllegalStateException("PluginRegistry required for integration worker but not provided");
    }
    jobQueue.initialize();

    try {
      for (WorkerName name : WorkerName.values()) {
        if (!settings.isEnabled(name)) {
          logger.log(Level.INFO, "Worker {0} is disabled", name);
          continue;
        }
        Worker worker = factories.get(name).create(
            new WorkerContext(name, jobQueue, dependencies, settings, this));
        workers.put(name, worker);
        stats.put(worker.name(), new WorkerStats());
        worker.start();
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to start workers; closing those already started", e);
      for (Worker worker : workers.values()) {
        closeQuietly(worker);
      }
      workers.clear();
      stats.clear();
      throw e;
    }
    startedAt = Instant.now();
    state = State.STARTED;
    logger.log(Level.INFO, "Started {0} workers: {1}", new Object[]{workers.size(), workers.keySet()});
  }

  private static void closeQuietly(Worker worker) {
    try {
      worker.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close worker " + worker.name(), e);
    }
  }

  @Override
  public void onCompleted(String workerName, JobRecord job, long processingTimeMs) {
    WorkerStats s = stats.get(workerName);
    if (s != null) {
      s.recordSuccess(processingTimeMs, Instant.now());
    }
  }

  @Override
  public void onFailed(String workerName, JobRecord job, Throwable error) {
    WorkerStats s = stats.get(workerName);
    if (s != null) {
      s.recordFailure(error == null ? null : error.getMessage(), Instant.now());
    }
  }

  /**
   * Returns the aggregate metrics of all started workers.
   */
  public synchronized WorkerManagerMetrics getMetrics() {
    List<WorkerMetrics> snapshots = new ArrayList<>();
    int running = 0;
    long processed = 0;
    long failed = 0;
    for (Worker worker : workers.values()) {
      WorkerMetrics snapshot = snapshot(worker);
      snapshots.add(snapshot);
      if (snapshot.running()) {
        running++;
      }
      processed += snapshot.jobsProcessed();
      failed += snapshot.jobsFailed();
    }
    long uptime = startedAt == null ? 0L : Duration.between(startedAt, Instant.now()).toMillis();
    return new WorkerManagerMetrics(workers.size(), running, processed, failed, snapshots, uptime);
  }

  /**
   * Returns the metrics of one worker, or {@code null} if no such worker was started.
   */
  public synchronized WorkerMetrics getWorkerMetrics(String name) {
    Worker worker = lookup(name);
    return worker == null ? null : snapshot(worker);
  }

  /**
   * Reports whether every started worker is running.
   */
  public synchronized HealthStatus healthCheck() {
    Map<String, Boolean> running = new LinkedHashMap<>();
    boolean healthy = state == State.STARTED;
    for (Worker worker : workers.values()) {
      boolean isRunning = snapshot(worker).running();
      running.put(worker.name(), isRunning);
      healthy &= isRunning;
    }
    return new HealthStatus(healthy, running);
  }

  /**
   * Stops the worker from claiming jobs. Its {@code running} flag reads false until
   * {@link #resumeWorker(String)}, so the manager reports unhealthy meanwhile.
   *
   * @throws IllegalArgumentException {@code "Worker <name> not found"} if no such worker was started
   */
  public synchronized void pauseWorker(String name) {
    Worker worker = require(name);
    worker.pause();
    stats.get(worker.name()).setPaused(true);
  }

  /**
   * @throws IllegalArgumentException {@code "Worker <name> not found"} if no such worker was started
   */
  public synchronized void resumeWorker(String name) {
    Worker worker = require(name);
    worker.resume();
    stats.get(worker.name()).setPaused(false);
  }

  private Worker require(String name) {
    Worker worker = lookup(name);
    if (worker == null) {
      throw new IllegalArgumentException("Worker " + name + " not found");
    }
    return worker;
  }

  private Worker lookup(String name) {
    WorkerName key = WorkerName.find(name);
    return key == null ? null : workers.get(key);
  }

  private WorkerMetrics snapshot(Worker worker) {
    WorkerStats s = stats.get(worker.name());
    return s.snapshot(worker.name(), worker.isRunning());
  }

  /**
   * Closes all workers in parallel, then shuts down the job queue. A worker that fails to
   * close is logged and does not prevent the others from closing.
   *
   * <p>Only the first call does any work; later calls log a warning and return.
   */
  public void shutdown() {
    List<Worker> toClose;
    synchronized (this) {
      if (state == State.SHUTTING_DOWN || state == State.SHUT_DOWN) {
        logger.warning("WorkerManager shutdown already in progress or completed");
        return;
      }
      state = State.SHUTTING_DOWN;
      toClose = new ArrayList<>(workers.values());
    }
    logger.log(Level.INFO, "Shutting down {0} workers", toClose.size());

    if (!toClose.isEmpty()) {
      ExecutorService executor = Executors.newFixedThreadPool(
          toClose.size(), new DaemonThreadFactory("bugtrail-shutdown-"));
      try {
        CompletableFuture<?>[] futures = new CompletableFuture<?>[toClose.size()];
        for (int i = 0; i < toClose.size(); i++) {
          Worker worker = toClose.get(i);
          futures[i] = CompletableFuture.runAsync(() -> closeWorker(worker), executor);
        }
        CompletableFuture.allOf(futures).join();
      } finally {
        executor.shutdown();
      }
    }

    try {
      jobQueue.shutdown();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to shut down job queue", e);
    }
    state = State.SHUT_DOWN;
    logger.info("WorkerManager shut down");
  }

  private void closeWorker(Worker worker) {
    try {
      worker.close();
      stats.get(worker.name()).markStopped();
      logger.log(Level.INFO, "Worker {0} closed", worker.name());
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to close worker " + worker.name(), e);
    }
  }

  /**
   * Mutable per-worker counters. Updated from worker threads.
   */
  private static final class WorkerStats {
    private long jobsProcessed;
    private long jobsFailed;
    private long totalProcessingTimeMs;
    private Instant lastProcessedAt;
    private String lastError;
    private boolean stopped;
    private boolean paused;

    synchronized void recordSuccess(long processingTimeMs, Instant at) {
      jobsProcessed++;
      totalProcessingTimeMs += processingTimeMs;
      lastProcessedAt = at;
    }

    synchronized void recordFailure(String error, Instant at) {
      jobsFailed++;
      lastError = error;
      lastProcessedAt = at;
    }

    synchronized void markStopped() {
      stopped = true;
    }

    synchronized void setPaused(boolean value) {
      paused = value;
    }

    synchronized WorkerMetrics snapshot(String name, boolean workerRunning) {
      double avg = jobsProcessed == 0 ? 0.0 : (double) totalProcessingTimeMs / jobsProcessed;
      return new WorkerMetrics(name, jobsProcessed, jobsFailed, avg, totalProcessingTimeMs,
          lastProcessedAt, lastError, !stopped && !paused && workerRunning);
    }
  }

  /** Builder for {@link WorkerManager}. */
  public static final class Builder {
    private JobQueue jobQueue;
    private WorkerDependencies dependencies;
    private WorkerSettings settings;
    private final Map<WorkerName, WorkerFactory> factories = new EnumMap<>(WorkerName.class);

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder jobQueue(JobQueue jobQueue) {
      this.jobQueue = jobQueue;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder dependencies(WorkerDependencies dependencies) {
      this.dependencies = dependencies;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link WorkerSettings#defaults()}.
     */
    public Builder settings(WorkerSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Replaces the factory of one worker.
     *
     * <p>Optional. Defaults to {@link WorkerFactories#defaults()}.
     */
    public Builder factory(WorkerName name, WorkerFactory factory) {
      factories.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public WorkerManager build() {
      return new WorkerManager(this);
    }
  }
}
