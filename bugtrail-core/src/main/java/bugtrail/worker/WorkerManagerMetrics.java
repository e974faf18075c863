package bugtrail.worker;

import java.util.List;

/**
 * Aggregate snapshot over all started workers.
 */
public record WorkerManagerMetrics(
    int totalWorkers,
    int runningWorkers,
    long totalJobsProcessed,
    long totalJobsFailed,
    List<WorkerMetrics> workers,
    long uptimeMs
) {

  public WorkerManagerMetrics {
    workers = List.copyOf(workers);
  }
}
