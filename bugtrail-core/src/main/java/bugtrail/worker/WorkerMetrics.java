package bugtrail.worker;

import java.time.Instant;

/**
 * Snapshot of one worker's counters.
 *
 * @param name                  worker name
 * @param jobsProcessed         completed jobs
 * @param jobsFailed            failed attempts
 * @param avgProcessingTimeMs   {@code totalProcessingTimeMs / jobsProcessed}, 0 before the first job
 * @param totalProcessingTimeMs summed processing time of completed jobs
 * @param lastProcessedAt       time of the last outcome, may be null
 * @param lastError             message of the last failure, may be null
 * @param running               whether the worker is started, not paused and not closed
 */
public record WorkerMetrics(
    String name,
    long jobsProcessed,
    long jobsFailed,
    double avgProcessingTimeMs,
    long totalProcessingTimeMs,
    Instant lastProcessedAt,
    String lastError,
    boolean running
) {
}
