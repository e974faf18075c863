package bugtrail.queue;

import bugtrail.model.JobState;

import java.time.Instant;

/**
 * Externally visible snapshot of a job.
 *
 * @param id           job id
 * @param name         job name
 * @param data         payload JSON
 * @param progress     last progress JSON, may be null
 * @param result       result JSON of a completed job, may be null
 * @param failedReason last failure message, may be null
 * @param stacktrace   last failure stack trace, may be null
 * @param attemptsMade failed attempts so far
 * @param timestamp    enqueue time
 * @param processedOn  start of the current or last attempt, may be null
 * @param finishedOn   completion time, may be null
 * @param state        reported state
 */
public record JobStatus(
    String id,
    String name,
    String data,
    String progress,
    String result,
    String failedReason,
    String stacktrace,
    int attemptsMade,
    Instant timestamp,
    Instant processedOn,
    Instant finishedOn,
    JobState state
) {
}
