package bugtrail.model;

import bugtrail.retry.BackoffType;

import java.time.Instant;

/**
 * Row model for a job in the job table.
 *
 * <p>Workers receive claimed jobs as instances of this record and report outcomes back
 * through {@link bugtrail.queue.JobQueue}; they never update rows themselves.
 *
 * @param jobId            unique job id within the queue
 * @param queueName        queue the job belongs to
 * @param name             job name (processor type)
 * @param payloadJson      JSON payload
 * @param state            current state
 * @param priority         0 for none, otherwise lower values are dispatched first
 * @param attemptsMade     number of failed attempts so far
 * @param maxAttempts      total attempts allowed
 * @param backoffType      job-level backoff curve between attempts
 * @param backoffDelayMs   base delay of the backoff curve
 * @param removeOnComplete whether the row is deleted as soon as the job completes
 * @param removeOnFail     whether the row is deleted as soon as the job permanently fails
 * @param progressJson     last reported progress, may be null
 * @param resultJson       result of a completed job, may be null
 * @param failedReason     message of the last failure, may be null
 * @param stacktrace       stack trace of the last failure, may be null
 * @param createdAt        enqueue time
 * @param availableAt      earliest dispatch time
 * @param processedOn      time the current or last attempt started, may be null
 * @param finishedOn       completion or permanent failure time, may be null
 */
public record JobRecord(
    String jobId,
    String queueName,
    String name,
    String payloadJson,
    JobState state,
    int priority,
    int attemptsMade,
    int maxAttempts,
    BackoffType backoffType,
    long backoffDelayMs,
    boolean removeOnComplete,
    boolean removeOnFail,
    String progressJson,
    String resultJson,
    String failedReason,
    String stacktrace,
    Instant createdAt,
    Instant availableAt,
    Instant processedOn,
    Instant finishedOn
) {

  /**
   * Whether another attempt is allowed after the current one fails.
   */
  public boolean hasAttemptsLeftAfterFailure() {
    return attemptsMade + 1 < maxAttempts;
  }
}
