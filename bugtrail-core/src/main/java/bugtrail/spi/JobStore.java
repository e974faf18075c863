package bugtrail.spi;

import bugtrail.model.JobRecord;
import bugtrail.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persistence contract for the job table that backs every queue.
 *
 * <p>All methods receive an open connection and never close it. Implementations throw
 * unchecked exceptions on database failure.
 *
 * @see bugtrail.queue.JobQueue
 */
public interface JobStore {

    /**
     * Inserts a new job.
     *
     * @return {@code false} if a job with the same id already exists in the queue
     */
    boolean insert(Connection conn, JobRecord job);

    /**
     * Loads a job, or returns {@code null} if it does not exist.
     */
    JobRecord findById(Connection conn, String queueName, String jobId);

    /**
     * Atomically claims up to {@code limit} dispatchable jobs for {@code ownerId} and marks
     * them ACTIVE. Dispatchable means pending with {@code available_at <= now}, or ACTIVE
     * with a lock older than {@code lockExpiry} (a stalled job).
     *
     * <p>Order: priority 0 first, then ascending priority, then creation time.
     *
     * @return the claimed jobs in dispatch order
     */
    List<JobRecord> claim(Connection conn, String queueName, String ownerId, Instant now,
        Instant lockExpiry, int limit);

    /**
     * Marks a job COMPLETED if it is still locked by {@code ownerId}.
     *
     * @return rows updated (0 if the lock was lost)
     */
    int markCompleted(Connection conn, String queueName, String jobId, String ownerId,
        String resultJson, Instant finishedAt);

    /**
     * Re-queues a failed attempt as DELAYED until {@code availableAt}.
     *
     * @return rows updated (0 if the lock was lost)
     */
    int markRetry(Connection conn, String queueName, String jobId, String ownerId,
        int attemptsMade, Instant availableAt, String error, String stacktrace);

    /**
     * Marks a job permanently FAILED.
     *
     * @return rows updated (0 if the lock was lost)
     */
    int markFailed(Connection conn, String queueName, String jobId, String ownerId,
        int attemptsMade, String error, String stacktrace, Instant finishedAt);

    int updateProgress(Connection conn, String queueName, String jobId, String progressJson);

    int delete(Connection conn, String queueName, String jobId);

    /**
     * Counts jobs of a queue per stored state. States without jobs may be absent.
     */
    Map<JobState, Long> countByState(Connection conn, String queueName);

    void setPaused(Connection conn, String queueName, boolean paused);

    boolean isPaused(Connection conn, String queueName);

    /**
     * Deletes up to {@code limit} jobs in a finished state that finished before {@code before}.
     *
     * @return rows deleted
     */
    int purgeFinishedBefore(Connection conn, String queueName, JobState state, Instant before, int limit);

    /**
     * Deletes finished jobs in {@code state} beyond the {@code keep} most recent ones.
     *
     * @return rows deleted
     */
    int trimFinished(Connection conn, String queueName, JobState state, int keep);
}
