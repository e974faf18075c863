package bugtrail.spi;

/**
 * Observability hook for job and retention counters.
 *
 * <p>The {@link #NOOP} instance discards all metrics. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs added to a queue.
     */
    void incrementJobEnqueued(String queueName);

    /**
     * Increments the count of jobs completed successfully.
     */
    void incrementJobCompleted(String queueName);

    /**
     * Increments the count of failed attempts that were re-queued.
     */
    void incrementJobRetried(String queueName);

    /**
     * Increments the count of jobs that failed permanently.
     */
    void incrementJobFailed(String queueName);

    /**
     * Records the wall-clock time a worker spent on one job.
     */
    default void recordJobDurationMs(String queueName, long durationMs) {
    }

    /**
     * Records the totals of one retention sweep.
     */
    default void recordRetentionSweep(long reportsDeleted, long reportsArchived, long bytesFreed, int errors) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementJobEnqueued(String queueName) {
        }

        @Override
        public void incrementJobCompleted(String queueName) {
        }

        @Override
        public void incrementJobRetried(String queueName) {
        }

        @Override
        public void incrementJobFailed(String queueName) {
        }
    }
}
