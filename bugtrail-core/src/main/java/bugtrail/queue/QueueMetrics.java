package bugtrail.queue;

/**
 * Job counts of one queue. {@code waiting} includes prioritized jobs.
 */
public record QueueMetrics(
    long waiting,
    long active,
    long completed,
    long failed,
    long delayed,
    boolean paused
) {
}
