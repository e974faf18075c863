package bugtrail.retention;

/**
 * Receives the outcome of scheduled retention sweeps.
 *
 * @see LoggingRetentionNotifier
 */
public interface RetentionNotifier {

    /**
     * Called after a sweep returned, including sweeps stopped by the error-rate breaker.
     *
     * @param durationMs wall-clock duration measured by the scheduler
     */
    void onCompleted(RetentionResult result, long durationMs);

    /**
     * Called when a sweep threw.
     */
    void onFailed(Throwable error);
}
