package bugtrail.worker;

/**
 * A running consumer of one job queue.
 *
 * @see QueueWorker
 */
public interface Worker extends AutoCloseable {

    /**
     * Worker name, e.g. {@code "screenshot"}.
     */
    String name();

    /**
     * Starts claiming and processing jobs.
     *
     * @throws IllegalStateException if the worker has been closed
     */
    void start();

    /**
     * Stops claiming new jobs. Jobs already running finish normally.
     */
    void pause();

    /**
     * Resumes claiming after {@link #pause()}.
     */
    void resume();

    /**
     * Whether the worker has been started and not closed. A paused worker is still running.
     */
    boolean isRunning();

    /**
     * Stops polling and waits for in-flight jobs within the drain timeout.
     */
    @Override
    void close() throws Exception;
}
