package bugtrail.worker;

import bugtrail.model.JobRecord;

/**
 * Receives the outcome of every processed job.
 *
 * <p>Callbacks run on worker threads. Exceptions thrown here are logged and never affect
 * the job or the worker loop.
 */
public interface WorkerListener {

    WorkerListener NOOP = new WorkerListener() {
        @Override
        public void onCompleted(String workerName, JobRecord job, long processingTimeMs) {
        }

        @Override
        public void onFailed(String workerName, JobRecord job, Throwable error) {
        }
    };

    void onCompleted(String workerName, JobRecord job, long processingTimeMs);

    /**
     * Called for every failed attempt, whether or not the job will be retried.
     */
    void onFailed(String workerName, JobRecord job, Throwable error);
}
