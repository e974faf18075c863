/**
 * Queue workers and their orchestration.
 *
 * <p>{@link bugtrail.worker.QueueWorker} consumes one queue; {@link bugtrail.worker.WorkerManager}
 * starts the enabled workers, aggregates their metrics and shuts them down. Job handlers of
 * the built-in workers live in the sub-packages.
 */
package bugtrail.worker;
