package bugtrail.worker;

import bugtrail.queue.JobQueue;

/**
 * Everything a {@link WorkerFactory} needs to build one worker.
 *
 * @param name         worker being built
 * @param jobQueue     queue access
 * @param dependencies shared collaborators
 * @param settings     worker settings
 * @param listener     receiver of job outcomes
 */
public record WorkerContext(
    WorkerName name,
    JobQueue jobQueue,
    WorkerDependencies dependencies,
    WorkerSettings settings,
    WorkerListener listener
) {

  public int concurrency() {
    return settings.concurrency(name);
  }
}
