package bugtrail.worker;

/**
 * Creates a worker. The returned worker is not started.
 */
@FunctionalInterface
public interface WorkerFactory {

    Worker create(WorkerContext context);
}
