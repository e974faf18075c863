package bugtrail.worker;

/**
 * Processes the decoded payload of one job.
 *
 * <p>Throwing fails the attempt; the queue decides between retry and permanent failure.
 *
 * @param <D> payload type
 * @param <R> result type, stored as JSON on completion
 */
@FunctionalInterface
public interface JobHandler<D, R> {

    R handle(JobContext<D> context) throws Exception;
}
