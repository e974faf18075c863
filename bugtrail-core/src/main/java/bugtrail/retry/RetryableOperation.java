package bugtrail.retry;

/**
 * An operation that may be invoked several times by {@link RetryExecutor}.
 *
 * @param <T> result type
 * @param <E> checked exception type thrown by the operation
 */
@FunctionalInterface
public interface RetryableOperation<T, E extends Exception> {

  T execute() throws E;
}
