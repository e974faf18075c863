/**
 * Retry policy engine: backoff strategies and a predicate-driven retry executor.
 *
 * <p>{@link bugtrail.retry.RetryExecutor} is policy-agnostic. Callers decide what is
 * retryable through {@link bugtrail.retry.RetryPredicates} or their own predicate, and
 * wrap only operations that are safe to repeat.
 *
 * @see bugtrail.retry.RetryExecutor
 * @see bugtrail.retry.BackoffStrategy
 */
package bugtrail.retry;
