/**
 * Retention lifecycle: policy sweeps, archive, certified hard delete, legal hold, compliance
 * rules and the daily scheduler.
 *
 * <p>Entry points are {@link bugtrail.retention.RetentionService} and
 * {@link bugtrail.retention.RetentionScheduler}.
 */
package bugtrail.retention;
