package bugtrail.retention;

import java.time.Instant;
import java.util.List;

/**
 * Totals of one {@link RetentionService#applyRetentionPolicies(RetentionOptions)} run.
 *
 * @param totalDeleted reports soft-deleted, or eligible reports counted in a dry run
 * @param aborted      true when the error-rate breaker stopped the sweep early
 */
public record RetentionResult(
    long totalDeleted,
    long totalArchived,
    long storageFreed,
    long screenshotsDeleted,
    long replaysDeleted,
    int projectsProcessed,
    List<RetentionError> errors,
    long durationMs,
    Instant startedAt,
    Instant completedAt,
    boolean dryRun,
    boolean aborted
) {

  public RetentionResult {
    errors = List.copyOf(errors);
  }
}
