package bugtrail.retention;

import java.time.Instant;

/**
 * Failure of one project during a retention sweep.
 */
public record RetentionError(String projectId, String error, Instant timestamp) {
}
