package bugtrail.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of a bug report taken when it leaves primary storage.
 *
 * <p>{@code archivedAt} is never earlier than {@code deletedAt}.
 */
public record ArchivedBugReport(
    String id,
    String projectId,
    String title,
    String description,
    String screenshotUrl,
    String replayUrl,
    Map<String, Object> metadata,
    String status,
    String priority,
    Instant originalCreatedAt,
    Instant originalUpdatedAt,
    Instant deletedAt,
    String deletedBy,
    String archivedReason,
    Instant archivedAt
) {

  public ArchivedBugReport {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    if (deletedAt != null && archivedAt != null && archivedAt.isBefore(deletedAt)) {
      throw new IllegalArgumentException("archivedAt must not be before deletedAt for report " + id);
    }
  }

  /**
   * Builds the archive copy of a report.
   */
  public static ArchivedBugReport of(BugReport report, String reason, String deletedBy,
      Instant deletedAt, Instant archivedAt) {
    return new ArchivedBugReport(
        report.id(),
        report.projectId(),
        report.title(),
        report.description(),
        report.screenshotUrl(),
        report.replayUrl(),
        report.metadata(),
        report.status(),
        report.priority(),
        report.createdAt(),
        report.updatedAt(),
        deletedAt,
        deletedBy,
        reason,
        archivedAt);
  }
}
