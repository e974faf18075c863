package bugtrail.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bug report as read from the relational store. Owned by the host application.
 *
 * @param deletedAt  soft-delete time, null while live
 * @param deletedBy  user who soft-deleted the report, null for policy deletes
 * @param legalHold  reports on legal hold are never deleted
 */
public record BugReport(
    String id,
    String projectId,
    String title,
    String description,
    String status,
    String priority,
    String screenshotUrl,
    String replayUrl,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt,
    String deletedBy,
    boolean legalHold
) {

  public BugReport {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  /**
   * Returns a metadata value as a string, or {@code null} if absent.
   */
  public String metadataString(String key) {
    Object value = metadata.get(key);
    return value == null ? null : value.toString();
  }
}
