package bugtrail.model;

import java.time.Instant;

/**
 * Project as read from the relational store.
 *
 * @param retentionPolicy retention settings, or {@code null} when the project has none
 */
public record Project(String id, String name, Instant createdAt, RetentionPolicy retentionPolicy) {

  public boolean hasRetentionPolicy() {
    return retentionPolicy != null;
  }
}
