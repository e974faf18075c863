package bugtrail.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit-trail record.
 *
 * @param action     action name, e.g. {@code soft_delete}
 * @param resource   resource type, e.g. {@code bug_report}
 * @param resourceId affected resource (the project id for retention actions)
 * @param userId     acting user, or {@code null} for the system
 * @param details    free-form details, serialised as JSON
 * @param timestamp  time of the action
 */
public record AuditEntry(
    String action,
    String resource,
    String resourceId,
    String userId,
    Map<String, Object> details,
    Instant timestamp
) {

  public AuditEntry {
    details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
