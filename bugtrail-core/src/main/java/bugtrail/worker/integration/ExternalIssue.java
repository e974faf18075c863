package bugtrail.worker.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An issue created on an external platform.
 *
 * @param externalId  platform issue key, e.g. {@code "BUG-123"}
 * @param externalUrl browsable URL of the issue
 * @param metadata    extra platform data, may be empty
 */
public record ExternalIssue(String externalId, String externalUrl, Map<String, Object> metadata) {

  public ExternalIssue {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
