package bugtrail.worker.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an integration job.
 */
public record IntegrationJobResult(
    String platform,
    String externalId,
    String externalUrl,
    IntegrationStatus status,
    Map<String, Object> metadata
) {

  public IntegrationJobResult {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
