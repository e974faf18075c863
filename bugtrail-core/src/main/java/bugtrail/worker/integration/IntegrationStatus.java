package bugtrail.worker.integration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of synchronizing a report with an external platform.
 */
public enum IntegrationStatus {
  CREATED,
  UPDATED,
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
