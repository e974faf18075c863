package bugtrail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Jurisdiction whose data-retention rules apply to a project.
 */
public enum ComplianceRegion {
  NONE,
  EU,
  US,
  KZ,
  UK,
  CA;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ComplianceRegion fromValue(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
