package bugtrail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sensitivity class of the data a project collects.
 */
public enum DataClassification {
  GENERAL,
  FINANCIAL,
  GOVERNMENT,
  HEALTHCARE,
  PII,
  SENSITIVE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DataClassification fromValue(String value) {
    if (value == null || value.isBlank()) {
      return GENERAL;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
