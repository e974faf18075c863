package bugtrail.retention;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why reports left primary storage. Recorded on archive rows, certificates and audit entries.
 */
public enum DeletionReason {
  RETENTION_POLICY,
  MANUAL,
  GDPR_REQUEST,
  CCPA_REQUEST,
  USER_REQUEST,
  LEGAL_HOLD_RELEASED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DeletionReason fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Deletion reason must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
