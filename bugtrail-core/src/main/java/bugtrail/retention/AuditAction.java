package bugtrail.retention;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Audit actions written by the retention lifecycle.
 */
public enum AuditAction {
  SOFT_DELETE,
  HARD_DELETE,
  RESTORE,
  LEGAL_HOLD_APPLIED,
  LEGAL_HOLD_RELEASED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
