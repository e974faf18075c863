package bugtrail.retention;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Subscription tier bounding the retention window a project may choose.
 */
public enum RetentionTier {
  FREE(7, 60),
  PROFESSIONAL(30, 365),
  ENTERPRISE(30, -1);

  private final int minDays;
  private final int maxDays;

  RetentionTier(int minDays, int maxDays) {
    this.minDays = minDays;
    this.maxDays = maxDays;
  }

  public int minDays() {
    return minDays;
  }

  /**
   * Upper bound in days, or {@code -1} when unlimited.
   */
  public int maxDays() {
    return maxDays;
  }

  public boolean isUnlimited() {
    return maxDays < 0;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static RetentionTier fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Retention tier must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
