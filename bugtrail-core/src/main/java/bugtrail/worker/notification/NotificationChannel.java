package bugtrail.worker.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery channel of a notification.
 */
public enum NotificationChannel {
  EMAIL,
  SLACK,
  WEBHOOK;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @throws IllegalArgumentException for unknown channel names
   */
  @JsonCreator
  public static NotificationChannel fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Notification type must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported notification type: " + value, e);
    }
  }
}
