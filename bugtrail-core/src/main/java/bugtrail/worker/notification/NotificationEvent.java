package bugtrail.worker.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Bug report lifecycle event a notification is about.
 */
public enum NotificationEvent {
  CREATED,
  UPDATED,
  RESOLVED,
  DELETED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static NotificationEvent fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Notification event must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown notification event: " + value, e);
    }
  }
}
