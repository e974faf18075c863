package bugtrail.worker.notification;

import java.util.List;

/**
 * Delivery summary of a notification job. {@code errors} holds one message per failed
 * recipient.
 */
public record NotificationJobResult(
    String type,
    int recipientCount,
    int successCount,
    int failureCount,
    List<String> errors
) {

  public NotificationJobResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
