package bugtrail.worker.notification;

import java.util.List;
import java.util.Map;

/**
 * Payload of a notification job.
 *
 * @param bugReportId report the notification is about
 * @param projectId   owning project
 * @param type        delivery channel
 * @param recipients  addresses, channel ids or URLs, depending on the channel
 * @param event       lifecycle event
 * @param metadata    extra data passed to the notifier, may be null
 */
public record NotificationJobData(
    String bugReportId,
    String projectId,
    NotificationChannel type,
    List<String> recipients,
    NotificationEvent event,
    Map<String, Object> metadata
) {

  public NotificationJobData {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    metadata = metadata == null ? Map.of() : metadata;
  }
}
