package bugtrail.worker.notification;

import bugtrail.model.BugReport;

import java.util.Map;

/**
 * Bug report details included in a notification.
 */
public record NotificationContext(
    String bugReportId,
    String projectId,
    String title,
    String description,
    String status,
    String priority,
    String screenshotUrl,
    String replayUrl,
    String externalUrl,
    Map<String, Object> metadata
) {

  public static NotificationContext from(BugReport report) {
    return new NotificationContext(report.id(), report.projectId(), report.title(), report.description(),
        report.status(), report.priority(), report.screenshotUrl(), report.replayUrl(),
        report.metadataString("externalUrl"), report.metadata());
  }
}
