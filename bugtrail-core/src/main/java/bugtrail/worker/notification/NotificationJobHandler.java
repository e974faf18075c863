package bugtrail.worker.notification;

import bugtrail.model.BugReport;
import bugtrail.spi.BugReportRepository;
import bugtrail.worker.JobContext;
import bugtrail.worker.JobHandler;
import bugtrail.worker.ProgressTracker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers a notification to every recipient. A failed recipient is recorded in the result
 * and does not fail the job.
 */
public final class NotificationJobHandler implements JobHandler<NotificationJobData, NotificationJobResult> {
  private static final Logger logger = Logger.getLogger(NotificationJobHandler.class.getName());

  private final BugReportRepository bugReports;
  private final NotifierRegistry notifiers;

  public NotificationJobHandler(BugReportRepository bugReports, NotifierRegistry notifiers) {
    this.bugReports = Objects.requireNonNull(bugReports, "bugReports");
    this.notifiers = notifiers != null ? notifiers : new NotifierRegistry();
  }

  @Override
  public NotificationJobResult handle(JobContext<NotificationJobData> context) {
    NotificationJobData data = context.data();
    if (data == null || data.bugReportId() == null || data.type() == null || data.event() == null) {
      throw new IllegalArgumentException("Invalid notification job data");
    }
    ProgressTracker progress = context.progress(2);

    progress.update(1, "Fetching context");
    BugReport report = bugReports.findById(data.bugReportId());
    if (report == null) {
      throw new IllegalArgumentException("Bug report not found: " + data.bugReportId());
    }
    NotificationContext notificationContext = NotificationContext.from(report);

    progress.update(2, "Sending notifications");
    Notifier notifier = notifiers.get(data.type());
    List<String> errors = new ArrayList<>();
    int success = 0;
    for (String recipient : data.recipients()) {
      if (notifier == null) {
        errors.add("Unsupported notification type: " + data.type().value());
        continue;
      }
      try {
        notifier.send(recipient, notificationContext, data.event(), data.metadata());
        success++;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        errors.add(recipient + ": interrupted");
      } catch (Exception e) {
        logger.log(Level.WARNING, "Notification to " + recipient + " failed for report " + data.bugReportId(), e);
        errors.add(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
      }
    }
    progress.complete("Done");

    int recipients = data.recipients().size();
    logger.log(Level.INFO, "Sent {0} notification for report {1}: {2}/{3} delivered",
        new Object[]{data.type().value(), data.bugReportId(), success, recipients});
    return new NotificationJobResult(data.type().value(), recipients, success, recipients - success, errors);
  }
}
