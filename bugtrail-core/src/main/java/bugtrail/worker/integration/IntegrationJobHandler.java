package bugtrail.worker.integration;

import bugtrail.model.BugReport;
import bugtrail.spi.BugReportRepository;
import bugtrail.worker.JobContext;
import bugtrail.worker.JobHandler;
import bugtrail.worker.ProgressTracker;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates an issue for a bug report on an external platform and records the external id.
 */
public final class IntegrationJobHandler implements JobHandler<IntegrationJobData, IntegrationJobResult> {
  private static final Logger logger = Logger.getLogger(IntegrationJobHandler.class.getName());

  private final BugReportRepository bugReports;
  private final PluginRegistry plugins;

  public IntegrationJobHandler(BugReportRepository bugReports, PluginRegistry plugins) {
    this.bugReports = Objects.requireNonNull(bugReports, "bugReports");
    this.plugins = Objects.requireNonNull(plugins, "plugins");
  }

  @Override
  public IntegrationJobResult handle(JobContext<IntegrationJobData> context) throws Exception {
    IntegrationJobData data = context.data();
    if (data == null || data.bugReportId() == null || data.projectId() == null || data.platform() == null) {
      throw new IllegalArgumentException("Invalid integration job data");
    }
    ProgressTracker progress = context.progress(3);

    progress.update(1, "Resolving " + data.platform() + " plugin");
    IntegrationPlugin plugin = plugins.get(data.platform());
    if (plugin == null) {
      throw new IllegalArgumentException("Integration platform '" + data.platform()
          + "' not supported. Supported: " + String.join(", ", plugins.supportedPlatforms()));
    }
    BugReport report = bugReports.findById(data.bugReportId());
    if (report == null) {
      throw new IllegalArgumentException("Bug report not found: " + data.bugReportId());
    }

    progress.update(2, "Creating " + data.platform() + " issue");
    ExternalIssue issue = plugin.createFromBugReport(report, data.projectId(), data.credentials(), data.config());

    progress.complete("Updating database");
    bugReports.updateExternalIntegration(data.bugReportId(), data.platform(), issue.externalId(), issue.externalUrl());

    logger.log(Level.INFO, "Created {0} issue {1} for report {2}",
        new Object[]{data.platform(), issue.externalId(), data.bugReportId()});
    return new IntegrationJobResult(data.platform(), issue.externalId(), issue.externalUrl(),
        IntegrationStatus.CREATED, issue.metadata());
  }
}
