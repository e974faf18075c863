package bugtrail.worker.integration;

import bugtrail.model.BugReport;

import java.util.Map;

/**
 * Client of one external issue tracker.
 */
public interface IntegrationPlugin {

    /**
     * Platform key this plugin serves, e.g. {@code "jira"}.
     */
    String platform();

    /**
     * Creates an issue for a bug report.
     *
     * @param report      the report
     * @param projectId   owning project
     * @param credentials platform credentials from the job
     * @param config      platform options from the job
     * @return the created issue
     * @throws Exception on any platform failure; the job attempt fails and may be retried
     */
    ExternalIssue createFromBugReport(BugReport report, String projectId,
        Map<String, Object> credentials, Map<String, Object> config) throws Exception;
}
