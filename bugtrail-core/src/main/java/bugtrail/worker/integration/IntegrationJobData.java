package bugtrail.worker.integration;

import java.util.Map;

/**
 * Payload of an integration job.
 *
 * @param bugReportId report to synchronize
 * @param projectId   owning project
 * @param platform    target platform key, e.g. {@code "jira"}
 * @param credentials platform credentials, may be null
 * @param config      platform options such as the target project or labels, may be null
 */
public record IntegrationJobData(
    String bugReportId,
    String projectId,
    String platform,
    Map<String, Object> credentials,
    Map<String, Object> config
) {

  public IntegrationJobData {
    credentials = credentials == null ? Map.of() : credentials;
    config = config == null ? Map.of() : config;
  }
}
