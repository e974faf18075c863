package bugtrail.retention;

import java.time.Instant;

/**
 * What a retention sweep would remove from one project.
 *
 * @param oldestReportDate creation time of the oldest eligible report, null when none
 */
public record ProjectPreview(
    String projectId,
    String projectName,
    int reportsToDelete,
    long estimatedStorageBytes,
    Instant oldestReportDate
) {
}
