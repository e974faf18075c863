package bugtrail.spi;

import bugtrail.model.BugReport;

/**
 * Bug report access needed by the media and integration workers.
 */
public interface BugReportRepository {

    /**
     * Returns the report, or {@code null} if it does not exist.
     */
    BugReport findById(String bugReportId);

    /**
     * Stores the processed screenshot URL and records the thumbnail URL in the report metadata.
     *
     * @return rows updated
     */
    int updateScreenshotUrls(String bugReportId, String screenshotUrl, String thumbnailUrl);

    /**
     * Points the report's replay URL at the replay manifest.
     *
     * @return rows updated
     */
    int updateReplayManifestUrl(String bugReportId, String manifestUrl);

    /**
     * Records the issue created on an external platform in the report metadata.
     *
     * @return rows updated
     */
    int updateExternalIntegration(String bugReportId, String platform, String externalId, String externalUrl);
}
