package bugtrail.spi;

/**
 * Stored files belonging to one bug report. Either URL may be null.
 */
public record ReportFiles(String reportId, String screenshotUrl, String replayUrl) {
}
