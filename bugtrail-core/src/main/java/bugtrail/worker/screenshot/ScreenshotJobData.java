package bugtrail.worker.screenshot;

/**
 * Payload of a screenshot job.
 *
 * @param bugReportId      report the screenshot belongs to
 * @param projectId        owning project
 * @param screenshotData   base64 image, optionally as a {@code data:image/...;base64,} URL
 * @param originalFilename client-side file name, may be null
 */
public record ScreenshotJobData(
    String bugReportId,
    String projectId,
    String screenshotData,
    String originalFilename
) {
}
