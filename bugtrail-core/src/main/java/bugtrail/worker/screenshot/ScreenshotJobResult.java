package bugtrail.worker.screenshot;

/**
 * Result of a screenshot job. Sizes are in bytes, dimensions in pixels.
 */
public record ScreenshotJobResult(
    String originalUrl,
    String thumbnailUrl,
    long originalSize,
    long thumbnailSize,
    int width,
    int height,
    long processingTimeMs
) {
}
