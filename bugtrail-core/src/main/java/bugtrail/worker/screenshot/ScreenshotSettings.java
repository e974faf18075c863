package bugtrail.worker.screenshot;

/**
 * Image encoding settings of the screenshot worker.
 *
 * @param quality          JPEG quality of the stored original, 1-100
 * @param thumbnailWidth   maximum thumbnail width in pixels
 * @param thumbnailHeight  maximum thumbnail height in pixels
 * @param thumbnailQuality JPEG quality of the thumbnail, 1-100
 */
public record ScreenshotSettings(int quality, int thumbnailWidth, int thumbnailHeight, int thumbnailQuality) {

  public ScreenshotSettings {
    if (quality < 1 || quality > 100) {
      throw new IllegalArgumentException("quality must be between 1 and 100");
    }
    if (thumbnailQuality < 1 || thumbnailQuality > 100) {
      throw new IllegalArgumentException("thumbnailQuality must be between 1 and 100");
    }
    if (thumbnailWidth <= 0 || thumbnailHeight <= 0) {
      throw new IllegalArgumentException("thumbnail dimensions must be > 0");
    }
  }

  public static ScreenshotSettings defaults() {
    return new ScreenshotSettings(85, 320, 240, 80);
  }
}
