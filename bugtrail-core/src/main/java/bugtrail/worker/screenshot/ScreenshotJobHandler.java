package bugtrail.worker.screenshot;

import bugtrail.model.BugReport;
import bugtrail.spi.BugReportRepository;
import bugtrail.spi.ObjectHead;
import bugtrail.spi.StorageService;
import bugtrail.spi.StoredObject;
import bugtrail.worker.JobContext;
import bugtrail.worker.JobHandler;
import bugtrail.worker.ProgressTracker;

import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Optimizes an uploaded screenshot, creates its thumbnail and stores both.
 *
 * <p>If the report already carries a screenshot URL and a {@code thumbnailUrl} in its
 * metadata, an earlier attempt uploaded the files and only the bookkeeping failed; the
 * existing files are reused instead of being uploaded again.
 */
public final class ScreenshotJobHandler implements JobHandler<ScreenshotJobData, ScreenshotJobResult> {
  private static final Logger logger = Logger.getLogger(ScreenshotJobHandler.class.getName());

  static final String THUMBNAIL_URL_KEY = "thumbnailUrl";
  private static final String CONTENT_TYPE = "image/jpeg";

  private final BugReportRepository bugReports;
  private final StorageService storage;
  private final ScreenshotSettings settings;

  public ScreenshotJobHandler(BugReportRepository bugReports, StorageService storage, ScreenshotSettings settings) {
    this.bugReports = Objects.requireNonNull(bugReports, "bugReports");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.settings = settings != null ? settings : ScreenshotSettings.defaults();
  }

  static String originalKey(String projectId, String bugReportId) {
    return "screenshots/" + projectId + "/" + bugReportId + "/original.jpg";
  }

  static String thumbnailKey(String projectId, String bugReportId) {
    return "screenshots/" + projectId + "/" + bugReportId + "/thumbnail.jpg";
  }

  @Override
  public ScreenshotJobResult handle(JobContext<ScreenshotJobData> context) throws Exception {
    long start = System.currentTimeMillis();
    ScreenshotJobData data = validate(context.data());

    BugReport existing = bugReports.findById(data.bugReportId());
    String existingThumbnail = existing == null ? null : existing.metadataString(THUMBNAIL_URL_KEY);
    ScreenshotJobResult result;
    if (existing != null && existing.screenshotUrl() != null && existingThumbnail != null) {
      logger.log(Level.INFO, "Reusing uploaded screenshot for report {0} (attempt {1})",
          new Object[]{data.bugReportId(), context.job().attemptsMade() + 1});
      result = reuse(data, existing.screenshotUrl(), existingThumbnail, start);
    } else {
      result = processAndUpload(context, data, start);
    }
    logger.log(Level.INFO, "Screenshot processed for report {0}: original {1} bytes, thumbnail {2} bytes",
        new Object[]{data.bugReportId(), result.originalSize(), result.thumbnailSize()});
    return result;
  }

  private ScreenshotJobResult processAndUpload(JobContext<ScreenshotJobData> context,
      ScreenshotJobData data, long start) throws Exception {
    ProgressTracker progress = context.progress(4);

    progress.update(1, "Decoding screenshot");
    BufferedImage image = ImageProcessor.read(ImageProcessor.decodeBase64(data.screenshotData()));

    progress.update(2, "Optimizing image");
    byte[] optimized = ImageProcessor.toJpeg(image, settings.quality());

    progress.update(3, "Creating thumbnail");
    BufferedImage thumbnailImage =
        ImageProcessor.fitInside(image, settings.thumbnailWidth(), settings.thumbnailHeight());
    byte[] thumbnail = ImageProcessor.toJpeg(thumbnailImage, settings.thumbnailQuality());

    progress.complete("Uploading");
    StoredObject original = storage.upload(originalKey(data.projectId(), data.bugReportId()), optimized, CONTENT_TYPE);
    StoredObject thumb = storage.upload(thumbnailKey(data.projectId(), data.bugReportId()), thumbnail, CONTENT_TYPE);
    bugReports.updateScreenshotUrls(data.bugReportId(), original.url(), thumb.url());

    return new ScreenshotJobResult(original.url(), thumb.url(), optimized.length, thumbnail.length,
        image.getWidth(), image.getHeight(), System.currentTimeMillis() - start);
  }

  private ScreenshotJobResult reuse(ScreenshotJobData data, String originalUrl, String thumbnailUrl,
      long start) throws Exception {
    byte[] bytes = ImageProcessor.decodeBase64(data.screenshotData());
    BufferedImage image = ImageProcessor.read(bytes);
    ObjectHead originalHead = storage.headObject(originalKey(data.projectId(), data.bugReportId()));
    ObjectHead thumbnailHead = storage.headObject(thumbnailKey(data.projectId(), data.bugReportId()));
    long originalSize = originalHead != null ? originalHead.size() : bytes.length;
    long thumbnailSize = thumbnailHead != null ? thumbnailHead.size() : Math.round(originalSize * 0.15);
    return new ScreenshotJobResult(originalUrl, thumbnailUrl, originalSize, thumbnailSize,
        image.getWidth(), image.getHeight(), System.currentTimeMillis() - start);
  }

  private static ScreenshotJobData validate(ScreenshotJobData data) {
    if (data == null || isBlank(data.bugReportId()) || isBlank(data.projectId())
        || isBlank(data.screenshotData())) {
      throw new IllegalArgumentException("Invalid screenshot job data");
    }
    return data;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
