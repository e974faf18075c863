package bugtrail.retention.archive;

import bugtrail.spi.ArchiveResult;
import bugtrail.spi.ObjectHead;
import bugtrail.spi.ReportFiles;
import bugtrail.spi.StorageArchiver;
import bugtrail.spi.StorageService;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Archiver that deletes files outright. The report row itself is kept as an archive copy.
 *
 * <p>Each file is sized with {@link StorageService#headObject} and then deleted. A missing
 * object counts as archived with size zero; a failing one is recorded in the result.
 */
public final class DeletionArchiveStrategy implements StorageArchiver {
  public static final String NAME = "deletion";

  private static final Logger logger = Logger.getLogger(DeletionArchiveStrategy.class.getName());

  private final StorageService storage;

  public DeletionArchiveStrategy(StorageService storage) {
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  @Override
  public ArchiveResult archiveBatch(List<ReportFiles> files) {
    int archived = 0;
    long bytes = 0;
    List<ArchiveResult.FileError> errors = new ArrayList<>();
    for (ReportFiles report : files) {
      for (String url : new String[]{report.screenshotUrl(), report.replayUrl()}) {
        String key = StorageKeys.fromUrl(url);
        if (key == null) {
          continue;
        }
        try {
          ObjectHead head = storage.headObject(key);
          storage.deleteObject(key);
          archived++;
          bytes += head == null ? 0L : head.size();
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Failed to archive file {0} of report {1}: {2}",
              new Object[]{key, report.reportId(), e.getMessage()});
          errors.add(new ArchiveResult.FileError(key, String.valueOf(e.getMessage())));
        }
      }
    }
    return new ArchiveResult(archived, bytes, errors);
  }

  @Override
  public String strategyName() {
    return NAME;
  }
}
