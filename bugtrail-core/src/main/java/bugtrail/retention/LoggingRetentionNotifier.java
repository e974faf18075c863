package bugtrail.retention;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link RetentionNotifier}: writes a one-line summary to the log.
 */
public final class LoggingRetentionNotifier implements RetentionNotifier {
  private static final Logger logger = Logger.getLogger(LoggingRetentionNotifier.class.getName());

  private static final String[] UNITS = {"Bytes", "KB", "MB", "GB", "TB"};

  @Override
  public void onCompleted(RetentionResult result, long durationMs) {
    Level level = result.aborted() || !result.errors().isEmpty() ? Level.WARNING : Level.INFO;
    logger.log(level,
        "Retention summary: {0} projects, {1} deleted, {2} archived, {3} freed, {4} errors, took {5}{6}",
        new Object[]{
            result.projectsProcessed(),
            result.totalDeleted(),
            result.totalArchived(),
            formatBytes(result.storageFreed()),
            result.errors().size(),
            formatDuration(durationMs),
            result.aborted() ? " (aborted)" : ""});
  }

  @Override
  public void onFailed(Throwable error) {
    logger.log(Level.SEVERE, "Retention sweep failed", error);
  }

  /**
   * Formats a byte count with binary units, e.g. {@code 1.5 KB}.
   */
  static String formatBytes(long bytes) {
    if (bytes <= 0) {
      return "0 Bytes";
    }
    int unit = 0;
    double value = bytes;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
    return rounded.toPlainString() + " " + UNITS[unit];
  }

  static String formatDuration(long millis) {
    return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
  }
}
