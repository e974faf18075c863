package bugtrail.worker.replay;

import java.util.List;

/**
 * Index of the uploaded chunks of one replay, stored next to them as {@code manifest.json}.
 */
public record ReplayManifest(
    String version,
    String bugReportId,
    String projectId,
    long totalDuration,
    int totalEvents,
    int totalChunks,
    List<Chunk> chunks,
    String createdAt
) {
  public static final String VERSION = "1.0";

  public ReplayManifest {
    chunks = List.copyOf(chunks);
  }

  /**
   * One uploaded chunk. {@code compressionRatio} is original over compressed size, rounded
   * to two decimals.
   */
  public record Chunk(
      int chunkIndex,
      long startTime,
      long endTime,
      int eventCount,
      String url,
      long compressedSize,
      double compressionRatio
  ) {
  }
}
