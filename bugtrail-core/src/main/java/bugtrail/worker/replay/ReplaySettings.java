package bugtrail.worker.replay;

/**
 * @param chunkDurationSeconds length of one replay segment, &ge; 5
 * @param maxReplaySizeMb      largest accepted recording, &gt; 0
 */
public record ReplaySettings(int chunkDurationSeconds, int maxReplaySizeMb) {

  public ReplaySettings {
    if (chunkDurationSeconds < 5) {
      throw new IllegalArgumentException("chunkDurationSeconds must be >= 5");
    }
    if (maxReplaySizeMb <= 0) {
      throw new IllegalArgumentException("maxReplaySizeMb must be > 0");
    }
  }

  public static ReplaySettings defaults() {
    return new ReplaySettings(30, 100);
  }

  public long chunkDurationMs() {
    return chunkDurationSeconds * 1000L;
  }

  public long maxReplaySizeBytes() {
    return maxReplaySizeMb * 1024L * 1024L;
  }
}
