package bugtrail.worker.replay;

import bugtrail.spi.BugReportRepository;
import bugtrail.spi.StorageService;
import bugtrail.spi.StoredObject;
import bugtrail.util.JsonCodec;
import bugtrail.worker.JobContext;
import bugtrail.worker.JobHandler;
import bugtrail.worker.ProgressTracker;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

/**
 * Splits a session recording into time-based chunks, gzips and uploads each chunk, then
 * uploads a manifest and points the report at it.
 */
public final class ReplayJobHandler implements JobHandler<ReplayJobData, ReplayJobResult> {
  private static final Logger logger = Logger.getLogger(ReplayJobHandler.class.getName());

  private final BugReportRepository bugReports;
  private final StorageService storage;
  private final JsonCodec jsonCodec;
  private final ReplaySettings settings;

  public ReplayJobHandler(BugReportRepository bugReports, StorageService storage, JsonCodec jsonCodec,
      ReplaySettings settings) {
    this.bugReports = Objects.requireNonNull(bugReports, "bugReports");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.jsonCodec = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();
    this.settings = settings != null ? settings : ReplaySettings.defaults();
  }

  static String chunkKey(String projectId, String bugReportId, int index) {
    return "replays/" + projectId + "/" + bugReportId + "/chunks/" + index + ".json.gz";
  }

  static String manifestKey(String projectId, String bugReportId) {
    return "replays/" + projectId + "/" + bugReportId + "/manifest.json";
  }

  @Override
  public ReplayJobResult handle(JobContext<ReplayJobData> context) throws Exception {
    long start = System.currentTimeMillis();
    ReplayJobData data = context.data();
    if (data == null || data.bugReportId() == null || data.projectId() == null || data.replayData() == null) {
      throw new IllegalArgumentException("Invalid replay job data");
    }
    ProgressTracker progress = context.progress(5);

    progress.update(1, "Parsing replay data");
    List<JsonNode> events = parseEvents(data.replayData());
    int totalEvents = events.size();
    long totalDuration = totalEvents > 0
        ? ReplayChunker.timestamp(events.get(totalEvents - 1)) - ReplayChunker.timestamp(events.get(0))
        : 0L;

    progress.update(2, "Chunking events");
    List<List<JsonNode>> eventChunks = ReplayChunker.chunk(events, settings.chunkDurationMs());

    progress.update(3, "Compressing and uploading chunks");
    List<ReplayManifest.Chunk> chunks = new ArrayList<>(eventChunks.size());
    long totalCompressed = 0;
    for (int i = 0; i < eventChunks.size(); i++) {
      List<JsonNode> chunkEvents = eventChunks.get(i);
      byte[] json = jsonCodec.toJson(Map.of("events", chunkEvents)).getBytes(StandardCharsets.UTF_8);
      byte[] compressed = gzip(json);
      StoredObject stored = storage.upload(
          chunkKey(data.projectId(), data.bugReportId(), i), compressed, "application/gzip");
      totalCompressed += compressed.length;
      chunks.add(new ReplayManifest.Chunk(i,
          ReplayChunker.timestamp(chunkEvents.get(0)),
          ReplayChunker.timestamp(chunkEvents.get(chunkEvents.size() - 1)),
          chunkEvents.size(), stored.url(), compressed.length,
          ratio(json.length, compressed.length)));
      logger.log(Level.FINE, "Uploaded replay chunk {0} of report {1} ({2} bytes)",
          new Object[]{i, data.bugReportId(), compressed.length});
    }

    progress.update(4, "Creating manifest");
    ReplayManifest manifest = new ReplayManifest(ReplayManifest.VERSION, data.bugReportId(), data.projectId(),
        totalDuration, totalEvents, chunks.size(), chunks, Instant.now().toString());
    StoredObject manifestObject = storage.upload(manifestKey(data.projectId(), data.bugReportId()),
        jsonCodec.toJson(manifest).getBytes(StandardCharsets.UTF_8), "application/json");
    bugReports.updateReplayManifestUrl(data.bugReportId(), manifestObject.url());

    progress.complete("Done");
    long elapsed = System.currentTimeMillis() - start;
    logger.log(Level.INFO, "Replay processed for report {0}: {1} events in {2} chunks, {3} bytes",
        new Object[]{data.bugReportId(), totalEvents, chunks.size(), totalCompressed});
    return new ReplayJobResult(manifestObject.url(), manifestObject.url(), chunks.size(), totalCompressed,
        totalDuration, totalEvents, elapsed);
  }

  private List<JsonNode> parseEvents(JsonNode replayData) {
    long size;
    JsonNode root;
    if (replayData.isTextual()) {
      String text = replayData.asText();
      size = text.getBytes(StandardCharsets.UTF_8).length;
      checkSize(size);
      try {
        root = jsonCodec.readTree(text);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Failed to parse replay data JSON: " + e.getMessage(), e);
      }
    } else {
      size = jsonCodec.toJson(replayData).getBytes(StandardCharsets.UTF_8).length;
      checkSize(size);
      root = replayData;
    }
    JsonNode events = root == null ? null : root.get("events");
    if (events == null || !events.isArray()) {
      throw new IllegalArgumentException("Replay data has no events array");
    }
    List<JsonNode> result = new ArrayList<>(events.size());
    for (JsonNode event : events) {
      if (!event.path("timestamp").isNumber()) {
        throw new IllegalArgumentException("Replay event without numeric timestamp");
      }
      result.add(event);
    }
    return result;
  }

  private void checkSize(long size) {
    if (size > settings.maxReplaySizeBytes()) {
      throw new IllegalArgumentException("Replay data exceeds maximum size of "
          + settings.maxReplaySizeMb() + " MB");
    }
  }

  static byte[] gzip(byte[] data) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 4));
    try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
      gz.write(data);
    }
    return out.toByteArray();
  }

  static double ratio(long originalSize, long compressedSize) {
    if (compressedSize == 0) {
      return 0.0;
    }
    return BigDecimal.valueOf((double) originalSize / compressedSize)
        .setScale(2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
