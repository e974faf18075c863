package bugtrail.worker.replay;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a time-ordered event stream into segments.
 *
 * <p>A new segment starts with the first event whose timestamp is at least
 * {@code chunkDurationMs} after the start of the current, non-empty segment.
 */
public final class ReplayChunker {

  private ReplayChunker() {}

  public static List<List<JsonNode>> chunk(List<JsonNode> events, long chunkDurationMs) {
    if (chunkDurationMs <= 0) {
      throw new IllegalArgumentException("chunkDurationMs must be > 0");
    }
    List<List<JsonNode>> chunks = new ArrayList<>();
    if (events.isEmpty()) {
      return chunks;
    }
    List<JsonNode> current = new ArrayList<>();
    long chunkStart = timestamp(events.get(0));
    for (JsonNode event : events) {
      long ts = timestamp(event);
      if (ts - chunkStart >= chunkDurationMs && !current.isEmpty()) {
        chunks.add(current);
        current = new ArrayList<>();
        chunkStart = ts;
      }
      current.add(event);
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }
    return chunks;
  }

  static long timestamp(JsonNode event) {
    return event.path("timestamp").asLong();
  }
}
