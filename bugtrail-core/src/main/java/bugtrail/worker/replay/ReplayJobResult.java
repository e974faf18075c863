package bugtrail.worker.replay;

/**
 * Result of a replay job.
 *
 * @param replayUrl        manifest URL used for playback
 * @param metadataUrl      manifest URL
 * @param chunkCount       number of uploaded chunks
 * @param totalSize        compressed bytes across all chunks
 * @param duration         last minus first event timestamp in milliseconds
 * @param eventCount       number of events
 * @param processingTimeMs time spent processing
 */
public record ReplayJobResult(
    String replayUrl,
    String metadataUrl,
    int chunkCount,
    long totalSize,
    long duration,
    int eventCount,
    long processingTimeMs
) {
}
