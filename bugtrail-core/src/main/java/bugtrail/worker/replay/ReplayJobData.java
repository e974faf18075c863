package bugtrail.worker.replay;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of a replay job.
 *
 * @param bugReportId report the replay belongs to
 * @param projectId   owning project
 * @param replayData  recording as a JSON object, or a JSON string containing it
 * @param duration    client-reported duration in milliseconds, may be null
 * @param eventCount  client-reported event count, may be null
 */
public record ReplayJobData(
    String bugReportId,
    String projectId,
    JsonNode replayData,
    Long duration,
    Integer eventCount
) {
}
