package bugtrail.testing;

import bugtrail.model.BugReport;
import bugtrail.spi.BugReportRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link BugReportRepository} that applies updates the way the JDBC one does.
 */
public class InMemoryBugReportRepository implements BugReportRepository {
  public final Map<String, BugReport> reports = new ConcurrentHashMap<>();

  public InMemoryBugReportRepository add(BugReport report) {
    reports.put(report.id(), report);
    return this;
  }

  @Override
  public BugReport findById(String bugReportId) {
    return reports.get(bugReportId);
  }

  @Override
  public int updateScreenshotUrls(String bugReportId, String screenshotUrl, String thumbnailUrl) {
    return update(bugReportId, screenshotUrl, null, Map.of("thumbnailUrl", thumbnailUrl));
  }

  @Override
  public int updateReplayManifestUrl(String bugReportId, String manifestUrl) {
    return update(bugReportId, null, manifestUrl, Map.of("replayManifestUrl", manifestUrl));
  }

  @Override
  public int updateExternalIntegration(String bugReportId, String platform, String externalId,
      String externalUrl) {
    return update(bugReportId, null, null, Map.of(
        "externalId", externalId, "externalUrl", externalUrl, "externalPlatform", platform));
  }

  private synchronized int update(String id, String screenshotUrl, String replayUrl,
      Map<String, Object> additions) {
    BugReport r = reports.get(id);
    if (r == null) {
      return 0;
    }
    Map<String, Object> metadata = new LinkedHashMap<>(r.metadata());
    metadata.putAll(additions);
    reports.put(id, new BugReport(r.id(), r.projectId(), r.title(), r.description(), r.status(),
        r.priority(), screenshotUrl != null ? screenshotUrl : r.screenshotUrl(),
        replayUrl != null ? replayUrl : r.replayUrl(), metadata, r.createdAt(), r.updatedAt(),
        r.deletedAt(), r.deletedBy(), r.legalHold()));
    return 1;
  }
}
