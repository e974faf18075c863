package bugtrail.jdbc.repository;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.model.BugReport;
import bugtrail.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Column list and row mapping shared by the bug report repositories.
 */
final class BugReportRows {
  private static final Logger logger = Logger.getLogger(BugReportRows.class.getName());

  static final String COLUMNS = "id, project_id, title, description, status, priority, screenshot_url, "
      + "replay_url, metadata, created_at, updated_at, deleted_at, deleted_by, legal_hold";

  private BugReportRows() {}

  static JdbcTemplate.RowMapper<BugReport> mapper(JsonCodec jsonCodec) {
    return rs -> new BugReport(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("status"),
        rs.getString("priority"),
        rs.getString("screenshot_url"),
        rs.getString("replay_url"),
        readMetadata(jsonCodec, rs.getString("id"), rs.getString("metadata")),
        JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("updated_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("deleted_at")),
        rs.getString("deleted_by"),
        rs.getBoolean("legal_hold"));
  }

  /**
   * Parses a metadata column. Malformed JSON is logged and read as an empty map.
   */
  @SuppressWarnings("unchecked")
  static Map<String, Object> readMetadata(JsonCodec jsonCodec, String reportId, String json) {
    if (json == null || json.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, Object> parsed = jsonCodec.fromJson(json, Map.class);
      return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring malformed metadata of bug report " + reportId, e);
      return new LinkedHashMap<>();
    }
  }
}
