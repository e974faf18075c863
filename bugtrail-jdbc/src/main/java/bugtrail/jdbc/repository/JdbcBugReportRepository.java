package bugtrail.jdbc.repository;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.jdbc.TableNames;
import bugtrail.jdbc.tx.JdbcTransactionManager;
import bugtrail.model.BugReport;
import bugtrail.spi.BugReportRepository;
import bugtrail.spi.ConnectionProvider;
import bugtrail.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC {@link BugReportRepository} over the {@code bug_reports} table.
 *
 * <p>Metadata is stored as JSON text. Metadata updates read the row with
 * {@code SELECT ... FOR UPDATE}, merge the new keys and write it back in one transaction.
 */
public final class JdbcBugReportRepository implements BugReportRepository {
  public static final String THUMBNAIL_URL_KEY = "thumbnailUrl";
  public static final String REPLAY_MANIFEST_URL_KEY = "replayManifestUrl";
  public static final String EXTERNAL_ID_KEY = "externalId";
  public static final String EXTERNAL_URL_KEY = "externalUrl";
  public static final String EXTERNAL_PLATFORM_KEY = "externalPlatform";

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final JsonCodec jsonCodec;
  private final String tableName;

  public JdbcBugReportRepository(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcBugReportRepository(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.tableName = TableNames.BUG_REPORTS;
  }

  @Override
  public BugReport findById(String bugReportId) {
    String sql = "SELECT " + BugReportRows.COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.queryOne(conn, sql, BugReportRows.mapper(jsonCodec), bugReportId));
  }

  @Override
  public int updateScreenshotUrls(String bugReportId, String screenshotUrl, String thumbnailUrl) {
    Map<String, Object> additions = new LinkedHashMap<>();
    additions.put(THUMBNAIL_URL_KEY, thumbnailUrl);
    return updateWithMetadata(bugReportId, additions, "screenshot_url", screenshotUrl);
  }

  @Override
  public int updateReplayManifestUrl(String bugReportId, String manifestUrl) {
    Map<String, Object> additions = new LinkedHashMap<>();
    additions.put(REPLAY_MANIFEST_URL_KEY, manifestUrl);
    return updateWithMetadata(bugReportId, additions, "replay_url", manifestUrl);
  }

  @Override
  public int updateExternalIntegration(String bugReportId, String platform, String externalId,
      String externalUrl) {
    Map<String, Object> additions = new LinkedHashMap<>();
    additions.put(EXTERNAL_ID_KEY, externalId);
    additions.put(EXTERNAL_URL_KEY, externalUrl);
    additions.put(EXTERNAL_PLATFORM_KEY, platform);
    return updateWithMetadata(bugReportId, additions, null, null);
  }

  private int updateWithMetadata(String bugReportId, Map<String, Object> additions,
      String column, String value) {
    return txManager.inTransaction(conn -> {
      String current = JdbcTemplate.queryOne(conn,
          "SELECT metadata FROM " + tableName + " WHERE id=? FOR UPDATE",
          rs -> {
            String json = rs.getString("metadata");
            return json == null ? "" : json;
          },
          bugReportId);
      if (current == null) {
        return 0;
      }
      Map<String, Object> metadata = BugReportRows.readMetadata(jsonCodec, bugReportId, current);
      metadata.putAll(additions);
      return write(conn, bugReportId, jsonCodec.toJson(metadata), column, value);
    });
  }

  private int write(Connection conn, String bugReportId, String metadataJson, String column, String value) {
    Instant now = Instant.now();
    if (column == null) {
      return JdbcTemplate.update(conn,
          "UPDATE " + tableName + " SET metadata=?, updated_at=? WHERE id=?",
          metadataJson, now, bugReportId);
    }
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET " + column + "=?, metadata=?, updated_at=? WHERE id=?",
        value, metadataJson, now, bugReportId);
  }
}
