package bugtrail.jdbc.repository;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.jdbc.TableNames;
import bugtrail.jdbc.tx.JdbcTransactionManager;
import bugtrail.model.ArchivedBugReport;
import bugtrail.model.BugReport;
import bugtrail.model.ReportRef;
import bugtrail.spi.ConnectionProvider;
import bugtrail.spi.RetentionRepository;
import bugtrail.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link RetentionRepository} over {@code bug_reports} and {@code archived_bug_reports}.
 *
 * <p>Every mutating statement carries {@code legal_hold = FALSE} in its WHERE clause, so
 * held reports are protected even when a caller passes their ids.
 */
public final class JdbcRetentionRepository implements RetentionRepository {
  private static final Logger logger = Logger.getLogger(JdbcRetentionRepository.class.getName());

  private static final String ARCHIVE_COLUMNS = "id, project_id, title, description, screenshot_url, "
      + "replay_url, metadata, status, priority, original_created_at, original_updated_at, "
      + "deleted_at, deleted_by, archived_at, archived_reason";
  private static final int ARCHIVE_COLUMN_COUNT = 15;
  private static final int ARCHIVE_BATCH_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final JsonCodec jsonCodec;
  private final String reportTable;
  private final String archiveTable;
  private volatile Boolean postgres;

  public JdbcRetentionRepository(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcRetentionRepository(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.reportTable = TableNames.BUG_REPORTS;
    this.archiveTable = TableNames.ARCHIVED_BUG_REPORTS;
  }

  @Override
  public List<BugReport> findEligibleForDeletion(String projectId, Instant cutoff) {
    String sql = "SELECT " + BugReportRows.COLUMNS + " FROM " + reportTable
        + " WHERE project_id=? AND created_at < ? AND deleted_at IS NULL AND legal_hold = FALSE"
        + " ORDER BY created_at, id";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, BugReportRows.mapper(jsonCodec), projectId, cutoff));
  }

  @Override
  public List<BugReport> findByIds(Collection<String> reportIds) {
    if (reportIds.isEmpty()) {
      return List.of();
    }
    String sql = "SELECT " + BugReportRows.COLUMNS + " FROM " + reportTable
        + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ") ORDER BY created_at, id";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, BugReportRows.mapper(jsonCodec), reportIds));
  }

  @Override
  public int softDelete(Collection<String> reportIds, String deletedBy) {
    if (reportIds.isEmpty()) {
      return 0;
    }
    Instant now = Instant.now();
    String sql = "UPDATE " + reportTable + " SET deleted_at=?, deleted_by=?, updated_at=?"
        + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ")"
        + " AND deleted_at IS NULL AND legal_hold = FALSE";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.update(conn, sql, now, deletedBy, now, reportIds));
  }

  @Override
  public List<ReportRef> hardDeleteInTransaction(Collection<String> reportIds) {
    if (reportIds.isEmpty()) {
      return List.of();
    }
    return txManager.inTransaction(conn -> {
      List<ReportRef> eligible = JdbcTemplate.query(conn,
          "SELECT id, project_id FROM " + reportTable
              + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ")"
              + " AND legal_hold = FALSE FOR UPDATE",
          rs -> new ReportRef(rs.getString("id"), rs.getString("project_id")),
          reportIds);
      if (eligible.isEmpty()) {
        return List.of();
      }
      List<String> ids = new ArrayList<>(eligible.size());
      for (ReportRef ref : eligible) {
        ids.add(ref.id());
      }
      int deleted = JdbcTemplate.update(conn,
          "DELETE FROM " + reportTable + " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ")"
              + " AND legal_hold = FALSE",
          ids);
      if (deleted != ids.size()) {
        logger.log(Level.WARNING, "Hard delete removed {0} of {1} locked reports",
            new Object[]{deleted, ids.size()});
      }
      return eligible;
    });
  }

  @Override
  public int restore(Collection<String> reportIds) {
    if (reportIds.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + reportTable + " SET deleted_at=NULL, deleted_by=NULL, updated_at=?"
        + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ") AND deleted_at IS NOT NULL";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.update(conn, sql, Instant.now(), reportIds));
  }

  @Override
  public int setLegalHold(Collection<String> reportIds, boolean hold) {
    if (reportIds.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + reportTable + " SET legal_hold=?, updated_at=?"
        + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ")";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.update(conn, sql, hold, Instant.now(), reportIds));
  }

  @Override
  public List<String> findProjectIds(Collection<String> reportIds) {
    if (reportIds.isEmpty()) {
      return List.of();
    }
    String sql = "SELECT DISTINCT project_id FROM " + reportTable
        + " WHERE id IN (" + JdbcTemplate.placeholders(reportIds.size()) + ") ORDER BY project_id";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, rs -> rs.getString("project_id"), reportIds));
  }

  @Override
  public long countLegalHoldReports() {
    String sql = "SELECT COUNT(*) AS cnt FROM " + reportTable
        + " WHERE legal_hold = TRUE AND deleted_at IS NULL";
    Long count = JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong("cnt")));
    return count == null ? 0L : count;
  }

  /**
   * Inserts archive copies with {@code ON CONFLICT (id) DO NOTHING}, so an id archived by a
   * concurrent or earlier sweep is skipped instead of failing the batch. PostgreSQL gets
   * multi-row statements with {@code RETURNING id}; H2 (in PostgreSQL mode) inserts row by
   * row and reads the update count, as it has no {@code RETURNING}.
   */
  @Override
  public List<ArchivedBugReport> insertArchived(List<ArchivedBugReport> reports) {
    if (reports.isEmpty()) {
      return List.of();
    }
    Map<String, ArchivedBugReport> byId = new LinkedHashMap<>();
    for (ArchivedBugReport report : reports) {
      byId.putIfAbsent(report.id(), report);
    }
    List<ArchivedBugReport> unique = new ArrayList<>(byId.values());
    return txManager.inTransaction(conn -> isPostgres(conn)
        ? insertArchivedReturning(conn, unique)
        : insertArchivedRowByRow(conn, unique));
  }

  private List<ArchivedBugReport> insertArchivedReturning(Connection conn, List<ArchivedBugReport> reports) {
    List<ArchivedBugReport> inserted = new ArrayList<>();
    for (int from = 0; from < reports.size(); from += ARCHIVE_BATCH_SIZE) {
      List<ArchivedBugReport> batch = reports.subList(from, Math.min(reports.size(), from + ARCHIVE_BATCH_SIZE));
      StringBuilder sql = new StringBuilder("INSERT INTO ").append(archiveTable)
          .append(" (").append(ARCHIVE_COLUMNS).append(") VALUES ");
      List<Object> params = new ArrayList<>(batch.size() * ARCHIVE_COLUMN_COUNT);
      for (int i = 0; i < batch.size(); i++) {
        sql.append(i == 0 ? "" : ", ").append('(').append(JdbcTemplate.placeholders(ARCHIVE_COLUMN_COUNT)).append(')');
        params.addAll(archiveValues(batch.get(i)));
      }
      sql.append(" ON CONFLICT (id) DO NOTHING RETURNING id");
      Set<String> ids = new HashSet<>(JdbcTemplate.updateReturning(conn, sql.toString(),
          rs -> rs.getString("id"), params.toArray()));
      for (ArchivedBugReport report : batch) {
        if (ids.contains(report.id())) {
          inserted.add(report);
        }
      }
    }
    return inserted;
  }

  private List<ArchivedBugReport> insertArchivedRowByRow(Connection conn, List<ArchivedBugReport> reports) {
    String sql = "INSERT INTO " + archiveTable + " (" + ARCHIVE_COLUMNS + ")"
        + " VALUES (" + JdbcTemplate.placeholders(ARCHIVE_COLUMN_COUNT) + ") ON CONFLICT DO NOTHING";
    List<ArchivedBugReport> inserted = new ArrayList<>();
    for (ArchivedBugReport report : reports) {
      if (JdbcTemplate.update(conn, sql, archiveValues(report).toArray()) > 0) {
        inserted.add(report);
      }
    }
    return inserted;
  }

  private List<Object> archiveValues(ArchivedBugReport report) {
    return Arrays.asList(
        report.id(),
        report.projectId(),
        report.title(),
        report.description(),
        report.screenshotUrl(),
        report.replayUrl(),
        jsonCodec.toJson(report.metadata()),
        report.status(),
        report.priority(),
        report.originalCreatedAt(),
        report.originalUpdatedAt(),
        report.deletedAt(),
        report.deletedBy(),
        report.archivedAt(),
        report.archivedReason());
  }

  private boolean isPostgres(Connection conn) throws SQLException {
    Boolean cached = postgres;
    if (cached == null) {
      String url = conn.getMetaData().getURL();
      cached = url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:");
      postgres = cached;
    }
    return cached;
  }
}
