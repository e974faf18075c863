package bugtrail.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;

/**
 * In-memory H2 database with the bundled schema, plus row fixtures.
 */
public final class H2Database {
  private final JdbcDataSource dataSource;

  private H2Database(JdbcDataSource dataSource) {
    this.dataSource = dataSource;
  }

  public static H2Database create() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:bugtrail_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    H2Database db = new H2Database(ds);
    db.runScript("/bugtrail/jdbc/schema-h2.sql");
    return db;
  }

  public JdbcDataSource dataSource() {
    return dataSource;
  }

  public DataSourceConnectionProvider connectionProvider() {
    return new DataSourceConnectionProvider(dataSource);
  }

  public void runScript(String resource) {
    String script = loadResource(resource);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to run " + resource, e);
    }
  }

  public int update(String sql, Object... params) {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.update(conn, sql, params);
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  public <T> T queryOne(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.queryOne(conn, sql, mapper, params);
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  public long count(String table) {
    return countRows("SELECT COUNT(*) FROM " + table);
  }

  /** Runs a {@code SELECT COUNT(*)} statement and returns its single value. */
  public long countRows(String sql, Object... params) {
    Long count = queryOne(sql, rs -> rs.getLong(1), params);
    return count == null ? 0L : count;
  }

  public void insertProject(String id, String name, String settingsJson) {
    update("INSERT INTO projects (id, name, settings, created_at) VALUES (?,?,?,?)",
        id, name, settingsJson, Instant.parse("2023-01-01T00:00:00Z"));
  }

  public void insertReport(String id, String projectId, Instant createdAt) {
    insertReport(id, projectId, createdAt, null, null, false);
  }

  public void insertReport(String id, String projectId, Instant createdAt, String screenshotUrl,
      String replayUrl, boolean legalHold) {
    update("INSERT INTO bug_reports (id, project_id, title, description, screenshot_url, replay_url,"
            + " metadata, status, priority, legal_hold, created_at, updated_at)"
            + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
        id, projectId, "Report " + id, "Steps to reproduce", screenshotUrl, replayUrl,
        "{\"browser\":\"firefox\"}", "open", "high", legalHold, createdAt, createdAt);
  }

  private static String loadResource(String path) {
    try (InputStream is = H2Database.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
