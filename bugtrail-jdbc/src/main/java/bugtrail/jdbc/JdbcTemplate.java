package bugtrail.jdbc;

import bugtrail.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in stores and repositories.
 *
 * <p>{@link Instant} parameters are bound as timestamps and collections are expanded in
 * place, so {@code "id IN (" + placeholders(ids.size()) + ")"} takes the collection as one
 * argument.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T apply(Connection conn);
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT, map the first row or return {@code null}. */
  public static <T> T queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to execute updateReturning", e);
    }
  }

  /**
   * Runs the callback on a fresh auto-commit connection and closes it afterwards.
   */
  public static <T> T withConnection(ConnectionProvider provider, ConnectionCallback<T> callback) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to obtain connection", e);
    }
  }

  /** Returns {@code ?,?,...} with {@code count} placeholders. */
  public static String placeholders(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("count must be >= 1");
    }
    return String.join(",", Collections.nCopies(count, "?"));
  }

  public static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    int index = 1;
    for (Object param : params) {
      if (param instanceof Collection<?> values) {
        for (Object value : values) {
          bind(ps, index++, value);
        }
      } else {
        bind(ps, index++, param);
      }
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param == null) {
      ps.setObject(index, null);
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else if (param instanceof Long n) {
      ps.setLong(index, n);
    } else if (param instanceof Boolean b) {
      ps.setBoolean(index, b);
    } else if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof Timestamp ts) {
      ps.setTimestamp(index, ts);
    } else {
      ps.setObject(index, param);
    }
  }

  private JdbcTemplate() {}
}
