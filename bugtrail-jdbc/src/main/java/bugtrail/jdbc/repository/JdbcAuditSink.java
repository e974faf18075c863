package bugtrail.jdbc.repository;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.jdbc.TableNames;
import bugtrail.spi.AuditEntry;
import bugtrail.spi.AuditSink;
import bugtrail.spi.ConnectionProvider;
import bugtrail.util.JsonCodec;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Appends {@link AuditEntry} rows to the {@code audit_logs} table. Details are stored as JSON.
 */
public final class JdbcAuditSink implements AuditSink {
  private final ConnectionProvider connectionProvider;
  private final JsonCodec jsonCodec;
  private final String tableName;

  public JdbcAuditSink(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcAuditSink(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.tableName = TableNames.AUDIT_LOGS;
  }

  @Override
  public void append(AuditEntry entry) {
    Objects.requireNonNull(entry, "entry");
    String sql = "INSERT INTO " + tableName
        + " (id, user_id, action, resource, resource_id, details, created_at) VALUES (?,?,?,?,?,?,?)";
    Instant timestamp = entry.timestamp() != null ? entry.timestamp() : Instant.now();
    JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.update(conn, sql,
        UUID.randomUUID().toString(),
        entry.userId(),
        entry.action(),
        entry.resource(),
        entry.resourceId(),
        jsonCodec.toJson(entry.details()),
        timestamp));
  }
}
