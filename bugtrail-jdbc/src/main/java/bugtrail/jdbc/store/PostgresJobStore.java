package bugtrail.jdbc.store;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.model.JobRecord;
import bugtrail.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim, so concurrent workers never block on each other's rows.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String jobTable, String queueTable) {
    super(jobTable, queueTable);
  }

  @Override
  public AbstractJdbcJobStore withTables(String jobTable, String queueTable) {
    return new PostgresJobStore(jobTable, queueTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<JobRecord> claim(Connection conn, String queueName, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "UPDATE " + jobTable()
        + " SET state=" + JobState.ACTIVE.code() + ", locked_by=?, locked_at=?, processed_on=?"
        + " WHERE queue_name=? AND job_id IN ("
        + "SELECT job_id FROM " + jobTable() + " WHERE queue_name=? AND " + dispatchableCondition()
        + " ORDER BY " + DISPATCH_ORDER + " LIMIT ?"
        + " FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + JOB_COLUMNS;
    List<JobRecord> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER,
        ownerId, nowMs, nowMs, queueName, queueName, now, lockExpiry, limit));
    // RETURNING does not preserve the subquery order
    claimed.sort(DISPATCH_COMPARATOR);
    return claimed;
  }

  @Override
  public void setPaused(Connection conn, String queueName, boolean paused) {
    JdbcTemplate.update(conn, "INSERT INTO " + queueTable() + " (queue_name, paused) VALUES (?,?)"
        + " ON CONFLICT (queue_name) DO UPDATE SET paused = EXCLUDED.paused", queueName, paused);
  }
}
