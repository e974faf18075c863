package bugtrail.jdbc.store;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.jdbc.StoreException;
import bugtrail.jdbc.TableNames;
import bugtrail.model.JobRecord;
import bugtrail.model.JobState;
import bugtrail.retry.BackoffType;
import bugtrail.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Jobs live in one table keyed by {@code (queue_name, job_id)}; pause flags live in a
 * small per-queue table. Subclasses override {@link #claim} to provide database-specific
 * claim strategies. Register custom implementations via
 * {@code META-INF/services/bugtrail.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String PENDING_STATE_IN = "(" + JobState.WAITING.code() + ","
      + JobState.DELAYED.code() + "," + JobState.PRIORITIZED.code() + ")";

  /** Jobs without priority first, then ascending priority, then oldest first. */
  protected static final String DISPATCH_ORDER =
      "CASE WHEN priority = 0 THEN 0 ELSE 1 END, priority, created_at";

  protected static final Comparator<JobRecord> DISPATCH_COMPARATOR = Comparator
      .comparingInt((JobRecord job) -> job.priority() == 0 ? 0 : 1)
      .thenComparingInt(JobRecord::priority)
      .thenComparing(JobRecord::createdAt);

  protected static final String JOB_COLUMNS = "queue_name, job_id, job_name, payload, state, priority, "
      + "attempts_made, max_attempts, backoff_type, backoff_delay_ms, remove_on_complete, remove_on_fail, "
      + "progress, result, failed_reason, stacktrace, created_at, available_at, processed_on, finished_on";

  protected static final JdbcTemplate.RowMapper<JobRecord> JOB_ROW_MAPPER = rs -> new JobRecord(
      rs.getString("job_id"),
      rs.getString("queue_name"),
      rs.getString("job_name"),
      rs.getString("payload"),
      JobState.fromCode(rs.getInt("state")),
      rs.getInt("priority"),
      rs.getInt("attempts_made"),
      rs.getInt("max_attempts"),
      BackoffType.fromString(rs.getString("backoff_type")),
      rs.getLong("backoff_delay_ms"),
      rs.getBoolean("remove_on_complete"),
      rs.getBoolean("remove_on_fail"),
      rs.getString("progress"),
      rs.getString("result"),
      rs.getString("failed_reason"),
      rs.getString("stacktrace"),
      JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("available_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("processed_on")),
      JdbcTemplate.toInstant(rs.getTimestamp("finished_on")));

  private final String jobTable;
  private final String queueTable;

  protected AbstractJdbcJobStore() {
    this(TableNames.JOB_TABLE, TableNames.QUEUE_TABLE);
  }

  protected AbstractJdbcJobStore(String jobTable, String queueTable) {
    this.jobTable = TableNames.validate(jobTable);
    this.queueTable = TableNames.validate(queueTable);
  }

  /**
   * Unique identifier for this job store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same type bound to other table names.
   */
  public abstract AbstractJdbcJobStore withTables(String jobTable, String queueTable);

  protected String jobTable() {
    return jobTable;
  }

  protected String queueTable() {
    return queueTable;
  }

  @Override
  public boolean insert(Connection conn, JobRecord job) {
    String sql = "INSERT INTO " + jobTable() + " (" + JOB_COLUMNS + ", locked_by, locked_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    try {
      JdbcTemplate.update(conn, sql,
          job.queueName(), job.jobId(), job.name(), job.payloadJson(), job.state().code(),
          job.priority(), job.attemptsMade(), job.maxAttempts(), job.backoffType().name(),
          job.backoffDelayMs(), job.removeOnComplete(), job.removeOnFail(),
          job.progressJson(), job.resultJson(), truncateError(job.failedReason()), job.stacktrace(),
          job.createdAt(), job.availableAt(), job.processedOn(), job.finishedOn());
      return true;
    } catch (StoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public JobRecord findById(Connection conn, String queueName, String jobId) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable() + " WHERE queue_name=? AND job_id=?";
    return JdbcTemplate.queryOne(conn, sql, JOB_ROW_MAPPER, queueName, jobId);
  }

  @Override
  public List<JobRecord> claim(Connection conn, String queueName, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + jobTable()
        + " SET state=" + JobState.ACTIVE.code() + ", locked_by=?, locked_at=?, processed_on=?"
        + " WHERE queue_name=? AND job_id IN ("
        + "SELECT job_id FROM " + jobTable() + " WHERE queue_name=? AND " + dispatchableCondition()
        + " ORDER BY " + DISPATCH_ORDER + " LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, nowMs, nowMs, queueName, queueName, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    // Phase 2: SELECT rows claimed in this cycle
    return selectClaimed(conn, queueName, ownerId, nowMs);
  }

  /**
   * Pending jobs whose available time has passed, or active jobs whose lock expired.
   * Binds {@code now} then {@code lockExpiry}.
   */
  protected String dispatchableCondition() {
    return "((state IN " + PENDING_STATE_IN + " AND available_at <= ?)"
        + " OR (state=" + JobState.ACTIVE.code() + " AND locked_at < ?))";
  }

  /**
   * Selects rows previously claimed by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<JobRecord> selectClaimed(Connection conn, String queueName, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable()
        + " WHERE queue_name=? AND locked_by=? AND locked_at=? AND state=" + JobState.ACTIVE.code()
        + " ORDER BY " + DISPATCH_ORDER;
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queueName, ownerId, lockedAt);
  }

  @Override
  public int markCompleted(Connection conn, String queueName, String jobId, String ownerId,
      String resultJson, Instant finishedAt) {
    String sql = "UPDATE " + jobTable()
        + " SET state=" + JobState.COMPLETED.code() + ", result=?, finished_on=?, locked_by=NULL, locked_at=NULL"
        + " WHERE queue_name=? AND job_id=? AND locked_by=? AND state=" + JobState.ACTIVE.code();
    return JdbcTemplate.update(conn, sql, resultJson, finishedAt, queueName, jobId, ownerId);
  }

  @Override
  public int markRetry(Connection conn, String queueName, String jobId, String ownerId,
      int attemptsMade, Instant availableAt, String error, String stacktrace) {
    String sql = "UPDATE " + jobTable()
        + " SET state=" + JobState.DELAYED.code()
        + ", attempts_made=?, available_at=?, failed_reason=?, stacktrace=?, locked_by=NULL, locked_at=NULL"
        + " WHERE queue_name=? AND job_id=? AND locked_by=? AND state=" + JobState.ACTIVE.code();
    return JdbcTemplate.update(conn, sql, attemptsMade, availableAt, truncateError(error), stacktrace,
        queueName, jobId, ownerId);
  }

  @Override
  public int markFailed(Connection conn, String queueName, String jobId, String ownerId,
      int attemptsMade, String error, String stacktrace, Instant finishedAt) {
    String sql = "UPDATE " + jobTable()
        + " SET state=" + JobState.FAILED.code()
        + ", attempts_made=?, failed_reason=?, stacktrace=?, finished_on=?, locked_by=NULL, locked_at=NULL"
        + " WHERE queue_name=? AND job_id=? AND locked_by=? AND state=" + JobState.ACTIVE.code();
    return JdbcTemplate.update(conn, sql, attemptsMade, truncateError(error), stacktrace, finishedAt,
        queueName, jobId, ownerId);
  }

  @Override
  public int updateProgress(Connection conn, String queueName, String jobId, String progressJson) {
    String sql = "UPDATE " + jobTable() + " SET progress=? WHERE queue_name=? AND job_id=?";
    return JdbcTemplate.update(conn, sql, progressJson, queueName, jobId);
  }

  @Override
  public int delete(Connection conn, String queueName, String jobId) {
    String sql = "DELETE FROM " + jobTable() + " WHERE queue_name=? AND job_id=?";
    return JdbcTemplate.update(conn, sql, queueName, jobId);
  }

  @Override
  public Map<JobState, Long> countByState(Connection conn, String queueName) {
    String sql = "SELECT state, COUNT(*) AS cnt FROM " + jobTable() + " WHERE queue_name=? GROUP BY state";
    Map<JobState, Long> counts = new EnumMap<>(JobState.class);
    for (Object[] row : JdbcTemplate.query(conn, sql,
        rs -> new Object[]{JobState.fromCode(rs.getInt("state")), rs.getLong("cnt")}, queueName)) {
      counts.merge((JobState) row[0], (Long) row[1], Long::sum);
    }
    return counts;
  }

  @Override
  public void setPaused(Connection conn, String queueName, boolean paused) {
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + queueTable() + " SET paused=? WHERE queue_name=?", paused, queueName);
    if (updated == 0) {
      try {
        JdbcTemplate.update(conn,
            "INSERT INTO " + queueTable() + " (queue_name, paused) VALUES (?,?)", queueName, paused);
      } catch (StoreException e) {
        if (!e.isConstraintViolation()) {
          throw e;
        }
        // Inserted concurrently by another instance
        JdbcTemplate.update(conn,
            "UPDATE " + queueTable() + " SET paused=? WHERE queue_name=?", paused, queueName);
      }
    }
  }

  @Override
  public boolean isPaused(Connection conn, String queueName) {
    Boolean paused = JdbcTemplate.queryOne(conn,
        "SELECT paused FROM " + queueTable() + " WHERE queue_name=?",
        rs -> rs.getBoolean("paused"), queueName);
    return Boolean.TRUE.equals(paused);
  }

  @Override
  public int purgeFinishedBefore(Connection conn, String queueName, JobState state, Instant before, int limit) {
    String sql = "DELETE FROM " + jobTable() + " WHERE queue_name=? AND job_id IN ("
        + "SELECT job_id FROM " + jobTable()
        + " WHERE queue_name=? AND state=? AND finished_on < ? ORDER BY finished_on LIMIT ?)";
    return JdbcTemplate.update(conn, sql, queueName, queueName, state.code(), before, limit);
  }

  @Override
  public int trimFinished(Connection conn, String queueName, JobState state, int keep) {
    if (keep < 0) {
      throw new IllegalArgumentException("keep must be >= 0");
    }
    // Finish time of the newest job beyond the keep window; it and everything older goes
    String boundarySql = "SELECT finished_on FROM " + jobTable() + " WHERE queue_name=? AND state=?"
        + " AND finished_on IS NOT NULL ORDER BY finished_on DESC LIMIT 1 OFFSET ?";
    Instant boundary = JdbcTemplate.queryOne(conn, boundarySql,
        rs -> JdbcTemplate.toInstant(rs.getTimestamp("finished_on")), queueName, state.code(), keep);
    if (boundary == null) {
      return 0;
    }
    String sql = "DELETE FROM " + jobTable() + " WHERE queue_name=? AND state=? AND finished_on <= ?";
    return JdbcTemplate.update(conn, sql, queueName, state.code(), boundary);
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
