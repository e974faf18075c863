package bugtrail.jdbc;

import java.util.Objects;

/**
 * Default table names and validation of configured ones.
 */
public final class TableNames {
  public static final String JOB_TABLE = "bugtrail_job";
  public static final String QUEUE_TABLE = "bugtrail_queue";
  public static final String PROJECTS = "projects";
  public static final String BUG_REPORTS = "bug_reports";
  public static final String ARCHIVED_BUG_REPORTS = "archived_bug_reports";
  public static final String AUDIT_LOGS = "audit_logs";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Rejects anything but a plain SQL identifier, since table names are concatenated into SQL.
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
