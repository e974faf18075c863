package bugtrail.jdbc.store;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String jobTable, String queueTable) {
    super(jobTable, queueTable);
  }

  @Override
  public AbstractJdbcJobStore withTables(String jobTable, String queueTable) {
    return new H2JobStore(jobTable, queueTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String toString() {
    return "H2JobStore[" + jobTable() + "]";
  }
}
