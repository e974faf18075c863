package bugtrail.jdbc.repository;

import bugtrail.jdbc.JdbcTemplate;
import bugtrail.jdbc.TableNames;
import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;
import bugtrail.model.Project;
import bugtrail.model.RetentionPolicy;
import bugtrail.spi.ConnectionProvider;
import bugtrail.spi.ProjectRepository;
import bugtrail.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link ProjectRepository} over the {@code projects} table.
 *
 * <p>The retention policy is read from the {@code retention} object of the JSON
 * {@code settings} column. A project whose settings lack it, or carry an invalid one, has no
 * policy and is skipped by retention sweeps.
 */
public final class JdbcProjectRepository implements ProjectRepository {
  private static final Logger logger = Logger.getLogger(JdbcProjectRepository.class.getName());

  private static final String COLUMNS = "id, name, settings, created_at";

  private final ConnectionProvider connectionProvider;
  private final JsonCodec jsonCodec;
  private final String tableName;

  public JdbcProjectRepository(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcProjectRepository(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.tableName = TableNames.PROJECTS;
  }

  @Override
  public List<Project> findAll() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY created_at, id";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, this::mapProject));
  }

  @Override
  public Project findById(String projectId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.queryOne(conn, sql, this::mapProject, projectId));
  }

  private Project mapProject(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    return new Project(
        id,
        rs.getString("name"),
        JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
        parsePolicy(id, rs.getString("settings")));
  }

  RetentionPolicy parsePolicy(String projectId, String settingsJson) {
    if (settingsJson == null || settingsJson.isBlank()) {
      return null;
    }
    try {
      JsonNode retention = jsonCodec.readTree(settingsJson).get("retention");
      if (retention == null || !retention.isObject()) {
        return null;
      }
      JsonNode days = retention.get("bugReportRetentionDays");
      if (days == null || !days.canConvertToInt()) {
        logger.log(Level.WARNING, "Project {0} retention settings lack bugReportRetentionDays",
            projectId);
        return null;
      }
      return new RetentionPolicy(
          days.asInt(),
          retention.path("screenshotRetentionDays").asInt(0),
          retention.path("replayRetentionDays").asInt(0),
          retention.path("attachmentRetentionDays").asInt(0),
          retention.path("archivedRetentionDays").asInt(0),
          retention.path("archiveBeforeDelete").asBoolean(false),
          DataClassification.fromValue(retention.path("dataClassification").asText(null)),
          ComplianceRegion.fromValue(retention.path("complianceRegion").asText(null)));
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring invalid retention settings of project " + projectId, e);
      return null;
    }
  }
}
