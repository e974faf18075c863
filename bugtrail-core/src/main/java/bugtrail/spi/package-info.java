/**
 * Service provider interfaces: the collaborators this core consumes.
 *
 * <ul>
 *   <li>{@link bugtrail.spi.ConnectionProvider} and {@link bugtrail.spi.JobStore}: the
 *       durable job table behind every queue</li>
 *   <li>{@link bugtrail.spi.ProjectRepository}, {@link bugtrail.spi.BugReportRepository},
 *       {@link bugtrail.spi.RetentionRepository}: the relational store</li>
 *   <li>{@link bugtrail.spi.StorageService}, {@link bugtrail.spi.StorageArchiver}: object storage</li>
 *   <li>{@link bugtrail.spi.AuditSink}: the audit trail</li>
 *   <li>{@link bugtrail.spi.MetricsExporter}: counters for a metrics backend</li>
 * </ul>
 *
 * <p>JDBC implementations live in {@code bugtrail-jdbc}.
 */
package bugtrail.spi;
