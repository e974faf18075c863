/**
 * JDBC implementations of the relational repositories: projects, bug reports, the retention
 * lifecycle and the audit log.
 *
 * <p>JSON columns (project settings, report metadata, audit details) are stored as text so the
 * same statements run on H2 and PostgreSQL.
 */
package bugtrail.jdbc.repository;
