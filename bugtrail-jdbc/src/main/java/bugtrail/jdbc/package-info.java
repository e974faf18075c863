/**
 * JDBC implementations of the bugtrail persistence SPIs and their shared helpers.
 *
 * @see bugtrail.jdbc.store.JdbcJobStores
 * @see bugtrail.jdbc.repository
 */
package bugtrail.jdbc;
