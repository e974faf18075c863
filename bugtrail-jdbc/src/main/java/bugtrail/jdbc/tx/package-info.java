/**
 * Manual JDBC transaction handling.
 */
package bugtrail.jdbc.tx;
