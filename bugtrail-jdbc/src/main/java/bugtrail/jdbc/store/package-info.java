/**
 * JDBC {@link bugtrail.spi.JobStore} implementations and their ServiceLoader registry.
 */
package bugtrail.jdbc.store;
