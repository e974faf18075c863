/**
 * Spring Boot auto-configuration for bugtrail.
 *
 * <p>Add this starter, a {@code DataSource} and a {@link bugtrail.spi.StorageService} bean to get
 * a running job queue, the four workers and the daily retention sweep. Settings live under the
 * {@code bugtrail.*} prefix; see {@link bugtrail.spring.boot.BugtrailProperties}.
 */
package bugtrail.spring.boot;
