/**
 * Micrometer bridge for bugtrail job and retention metrics.
 *
 * @see bugtrail.micrometer.MicrometerMetricsExporter
 */
package bugtrail.micrometer;
