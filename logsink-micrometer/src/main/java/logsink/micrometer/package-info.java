/**
 * Micrometer bridge for sink metrics.
 *
 * @see logsink.micrometer.MicrometerMetricsExporter
 */
package logsink.micrometer;
