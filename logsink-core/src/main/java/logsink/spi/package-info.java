/**
 * Service provider interfaces implemented by storage back ends and monitoring bridges.
 *
 * <p>{@link logsink.spi.LogStore} and {@link logsink.spi.LogReader} are implemented by
 * the JDBC module; {@link logsink.spi.MetricsExporter} by the Micrometer module.
 */
package logsink.spi;
