/**
 * H2 file storage for the log sink.
 *
 * <p>{@link logsink.jdbc.SchemaCatalog} defines the table; {@link logsink.jdbc.ConnectionGuard}
 * owns the single writer connection; {@link logsink.jdbc.H2LogStore} and
 * {@link logsink.jdbc.H2LogReader} implement the storage SPIs on top of it.
 */
package logsink.jdbc;
