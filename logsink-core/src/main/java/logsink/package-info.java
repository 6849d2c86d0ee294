/**
 * Producer API of the structured log sink.
 *
 * <p>{@link logsink.LogSink} is the entry point; {@link logsink.SinkLogger} builds
 * {@link logsink.LogEntry} instances from message templates, capturing the active
 * {@link logsink.LogScopes scopes}.
 */
package logsink;
