package logsink.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the log store, reader and
 * connection guard.
 */
public final class LogStoreException extends RuntimeException {
  public LogStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
