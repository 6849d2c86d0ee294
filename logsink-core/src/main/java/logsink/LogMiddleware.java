package logsink;

/**
 * Transforms entries before they enter the write buffer. Middleware registered on a
 * {@link LogSink} runs on the producer thread, in registration order.
 *
 * <p>A middleware that throws is skipped for that entry.
 */
@FunctionalInterface
public interface LogMiddleware {

  /**
   * @param entry the entry produced so far
   * @return the entry to pass on, or {@code null} to suppress it
   */
  LogEntry apply(LogEntry entry);
}
