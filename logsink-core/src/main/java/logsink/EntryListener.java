package logsink;

/**
 * Callback for entries accepted by a {@link LogSink}, invoked on the producer thread
 * after the entry is buffered. Implementations must be fast and thread-safe; failures
 * are logged and ignored.
 *
 * @see RecentEntriesBuffer
 */
@FunctionalInterface
public interface EntryListener {

  void onEntry(LogEntry entry);
}
