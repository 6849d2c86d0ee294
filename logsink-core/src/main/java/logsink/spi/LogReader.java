package logsink.spi;

import logsink.LogEntry;
import logsink.LogQuery;

import java.util.List;

/**
 * Read-only query surface over stored entries. Never mutates the store.
 *
 * <p>Decoding is per field: a malformed stored value yields an empty or default
 * value for that field, never a failed row.
 *
 * @see logsink.jdbc.H2LogReader
 */
public interface LogReader {

    long getEntryCount();

    /**
     * Size of the backing database file.
     *
     * @return bytes on disk, or {@code 0} for stores without a file
     */
    long getDatabaseFileSize();

    /**
     * @return all entries in id order
     */
    List<LogEntry> getAllEntries();

    List<LogEntry> getEntries(LogQuery query);

    /**
     * Returns the most recent entries.
     *
     * @param count maximum entries to return
     * @return entries, newest first
     */
    List<LogEntry> getRecentEntries(int count);

    /**
     * Returns entries whose named parameter {@code key} equals {@code value},
     * compared by string form.
     *
     * @param key   parameter name
     * @param value expected value
     * @return matching entries in id order
     */
    List<LogEntry> getEntriesByParameter(String key, Object value);
}
