package logsink.spi;

import logsink.LogEntry;

import java.util.List;
import java.util.Objects;

/**
 * Entries already encoded for one insert, produced by {@link LogStore#prepare(List)}.
 *
 * <p>Entries that could not be encoded are listed in {@link #rejected()} and take no
 * part in the insert. Stores subclass this to carry their encoded rows.
 */
public class PreparedBatch {

    private final List<LogEntry> entries;
    private final List<Rejection> rejected;

    protected PreparedBatch(List<LogEntry> entries, List<Rejection> rejected) {
        this.entries = List.copyOf(entries);
        this.rejected = List.copyOf(rejected);
    }

    /**
     * Wraps entries that need no encoding.
     */
    public static PreparedBatch of(List<LogEntry> entries) {
        return new PreparedBatch(entries, List.of());
    }

    public static PreparedBatch of(List<LogEntry> entries, List<Rejection> rejected) {
        return new PreparedBatch(entries, rejected);
    }

    /** Entries to insert, in order. */
    public List<LogEntry> entries() {
        return entries;
    }

    public List<Rejection> rejected() {
        return rejected;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * An entry that failed to encode.
     *
     * @param entry the entry
     * @param error the encoding failure
     */
    public record Rejection(LogEntry entry, RuntimeException error) {

        public Rejection {
            Objects.requireNonNull(entry, "entry");
            Objects.requireNonNull(error, "error");
        }
    }
}
