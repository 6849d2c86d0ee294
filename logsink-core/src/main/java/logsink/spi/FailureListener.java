package logsink.spi;

import logsink.LogEntry;

import java.util.List;

/**
 * Notified when the sink abandons work after exhausting retries. Callbacks run on
 * the background thread that gave up; they must not block.
 */
public interface FailureListener {

    FailureListener NOOP = (entries, error) -> {
    };

    /**
     * A batch could not be written and was dropped.
     *
     * @param entries the dropped entries
     * @param error   the last failure
     */
    void onBatchFailed(List<LogEntry> entries, Exception error);

    /**
     * An entry could not be encoded for storage and was dropped without affecting the
     * rest of its batch.
     *
     * @param entry the dropped entry
     * @param error the encoding failure
     */
    default void onEntryRejected(LogEntry entry, Exception error) {
    }

    /**
     * An automatic housekeeping sweep failed.
     *
     * @param error the last failure
     */
    default void onHousekeepingFailed(Exception error) {
    }
}
