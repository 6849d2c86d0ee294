package logsink.spi;

import logsink.LogEntry;

import java.time.Instant;
import java.util.List;

/**
 * Write side of the log table: batch inserts and row deletion.
 *
 * <p>Implementations serialize all calls against the single writable connection.
 * Every method either applies completely or not at all; failures surface as
 * unchecked exceptions.
 *
 * @see logsink.jdbc.H2LogStore
 */
public interface LogStore {

    /**
     * Inserts all entries in one transaction.
     *
     * @param entries entries to insert, in order
     * @throws IllegalArgumentException if an entry cannot be encoded; nothing is inserted
     */
    void insertBatch(List<LogEntry> entries);

    /**
     * Encodes entries ahead of {@link #insertPrepared}. Called once per batch before the
     * first insert attempt, so an entry that cannot be encoded is rejected on its own
     * instead of failing every attempt for the whole batch.
     *
     * @param entries entries to encode, in order
     * @return the encodable entries and the rejected ones
     */
    default PreparedBatch prepare(List<LogEntry> entries) {
        return PreparedBatch.of(entries);
    }

    /**
     * Inserts a batch from {@link #prepare} in one transaction. May be called again for
     * the same batch when an attempt fails.
     *
     * @param batch the prepared batch
     */
    default void insertPrepared(PreparedBatch batch) {
        insertBatch(batch.entries());
    }

    /**
     * Deletes every row.
     *
     * @return rows deleted
     */
    int deleteAll();

    /**
     * Deletes rows whose timestamp is strictly before {@code cutoff}.
     *
     * @param cutoff the exclusive upper bound
     * @return rows deleted
     */
    int deleteOlderThan(Instant cutoff);

    /**
     * Deletes all rows except the {@code maxRows} with the highest ids.
     *
     * @param maxRows rows to keep (&ge; 0)
     * @return rows deleted
     */
    int deleteExceedingCount(long maxRows);

    /**
     * Deletes rows by id, in one transaction.
     *
     * @param ids row ids
     * @return rows deleted
     */
    int deleteByIds(long... ids);
}
