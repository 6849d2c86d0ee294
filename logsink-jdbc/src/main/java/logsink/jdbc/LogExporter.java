package logsink.jdbc;

import logsink.LogEntry;
import logsink.spi.LogStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copies selected rows from one log database into another, for example to hand a
 * subset of entries to someone else as a standalone file.
 *
 * <p>Rows are copied in chunks of 500 ids; each chunk is inserted in one destination
 * transaction. Copied rows receive new ids in the destination.
 */
public final class LogExporter {
  private static final Logger logger = Logger.getLogger(LogExporter.class.getName());

  private final H2LogReader source;
  private final LogStore destination;

  public LogExporter(H2LogReader source, LogStore destination) {
    this.source = Objects.requireNonNull(source, "source");
    this.destination = Objects.requireNonNull(destination, "destination");
  }

  /**
   * Copies the rows with the given ids. Unknown ids are skipped.
   *
   * @return rows copied
   */
  public int export(long... ids) {
    Objects.requireNonNull(ids, "ids");
    long[] sorted = ids.clone();
    Arrays.sort(sorted);
    int copied = 0;
    for (int from = 0; from < sorted.length; from += H2LogStore.ID_CHUNK_SIZE) {
      long[] chunk = Arrays.copyOfRange(sorted, from, Math.min(sorted.length, from + H2LogStore.ID_CHUNK_SIZE));
      List<LogEntry> entries = source.getEntriesByIds(chunk);
      if (entries.isEmpty()) {
        continue;
      }
      List<LogEntry> copies = new ArrayList<>(entries.size());
      for (LogEntry entry : entries) {
        copies.add(entry.toBuilder().id(0).build());
      }
      destination.insertBatch(copies);
      copied += copies.size();
    }
    logger.log(Level.FINE, "Exported {0} of {1} requested rows", new Object[]{copied, ids.length});
    return copied;
  }

  /**
   * Copies every row of the source.
   *
   * @return rows copied
   */
  public int exportAll() {
    return export(source.getAllIds());
  }
}
