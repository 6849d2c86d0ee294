package logsink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-size view of the most recently accepted entries. When full, the oldest entry
 * is dropped to make room. Register it with {@link LogSink#addEntryListener} to back
 * a live display.
 *
 * <p>This class is thread-safe.
 */
public final class RecentEntriesBuffer implements EntryListener {
  private final int capacity;
  private final Deque<LogEntry> entries;
  private long dropped;

  public RecentEntriesBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(capacity);
  }

  @Override
  public void onEntry(LogEntry entry) {
    add(entry);
  }

  public synchronized void add(LogEntry entry) {
    if (entries.size() == capacity) {
      entries.pollFirst();
      dropped++;
    }
    entries.addLast(entry);
  }

  /**
   * @return the buffered entries, oldest first
   */
  public synchronized List<LogEntry> snapshot() {
    return List.copyOf(entries);
  }

  /**
   * Removes and returns the buffered entries, oldest first.
   */
  public synchronized List<LogEntry> drain() {
    List<LogEntry> drained = new ArrayList<>(entries);
    entries.clear();
    return drained;
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  /** Entries pushed out by newer ones since creation. */
  public synchronized long droppedCount() {
    return dropped;
  }

  public synchronized void clear() {
    entries.clear();
  }
}
