package logsink.jdbc;

import logsink.LogEntry;
import logsink.codec.ExceptionCodec;
import logsink.codec.JsonCodec;
import logsink.spi.LogStore;
import logsink.spi.PreparedBatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@link LogStore} over the H2 log table. Every statement runs through the
 * {@link ConnectionGuard}, so inserts and deletes are serialized on one connection.
 */
public final class H2LogStore implements LogStore {
  static final int ID_CHUNK_SIZE = 500;

  private static final String DELETE_ALL = "DELETE FROM " + SchemaCatalog.TABLE;
  private static final String DELETE_OLDER_THAN = "DELETE FROM " + SchemaCatalog.TABLE
      + " WHERE " + LogColumn.LOGGED_AT.columnName() + " < ?";
  private static final String DELETE_EXCEEDING = "DELETE FROM " + SchemaCatalog.TABLE
      + " WHERE " + LogColumn.ID.columnName() + " <= (SELECT " + LogColumn.ID.columnName()
      + " FROM " + SchemaCatalog.TABLE + " ORDER BY " + LogColumn.ID.columnName()
      + " DESC OFFSET ? ROWS FETCH NEXT 1 ROWS ONLY)";

  private final ConnectionGuard guard;
  private final JsonCodec json;
  private final ExceptionCodec exceptions;

  public H2LogStore(ConnectionGuard guard) {
    this(guard, JsonCodec.getDefault(), ExceptionCodec.getDefault());
  }

  public H2LogStore(ConnectionGuard guard, JsonCodec json, ExceptionCodec exceptions) {
    this.guard = Objects.requireNonNull(guard, "guard");
    this.json = Objects.requireNonNull(json, "json");
    this.exceptions = Objects.requireNonNull(exceptions, "exceptions");
  }

  @Override
  public void insertBatch(List<LogEntry> entries) {
    PreparedBatch batch = prepare(entries);
    if (!batch.rejected().isEmpty()) {
      throw batch.rejected().get(0).error();
    }
    insertPrepared(batch);
  }

  /**
   * Encodes each entry into its column values. An entry whose parameters, scopes or
   * exception cannot be serialized is rejected alone.
   */
  @Override
  public PreparedBatch prepare(List<LogEntry> entries) {
    List<LogEntry> encoded = new ArrayList<>(entries.size());
    List<Object[]> rows = new ArrayList<>(entries.size());
    List<PreparedBatch.Rejection> rejected = new ArrayList<>();
    for (LogEntry entry : entries) {
      try {
        rows.add(toRow(entry));
        encoded.add(entry);
      } catch (RuntimeException e) {
        rejected.add(new PreparedBatch.Rejection(entry, e));
      }
    }
    return new RowBatch(encoded, rejected, rows);
  }

  @Override
  public void insertPrepared(PreparedBatch batch) {
    if (!(batch instanceof RowBatch)) {
      insertBatch(batch.entries());
      return;
    }
    List<Object[]> rows = ((RowBatch) batch).rows;
    if (rows.isEmpty()) {
      return;
    }
    guard.inTransaction(conn -> JdbcTemplate.batch(conn, SchemaCatalog.insertSql(), rows));
  }

  Object[] toRow(LogEntry entry) {
    List<LogColumn> columns = SchemaCatalog.insertableColumns();
    Object[] row = new Object[columns.size()];
    for (LogColumn column : columns) {
      row[SchemaCatalog.insertOrdinalOf(column) - 1] = valueOf(column, entry);
    }
    return row;
  }

  private Object valueOf(LogColumn column, LogEntry entry) {
    switch (column) {
      case LOGGED_AT:
        return entry.timestamp();
      case LOG_LEVEL:
        return entry.level().code();
      case CATEGORY:
        return entry.category();
      case EVENT_ID:
        return entry.eventId();
      case EVENT_NAME:
        return entry.eventName();
      case THREAD_ID:
        return entry.threadId();
      case MESSAGE_TEMPLATE:
        return entry.messageTemplate();
      case RENDERED_MESSAGE:
        return entry.renderedMessage();
      case PROPERTIES:
        return json.writeParameters(entry.parameters());
      case SCOPES:
        return json.writeScopes(entry.scopes());
      case EXCEPTION:
        return exceptions.encode(entry.exception());
      default:
        throw new IllegalArgumentException("Column is not insertable: " + column.columnName());
    }
  }

  @Override
  public int deleteAll() {
    return guard.withWriteAccess(conn -> JdbcTemplate.update(conn, DELETE_ALL));
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    return guard.withWriteAccess(conn -> JdbcTemplate.update(conn, DELETE_OLDER_THAN, cutoff));
  }

  @Override
  public int deleteExceedingCount(long maxRows) {
    if (maxRows < 0) {
      throw new IllegalArgumentException("maxRows must be >= 0");
    }
    if (maxRows == 0) {
      return deleteAll();
    }
    return guard.withWriteAccess(conn -> JdbcTemplate.update(conn, DELETE_EXCEEDING, maxRows));
  }

  @Override
  public int deleteByIds(long... ids) {
    if (ids.length == 0) {
      return 0;
    }
    return guard.inTransaction(conn -> {
      int deleted = 0;
      for (int from = 0; from < ids.length; from += ID_CHUNK_SIZE) {
        int to = Math.min(ids.length, from + ID_CHUNK_SIZE);
        Object[] params = new Object[to - from];
        for (int i = from; i < to; i++) {
          params[i - from] = ids[i];
        }
        deleted += JdbcTemplate.update(conn, "DELETE FROM " + SchemaCatalog.TABLE
            + " WHERE " + LogColumn.ID.columnName() + " IN (" + placeholders(params.length) + ")", params);
      }
      return deleted;
    });
  }

  static String placeholders(int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }

  private static final class RowBatch extends PreparedBatch {
    private final List<Object[]> rows;

    RowBatch(List<LogEntry> entries, List<Rejection> rejected, List<Object[]> rows) {
      super(entries, rejected);
      this.rows = Collections.unmodifiableList(rows);
    }
  }
}
