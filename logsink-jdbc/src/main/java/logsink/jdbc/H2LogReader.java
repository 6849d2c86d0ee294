package logsink.jdbc;

import logsink.LogEntry;
import logsink.LogQuery;
import logsink.codec.ExceptionCodec;
import logsink.codec.JsonCodec;
import logsink.spi.LogReader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LogReader} over the H2 log table. Queries run on the guard's read connections
 * and never modify the table.
 */
public final class H2LogReader implements LogReader {
  private static final String ID = LogColumn.ID.columnName();
  private static final String COUNT = "SELECT COUNT(*) FROM " + SchemaCatalog.TABLE;
  private static final String SELECT_IDS = "SELECT " + ID + " FROM " + SchemaCatalog.TABLE + " ORDER BY " + ID;
  private static final JdbcTemplate.RowMapper<Long> ID_MAPPER = rs -> rs.getLong(1);

  private final ConnectionGuard guard;
  private final RowDecoder decoder;

  public H2LogReader(ConnectionGuard guard) {
    this(guard, JsonCodec.getDefault(), ExceptionCodec.getDefault());
  }

  public H2LogReader(ConnectionGuard guard, JsonCodec json, ExceptionCodec exceptions) {
    this.guard = Objects.requireNonNull(guard, "guard");
    this.decoder = new RowDecoder(json, exceptions);
  }

  @Override
  public long getEntryCount() {
    return guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));
  }

  @Override
  public long getDatabaseFileSize() {
    return guard.databaseFileSize();
  }

  @Override
  public List<LogEntry> getAllEntries() {
    return select(" ORDER BY " + ID);
  }

  @Override
  public List<LogEntry> getRecentEntries(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0");
    }
    if (count == 0) {
      return List.of();
    }
    return select(" ORDER BY " + ID + " DESC FETCH FIRST ? ROWS ONLY", count);
  }

  @Override
  public List<LogEntry> getEntries(LogQuery query) {
    Objects.requireNonNull(query, "query");
    StringBuilder sql = new StringBuilder();
    List<Object> params = new ArrayList<>();
    String conjunction = " WHERE ";
    if (query.minLevel() != null) {
      sql.append(conjunction).append(LogColumn.LOG_LEVEL.columnName()).append(" >= ?");
      params.add(query.minLevel().code());
      conjunction = " AND ";
    }
    if (query.category() != null) {
      sql.append(conjunction).append(LogColumn.CATEGORY.columnName()).append(" = ?");
      params.add(query.category());
      conjunction = " AND ";
    }
    if (query.from() != null) {
      sql.append(conjunction).append(LogColumn.LOGGED_AT.columnName()).append(" >= ?");
      params.add(query.from());
      conjunction = " AND ";
    }
    if (query.to() != null) {
      sql.append(conjunction).append(LogColumn.LOGGED_AT.columnName()).append(" < ?");
      params.add(query.to());
      conjunction = " AND ";
    }
    if (query.messageContains() != null && !query.messageContains().isEmpty()) {
      sql.append(conjunction).append(LogColumn.RENDERED_MESSAGE.columnName()).append(" LIKE ? ESCAPE '\\'");
      params.add('%' + escapeLike(query.messageContains()) + '%');
    }
    sql.append(" ORDER BY ").append(ID).append(query.descending() ? " DESC" : " ASC");
    if (query.offset() > 0) {
      sql.append(" OFFSET ? ROWS");
      params.add(query.offset());
    }
    if (query.limit() > 0) {
      sql.append(" FETCH NEXT ? ROWS ONLY");
      params.add(query.limit());
    }
    return select(sql.toString(), params.toArray());
  }

  @Override
  public List<LogEntry> getEntriesByParameter(String key, Object value) {
    Objects.requireNonNull(key, "key");
    String expected = String.valueOf(value);
    List<LogEntry> candidates = select(" WHERE " + LogColumn.PROPERTIES.columnName()
        + " IS NOT NULL ORDER BY " + ID);
    List<LogEntry> matches = new ArrayList<>();
    for (LogEntry entry : candidates) {
      Map<String, Object> parameters = entry.parameters();
      if (parameters.containsKey(key) && expected.equals(String.valueOf(parameters.get(key)))) {
        matches.add(entry);
      }
    }
    return matches;
  }

  /**
   * Returns the rows with the given ids, in id order. Unknown ids are ignored.
   */
  public List<LogEntry> getEntriesByIds(long... ids) {
    long[] sorted = ids.clone();
    Arrays.sort(sorted);
    List<LogEntry> entries = new ArrayList<>(sorted.length);
    for (int from = 0; from < sorted.length; from += H2LogStore.ID_CHUNK_SIZE) {
      int to = Math.min(sorted.length, from + H2LogStore.ID_CHUNK_SIZE);
      Object[] params = new Object[to - from];
      for (int i = from; i < to; i++) {
        params[i - from] = sorted[i];
      }
      entries.addAll(select(" WHERE " + ID + " IN (" + H2LogStore.placeholders(params.length)
          + ") ORDER BY " + ID, params));
    }
    return entries;
  }

  /**
   * Returns every row id in ascending order without decoding the rows.
   */
  public long[] getAllIds() {
    List<Long> ids = guard.withReadConnection(conn -> JdbcTemplate.query(conn, SELECT_IDS, ID_MAPPER));
    long[] result = new long[ids.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = ids.get(i);
    }
    return result;
  }

  private List<LogEntry> select(String clauses, Object... params) {
    String sql = SchemaCatalog.selectSql() + clauses;
    return guard.withReadConnection(conn -> JdbcTemplate.query(conn, sql, decoder, params));
  }

  static String escapeLike(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '%' || c == '_' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
