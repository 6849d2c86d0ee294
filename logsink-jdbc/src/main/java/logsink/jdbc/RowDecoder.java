package logsink.jdbc;

import logsink.LogEntry;
import logsink.LogLevel;
import logsink.codec.ExceptionCodec;
import logsink.codec.JsonCodec;
import logsink.model.SerializedException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps rows selected with {@link SchemaCatalog#selectSql()} back to {@link LogEntry}
 * instances, reading every column by its catalog ordinal.
 *
 * <p>Malformed values in the parameter, scope and exception columns decode to an
 * empty value for that field; the rest of the row is still returned.
 */
public final class RowDecoder implements JdbcTemplate.RowMapper<LogEntry> {
  private static final Logger logger = Logger.getLogger(RowDecoder.class.getName());

  private final JsonCodec json;
  private final ExceptionCodec exceptions;

  public RowDecoder(JsonCodec json, ExceptionCodec exceptions) {
    this.json = Objects.requireNonNull(json, "json");
    this.exceptions = Objects.requireNonNull(exceptions, "exceptions");
  }

  @Override
  public LogEntry map(ResultSet rs) throws SQLException {
    long id = rs.getLong(SchemaCatalog.ordinalOf(LogColumn.ID));
    String template = rs.getString(SchemaCatalog.ordinalOf(LogColumn.MESSAGE_TEMPLATE));
    String rendered = rs.getString(SchemaCatalog.ordinalOf(LogColumn.RENDERED_MESSAGE));
    return LogEntry.builder(LogLevel.fromCode(rs.getInt(SchemaCatalog.ordinalOf(LogColumn.LOG_LEVEL))))
        .id(id)
        .timestamp(timestamp(rs))
        .category(rs.getString(SchemaCatalog.ordinalOf(LogColumn.CATEGORY)))
        .eventId(rs.getInt(SchemaCatalog.ordinalOf(LogColumn.EVENT_ID)))
        .eventName(rs.getString(SchemaCatalog.ordinalOf(LogColumn.EVENT_NAME)))
        .threadId(rs.getLong(SchemaCatalog.ordinalOf(LogColumn.THREAD_ID)))
        .messageTemplate(template)
        .renderedMessage(rendered != null ? rendered : "")
        .parameters(parameters(id, rs.getString(SchemaCatalog.ordinalOf(LogColumn.PROPERTIES))))
        .scopes(scopes(id, rs.getString(SchemaCatalog.ordinalOf(LogColumn.SCOPES))))
        .exception(exception(id, rs.getString(SchemaCatalog.ordinalOf(LogColumn.EXCEPTION))))
        .build();
  }

  private static Instant timestamp(ResultSet rs) throws SQLException {
    OffsetDateTime value = rs.getObject(SchemaCatalog.ordinalOf(LogColumn.LOGGED_AT), OffsetDateTime.class);
    return value != null ? value.toInstant() : Instant.EPOCH;
  }

  private Map<String, Object> parameters(long id, String text) {
    try {
      return json.readParameters(text);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Unreadable parameters in row " + id, e);
      return Collections.emptyMap();
    }
  }

  private List<Map<String, Object>> scopes(long id, String text) {
    try {
      return json.readScopes(text);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Unreadable scopes in row " + id, e);
      return Collections.emptyList();
    }
  }

  private SerializedException exception(long id, String text) {
    try {
      return exceptions.decode(text);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Unreadable exception in row " + id, e);
      return null;
    }
  }
}
