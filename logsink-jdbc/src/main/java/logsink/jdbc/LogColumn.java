package logsink.jdbc;

/**
 * Columns of the log table, in table order. {@link SchemaCatalog} derives every
 * statement from this declaration.
 */
public enum LogColumn {
  ID("id", "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY", false, true),
  LOGGED_AT("logged_at", "TIMESTAMP(9) WITH TIME ZONE NOT NULL", true, false),
  LOG_LEVEL("log_level", "INT NOT NULL", true, false),
  CATEGORY("category", "VARCHAR(1024)", true, false),
  EVENT_ID("event_id", "INT NOT NULL", true, false),
  EVENT_NAME("event_name", "VARCHAR(1024)", true, false),
  THREAD_ID("thread_id", "BIGINT NOT NULL", true, false),
  MESSAGE_TEMPLATE("message_template", "VARCHAR", true, false),
  RENDERED_MESSAGE("rendered_message", "VARCHAR", true, false),
  PROPERTIES("properties", "CLOB", true, false),
  SCOPES("scopes", "CLOB", true, false),
  EXCEPTION("exception", "CLOB", true, false);

  private final String columnName;
  private final String sqlType;
  private final boolean insertable;
  private final boolean autoGenerated;

  LogColumn(String columnName, String sqlType, boolean insertable, boolean autoGenerated) {
    this.columnName = columnName;
    this.sqlType = sqlType;
    this.insertable = insertable;
    this.autoGenerated = autoGenerated;
  }

  public String columnName() {
    return columnName;
  }

  /** Column type and constraints as used in {@code CREATE TABLE}. */
  public String sqlType() {
    return sqlType;
  }

  /** Whether the column appears in {@code INSERT} statements. */
  public boolean insertable() {
    return insertable;
  }

  /** Whether the database assigns the value. */
  public boolean autoGenerated() {
    return autoGenerated;
  }
}
