package logsink.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single definition of the log table. The create, insert, select and delete statements
 * and the ordinals used to read result sets are all derived from {@link LogColumn}.
 *
 * <p>{@link #SCHEMA_VERSION} is part of the database file name (see {@link DatabaseFiles}),
 * so an incompatible change to the column set starts a new file instead of migrating
 * an old one.
 */
public final class SchemaCatalog {
  public static final int SCHEMA_VERSION = 1;
  public static final String TABLE = "log_entry";

  private static final List<LogColumn> COLUMNS = List.of(LogColumn.values());
  private static final List<LogColumn> INSERTABLE = COLUMNS.stream()
      .filter(LogColumn::insertable)
      .collect(Collectors.toUnmodifiableList());
  private static final Map<LogColumn, Integer> SELECT_ORDINALS = ordinals(COLUMNS);
  private static final Map<LogColumn, Integer> INSERT_ORDINALS = ordinals(INSERTABLE);

  private static final String CREATE_TABLE = buildCreateTable();
  private static final String INSERT = "INSERT INTO " + TABLE + " (" + join(INSERTABLE) + ") VALUES ("
      + String.join(", ", Collections.nCopies(INSERTABLE.size(), "?")) + ")";
  private static final String SELECT = "SELECT " + join(COLUMNS) + " FROM " + TABLE;

  private SchemaCatalog() {}

  private static Map<LogColumn, Integer> ordinals(List<LogColumn> columns) {
    Map<LogColumn, Integer> ordinals = new EnumMap<>(LogColumn.class);
    for (int i = 0; i < columns.size(); i++) {
      ordinals.put(columns.get(i), i + 1);
    }
    return Collections.unmodifiableMap(ordinals);
  }

  private static String join(List<LogColumn> columns) {
    return columns.stream().map(LogColumn::columnName).collect(Collectors.joining(", "));
  }

  private static String buildCreateTable() {
    StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(TABLE).append(" (");
    for (int i = 0; i < COLUMNS.size(); i++) {
      LogColumn column = COLUMNS.get(i);
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(column.columnName()).append(' ').append(column.sqlType());
    }
    return sb.append(')').toString();
  }

  /** All columns in table order. */
  public static List<LogColumn> columns() {
    return COLUMNS;
  }

  /** Columns written by {@link #insertSql()}, in parameter order. */
  public static List<LogColumn> insertableColumns() {
    return INSERTABLE;
  }

  public static List<String> allColumnNames() {
    return COLUMNS.stream().map(LogColumn::columnName).collect(Collectors.toUnmodifiableList());
  }

  public static List<String> insertableColumnNames() {
    return INSERTABLE.stream().map(LogColumn::columnName).collect(Collectors.toUnmodifiableList());
  }

  /**
   * 1-based position of {@code column} in result sets of {@link #selectSql()}.
   */
  public static int ordinalOf(LogColumn column) {
    return SELECT_ORDINALS.get(column);
  }

  /**
   * 1-based parameter index of {@code column} in {@link #insertSql()}.
   *
   * @throws IllegalArgumentException if the column is not insertable
   */
  public static int insertOrdinalOf(LogColumn column) {
    Integer ordinal = INSERT_ORDINALS.get(column);
    if (ordinal == null) {
      throw new IllegalArgumentException("Column is not insertable: " + column.columnName());
    }
    return ordinal;
  }

  public static String createTableSql() {
    return CREATE_TABLE;
  }

  /**
   * Statements that bring an empty database to the current schema. Each is idempotent.
   */
  public static List<String> createStatements() {
    List<String> statements = new ArrayList<>();
    statements.add(CREATE_TABLE);
    statements.add("CREATE INDEX IF NOT EXISTS " + TABLE + "_" + LogColumn.LOGGED_AT.columnName()
        + "_idx ON " + TABLE + " (" + LogColumn.LOGGED_AT.columnName() + ")");
    return Collections.unmodifiableList(statements);
  }

  public static String insertSql() {
    return INSERT;
  }

  /** {@code SELECT <all columns> FROM <table>}, without a WHERE or ORDER BY clause. */
  public static String selectSql() {
    return SELECT;
  }
}
