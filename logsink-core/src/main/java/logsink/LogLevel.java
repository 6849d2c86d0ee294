package logsink;

/**
 * Ordered severity of a log entry. The numeric {@linkplain #code() code} is what
 * gets persisted; ordering follows the declaration order.
 */
public enum LogLevel {
  TRACE(0),
  DEBUG(1),
  INFORMATION(2),
  WARNING(3),
  ERROR(4),
  CRITICAL(5),
  /** Disables logging when used as a minimum level. Never written by {@link SinkLogger}. */
  NONE(6);

  private static final LogLevel[] BY_CODE = values();

  private final int code;

  LogLevel(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isAtLeast(LogLevel other) {
    return compareTo(other) >= 0;
  }

  /**
   * Resolves a stored code. Unknown codes map to {@link #NONE} rather than failing,
   * so rows written by a newer schema revision still decode.
   *
   * @param code the persisted code
   * @return the matching level, or {@link #NONE}
   */
  public static LogLevel fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      return NONE;
    }
    return BY_CODE[code];
  }
}
