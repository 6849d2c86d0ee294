package logsink;

import logsink.codec.MessageTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Producer-facing logger for one category, obtained from {@link LogSink#logger(String)}.
 *
 * <p>Positional arguments bind, in order, to the distinct placeholder names of the
 * template; arguments beyond the placeholders are stored as {@code arg<index>}.
 * Calls below the minimum level return before any entry is built.
 *
 * <pre>{@code
 * SinkLogger log = sink.logger("Orders");
 * log.info("Order {OrderId} shipped to {City}", 42, "Oslo");
 * // parameters: OrderId=42, City=Oslo
 * }</pre>
 */
public final class SinkLogger {
  private final LogSink sink;
  private final String category;
  private final LogLevel minimumLevel;

  SinkLogger(LogSink sink, String category, LogLevel minimumLevel) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.category = Objects.requireNonNull(category, "category");
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
  }

  public String category() {
    return category;
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  /**
   * Returns a logger for the same category with a different minimum level.
   */
  public SinkLogger withMinimumLevel(LogLevel level) {
    return new SinkLogger(sink, category, level);
  }

  public boolean isEnabled(LogLevel level) {
    return level != LogLevel.NONE && minimumLevel != LogLevel.NONE && level.isAtLeast(minimumLevel);
  }

  public boolean trace(String template, Object... args) {
    return log(LogLevel.TRACE, 0, null, null, template, args);
  }

  public boolean debug(String template, Object... args) {
    return log(LogLevel.DEBUG, 0, null, null, template, args);
  }

  public boolean info(String template, Object... args) {
    return log(LogLevel.INFORMATION, 0, null, null, template, args);
  }

  public boolean warn(String template, Object... args) {
    return log(LogLevel.WARNING, 0, null, null, template, args);
  }

  public boolean warn(Throwable error, String template, Object... args) {
    return log(LogLevel.WARNING, 0, null, error, template, args);
  }

  public boolean error(String template, Object... args) {
    return log(LogLevel.ERROR, 0, null, null, template, args);
  }

  public boolean error(Throwable error, String template, Object... args) {
    return log(LogLevel.ERROR, 0, null, error, template, args);
  }

  public boolean critical(String template, Object... args) {
    return log(LogLevel.CRITICAL, 0, null, null, template, args);
  }

  public boolean critical(Throwable error, String template, Object... args) {
    return log(LogLevel.CRITICAL, 0, null, error, template, args);
  }

  /**
   * Logs an entry with positional arguments.
   *
   * @return {@code true} if the entry was accepted by the sink; {@code false} if it was
   *     filtered, suppressed by middleware or discarded by the overflow policy
   * @throws IllegalStateException if the sink has been closed
   */
  public boolean log(LogLevel level, int eventId, String eventName, Throwable error,
      String template, Object... args) {
    if (!isEnabled(level)) {
      return false;
    }
    String text = template == null ? "" : template;
    return log(level, eventId, eventName, error, text, bind(text, args));
  }

  /**
   * Logs an entry with named parameters.
   *
   * @return {@code true} if the entry was accepted by the sink
   * @throws IllegalStateException if the sink has been closed
   */
  public boolean log(LogLevel level, int eventId, String eventName, Throwable error,
      String template, Map<String, Object> parameters) {
    if (!isEnabled(level)) {
      return false;
    }
    LogEntry entry = LogEntry.builder(level)
        .timestamp(sink.clock().instant())
        .category(category)
        .eventId(eventId)
        .eventName(eventName)
        .messageTemplate(template)
        .parameters(parameters)
        .scopes(sink.scopes().current())
        .exception(error)
        .build();
    return sink.enqueue(entry);
  }

  static Map<String, Object> bind(String template, Object[] args) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    if (args == null || args.length == 0) {
      return parameters;
    }
    List<String> names = MessageTemplate.of(template).placeholderNames();
    for (int i = 0; i < args.length; i++) {
      String name = i < names.size() ? names.get(i) : "arg" + i;
      parameters.put(name, args[i]);
    }
    return parameters;
  }
}
