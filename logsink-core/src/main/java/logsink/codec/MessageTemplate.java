package logsink.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsed structured-logging template such as {@code "Order {OrderId} shipped in {Elapsed:0.00}s"}.
 *
 * <p>{@code {{} and {@code }}} escape literal braces. A placeholder may carry a format
 * after a colon: {@link String#format} patterns when the format contains {@code %},
 * otherwise decimal patterns for numbers and {@link DateTimeFormatter} patterns for
 * {@code java.time} values. Missing keys render as {@value #MISSING}; formatting errors
 * do the same instead of failing.
 *
 * <p>Parsed templates are cached; instances are immutable and thread-safe.
 */
public final class MessageTemplate {
  public static final String MISSING = "MissingMsgParam";

  private static final int MAX_CACHED = 2048;
  private static final Map<String, MessageTemplate> CACHE = new ConcurrentHashMap<>();

  private final String text;
  private final List<Segment> segments;
  private final List<String> placeholderNames;

  private MessageTemplate(String text, List<Segment> segments) {
    this.text = text;
    this.segments = segments;
    List<String> names = new ArrayList<>();
    for (Segment segment : segments) {
      if (segment.key != null && !names.contains(segment.key)) {
        names.add(segment.key);
      }
    }
    this.placeholderNames = Collections.unmodifiableList(names);
  }

  /**
   * Returns the parsed form of {@code template}, from the cache when available.
   */
  public static MessageTemplate of(String template) {
    Objects.requireNonNull(template, "template");
    MessageTemplate cached = CACHE.get(template);
    if (cached != null) {
      return cached;
    }
    MessageTemplate parsed = new MessageTemplate(template, parse(template));
    if (CACHE.size() >= MAX_CACHED) {
      CACHE.clear();
    }
    CACHE.putIfAbsent(template, parsed);
    return parsed;
  }

  /**
   * Renders {@code template} with {@code parameters}. A {@code null} parameter map
   * returns the template unchanged.
   */
  public static String format(String template, Map<String, Object> parameters) {
    if (template == null) {
      return "";
    }
    if (parameters == null) {
      return template;
    }
    return of(template).render(parameters);
  }

  public String text() {
    return text;
  }

  /** Distinct placeholder names in order of first appearance. */
  public List<String> placeholderNames() {
    return placeholderNames;
  }

  public String render(Map<String, Object> parameters) {
    StringBuilder sb = new StringBuilder(text.length() + 32);
    for (Segment segment : segments) {
      if (segment.key == null) {
        sb.append(segment.literal);
      } else {
        appendValue(sb, segment, parameters);
      }
    }
    return sb.toString();
  }

  private static void appendValue(StringBuilder sb, Segment segment, Map<String, Object> parameters) {
    if (parameters == null || !parameters.containsKey(segment.key)) {
      sb.append(MISSING);
      return;
    }
    Object value = parameters.get(segment.key);
    if (value == null) {
      sb.append("null");
      return;
    }
    try {
      sb.append(segment.format == null ? String.valueOf(value) : formatted(value, segment.format));
    } catch (RuntimeException e) {
      sb.append(MISSING);
    }
  }

  private static String formatted(Object value, String format) {
    if (format.indexOf('%') >= 0) {
      return String.format(Locale.ROOT, format, value);
    }
    if (value instanceof TemporalAccessor temporal) {
      return DateTimeFormatter.ofPattern(format, Locale.ROOT).withZone(ZoneOffset.UTC).format(temporal);
    }
    if (value instanceof Number number) {
      DecimalFormat decimal = new DecimalFormat(format, DecimalFormatSymbols.getInstance(Locale.ROOT));
      if (number instanceof BigDecimal || number instanceof BigInteger) {
        return decimal.format(number);
      }
      return number instanceof Double || number instanceof Float
          ? decimal.format(number.doubleValue()) : decimal.format(number.longValue());
    }
    return String.valueOf(value);
  }

  private static List<Segment> parse(String template) {
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int pos = 0;
    int len = template.length();
    while (pos < len) {
      char c = template.charAt(pos);
      if (c == '{') {
        if (pos + 1 < len && template.charAt(pos + 1) == '{') {
          literal.append('{');
          pos += 2;
          continue;
        }
        int end = template.indexOf('}', pos + 1);
        if (end < 0) {
          // unterminated placeholder stays literal
          literal.append(template, pos, len);
          break;
        }
        if (literal.length() > 0) {
          segments.add(Segment.literal(literal.toString()));
          literal.setLength(0);
        }
        String content = template.substring(pos + 1, end);
        int colon = content.indexOf(':');
        if (colon >= 0) {
          segments.add(Segment.placeholder(content.substring(0, colon).trim(), content.substring(colon + 1).trim()));
        } else {
          segments.add(Segment.placeholder(content.trim(), null));
        }
        pos = end + 1;
      } else if (c == '}') {
        literal.append('}');
        pos += (pos + 1 < len && template.charAt(pos + 1) == '}') ? 2 : 1;
      } else {
        literal.append(c);
        pos++;
      }
    }
    if (literal.length() > 0) {
      segments.add(Segment.literal(literal.toString()));
    }
    return List.copyOf(segments);
  }

  private static final class Segment {
    private final String literal;
    private final String key;
    private final String format;

    private Segment(String literal, String key, String format) {
      this.literal = literal;
      this.key = key;
      this.format = format == null || format.isEmpty() ? null : format;
    }

    static Segment literal(String text) {
      return new Segment(text, null, null);
    }

    static Segment placeholder(String key, String format) {
      return new Segment(null, key, format);
    }
  }

  @Override
  public String toString() {
    return text;
  }
}
