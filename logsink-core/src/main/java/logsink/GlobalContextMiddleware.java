package logsink;

import logsink.codec.MessageTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adds a shared set of key/value pairs to every entry's parameters. Keys the entry
 * already carries are left untouched. If the entry's template refers to an added key,
 * the message is rendered again.
 *
 * <p>The context may be changed at any time from any thread; each entry sees a
 * consistent view of individual keys, not of the whole map.
 */
public final class GlobalContextMiddleware implements LogMiddleware {
  private final Map<String, Object> context = new ConcurrentHashMap<>();

  /**
   * Sets a context value. {@code null} removes the key.
   *
   * @return this middleware
   */
  public GlobalContextMiddleware put(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      context.remove(key);
    } else {
      context.put(key, value);
    }
    return this;
  }

  public void remove(String key) {
    context.remove(key);
  }

  public void clear() {
    context.clear();
  }

  /** Copy of the current context. */
  public Map<String, Object> snapshot() {
    return Map.copyOf(context);
  }

  @Override
  public LogEntry apply(LogEntry entry) {
    if (context.isEmpty()) {
      return entry;
    }
    Map<String, Object> merged = null;
    for (Map.Entry<String, Object> e : context.entrySet()) {
      if (!entry.parameters().containsKey(e.getKey())) {
        if (merged == null) {
          merged = new LinkedHashMap<>(entry.parameters());
        }
        merged.put(e.getKey(), e.getValue());
      }
    }
    if (merged == null) {
      return entry;
    }
    boolean referenced = false;
    for (String name : MessageTemplate.of(entry.messageTemplate()).placeholderNames()) {
      if (!entry.parameters().containsKey(name) && merged.containsKey(name)) {
        referenced = true;
        break;
      }
    }
    // re-render only when the template was waiting on a context key
    return entry.toBuilder()
        .parameters(merged)
        .renderedMessage(referenced ? null : entry.renderedMessage())
        .build();
  }
}
