package logsink.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Language-neutral snapshot of an exception and its cause chain, as persisted in the
 * exception column.
 *
 * <p>Each instance exclusively owns its {@code inner} cause; instances are never shared
 * between chains.
 *
 * @param type       fully qualified type name of the throwable
 * @param message    the message, never {@code null} (empty when the throwable had none)
 * @param stackTrace rendered stack frames, or {@code null}
 * @param source     class that raised the throwable (top stack frame), or {@code null}
 * @param data       additional key/value data attached to the throwable
 * @param inner      the serialized cause, or {@code null}
 */
public record SerializedException(
    String type,
    String message,
    String stackTrace,
    String source,
    Map<String, Object> data,
    SerializedException inner
) {

  public SerializedException {
    Objects.requireNonNull(type, "type");
    message = message == null ? "" : message;
    data = data == null || data.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    if (data.containsKey(null)) {
      throw new IllegalArgumentException("data cannot contain null keys");
    }
  }

  /**
   * Number of exceptions in this chain, including this one.
   */
  public int depth() {
    int depth = 0;
    for (SerializedException e = this; e != null; e = e.inner) {
      depth++;
    }
    return depth;
  }

  /**
   * Innermost exception of the chain (this instance when there is no cause).
   */
  public SerializedException root() {
    SerializedException e = this;
    while (e.inner != null) {
      e = e.inner;
    }
    return e;
  }
}
