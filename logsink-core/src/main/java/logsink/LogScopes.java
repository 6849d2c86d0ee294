package logsink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-thread stacks of contextual key/value scopes, owned by one {@link LogSink}.
 *
 * <p>{@link #begin(Map)} pushes a scope for the calling thread; closing the returned
 * handle removes it, even when handles are closed out of order. Entries created by
 * a {@link SinkLogger} capture {@link #current()}.
 *
 * <pre>{@code
 * try (LogScopes.Scope scope = sink.scopes().begin(Map.of("RequestId", id))) {
 *   logger.info("Handling request");
 * }
 * }</pre>
 */
public final class LogScopes {
  private final ThreadLocal<List<Scope>> stacks = ThreadLocal.withInitial(ArrayList::new);

  /**
   * Pushes a scope for the calling thread.
   *
   * @param values scope values; copied
   * @return a handle that removes the scope when closed
   * @throws IllegalArgumentException if {@code values} contains a {@code null} key
   */
  public Scope begin(Map<String, Object> values) {
    Objects.requireNonNull(values, "values");
    if (values.containsKey(null)) {
      throw new IllegalArgumentException("scope values cannot contain null keys");
    }
    Scope scope = new Scope(this, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    stacks.get().add(scope);
    return scope;
  }

  public Scope begin(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(key, value);
    return begin(values);
  }

  /**
   * Returns the calling thread's active scopes, outermost first.
   *
   * @return an immutable snapshot, empty when no scope is active
   */
  public List<Map<String, Object>> current() {
    List<Scope> stack = stacks.get();
    if (stack.isEmpty()) {
      return Collections.emptyList();
    }
    List<Map<String, Object>> values = new ArrayList<>(stack.size());
    for (Scope scope : stack) {
      values.add(scope.values);
    }
    return Collections.unmodifiableList(values);
  }

  private void remove(Scope scope) {
    List<Scope> stack = stacks.get();
    for (int i = stack.size() - 1; i >= 0; i--) {
      if (stack.get(i) == scope) {
        stack.remove(i);
        break;
      }
    }
    if (stack.isEmpty()) {
      stacks.remove();
    }
  }

  /**
   * Handle for an active scope. Must be closed on the thread that opened it.
   */
  public static final class Scope implements AutoCloseable {
    private final LogScopes owner;
    private final Map<String, Object> values;
    private boolean closed;

    private Scope(LogScopes owner, Map<String, Object> values) {
      this.owner = owner;
      this.values = values;
    }

    public Map<String, Object> values() {
      return values;
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        owner.remove(this);
      }
    }
  }
}
