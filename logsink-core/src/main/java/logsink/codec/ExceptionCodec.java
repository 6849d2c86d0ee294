package logsink.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import logsink.model.SerializedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts throwables to {@link SerializedException} trees and those trees to and from
 * the JSON text stored in the exception column.
 *
 * <p>Chains are walked iteratively and capped at {@value #MAX_DEPTH} levels, so a cyclic
 * cause chain or a hand-crafted deeply nested document cannot loop or overflow the stack.
 */
public final class ExceptionCodec {
  public static final int MAX_DEPTH = 64;

  private static final ExceptionCodec DEFAULT = new ExceptionCodec(JacksonJsonCodec.INSTANCE);

  private final JacksonJsonCodec json;

  public ExceptionCodec(JacksonJsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public static ExceptionCodec getDefault() {
    return DEFAULT;
  }

  /**
   * Snapshots a throwable and its causes.
   *
   * @param throwable the throwable, may be {@code null}
   * @return the snapshot, or {@code null} for a {@code null} throwable
   */
  public static SerializedException flatten(Throwable throwable) {
    if (throwable == null) {
      return null;
    }
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = throwable; t != null && chain.size() < MAX_DEPTH && seen.add(t); t = t.getCause()) {
      chain.add(t);
    }
    SerializedException inner = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      inner = snapshot(chain.get(i), inner);
    }
    return inner;
  }

  private static SerializedException snapshot(Throwable t, SerializedException inner) {
    StackTraceElement[] frames = t.getStackTrace();
    String stackTrace = null;
    String source = null;
    if (frames.length > 0) {
      StringBuilder sb = new StringBuilder();
      for (StackTraceElement frame : frames) {
        sb.append("\tat ").append(frame).append('\n');
      }
      stackTrace = sb.toString();
      source = frames[0].getClassName();
    }
    Map<String, Object> data = Collections.emptyMap();
    if (t instanceof ExceptionData carrier && carrier.exceptionData() != null) {
      // null keys cannot be stored
      data = new LinkedHashMap<>(carrier.exceptionData());
      data.remove(null);
    }
    return new SerializedException(t.getClass().getName(), t.getMessage(), stackTrace, source, data, inner);
  }

  /**
   * Encodes a throwable chain.
   *
   * @return JSON text, or {@code null} for a {@code null} throwable
   */
  public String encode(Throwable throwable) {
    return encode(flatten(throwable));
  }

  /**
   * Encodes an already flattened chain.
   *
   * @return JSON text, or {@code null} for {@code null} input
   */
  public String encode(SerializedException exception) {
    if (exception == null) {
      return null;
    }
    List<SerializedException> chain = new ArrayList<>();
    for (SerializedException e = exception; e != null && chain.size() < MAX_DEPTH; e = e.inner()) {
      chain.add(e);
    }
    ObjectNode inner = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      SerializedException e = chain.get(i);
      ObjectNode node = json.mapper().createObjectNode();
      node.put("type", e.type());
      node.put("message", e.message());
      if (e.stackTrace() != null) {
        node.put("stackTrace", e.stackTrace());
      }
      if (e.source() != null) {
        node.put("source", e.source());
      }
      if (!e.data().isEmpty()) {
        node.set("data", json.toObjectNode(e.data()));
      }
      if (inner != null) {
        node.set("inner", inner);
      }
      inner = node;
    }
    return json.write(inner);
  }

  /**
   * Decodes stored exception text.
   *
   * @param text stored JSON
   * @return the decoded chain, or {@code null} for {@code null} or blank input
   * @throws IllegalArgumentException if the text is not a JSON exception document
   */
  public SerializedException decode(String text) {
    JsonNode root = json.parse(text);
    if (root == null || root.isNull()) {
      return null;
    }
    List<JsonNode> nodes = new ArrayList<>();
    for (JsonNode n = root; n != null && n.isObject() && nodes.size() < MAX_DEPTH; n = n.get("inner")) {
      nodes.add(n);
    }
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException("Expected JSON object for exception");
    }
    SerializedException inner = null;
    for (int i = nodes.size() - 1; i >= 0; i--) {
      JsonNode n = nodes.get(i);
      JsonNode data = n.get("data");
      inner = new SerializedException(
          text(n, "type", "Unknown"),
          text(n, "message", ""),
          text(n, "stackTrace", null),
          text(n, "source", null),
          data != null && data.isObject() ? json.toMap(data) : null,
          inner);
    }
    return inner;
  }

  private static String text(JsonNode node, String field, String fallback) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? fallback : value.asText();
  }
}
