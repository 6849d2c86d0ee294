package logsink.codec;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON text columns of a log entry: named parameters and the scope chain.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by Jackson.
 * Encoding never fails on an individual value; values Jackson cannot serialize are
 * stored as their {@code toString()} form.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes named parameters as a JSON object. Returns {@code null} if the map is null or empty.
   *
   * @param parameters the parameters to encode
   * @return JSON string, or {@code null}
   */
  String writeParameters(Map<String, Object> parameters);

  /**
   * Parses a JSON object into a parameter map. Returns an empty map for {@code null},
   * blank, or {@code "null"} input.
   *
   * @param json the stored JSON
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, Object> readParameters(String json);

  /**
   * Encodes a scope chain (outermost first) as a JSON array of objects. Returns
   * {@code null} if the chain is null or empty.
   *
   * @param scopes the scope chain
   * @return JSON string, or {@code null}
   */
  String writeScopes(List<Map<String, Object>> scopes);

  /**
   * Parses a stored scope chain. Returns an empty list for {@code null} or blank input.
   * A single JSON object is accepted as a one-element chain.
   *
   * @param json the stored JSON
   * @return parsed chain (never {@code null})
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  List<Map<String, Object>> readScopes(String json);
}
