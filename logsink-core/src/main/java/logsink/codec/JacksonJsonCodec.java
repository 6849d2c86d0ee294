package logsink.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed {@link JsonCodec}. Accessible via {@link JsonCodec#getDefault()}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(newObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Creates the mapper used by the default codecs: ISO-8601 {@code java.time} values,
   * no failure on bean types without properties.
   */
  public static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    return mapper;
  }

  ObjectMapper mapper() {
    return mapper;
  }

  @Override
  public String writeParameters(Map<String, Object> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return null;
    }
    return write(toObjectNode(parameters));
  }

  @Override
  public Map<String, Object> readParameters(String json) {
    JsonNode node = parse(json);
    if (node == null || node.isNull()) {
      return Collections.emptyMap();
    }
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    return toMap(node);
  }

  @Override
  public String writeScopes(List<Map<String, Object>> scopes) {
    if (scopes == null || scopes.isEmpty()) {
      return null;
    }
    ArrayNode array = mapper.createArrayNode();
    for (Map<String, Object> scope : scopes) {
      array.add(toObjectNode(scope == null ? Collections.emptyMap() : scope));
    }
    return write(array);
  }

  @Override
  public List<Map<String, Object>> readScopes(String json) {
    JsonNode node = parse(json);
    if (node == null || node.isNull()) {
      return Collections.emptyList();
    }
    if (node.isObject()) {
      return List.of(toMap(node));
    }
    if (!node.isArray()) {
      throw new IllegalArgumentException("Expected JSON array of scopes");
    }
    List<Map<String, Object>> scopes = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      if (element.isObject()) {
        scopes.add(toMap(element));
      } else {
        // scopes pushed as plain values
        scopes.add(Map.of("Scope", element.isTextual() ? element.asText() : element.toString()));
      }
    }
    return Collections.unmodifiableList(scopes);
  }

  ObjectNode toObjectNode(Map<String, Object> values) {
    ObjectNode node = mapper.createObjectNode();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("parameters cannot contain null keys");
      }
      node.set(entry.getKey(), valueNode(entry.getValue()));
    }
    return node;
  }

  private JsonNode valueNode(Object value) {
    try {
      return mapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      return TextNode.valueOf(String.valueOf(value));
    }
  }

  Map<String, Object> toMap(JsonNode node) {
    return Collections.unmodifiableMap(mapper.convertValue(node, MAP_TYPE));
  }

  JsonNode parse(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  String write(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to encode JSON", e);
    }
  }
}
