package bugtrail.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec DEFAULT = new JacksonJsonCodec(createDefaultMapper());

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize " + value.getClass().getName() + " to JSON", e);
    }
  }

  @Override
  public <T> T fromJson(String json, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (json == null || json.isEmpty()) {
      return null;
    }
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to deserialize JSON into " + type.getSimpleName(), e);
    }
  }

  @Override
  public JsonNode readTree(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON", e);
    }
  }

  @Override
  public <T> T convert(Object value, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      return null;
    }
    return mapper.convertValue(value, type);
  }

  private static ObjectMapper createDefaultMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return mapper;
  }
}
