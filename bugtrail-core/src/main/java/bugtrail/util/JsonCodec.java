package bugtrail.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON encoding used for job payloads, results, progress, audit details and manifests.
 *
 * <p>The default instance is backed by Jackson. Supply a custom implementation to share
 * an application-wide {@code ObjectMapper}.
 */
public interface JsonCodec {

    /**
     * Returns the shared default codec.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.DEFAULT;
    }

    /**
     * Encodes a value as compact JSON. {@code null} encodes to {@code null}.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Object value);

    /**
     * Decodes JSON into the given type. {@code null} or empty input decodes to {@code null}.
     *
     * @throws IllegalArgumentException if the JSON is malformed or does not fit the type
     */
    <T> T fromJson(String json, Class<T> type);

    /**
     * Parses JSON into a tree.
     *
     * @throws IllegalArgumentException if the JSON is malformed
     */
    JsonNode readTree(String json);

    /**
     * Converts an already-parsed value (for example a {@link JsonNode} or map) into the
     * given type.
     */
    <T> T convert(Object value, Class<T> type);
}
