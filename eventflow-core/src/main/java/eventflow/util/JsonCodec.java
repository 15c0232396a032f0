package eventflow.util;

import java.util.Map;

/**
 * JSON conversion used for event payloads, saga data and the bus wire format.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by Jackson with
 * Java time support. Applications that configure their own {@code ObjectMapper} can
 * wrap it with {@link JacksonJsonCodec#JacksonJsonCodec(com.fasterxml.jackson.databind.ObjectMapper)}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the shared default codec.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Serializes a value (typically a payload record or a map) to a JSON string.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Object value);

    /**
     * Deserializes a JSON string into the given type.
     *
     * @throws IllegalArgumentException if the input is not valid for {@code type}
     */
    <T> T fromJson(String json, Class<T> type);

    /**
     * Parses a flat JSON object into a string map. Returns an empty map for {@code null},
     * empty or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, String> parseStringMap(String json);
}
