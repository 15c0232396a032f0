package eventflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The default mapper writes {@link java.time} values as ISO-8601 strings and ignores
 * unknown properties on read, so older payload records keep decoding newer events.
 */
public final class JacksonJsonCodec implements JsonCodec {

    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultObjectMapper());

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP =
            new TypeReference<>() {
            };

    private final ObjectMapper mapper;

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns a new mapper configured the way the default codec uses it.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper objectMapper() {
        return mapper;
    }

    @Override
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + typeName(value), e);
        }
    }

    @Override
    public <T> T fromJson(String json, Class<T> type) {
        Objects.requireNonNull(type, "type");
        try {
            return mapper.readValue(json == null || json.isEmpty() ? "{}" : json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, String> parseStringMap(String json) {
        if (json == null || json.isEmpty() || "null".equals(json)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, String> map = mapper.readValue(json, STRING_MAP);
            return map == null ? new LinkedHashMap<>() : map;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Expected a flat JSON object: " + e.getOriginalMessage(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
