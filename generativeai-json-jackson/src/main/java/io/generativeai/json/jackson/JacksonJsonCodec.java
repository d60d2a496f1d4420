package io.generativeai.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.generativeai.json.spi.JsonCodec;
import io.generativeai.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Applies the wire conventions of the generative language API on top of a plain {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * The mapper is used as is; start from {@link #defaultMapper()} to keep the wire conventions.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns a mapper configured with the wire naming table, omit-null output, lenient unknown fields,
     * {@code UNKNOWN} enum fallback and the part codec.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .propertyNamingStrategy(new WireNamingStrategy())
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .addHandler(new UnknownEnumValueHandler())
                .addModule(new GenerativeAIModule())
                .build();
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value) + " to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value) + " to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot deserialize empty data to " + type.getName());
        }
        try {
            return requireValue(mapper.readValue(data, type), type);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot deserialize empty string to " + type.getName());
        }
        try {
            return requireValue(mapper.readValue(json, type), type);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    @Override
    public Object readEither(byte[] data, Class<?> type, String discriminator, Class<?> alternative) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot deserialize empty data to " + type.getName());
        }
        Class<?> target = type;
        try {
            JsonNode tree = mapper.readTree(data);
            if (tree != null && tree.hasNonNull(discriminator)) {
                target = alternative;
            }
            return bind(tree, target);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + target.getName(), e);
        }
    }

    private <T> T bind(JsonNode tree, Class<T> type) throws JsonProcessingException, JsonException {
        return requireValue(mapper.treeToValue(tree, type), type);
    }

    // a literal JSON null decodes to null, which no caller can use
    private static <T> T requireValue(T value, Class<T> type) throws JsonException {
        if (value == null) {
            throw new JsonException("JSON null is not a valid " + type.getName());
        }
        return value;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
