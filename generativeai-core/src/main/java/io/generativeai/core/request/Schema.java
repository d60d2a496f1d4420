package io.generativeai.core.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Subset of OpenAPI schema used to describe function parameters and structured output.
 *
 * @param type value type
 * @param description free-form description
 * @param format format hint (e.g. {@code int64}, {@code enum})
 * @param nullable whether {@code null} is allowed
 * @param enumValues allowed values when {@code format} is {@code enum}; written as {@code enum}
 * @param properties members of an {@link Type#OBJECT}
 * @param required names of required members of an {@link Type#OBJECT}
 * @param items element schema of an {@link Type#ARRAY}
 */
public record Schema(
        Type type,
        String description,
        String format,
        Boolean nullable,
        List<String> enumValues,
        Map<String, Schema> properties,
        List<String> required,
        Schema items
) {
    public enum Type {
        STRING, NUMBER, INTEGER, BOOLEAN, ARRAY, OBJECT, UNKNOWN
    }

    public Schema {
        Objects.requireNonNull(type, "type");
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
        properties = properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? null : List.copyOf(required);
    }

    public static Schema of(Type type, String description) {
        return new Schema(type, description, null, null, null, null, null, null);
    }

    public static Schema enumeration(String description, List<String> values) {
        return new Schema(Type.STRING, description, "enum", null, values, null, null, null);
    }

    public static Schema array(String description, Schema items) {
        return new Schema(Type.ARRAY, description, null, null, null, null, null, Objects.requireNonNull(items, "items"));
    }

    public static Schema object(Map<String, Schema> properties, List<String> required) {
        return new Schema(Type.OBJECT, null, null, null, null, Objects.requireNonNull(properties, "properties"), required, null);
    }
}
