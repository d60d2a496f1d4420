package io.generativeai.core.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A function invocation predicted by the model.
 *
 * @param name name of a declared function
 * @param args JSON-compatible arguments (maps, lists, strings, numbers, booleans, nulls)
 */
public record FunctionCall(String name, Map<String, Object> args) {
    public FunctionCall {
        Objects.requireNonNull(name, "name");
        // arguments may legitimately contain null values, so Map.copyOf is not an option
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
