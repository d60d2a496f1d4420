package io.generativeai.core.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The result of a {@link FunctionCall}, sent back to the model.
 *
 * @param name name of the function that was called
 * @param response JSON-compatible result object
 */
public record FunctionResponse(String name, Map<String, Object> response) {
    public FunctionResponse {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(response, "response");
        response = Collections.unmodifiableMap(new LinkedHashMap<>(response));
    }
}
