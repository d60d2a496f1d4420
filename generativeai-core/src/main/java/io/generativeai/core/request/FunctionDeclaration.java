package io.generativeai.core.request;

import java.util.Objects;

/**
 * A function the model may ask the caller to invoke.
 *
 * @param name function name; letters, digits, underscores and dashes
 * @param description what the function does, used by the model to decide when to call it
 * @param parameters schema of the arguments object; optional for functions without arguments
 */
public record FunctionDeclaration(String name, String description, Schema parameters) {
    public FunctionDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
    }
}
