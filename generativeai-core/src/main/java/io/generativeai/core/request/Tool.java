package io.generativeai.core.request;

import java.util.List;
import java.util.Objects;

/**
 * A set of callable functions offered to the model.
 *
 * @param functionDeclarations declared functions
 */
public record Tool(List<FunctionDeclaration> functionDeclarations) {
    public Tool {
        Objects.requireNonNull(functionDeclarations, "functionDeclarations");
        functionDeclarations = List.copyOf(functionDeclarations);
    }

    public static Tool of(FunctionDeclaration... declarations) {
        return new Tool(List.of(declarations));
    }
}
