package io.generativeai.core.content;

import java.util.Objects;

public record FunctionCallPart(FunctionCall functionCall) implements Part {
    public FunctionCallPart {
        Objects.requireNonNull(functionCall, "functionCall");
    }
}
