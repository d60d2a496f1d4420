package io.generativeai.core.content;

import java.util.Objects;

public record FunctionResponsePart(FunctionResponse functionResponse) implements Part {
    public FunctionResponsePart {
        Objects.requireNonNull(functionResponse, "functionResponse");
    }
}
