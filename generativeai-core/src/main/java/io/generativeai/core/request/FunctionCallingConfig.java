package io.generativeai.core.request;

import java.util.List;
import java.util.Objects;

/**
 * Controls whether and which functions the model may call.
 *
 * @param mode calling mode
 * @param allowedFunctionNames restricts {@link Mode#ANY} to these functions; optional
 */
public record FunctionCallingConfig(Mode mode, List<String> allowedFunctionNames) {

    public enum Mode {
        /** The model decides between a function call and a text answer. */
        AUTO,
        /** The model must call a function. */
        ANY,
        /** The model must not call functions. */
        NONE,
        UNKNOWN
    }

    public FunctionCallingConfig {
        Objects.requireNonNull(mode, "mode");
        allowedFunctionNames = allowedFunctionNames == null ? null : List.copyOf(allowedFunctionNames);
    }

    public static FunctionCallingConfig of(Mode mode) {
        return new FunctionCallingConfig(mode, null);
    }
}
