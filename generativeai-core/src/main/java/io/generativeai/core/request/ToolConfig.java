package io.generativeai.core.request;

import java.util.Objects;

/**
 * Tool configuration shared by every tool in a request.
 *
 * @param functionCallingConfig function calling behavior
 */
public record ToolConfig(FunctionCallingConfig functionCallingConfig) {
    public ToolConfig {
        Objects.requireNonNull(functionCallingConfig, "functionCallingConfig");
    }
}
