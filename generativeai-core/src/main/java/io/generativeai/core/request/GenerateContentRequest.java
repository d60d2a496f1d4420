package io.generativeai.core.request;

import io.generativeai.core.content.Content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Body of {@code generateContent} and {@code streamGenerateContent}.
 *
 * <p>The model travels in the URL path. {@link #model()} may be set in memory, but the client always sends
 * {@link #withoutModel()}.
 *
 * @param model model identifier; never sent
 * @param contents the conversation so far, oldest turn first
 * @param safetySettings per-category blocking thresholds; optional
 * @param generationConfig sampling parameters; optional
 * @param tools functions the model may call; optional
 * @param toolConfig function calling behavior; optional
 * @param systemInstruction instructions applied to the whole conversation; optional
 */
public record GenerateContentRequest(
        String model,
        List<Content> contents,
        List<SafetySetting> safetySettings,
        GenerationConfig generationConfig,
        List<Tool> tools,
        ToolConfig toolConfig,
        Content systemInstruction
) {
    public GenerateContentRequest {
        Objects.requireNonNull(contents, "contents");
        contents = List.copyOf(contents);
        safetySettings = safetySettings == null ? null : List.copyOf(safetySettings);
        tools = tools == null ? null : List.copyOf(tools);
    }

    public static GenerateContentRequest of(Content... contents) {
        return new GenerateContentRequest(null, List.of(contents), null, null, null, null, null);
    }

    /** Returns a copy with {@link #model()} cleared, as sent over the wire. */
    public GenerateContentRequest withoutModel() {
        if (model == null) return this;
        return new GenerateContentRequest(null, contents, safetySettings, generationConfig, tools, toolConfig, systemInstruction);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private final List<Content> contents = new ArrayList<>();
        private List<SafetySetting> safetySettings;
        private GenerationConfig generationConfig;
        private List<Tool> tools;
        private ToolConfig toolConfig;
        private Content systemInstruction;

        private Builder() {}

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder addContent(Content content) {
            contents.add(Objects.requireNonNull(content, "content"));
            return this;
        }

        public Builder contents(List<Content> contents) {
            this.contents.clear();
            this.contents.addAll(contents);
            return this;
        }

        public Builder safetySettings(List<SafetySetting> safetySettings) {
            this.safetySettings = safetySettings;
            return this;
        }

        public Builder generationConfig(GenerationConfig generationConfig) {
            this.generationConfig = generationConfig;
            return this;
        }

        public Builder tools(List<Tool> tools) {
            this.tools = tools;
            return this;
        }

        public Builder toolConfig(ToolConfig toolConfig) {
            this.toolConfig = toolConfig;
            return this;
        }

        public Builder systemInstruction(Content systemInstruction) {
            this.systemInstruction = systemInstruction;
            return this;
        }

        public GenerateContentRequest build() {
            return new GenerateContentRequest(model, contents, safetySettings, generationConfig, tools, toolConfig, systemInstruction);
        }
    }
}
