package io.generativeai.core.request;

import io.generativeai.core.Protocol;
import io.generativeai.core.content.Content;

import java.util.List;
import java.util.Objects;

/**
 * Body of {@code countTokens}.
 *
 * <p>Two shapes exist and exactly one is populated: the embedded shape wraps a whole
 * {@link GenerateContentRequest}; the legacy shape carries {@code contents}, {@code toolConfig} and
 * {@code systemInstruction} at the top level. Use {@link #forApiVersion(String, GenerateContentRequest)} to
 * pick the shape the target API version understands.
 *
 * @param generateContentRequest embedded request (embedded shape)
 * @param model model identifier; never sent
 * @param contents conversation to count (legacy shape)
 * @param toolConfig tool configuration (legacy shape)
 * @param systemInstruction system instruction (legacy shape)
 */
public record CountTokensRequest(
        GenerateContentRequest generateContentRequest,
        String model,
        List<Content> contents,
        ToolConfig toolConfig,
        Content systemInstruction
) {
    public CountTokensRequest {
        contents = contents == null ? null : List.copyOf(contents);
        boolean legacy = contents != null || toolConfig != null || systemInstruction != null;
        if (generateContentRequest == null && contents == null) {
            throw new IllegalArgumentException("either generateContentRequest or contents is required");
        }
        if (generateContentRequest != null && legacy) {
            throw new IllegalArgumentException("generateContentRequest cannot be combined with legacy top-level fields");
        }
    }

    public static CountTokensRequest embedded(GenerateContentRequest request) {
        Objects.requireNonNull(request, "request");
        return new CountTokensRequest(request, null, null, null, null);
    }

    public static CountTokensRequest legacy(List<Content> contents) {
        return new CountTokensRequest(null, null, Objects.requireNonNull(contents, "contents"), null, null);
    }

    /**
     * Builds the shape understood by {@code apiVersion}: legacy for {@code v1}, embedded otherwise.
     */
    public static CountTokensRequest forApiVersion(String apiVersion, GenerateContentRequest request) {
        Objects.requireNonNull(request, "request");
        if (Protocol.LEGACY_COUNT_TOKENS_API_VERSION.equals(apiVersion)) {
            return new CountTokensRequest(null, request.model(), request.contents(), request.toolConfig(), request.systemInstruction());
        }
        return new CountTokensRequest(request, request.model(), null, null, null);
    }

    public boolean hasEmbeddedRequest() {
        return generateContentRequest != null;
    }

    /** Returns a copy with the top-level and the embedded model cleared, as sent over the wire. */
    public CountTokensRequest withoutModel() {
        GenerateContentRequest embedded = generateContentRequest == null ? null : generateContentRequest.withoutModel();
        if (model == null && embedded == generateContentRequest) return this;
        return new CountTokensRequest(embedded, null, contents, toolConfig, systemInstruction);
    }
}
