package io.generativeai.core.response;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@code countTokens}.
 *
 * @param totalTokens tokens the prompt would consume
 * @param promptTokensDetails per-modality breakdown; empty when the server does not report one
 */
public record CountTokensResponse(Integer totalTokens, List<ModalityTokenCount> promptTokensDetails) {
    public CountTokensResponse {
        Objects.requireNonNull(totalTokens, "totalTokens");
        promptTokensDetails = promptTokensDetails == null ? List.of() : List.copyOf(promptTokensDetails);
    }

    public static CountTokensResponse of(int totalTokens) {
        return new CountTokensResponse(totalTokens, null);
    }
}
