package io.generativeai.core.response;

/**
 * Token accounting for a call. Streaming responses report cumulative values.
 *
 * @param promptTokenCount tokens in the prompt
 * @param candidatesTokenCount tokens across all generated candidates
 * @param totalTokenCount prompt plus candidates
 */
public record UsageMetadata(Integer promptTokenCount, Integer candidatesTokenCount, Integer totalTokenCount) {
}
