package io.generativeai.client;

import io.generativeai.core.content.Content;
import io.generativeai.core.request.CountTokensRequest;
import io.generativeai.core.request.GenerateContentRequest;
import io.generativeai.core.response.CountTokensResponse;
import io.generativeai.core.response.GenerateContentResponse;

/**
 * Client for one model of the generative language API.
 *
 * <p>Every operation either returns a decoded, validated response or throws one
 * {@link io.generativeai.core.GenerativeAIException} subclass. Instances are thread-safe.
 */
public interface GenerativeAIClient {

    /**
     * Generates a complete response for {@code request}.
     */
    GenerateContentResponse generateContent(GenerateContentRequest request);

    /**
     * Generates a response incrementally. The HTTP exchange is started before this method returns;
     * elements are decoded as the caller iterates.
     */
    ResponseStream<GenerateContentResponse> generateContentStream(GenerateContentRequest request);

    /**
     * Counts the tokens {@code request} would consume.
     */
    CountTokensResponse countTokens(CountTokensRequest request);

    default GenerateContentResponse generateContent(Content... contents) {
        return generateContent(GenerateContentRequest.of(contents));
    }

    default ResponseStream<GenerateContentResponse> generateContentStream(Content... contents) {
        return generateContentStream(GenerateContentRequest.of(contents));
    }

    /**
     * Counts the tokens of {@code request} using the body shape the configured API version accepts.
     */
    CountTokensResponse countTokens(GenerateContentRequest request);

    static GenerativeAIClientBuilder builder() {
        return new GenerativeAIClientBuilder();
    }
}
