package io.generativeai.core.response;

import io.generativeai.core.content.Content;

import java.util.List;

/**
 * One generated completion.
 *
 * @param content generated content; absent when the candidate was blocked
 * @param finishReason why generation stopped; absent on intermediate stream elements
 * @param safetyRatings ratings of the candidate
 * @param citationMetadata source attributions
 * @param tokenCount tokens in this candidate
 */
public record Candidate(
        Content content,
        FinishReason finishReason,
        List<SafetyRating> safetyRatings,
        CitationMetadata citationMetadata,
        Integer tokenCount
) {
    public Candidate {
        safetyRatings = safetyRatings == null ? List.of() : List.copyOf(safetyRatings);
    }
}
