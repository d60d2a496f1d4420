package io.generativeai.core.response;

import java.util.List;

/**
 * Feedback about the prompt. A set {@link #blockReason()} means the prompt was blocked and no candidates
 * were produced.
 *
 * @param blockReason why the prompt was blocked; absent when it was not
 * @param safetyRatings ratings of the prompt
 */
public record PromptFeedback(BlockReason blockReason, List<SafetyRating> safetyRatings) {
    public PromptFeedback {
        safetyRatings = safetyRatings == null ? List.of() : List.copyOf(safetyRatings);
    }
}
