package io.generativeai.core.response;

import io.generativeai.core.content.FunctionCall;
import io.generativeai.core.content.FunctionCallPart;
import io.generativeai.core.content.Part;
import io.generativeai.core.content.TextPart;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@code generateContent}, or one element of a {@code streamGenerateContent} stream.
 *
 * <p>A prompt blocked by safety filters is not an error: {@link #candidates()} is empty and
 * {@link #promptFeedback()} says why.
 *
 * @param candidates generated completions; empty when the prompt was blocked
 * @param promptFeedback feedback about the prompt; optional
 * @param usageMetadata token accounting; optional
 */
public record GenerateContentResponse(
        List<Candidate> candidates,
        PromptFeedback promptFeedback,
        UsageMetadata usageMetadata
) {
    public GenerateContentResponse {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /** Whether the prompt itself was blocked. */
    public boolean promptBlocked() {
        return promptFeedback != null && promptFeedback.blockReason() != null;
    }

    /**
     * Concatenated text parts of the first candidate, or {@code null} when there is none.
     */
    public String text() {
        List<Part> parts = firstCandidateParts();
        if (parts == null) return null;
        StringBuilder sb = new StringBuilder();
        boolean any = false;
        for (Part part : parts) {
            if (part instanceof TextPart) {
                sb.append(((TextPart) part).text());
                any = true;
            }
        }
        return any ? sb.toString() : null;
    }

    /** Function calls requested by the first candidate, in order. */
    public List<FunctionCall> functionCalls() {
        List<Part> parts = firstCandidateParts();
        if (parts == null) return List.of();
        List<FunctionCall> calls = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof FunctionCallPart) {
                calls.add(((FunctionCallPart) part).functionCall());
            }
        }
        return List.copyOf(calls);
    }

    private List<Part> firstCandidateParts() {
        if (candidates.isEmpty()) return null;
        Candidate first = candidates.get(0);
        return first.content() == null ? null : first.content().parts();
    }
}
