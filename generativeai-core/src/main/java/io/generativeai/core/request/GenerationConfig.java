package io.generativeai.core.request;

import java.util.List;

/**
 * Sampling parameters. Every field is optional; {@code null} means "use the server default" and is never
 * written to the wire.
 *
 * @param temperature randomness of the output, typically in {@code [0.0, 2.0]}
 * @param topK number of highest-probability tokens considered at each step
 * @param topP cumulative probability cut-off, in {@code [0.0, 1.0]}
 * @param candidateCount number of candidates to generate
 * @param maxOutputTokens upper bound on generated tokens per candidate
 * @param stopSequences sequences that stop generation; order preserved, uniqueness not enforced
 * @param responseMimeType media type of the generated text (e.g. {@code application/json})
 * @param presencePenalty penalty for tokens already present in the output
 * @param frequencyPenalty penalty proportional to how often a token has been used
 * @param responseSchema schema the generated JSON must follow
 */
public record GenerationConfig(
        Float temperature,
        Integer topK,
        Float topP,
        Integer candidateCount,
        Integer maxOutputTokens,
        List<String> stopSequences,
        String responseMimeType,
        Float presencePenalty,
        Float frequencyPenalty,
        Schema responseSchema
) {
    public GenerationConfig {
        stopSequences = stopSequences == null ? null : List.copyOf(stopSequences);
        if (topK != null && topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Float temperature;
        private Integer topK;
        private Float topP;
        private Integer candidateCount;
        private Integer maxOutputTokens;
        private List<String> stopSequences;
        private String responseMimeType;
        private Float presencePenalty;
        private Float frequencyPenalty;
        private Schema responseSchema;

        private Builder() {}

        public Builder temperature(float temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder topP(float topP) {
            this.topP = topP;
            return this;
        }

        public Builder candidateCount(int candidateCount) {
            this.candidateCount = candidateCount;
            return this;
        }

        public Builder maxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        public Builder presencePenalty(float presencePenalty) {
            this.presencePenalty = presencePenalty;
            return this;
        }

        public Builder frequencyPenalty(float frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
            return this;
        }

        public Builder responseSchema(Schema responseSchema) {
            this.responseSchema = responseSchema;
            return this;
        }

        public GenerationConfig build() {
            return new GenerationConfig(temperature, topK, topP, candidateCount, maxOutputTokens,
                    stopSequences, responseMimeType, presencePenalty, frequencyPenalty, responseSchema);
        }
    }
}
