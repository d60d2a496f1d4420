package io.generativeai.core.response;

import io.generativeai.core.request.HarmCategory;

/**
 * Safety assessment of a prompt or candidate for one category.
 *
 * @param category the harm category
 * @param probability estimated probability of harm
 * @param blocked whether content was blocked because of this rating; absent means {@code false}
 */
public record SafetyRating(HarmCategory category, HarmProbability probability, Boolean blocked) {
}
