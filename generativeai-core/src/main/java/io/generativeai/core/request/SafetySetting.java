package io.generativeai.core.request;

import java.util.Objects;

/**
 * Blocking threshold for one harm category.
 *
 * @param category the harm category
 * @param threshold the threshold to apply
 */
public record SafetySetting(HarmCategory category, HarmBlockThreshold threshold) {
    public SafetySetting {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(threshold, "threshold");
    }
}
