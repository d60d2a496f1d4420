package io.generativeai.core.content;

import java.util.Objects;

/**
 * Plain text.
 *
 * @param text the text
 */
public record TextPart(String text) implements Part {
    public TextPart {
        Objects.requireNonNull(text, "text");
    }
}
