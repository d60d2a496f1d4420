package io.generativeai.core.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One turn of a conversation.
 *
 * @param role producer of the turn, usually {@code user} or {@code model}; optional
 * @param parts ordered parts of the turn
 */
public record Content(String role, List<Part> parts) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    public Content {
        Objects.requireNonNull(parts, "parts");
        parts = List.copyOf(parts);
    }

    public static Content user(String text) {
        return builder().role(ROLE_USER).addText(text).build();
    }

    public static Content model(String text) {
        return builder().role(ROLE_MODEL).addText(text).build();
    }

    public static Content text(String text) {
        return builder().addText(text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String role;
        private final List<Part> parts = new ArrayList<>();

        private Builder() {}

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder addPart(Part part) {
            parts.add(Objects.requireNonNull(part, "part"));
            return this;
        }

        public Builder addText(String text) {
            return addPart(new TextPart(text));
        }

        public Builder addInlineData(String mimeType, byte[] bytes) {
            return addPart(InlineDataPart.of(mimeType, bytes));
        }

        public Builder addFileData(String mimeType, String fileUri) {
            return addPart(new FileDataPart(mimeType, fileUri));
        }

        public Builder addFunctionResponse(String name, Map<String, Object> response) {
            return addPart(new FunctionResponsePart(new FunctionResponse(name, response)));
        }

        public Content build() {
            return new Content(role, parts);
        }
    }
}
