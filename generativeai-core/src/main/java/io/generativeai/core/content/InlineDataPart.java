package io.generativeai.core.content;

import java.util.Base64;
import java.util.Objects;

/**
 * Binary data sent inline with the request.
 *
 * @param mimeType IANA media type of the data (e.g. {@code image/png})
 * @param data base64 encoded bytes
 */
public record InlineDataPart(String mimeType, String data) implements Part {
    public InlineDataPart {
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(data, "data");
    }

    public static InlineDataPart of(String mimeType, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new InlineDataPart(mimeType, Base64.getEncoder().encodeToString(bytes));
    }

    /** Decodes {@link #data()}. */
    public byte[] bytes() {
        return Base64.getDecoder().decode(data);
    }
}
