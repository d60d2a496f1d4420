package io.generativeai.core.content;

import java.util.Objects;

/**
 * Reference to a file previously uploaded to the service.
 *
 * @param mimeType IANA media type of the file
 * @param fileUri URI returned by the upload
 */
public record FileDataPart(String mimeType, String fileUri) implements Part {
    public FileDataPart {
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(fileUri, "fileUri");
    }
}
