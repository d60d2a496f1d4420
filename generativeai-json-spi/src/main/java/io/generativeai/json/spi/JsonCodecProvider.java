package io.generativeai.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Modules such as {@code generativeai-json-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
