package io.generativeai.json.spi;

/**
 * JSON codec for the request and response schema types.
 * Implementations wrap specific JSON libraries and own the wire conventions:
 * <ul>
 *   <li>wire keys come from a fixed Java-name to wire-name table, applied in both directions</li>
 *   <li>{@code null} values are omitted, never written as {@code null}</li>
 *   <li>unknown fields are ignored on read</li>
 *   <li>parts are written and read as objects carrying exactly one variant key</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return UTF-8 JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data UTF-8 JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the bytes are not valid JSON, required fields are missing or types mismatch
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON string to a typed object.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the string is not valid JSON, required fields are missing or types mismatch
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON bytes to {@code type}, or to {@code alternative} when the top-level object carries a
     * non-null {@code discriminator} field. The input is parsed once.
     * @param data UTF-8 JSON bytes
     * @param type class decoded in the usual case
     * @param discriminator top-level field that selects {@code alternative}
     * @param alternative class decoded when the field is present
     * @return an instance of either {@code type} or {@code alternative}
     * @throws JsonException if the bytes are not valid JSON or do not bind to the selected class
     */
    Object readEither(byte[] data, Class<?> type, String discriminator, Class<?> alternative) throws JsonException;
}
