package io.generativeai.client;

import java.nio.ByteBuffer;

/**
 * Splits a streamed response body into the byte ranges of individual elements.
 *
 * <p>Implementations are stateful and single-use. Input may be cut at any byte, including inside a
 * multi-byte character or an escape sequence.
 */
interface StreamDecoder {

    /**
     * Consumes bytes from {@code input} until one element is complete.
     *
     * @return the element, or {@code null} when {@code input} was exhausted first
     * @throws io.generativeai.core.GenerativeAIException.SerializationException on malformed framing
     */
    byte[] next(ByteBuffer input);

    /**
     * Signals end of input.
     *
     * @throws io.generativeai.core.GenerativeAIException.SerializationException if the body ended mid-stream
     */
    void finish();
}
