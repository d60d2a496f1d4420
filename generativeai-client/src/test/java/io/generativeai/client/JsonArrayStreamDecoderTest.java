package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.SerializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonArrayStreamDecoderTest {

    private static final String BODY = "[{\"text\":\"a \\\"quoted\\\" } ] { [ value\"},\n"
            + " {\"nested\":{\"list\":[1,{\"x\":\"\\\\\"}]}, \"emoji\":\"café ☕\"} ,{}]\n";

    private static List<String> decode(String body, int chunkSize) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        JsonArrayStreamDecoder decoder = new JsonArrayStreamDecoder();
        List<String> out = new ArrayList<>();
        for (int i = 0; i < bytes.length; i += chunkSize) {
            ByteBuffer chunk = ByteBuffer.wrap(bytes, i, Math.min(chunkSize, bytes.length - i));
            byte[] element;
            while ((element = decoder.next(chunk)) != null) {
                out.add(new String(element, StandardCharsets.UTF_8));
            }
        }
        decoder.finish();
        return out;
    }

    @Test
    void splitsElementsInOneChunk() {
        assertThat(decode(BODY, Integer.MAX_VALUE)).containsExactly(
                "{\"text\":\"a \\\"quoted\\\" } ] { [ value\"}",
                "{\"nested\":{\"list\":[1,{\"x\":\"\\\\\"}]}, \"emoji\":\"café ☕\"}",
                "{}");
    }

    @Test
    void anyChunkingGivesTheSameElements() {
        List<String> expected = decode(BODY, Integer.MAX_VALUE);
        int length = BODY.getBytes(StandardCharsets.UTF_8).length;
        for (int size = 1; size <= length; size++) {
            assertThat(decode(BODY, size)).as("chunk size %d", size).isEqualTo(expected);
        }
    }

    @Test
    void emptyArrayHasNoElements() {
        assertThat(decode(" [ ] ", 1)).isEmpty();
    }

    @Test
    void leavesTheRestOfTheBufferForTheNextCall() {
        JsonArrayStreamDecoder decoder = new JsonArrayStreamDecoder();
        ByteBuffer buffer = ByteBuffer.wrap("[{\"a\":1},{\"b\":2}]".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(decoder.next(buffer), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
        assertThat(buffer.hasRemaining()).isTrue();
        assertThat(new String(decoder.next(buffer), StandardCharsets.UTF_8)).isEqualTo("{\"b\":2}");
        assertThat(decoder.next(buffer)).isNull();
        decoder.finish();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "[", "[{\"a\":1}", "[{\"a\":1},", "[{\"a\":\"unterminated"})
    void prematureEndFails(String body) {
        assertThatThrownBy(() -> decode(body, 3))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Stream ended");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"a\":1}", "[1,2]", "[{} {}]", "[{}]x", "[\"s\"]", "[{},]"})
    void malformedFramingFails(String body) {
        assertThatThrownBy(() -> decode(body, 2))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Malformed stream");
    }
}
