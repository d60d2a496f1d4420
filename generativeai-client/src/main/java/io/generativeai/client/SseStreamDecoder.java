package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.SerializationException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Incremental decoder for {@code text/event-stream} bodies.
 *
 * <p>Each event's {@code data:} lines are joined with {@code \n} and returned when the blank line ending the
 * event arrives. Comments and other fields are ignored.
 */
final class SseStreamDecoder implements StreamDecoder {

    private static final String DATA = "data";

    private final ByteArrayOutputStream line = new ByteArrayOutputStream();
    private final StringBuilder data = new StringBuilder();
    private boolean hasData;
    private boolean lastWasCr;

    @Override
    public byte[] next(ByteBuffer input) {
        while (input.hasRemaining()) {
            byte b = input.get();
            if (b == '\n' && lastWasCr) {
                // second half of CRLF
                lastWasCr = false;
                continue;
            }
            lastWasCr = b == '\r';
            if (b != '\n' && b != '\r') {
                line.write(b);
                continue;
            }
            byte[] event = endOfLine();
            if (event != null) return event;
        }
        return null;
    }

    @Override
    public void finish() {
        if (line.size() > 0 || hasData) {
            throw new SerializationException("Stream ended in the middle of an event");
        }
    }

    private byte[] endOfLine() {
        String text = line.toString(StandardCharsets.UTF_8);
        line.reset();
        if (text.isEmpty()) {
            if (!hasData) return null;
            byte[] event = data.toString().getBytes(StandardCharsets.UTF_8);
            data.setLength(0);
            hasData = false;
            return event;
        }
        if (text.charAt(0) == ':') return null;

        int colon = text.indexOf(':');
        String field = colon < 0 ? text : text.substring(0, colon);
        if (!DATA.equals(field)) return null;

        String value = colon < 0 ? "" : text.substring(colon + 1);
        if (value.startsWith(" ")) value = value.substring(1);
        if (hasData) data.append('\n');
        data.append(value);
        hasData = true;
        return null;
    }
}
