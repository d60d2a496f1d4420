package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.SerializationException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Incremental decoder for a top-level JSON array of objects: {@code [ {...}, {...} ]}.
 *
 * <p>Tracks nesting depth outside strings; an element ends when its depth returns to zero. Structural
 * characters are ASCII, so scanning UTF-8 bytes directly is safe.
 */
final class JsonArrayStreamDecoder implements StreamDecoder {

    private enum State { BEFORE_ARRAY, FIRST_ELEMENT, NEXT_ELEMENT, IN_ELEMENT, AFTER_ELEMENT, CLOSED }

    private final ByteArrayOutputStream element = new ByteArrayOutputStream();
    private State state = State.BEFORE_ARRAY;
    private int depth;
    private boolean inString;
    private boolean escaped;
    private long offset;

    @Override
    public byte[] next(ByteBuffer input) {
        while (input.hasRemaining()) {
            byte b = input.get();
            offset++;
            switch (state) {
                case BEFORE_ARRAY:
                    if (isWhitespace(b)) break;
                    if (b != '[') throw unexpected(b, "'['");
                    state = State.FIRST_ELEMENT;
                    break;
                case FIRST_ELEMENT:
                    if (isWhitespace(b)) break;
                    if (b == ']') {
                        state = State.CLOSED;
                        break;
                    }
                    startElement(b);
                    break;
                case NEXT_ELEMENT:
                    if (isWhitespace(b)) break;
                    startElement(b);
                    break;
                case IN_ELEMENT:
                    element.write(b);
                    if (scan(b)) {
                        state = State.AFTER_ELEMENT;
                        byte[] done = element.toByteArray();
                        element.reset();
                        return done;
                    }
                    break;
                case AFTER_ELEMENT:
                    if (isWhitespace(b)) break;
                    if (b == ',') {
                        state = State.NEXT_ELEMENT;
                    } else if (b == ']') {
                        state = State.CLOSED;
                    } else {
                        throw unexpected(b, "',' or ']'");
                    }
                    break;
                case CLOSED:
                    if (!isWhitespace(b)) throw unexpected(b, "end of stream");
                    break;
                default:
                    throw new IllegalStateException("unknown state " + state);
            }
        }
        return null;
    }

    @Override
    public void finish() {
        switch (state) {
            case CLOSED:
                return;
            case BEFORE_ARRAY:
                throw new SerializationException("Stream ended before any data was received");
            case IN_ELEMENT:
                throw new SerializationException("Stream ended in the middle of an element after " + offset + " bytes");
            default:
                throw new SerializationException("Stream ended before the JSON array was closed after " + offset + " bytes");
        }
    }

    private void startElement(byte b) {
        if (b != '{' && b != '[') throw unexpected(b, "'{'");
        element.write(b);
        depth = 1;
        inString = false;
        escaped = false;
        state = State.IN_ELEMENT;
    }

    /** Returns true when {@code b} closes the current element. */
    private boolean scan(byte b) {
        if (inString) {
            if (escaped) {
                escaped = false;
            } else if (b == '\\') {
                escaped = true;
            } else if (b == '"') {
                inString = false;
            }
            return false;
        }
        switch (b) {
            case '"':
                inString = true;
                return false;
            case '{':
            case '[':
                depth++;
                return false;
            case '}':
            case ']':
                return --depth == 0;
            default:
                return false;
        }
    }

    private SerializationException unexpected(byte b, String expected) {
        String found = b >= 0x20 && b < 0x7f ? "'" + (char) b + "'" : String.format("0x%02x", b & 0xff);
        return new SerializationException("Malformed stream at byte " + offset + ": expected " + expected + " but found " + found);
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t';
    }
}
