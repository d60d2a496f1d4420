package io.generativeai.core;

/**
 * Framing used by {@code streamGenerateContent} responses.
 */
public enum StreamFormat {
    /** A single JSON array whose elements arrive incrementally. */
    JSON_ARRAY,
    /** {@code text/event-stream} with one JSON response per {@code data:} event ({@code ?alt=sse}). */
    SSE
}
