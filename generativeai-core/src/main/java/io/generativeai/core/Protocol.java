package io.generativeai.core;

/**
 * Generative language API protocol constants (endpoints, method names, header names and well-known values).
 *
 * <p>This module has no HTTP client bindings and no JSON library dependencies.
 * It only models protocol-level concerns that are shared by the transport, codec and client modules.
 */
public final class Protocol {
    private Protocol() {}

    // Defaults
    public static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com";
    public static final String DEFAULT_API_VERSION = "v1beta";
    public static final String LEGACY_COUNT_TOKENS_API_VERSION = "v1";

    // Model resource naming
    public static final String MODELS_PREFIX = "models/";

    // Methods (the path segment after ':')
    public static final String M_GENERATE_CONTENT = "generateContent";
    public static final String M_STREAM_GENERATE_CONTENT = "streamGenerateContent";
    public static final String M_COUNT_TOKENS = "countTokens";

    // Query parameter keys
    public static final String Q_ALT = "alt";
    public static final String ALT_SSE = "sse";

    // HTTP headers
    public static final String H_API_KEY = "x-goog-api-key";
    public static final String H_API_CLIENT = "x-goog-api-client";
    public static final String H_ACCEPT = "Accept";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";

    /** Library identifier reported in {@link #H_API_CLIENT}. */
    public static final String CLIENT_NAME = "genai-java";

    /** Library version reported in {@link #H_API_CLIENT}. */
    public static final String CLIENT_VERSION = "0.1.0";
}
