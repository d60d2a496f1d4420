package io.generativeai.core.request;

/**
 * Probability at and above which content is blocked. Constant names are the wire values.
 */
public enum HarmBlockThreshold {
    HARM_BLOCK_THRESHOLD_UNSPECIFIED,
    BLOCK_LOW_AND_ABOVE,
    BLOCK_MEDIUM_AND_ABOVE,
    BLOCK_ONLY_HIGH,
    BLOCK_NONE,
    UNKNOWN
}
