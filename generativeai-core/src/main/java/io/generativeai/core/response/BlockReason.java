package io.generativeai.core.response;

/**
 * Why a prompt was blocked. Constant names are the wire values.
 */
public enum BlockReason {
    BLOCK_REASON_UNSPECIFIED,
    SAFETY,
    OTHER,
    UNKNOWN
}
