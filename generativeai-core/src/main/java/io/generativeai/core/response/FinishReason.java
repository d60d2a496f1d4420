package io.generativeai.core.response;

/**
 * Why a candidate stopped generating. Constant names are the wire values.
 */
public enum FinishReason {
    FINISH_REASON_UNSPECIFIED,
    STOP,
    MAX_TOKENS,
    SAFETY,
    RECITATION,
    OTHER,
    UNKNOWN
}
