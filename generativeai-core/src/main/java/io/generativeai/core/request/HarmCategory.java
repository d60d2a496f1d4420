package io.generativeai.core.request;

/**
 * Category of potentially harmful content. Constant names are the wire values.
 */
public enum HarmCategory {
    HARM_CATEGORY_UNSPECIFIED,
    HARM_CATEGORY_HARASSMENT,
    HARM_CATEGORY_HATE_SPEECH,
    HARM_CATEGORY_SEXUALLY_EXPLICIT,
    HARM_CATEGORY_DANGEROUS_CONTENT,
    /** A category this client version does not know about. */
    UNKNOWN
}
