package io.generativeai.core.content;

/**
 * One unit of content within a {@link Content} turn.
 *
 * <p>Exactly one variant is populated per instance. On the wire a part is an object carrying exactly one
 * of the keys {@code text}, {@code inline_data}, {@code functionCall}, {@code functionResponse} or
 * {@code file_data}.
 */
public sealed interface Part
        permits TextPart, InlineDataPart, FunctionCallPart, FunctionResponsePart, FileDataPart {
}
