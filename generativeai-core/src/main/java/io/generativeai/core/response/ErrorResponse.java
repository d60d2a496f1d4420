package io.generativeai.core.response;

/**
 * Error envelope returned with non-2xx statuses and, occasionally, in-band within a stream.
 *
 * @param error the error; {@code null} when the decoded object carried none
 */
public record ErrorResponse(ErrorBody error) {
}
