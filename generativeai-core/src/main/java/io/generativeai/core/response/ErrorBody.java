package io.generativeai.core.response;

import java.util.List;

/**
 * The {@code error} object of an error response.
 *
 * @param code HTTP status code
 * @param message human-readable message
 * @param status canonical status name (e.g. {@code PERMISSION_DENIED})
 * @param details structured details
 */
public record ErrorBody(Integer code, String message, String status, List<ErrorDetail> details) {
    public ErrorBody {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
