package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.InvalidAPIKeyException;
import io.generativeai.core.GenerativeAIException.QuotaExceededException;
import io.generativeai.core.GenerativeAIException.ServerException;
import io.generativeai.core.GenerativeAIException.ServiceDisabledException;
import io.generativeai.core.GenerativeAIException.UnsupportedUserLocationException;
import io.generativeai.core.response.ErrorBody;
import io.generativeai.core.response.ErrorDetail;
import io.generativeai.core.response.ErrorResponse;
import io.generativeai.json.spi.JsonCodec;
import io.generativeai.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Maps the service's error envelope to the {@link ServerException} hierarchy.
 */
final class ServerErrors {
    private ServerErrors() {}

    private static final Logger log = LoggerFactory.getLogger(ServerErrors.class);

    static final String STATUS_RESOURCE_EXHAUSTED = "RESOURCE_EXHAUSTED";
    static final String REASON_API_KEY_INVALID = "API_KEY_INVALID";
    static final String REASON_SERVICE_DISABLED = "SERVICE_DISABLED";
    static final String MSG_API_KEY_INVALID = "API key not valid";
    static final String MSG_LOCATION_UNSUPPORTED = "User location is not supported";
    static final int HTTP_TOO_MANY_REQUESTS = 429;

    /**
     * Classifies a non-2xx response body. A body that is not an error envelope is reported verbatim.
     */
    static ServerException fromResponse(int httpStatus, byte[] body, JsonCodec codec) {
        String raw = new String(body, StandardCharsets.UTF_8);
        ErrorResponse parsed = null;
        if (body.length > 0) {
            try {
                parsed = codec.readValue(body, ErrorResponse.class);
            } catch (JsonException e) {
                log.debug("HTTP {} body is not an error envelope: {}", httpStatus, e.getMessage());
            }
        }
        if (parsed == null || parsed.error() == null) {
            return new ServerException("Unexpected response (HTTP " + httpStatus + "): " + raw, httpStatus);
        }
        return classify(httpStatus, parsed.error());
    }

    /**
     * Classifies a parsed error envelope, received either as a response body or in-band in a stream.
     */
    static ServerException classify(int httpStatus, ErrorBody error) {
        String status = error.status();
        String message = error.message();
        String text = (status == null ? "HTTP " + httpStatus : status) + ": " + (message == null ? "<no message>" : message);

        ServerException e;
        if (contains(message, MSG_API_KEY_INVALID) || hasReason(error, REASON_API_KEY_INVALID)) {
            e = new InvalidAPIKeyException(text, httpStatus, status, message);
        } else if (STATUS_RESOURCE_EXHAUSTED.equals(status) || httpStatus == HTTP_TOO_MANY_REQUESTS) {
            e = new QuotaExceededException(text, httpStatus, status, message);
        } else if (hasReason(error, REASON_SERVICE_DISABLED)) {
            e = new ServiceDisabledException(text, httpStatus, status, message);
        } else if (contains(message, MSG_LOCATION_UNSUPPORTED)) {
            e = new UnsupportedUserLocationException(text, httpStatus, status, message);
        } else {
            e = new ServerException(text, httpStatus, status, message);
        }
        log.debug("Server error classified as {}: {}", e.getClass().getSimpleName(), text);
        return e;
    }

    private static boolean contains(String message, String needle) {
        return message != null && message.contains(needle);
    }

    private static boolean hasReason(ErrorBody error, String reason) {
        if (error.details() == null) return false;
        for (ErrorDetail detail : error.details()) {
            if (detail != null && reason.equals(detail.reason())) return true;
        }
        return false;
    }
}
