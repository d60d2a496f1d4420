package io.generativeai.http.spi;

import java.time.Duration;

/**
 * Exception thrown when an HTTP request times out.
 * Allows callers to distinguish timeout errors from other failures.
 */
public class HttpTimeoutException extends HttpClientException {

    private final Duration timeout;

    public HttpTimeoutException(String message) {
        this(message, null, null);
    }

    public HttpTimeoutException(String message, Duration timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    /** The timeout that elapsed, when known. */
    public Duration timeout() {
        return timeout;
    }
}
