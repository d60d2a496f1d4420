package io.generativeai.http.spi;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception thrown when an HTTP operation fails.
 * Wraps underlying implementation-specific exceptions.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }

    /**
     * Translates a failure raised by an HTTP library into this hierarchy.
     *
     * <p>Completion wrappers are unwrapped; library timeouts become {@link HttpTimeoutException}.
     *
     * @param failure the library failure
     * @param timeout the timeout in force, reported on timeouts; may be {@code null}
     */
    public static HttpClientException translate(Throwable failure, Duration timeout) {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof HttpClientException) {
            return (HttpClientException) t;
        }
        if (isTimeout(t)) {
            return new HttpTimeoutException("Request timed out" + (timeout == null ? "" : " after " + timeout), timeout, t);
        }
        return new HttpClientException(t);
    }

    private static boolean isTimeout(Throwable t) {
        if (t instanceof java.net.http.HttpTimeoutException || t instanceof SocketTimeoutException) {
            return true;
        }
        // OkHttp reports an elapsed call timeout as InterruptedIOException("timeout")
        return t instanceof InterruptedIOException && "timeout".equals(t.getMessage());
    }
}
