package io.generativeai.http.spi;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Flow;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>The status and headers are available immediately; the body arrives incrementally through
 * {@link #body()}.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as a publisher of byte chunks, in arrival order.
     *
     * <p>The publisher accepts a single subscriber. It signals {@code onError} with {@link HttpTimeoutException}
     * when the request timeout elapses mid-body and with {@link HttpClientException} for other read failures.
     * Cancelling the subscription releases the underlying connection.
     *
     * @return the body publisher
     */
    Flow.Publisher<List<ByteBuffer>> body();
}
