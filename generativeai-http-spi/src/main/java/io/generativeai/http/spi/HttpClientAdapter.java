package io.generativeai.http.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the generative AI client to work with different
 * HTTP client libraries (JDK HttpClient, OkHttp, etc.) without a direct
 * dependency on any specific implementation, and lets tests substitute a fake transport.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.post(uri).jsonBody(bytes).build();
 * HttpClientResponse response = adapter.send(request).get(30, TimeUnit.SECONDS);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Starts an HTTP exchange.
     *
     * <p>The returned future completes once the status line and headers have arrived; the body is then
     * delivered by {@link HttpClientResponse#body()}. It completes exceptionally with
     * {@link HttpTimeoutException} when {@link HttpClientRequest#timeout()} elapses and with
     * {@link HttpClientException} for any other transport failure.
     *
     * <p>Cancelling the returned future aborts the exchange.
     *
     * @param request the HTTP request to send
     * @return a future of the response
     */
    CompletableFuture<HttpClientResponse> send(HttpClientRequest request);
}
