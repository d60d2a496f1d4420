package io.generativeai.http.spi;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 *
 * <p>The request timeout bounds the wait for response headers; the body is streamed without a
 * per-read limit, so callers enforce their own deadline while consuming it.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public CompletableFuture<HttpClientResponse> send(HttpClientRequest request) {
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> exchange;
        try {
            exchange = httpClient.sendAsync(toJdkRequest(request), HttpResponse.BodyHandlers.ofPublisher());
        } catch (RuntimeException e) {
            result.completeExceptionally(new HttpClientException("Invalid request " + request, e));
            return result;
        }

        exchange.whenComplete((response, failure) -> {
            if (failure != null) {
                result.completeExceptionally(HttpClientException.translate(failure, request.timeout()));
            } else if (!result.complete(new PublisherResponse(response, request))) {
                // caller gave up before the headers arrived
                response.body().subscribe(new CancellingSubscriber());
            }
        });
        // cancelling the JDK future aborts the exchange (JDK 16+)
        result.whenComplete((response, failure) -> {
            if (result.isCancelled()) exchange.cancel(true);
        });
        return result;
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static final class PublisherResponse implements HttpClientResponse {
        private final HttpResponse<Flow.Publisher<List<ByteBuffer>>> response;
        private final Flow.Publisher<List<ByteBuffer>> body;

        PublisherResponse(HttpResponse<Flow.Publisher<List<ByteBuffer>>> response, HttpClientRequest request) {
            this.response = response;
            this.body = new TranslatingPublisher(response.body(), request.timeout());
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public Flow.Publisher<List<ByteBuffer>> body() {
            return body;
        }
    }

    private static final class CancellingSubscriber implements Flow.Subscriber<List<ByteBuffer>> {
        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.cancel();
        }

        @Override
        public void onNext(List<ByteBuffer> item) {
        }

        @Override
        public void onError(Throwable throwable) {
        }

        @Override
        public void onComplete() {
        }
    }
}
