package io.generativeai.http.spi;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>The request timeout becomes OkHttp's call timeout, which covers the whole exchange including the
 * body. Body reads run on the client's dispatcher executor.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public CompletableFuture<HttpClientResponse> send(HttpClientRequest request) {
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        OkHttpClient client = clientWithTimeout(request);
        Call call;
        try {
            call = client.newCall(toOkHttpRequest(request));
        } catch (RuntimeException e) {
            result.completeExceptionally(new HttpClientException("Invalid request " + request, e));
            return result;
        }

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                result.completeExceptionally(HttpClientException.translate(e, request.timeout()));
            }

            @Override
            public void onResponse(Call c, Response response) {
                if (!result.complete(new StreamingResponse(response, client.dispatcher().executorService(), request))) {
                    response.close();
                }
            }
        });
        result.whenComplete((response, failure) -> {
            if (result.isCancelled()) call.cancel();
        });
        return result;
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.header(HttpClientRequest.CONTENT_TYPE);
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final Response response;
        private final Flow.Publisher<List<ByteBuffer>> body;

        StreamingResponse(Response response, ExecutorService executor, HttpClientRequest request) {
            this.response = response;
            ResponseBody responseBody = response.body();
            this.body = responseBody == null
                    ? new InputStreamPublisher(InputStream.nullInputStream(), response::close, executor, request.timeout())
                    : new InputStreamPublisher(responseBody.byteStream(), response::close, executor, request.timeout());
        }

        @Override public int statusCode() { return response.code(); }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(response.header(name)); }
        @Override public Flow.Publisher<List<ByteBuffer>> body() { return body; }
    }
}
