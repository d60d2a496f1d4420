package io.generativeai.client;

import io.generativeai.core.GenerativeAIException;
import io.generativeai.core.GenerativeAIException.ClientException;
import io.generativeai.core.GenerativeAIException.RequestTimeoutException;
import io.generativeai.core.GenerativeAIException.SerializationException;
import io.generativeai.core.Protocol;
import io.generativeai.core.RequestOptions;
import io.generativeai.core.StreamFormat;
import io.generativeai.core.Urls;
import io.generativeai.core.request.CountTokensRequest;
import io.generativeai.core.request.GenerateContentRequest;
import io.generativeai.core.response.CountTokensResponse;
import io.generativeai.core.response.ErrorBody;
import io.generativeai.core.response.ErrorResponse;
import io.generativeai.core.response.GenerateContentResponse;
import io.generativeai.http.spi.HttpClientAdapter;
import io.generativeai.http.spi.HttpClientRequest;
import io.generativeai.http.spi.HttpClientResponse;
import io.generativeai.http.spi.HttpTimeoutException;
import io.generativeai.json.spi.JsonCodec;
import io.generativeai.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Talks to the generative language API over an injected {@link HttpClientAdapter}.
 *
 * <p>Each call gets a deadline of {@link RequestOptions#timeout()} measured from its start. The deadline
 * covers waiting for the response headers and, for streams, every element read after that.
 */
public final class ApiController implements GenerativeAIClient {

    private static final Logger log = LoggerFactory.getLogger(ApiController.class);

    static final String API_CLIENT_HEADER =
            Protocol.CLIENT_NAME + "/" + Protocol.CLIENT_VERSION + " java/" + System.getProperty("java.version");

    private static final String ERROR_FIELD = "error";

    private final String apiKey;
    private final String modelPath;
    private final RequestOptions options;
    private final HttpClientAdapter transport;
    private final JsonCodec codec;

    public ApiController(String apiKey, String model, RequestOptions options, HttpClientAdapter transport, JsonCodec codec) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.modelPath = Urls.modelPath(model);
        this.options = Objects.requireNonNull(options, "options");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /** Resource path of the model, e.g. {@code models/gemini-pro}. */
    public String modelPath() {
        return modelPath;
    }

    public RequestOptions requestOptions() {
        return options;
    }

    @Override
    public GenerateContentResponse generateContent(GenerateContentRequest request) {
        Objects.requireNonNull(request, "request");
        Deadline deadline = Deadline.after(options.timeout());
        URI url = methodUrl(Protocol.M_GENERATE_CONTENT, Map.of());

        HttpClientResponse response = exchange(url, encode(request.withoutModel()), Protocol.CT_JSON, deadline);
        byte[] body = readBody(response, deadline);
        return validate(decode(body, response.statusCode(), GenerateContentResponse.class));
    }

    @Override
    public ResponseStream<GenerateContentResponse> generateContentStream(GenerateContentRequest request) {
        Objects.requireNonNull(request, "request");
        Deadline deadline = Deadline.after(options.timeout());
        boolean sse = options.streamFormat() == StreamFormat.SSE;
        URI url = methodUrl(Protocol.M_STREAM_GENERATE_CONTENT, sse ? Map.of(Protocol.Q_ALT, Protocol.ALT_SSE) : Map.of());

        HttpClientResponse response = exchange(url, encode(request.withoutModel()),
                sse ? Protocol.CT_EVENT_STREAM : Protocol.CT_JSON, deadline);
        ByteChunkSubscriber body = subscribe(response);
        if (!isSuccess(response.statusCode())) {
            throw serverError(response, body, deadline);
        }

        int status = response.statusCode();
        StreamDecoder framing = sse ? new SseStreamDecoder() : new JsonArrayStreamDecoder();
        return new ResponseStream<>(body, framing,
                element -> validate(decode(element, status, GenerateContentResponse.class)),
                deadline, Protocol.M_STREAM_GENERATE_CONTENT);
    }

    @Override
    public CountTokensResponse countTokens(CountTokensRequest request) {
        Objects.requireNonNull(request, "request");
        Deadline deadline = Deadline.after(options.timeout());
        URI url = methodUrl(Protocol.M_COUNT_TOKENS, Map.of());

        HttpClientResponse response = exchange(url, encode(request.withoutModel()), Protocol.CT_JSON, deadline);
        byte[] body = readBody(response, deadline);
        return decode(body, response.statusCode(), CountTokensResponse.class);
    }

    @Override
    public CountTokensResponse countTokens(GenerateContentRequest request) {
        Objects.requireNonNull(request, "request");
        return countTokens(CountTokensRequest.forApiVersion(options.apiVersion(), request));
    }

    private URI methodUrl(String method, Map<String, String> query) {
        return Urls.methodUrl(options.endpoint(), options.apiVersion(), modelPath, method, query);
    }

    private byte[] encode(Object body) {
        try {
            return codec.writeBytes(body);
        } catch (JsonException e) {
            throw new SerializationException("Failed to encode " + body.getClass().getSimpleName(), e);
        }
    }

    /**
     * Sends the request and waits, within the deadline, for status and headers.
     */
    private HttpClientResponse exchange(URI url, byte[] body, String accept, Deadline deadline) {
        HttpClientRequest request = HttpClientRequest.post(url)
                .header(Protocol.H_API_KEY, apiKey)
                .header(Protocol.H_API_CLIENT, API_CLIENT_HEADER)
                .header(Protocol.H_ACCEPT, accept)
                .jsonBody(body)
                .timeout(options.timeout())
                .build();

        log.debug("POST {}", url);
        CompletableFuture<HttpClientResponse> future;
        try {
            future = transport.send(request);
        } catch (RuntimeException e) {
            throw new ClientException("Transport rejected request to " + url, e);
        }
        if (future == null) {
            throw new ClientException("Transport returned no response future for " + url);
        }

        try {
            HttpClientResponse response = future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
            log.debug("HTTP {} from {}", response.statusCode(), url);
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RequestTimeoutException("No response from " + url + " within " + deadline.timeout(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted while waiting for " + url, e);
        } catch (CancellationException e) {
            throw new ClientException("Request to " + url + " was cancelled", e);
        } catch (ExecutionException e) {
            throw transportFailure(e.getCause(), url, deadline);
        }
    }

    private static GenerativeAIException transportFailure(Throwable cause, URI url, Deadline deadline) {
        if (cause instanceof GenerativeAIException) {
            return (GenerativeAIException) cause;
        }
        if (cause instanceof HttpTimeoutException) {
            return new RequestTimeoutException("No response from " + url + " within " + deadline.timeout(), cause);
        }
        String reason = cause == null ? "unknown failure" : cause.getMessage();
        return new ClientException("Failed to reach " + url + ": " + reason, cause);
    }

    private static ByteChunkSubscriber subscribe(HttpClientResponse response) {
        ByteChunkSubscriber subscriber = new ByteChunkSubscriber();
        response.body().subscribe(subscriber);
        return subscriber;
    }

    private byte[] readBody(HttpClientResponse response, Deadline deadline) {
        ByteChunkSubscriber body = subscribe(response);
        if (!isSuccess(response.statusCode())) {
            throw serverError(response, body, deadline);
        }
        return body.readAll(deadline);
    }

    private GenerativeAIException serverError(HttpClientResponse response, ByteChunkSubscriber body, Deadline deadline) {
        byte[] raw = body.readAll(deadline);
        return ServerErrors.fromResponse(response.statusCode(), raw, codec);
    }

    /**
     * Decodes one payload, raising the server error it carries in-band if there is one.
     */
    private <T> T decode(byte[] payload, int httpStatus, Class<T> type) {
        Object decoded;
        try {
            decoded = codec.readEither(payload, type, ERROR_FIELD, ErrorResponse.class);
        } catch (JsonException e) {
            throw new SerializationException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (decoded instanceof ErrorResponse) {
            ErrorBody inBand = ((ErrorResponse) decoded).error();
            Integer code = inBand.code();
            throw ServerErrors.classify(code != null ? code : httpStatus, inBand);
        }
        return type.cast(decoded);
    }

    private static GenerateContentResponse validate(GenerateContentResponse response) {
        if (response.candidates().isEmpty() && response.promptFeedback() == null) {
            throw new SerializationException("Error deserializing response, found no valid fields");
        }
        return response;
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
