package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.ClientException;
import io.generativeai.core.RequestOptions;
import io.generativeai.http.spi.HttpClientAdapter;
import io.generativeai.http.spi.JdkHttpClientAdapter;
import io.generativeai.json.spi.JsonCodec;
import io.generativeai.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.util.Objects;

public final class GenerativeAIClientBuilder {
    private String apiKey;
    private String model;
    private RequestOptions options = RequestOptions.defaults();
    private HttpClientAdapter transport;
    private JsonCodec codec;

    public GenerativeAIClientBuilder apiKey(String apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        return this;
    }

    /**
     * Model to call: a bare name such as {@code gemini-pro} or a resource path such as {@code tunedModels/x}.
     */
    public GenerativeAIClientBuilder model(String model) {
        this.model = Objects.requireNonNull(model, "model");
        return this;
    }

    public GenerativeAIClientBuilder requestOptions(RequestOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        return this;
    }

    public GenerativeAIClientBuilder transport(HttpClientAdapter transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public GenerativeAIClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public GenerativeAIClientBuilder jsonCodec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /**
     * @throws IllegalStateException if the API key or model is missing
     * @throws ClientException if no codec was set and none is registered
     */
    public GenerativeAIClient build() {
        if (apiKey == null || apiKey.isBlank()) throw new IllegalStateException("apiKey is required");
        if (model == null || model.isBlank()) throw new IllegalStateException("model is required");

        HttpClientAdapter resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = JdkHttpClientAdapter.create();
        }
        JsonCodec resolvedCodec = codec;
        if (resolvedCodec == null) {
            resolvedCodec = JsonCodecs.discover()
                    .orElseThrow(() -> new ClientException("No JsonCodec configured and none registered via ServiceLoader"));
        }
        return new ApiController(apiKey, model, options, resolvedTransport, resolvedCodec);
    }
}
