package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.InvalidAPIKeyException;
import io.generativeai.core.GenerativeAIException.RequestTimeoutException;
import io.generativeai.core.RequestOptions;
import io.generativeai.core.StreamFormat;
import io.generativeai.core.content.Content;
import io.generativeai.core.request.GenerateContentRequest;
import io.generativeai.core.response.CountTokensResponse;
import io.generativeai.core.response.GenerateContentResponse;
import io.generativeai.http.spi.HttpClientAdapter;
import io.generativeai.http.spi.JdkHttpClientAdapter;
import io.generativeai.http.spi.OkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerativeAIClientIntegrationTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    static Stream<Arguments> transports() {
        Supplier<HttpClientAdapter> jdk = JdkHttpClientAdapter::create;
        Supplier<HttpClientAdapter> okhttp = OkHttpClientAdapter::create;
        return Stream.of(Arguments.of("jdk", jdk), Arguments.of("okhttp", okhttp));
    }

    private GenerativeAIClient client(Supplier<HttpClientAdapter> transport, RequestOptions.Builder options) {
        return GenerativeAIClient.builder()
                .apiKey("test-key")
                .model("gemini-pro")
                .transport(transport.get())
                .requestOptions(options.endpoint(server.url("/").toString()).build())
                .build();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void generateContentRoundTrip(String name, Supplier<HttpClientAdapter> transport) throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setBody(Responses.candidate("Hi there")));

        GenerateContentResponse response = client(transport, RequestOptions.builder())
                .generateContent(Content.user("hello"));

        assertThat(response.text()).isEqualTo("Hi there");
        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/gemini-pro:generateContent");
        assertThat(recorded.getHeader("x-goog-api-key")).isEqualTo("test-key");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"hello\"}]}]}");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void streamsChunkedJsonArray(String name, Supplier<HttpClientAdapter> transport) {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setChunkedBody(Responses.jsonArray("The", " world", " is", " round"), 7));

        List<String> texts;
        try (ResponseStream<GenerateContentResponse> stream = client(transport, RequestOptions.builder())
                .generateContentStream(Content.user("go"))) {
            texts = stream.stream().map(GenerateContentResponse::text).collect(Collectors.toList());
        }

        assertThat(texts).containsExactly("The", " world", " is", " round");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void streamsServerSentEvents(String name, Supplier<HttpClientAdapter> transport) throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "text/event-stream")
                .setChunkedBody(Responses.sse("a", "b"), 5));

        List<String> texts;
        try (ResponseStream<GenerateContentResponse> stream = client(transport, RequestOptions.builder().streamFormat(StreamFormat.SSE))
                .generateContentStream(Content.user("go"))) {
            texts = stream.stream().map(GenerateContentResponse::text).collect(Collectors.toList());
        }

        assertThat(texts).containsExactly("a", "b");
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath())
                .isEqualTo("/v1beta/models/gemini-pro:streamGenerateContent?alt=sse");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void countTokens(String name, Supplier<HttpClientAdapter> transport) {
        server.enqueue(new MockResponse().setBody("{\"totalTokens\":42}"));

        CountTokensResponse response = client(transport, RequestOptions.builder())
                .countTokens(GenerateContentRequest.of(Content.user("count me")));

        assertThat(response.totalTokens()).isEqualTo(42);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void errorBodyIsClassified(String name, Supplier<HttpClientAdapter> transport) {
        server.enqueue(new MockResponse()
                .setResponseCode(400)
                .setBody(Responses.error(400, "INVALID_ARGUMENT", "API key not valid. Please pass a valid API key.", "API_KEY_INVALID")));

        assertThatThrownBy(() -> client(transport, RequestOptions.builder()).generateContent(Content.user("x")))
                .isInstanceOf(InvalidAPIKeyException.class);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("transports")
    void silentServerTimesOut(String name, Supplier<HttpClientAdapter> transport) {
        server.enqueue(new MockResponse()
                .setHeadersDelay(3, TimeUnit.SECONDS)
                .setBody(Responses.candidate("late")));

        GenerativeAIClient client = client(transport, RequestOptions.builder().timeout(Duration.ofSeconds(1)));

        long start = System.nanoTime();
        assertThatThrownBy(() -> client.generateContent(Content.user("x")))
                .isInstanceOf(RequestTimeoutException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }
}
