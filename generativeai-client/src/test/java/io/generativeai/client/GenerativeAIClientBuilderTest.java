package io.generativeai.client;

import io.generativeai.core.RequestOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerativeAIClientBuilderTest {

    @Test
    void buildsWithDiscoveredCodecAndDefaultTransport() {
        GenerativeAIClient client = GenerativeAIClient.builder()
                .apiKey("key")
                .model("gemini-pro")
                .build();

        assertThat(client).isInstanceOf(ApiController.class);
        ApiController controller = (ApiController) client;
        assertThat(controller.modelPath()).isEqualTo("models/gemini-pro");
        assertThat(controller.requestOptions()).isEqualTo(RequestOptions.defaults());
    }

    @Test
    void keepsCustomOptions() {
        RequestOptions options = RequestOptions.builder().timeout(Duration.ofSeconds(5)).apiVersion("v1").build();

        ApiController controller = (ApiController) GenerativeAIClient.builder()
                .apiKey("key")
                .model("tunedModels/mine")
                .requestOptions(options)
                .transport(FakeTransport.silent())
                .build();

        assertThat(controller.modelPath()).isEqualTo("tunedModels/mine");
        assertThat(controller.requestOptions().timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void requiresKeyAndModel() {
        assertThatThrownBy(() -> GenerativeAIClient.builder().model("m").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("apiKey");
        assertThatThrownBy(() -> GenerativeAIClient.builder().apiKey("k").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("model");
    }
}
