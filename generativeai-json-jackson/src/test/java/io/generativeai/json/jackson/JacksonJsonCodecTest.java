package io.generativeai.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.generativeai.core.content.Content;
import io.generativeai.core.content.FunctionCall;
import io.generativeai.core.content.FunctionCallPart;
import io.generativeai.core.content.InlineDataPart;
import io.generativeai.core.content.TextPart;
import io.generativeai.core.request.CountTokensRequest;
import io.generativeai.core.request.FunctionCallingConfig;
import io.generativeai.core.request.FunctionDeclaration;
import io.generativeai.core.request.GenerateContentRequest;
import io.generativeai.core.request.GenerationConfig;
import io.generativeai.core.request.HarmBlockThreshold;
import io.generativeai.core.request.HarmCategory;
import io.generativeai.core.request.SafetySetting;
import io.generativeai.core.request.Schema;
import io.generativeai.core.request.Tool;
import io.generativeai.core.request.ToolConfig;
import io.generativeai.core.response.CountTokensResponse;
import io.generativeai.core.response.ErrorResponse;
import io.generativeai.core.response.FinishReason;
import io.generativeai.core.response.GenerateContentResponse;
import io.generativeai.core.response.HarmProbability;
import io.generativeai.json.spi.JsonCodec;
import io.generativeai.json.spi.JsonCodecs;
import io.generativeai.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final ObjectMapper plain = new ObjectMapper();

    private JsonNode tree(Object value) throws Exception {
        return plain.readTree(codec.writeBytes(value));
    }

    @Test
    void toolConfigUsesSnakeCaseKeys() throws Exception {
        GenerateContentRequest request = GenerateContentRequest.builder()
                .addContent(Content.user("hi"))
                .toolConfig(new ToolConfig(FunctionCallingConfig.of(FunctionCallingConfig.Mode.AUTO)))
                .build();

        JsonNode json = tree(request);

        assertThat(json.at("/tool_config/function_calling_config/mode").asText()).isEqualTo("AUTO");
        assertThat(json.at("/tool_config/function_calling_config").has("allowed_function_names")).isFalse();
    }

    @Test
    void requestKeysFollowWireNames() throws Exception {
        GenerateContentRequest request = GenerateContentRequest.builder()
                .addContent(Content.user("hi"))
                .safetySettings(List.of(new SafetySetting(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmBlockThreshold.BLOCK_ONLY_HIGH)))
                .generationConfig(GenerationConfig.builder().topK(3).maxOutputTokens(64).build())
                .systemInstruction(Content.text("be brief"))
                .tools(List.of(Tool.of(new FunctionDeclaration("lookup", "finds things",
                        Schema.object(Map.of("q", Schema.of(Schema.Type.STRING, "query")), List.of("q"))))))
                .build();

        JsonNode json = tree(request.withoutModel());

        assertThat(json.has("model")).isFalse();
        assertThat(json.at("/contents/0/role").asText()).isEqualTo("user");
        assertThat(json.at("/contents/0/parts/0/text").asText()).isEqualTo("hi");
        assertThat(json.at("/safety_settings/0/category").asText()).isEqualTo("HARM_CATEGORY_HARASSMENT");
        assertThat(json.at("/safety_settings/0/threshold").asText()).isEqualTo("BLOCK_ONLY_HIGH");
        assertThat(json.at("/generation_config/top_k").asInt()).isEqualTo(3);
        assertThat(json.at("/generation_config/max_output_tokens").asInt()).isEqualTo(64);
        assertThat(json.at("/system_instruction/parts/0/text").asText()).isEqualTo("be brief");
        assertThat(json.at("/tools/0/function_declarations/0/parameters/type").asText()).isEqualTo("OBJECT");
        assertThat(json.at("/tools/0/function_declarations/0/parameters/properties/q/type").asText()).isEqualTo("STRING");
        assertThat(json.at("/tools/0/function_declarations/0/parameters/required/0").asText()).isEqualTo("q");
    }

    @Test
    void schemaEnumValuesUseEnumKey() throws Exception {
        JsonNode json = tree(Schema.enumeration("colour", List.of("red", "green")));

        assertThat(json.get("enum")).hasSize(2);
        assertThat(json.has("enumValues")).isFalse();
        assertThat(json.get("format").asText()).isEqualTo("enum");
    }

    @Test
    void unsetOptionalsAreOmitted() throws Exception {
        String json = codec.writeString(GenerationConfig.builder().temperature(0.5f).build());

        assertThat(json).isEqualTo("{\"temperature\":0.5}");
    }

    @Test
    void decodedValuesReEncodeWithoutAddedKeys() throws Exception {
        SafetySetting setting = codec.readValue(
                "{\"category\":\"HARM_CATEGORY_HATE_SPEECH\",\"threshold\":\"BLOCK_NONE\"}", SafetySetting.class);
        GenerationConfig config = codec.readValue("{}", GenerationConfig.class);
        ToolConfig toolConfig = codec.readValue("{\"function_calling_config\":{\"mode\":\"ANY\"}}", ToolConfig.class);

        assertThat(codec.writeString(setting)).isEqualTo("{\"category\":\"HARM_CATEGORY_HATE_SPEECH\",\"threshold\":\"BLOCK_NONE\"}");
        assertThat(codec.writeString(config)).isEqualTo("{}");
        assertThat(codec.writeString(toolConfig)).isEqualTo("{\"function_calling_config\":{\"mode\":\"ANY\"}}");
    }

    @Test
    void partVariantsEncodeWithOneKey() throws Exception {
        Content content = Content.builder()
                .role(Content.ROLE_USER)
                .addText("look")
                .addInlineData("image/png", new byte[] {1, 2, 3})
                .addFileData("application/pdf", "files/abc")
                .addFunctionResponse("lookup", Map.of("found", true))
                .addPart(new FunctionCallPart(new FunctionCall("lookup", null)))
                .build();

        JsonNode parts = tree(content).get("parts");

        assertThat(parts.get(0).get("text").asText()).isEqualTo("look");
        assertThat(parts.get(1).at("/inline_data/mime_type").asText()).isEqualTo("image/png");
        assertThat(parts.get(1).at("/inline_data/data").asText()).isEqualTo("AQID");
        assertThat(parts.get(2).at("/file_data/file_uri").asText()).isEqualTo("files/abc");
        assertThat(parts.get(3).at("/functionResponse/name").asText()).isEqualTo("lookup");
        assertThat(parts.get(3).at("/functionResponse/response/found").asBoolean()).isTrue();
        assertThat(parts.get(4).at("/functionCall/args").isObject()).isTrue();
        for (JsonNode part : parts) {
            assertThat(part.size()).isEqualTo(1);
        }
    }

    @Test
    void partAcceptsCamelCaseFromServer() throws Exception {
        Content content = codec.readValue(
                "{\"role\":\"model\",\"parts\":[{\"inlineData\":{\"mimeType\":\"image/png\",\"data\":\"AQID\"}},"
                        + "{\"functionCall\":{\"name\":\"lookup\",\"args\":{\"q\":\"cats\"}}},"
                        + "{\"text\":\"hi\",\"thought\":false}]}",
                Content.class);

        assertThat(content.parts().get(0)).isEqualTo(new InlineDataPart("image/png", "AQID"));
        assertThat(((InlineDataPart) content.parts().get(0)).bytes()).containsExactly(1, 2, 3);
        FunctionCall call = ((FunctionCallPart) content.parts().get(1)).functionCall();
        assertThat(call.name()).isEqualTo("lookup");
        assertThat(call.args()).containsEntry("q", "cats");
        assertThat(content.parts().get(2)).isEqualTo(new TextPart("hi"));
    }

    @Test
    void partWithoutVariantIsRejected() {
        assertThatThrownBy(() -> codec.readValue("{\"role\":\"user\",\"parts\":[{\"thought\":true}]}", Content.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining(Content.class.getName());
    }

    @Test
    void partWithTwoVariantsIsRejected() {
        assertThatThrownBy(() -> codec.readValue(
                "{\"parts\":[{\"text\":\"a\",\"inline_data\":{\"mime_type\":\"x\",\"data\":\"\"}}]}", Content.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void unknownEnumValuesDecodeAsUnknown() throws Exception {
        GenerateContentResponse response = codec.readValue(
                "{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"x\"}]},"
                        + "\"finishReason\":\"SOMETHING_NEW\","
                        + "\"safetyRatings\":[{\"category\":\"HARM_CATEGORY_CIVIC_INTEGRITY\",\"probability\":\"NEGLIGIBLE\"}]}]}",
                GenerateContentResponse.class);

        assertThat(response.candidates().get(0).finishReason()).isEqualTo(FinishReason.UNKNOWN);
        assertThat(response.candidates().get(0).safetyRatings().get(0).category()).isEqualTo(HarmCategory.UNKNOWN);
        assertThat(response.candidates().get(0).safetyRatings().get(0).probability()).isEqualTo(HarmProbability.NEGLIGIBLE);
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        CountTokensResponse response = codec.readValue(
                "{\"totalTokens\":7,\"cachedContentTokenCount\":2}".getBytes(StandardCharsets.UTF_8), CountTokensResponse.class);

        assertThat(response.totalTokens()).isEqualTo(7);
    }

    @Test
    void missingRequiredFieldFails() {
        assertThatThrownBy(() -> codec.readValue("{}", CountTokensResponse.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readValue("{\"role\":\"user\"}", Content.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void emptyAndNullInputFail() {
        assertThatThrownBy(() -> codec.readValue(new byte[0], CountTokensResponse.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readValue("null", CountTokensResponse.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void errorDetailTypeUsesAtKey() throws Exception {
        ErrorResponse error = codec.readValue(
                "{\"error\":{\"code\":400,\"message\":\"API key not valid.\",\"status\":\"INVALID_ARGUMENT\","
                        + "\"details\":[{\"@type\":\"type.googleapis.com/google.rpc.ErrorInfo\",\"reason\":\"API_KEY_INVALID\"}]}}",
                ErrorResponse.class);

        assertThat(error.error().code()).isEqualTo(400);
        assertThat(error.error().details().get(0).typeUrl()).isEqualTo("type.googleapis.com/google.rpc.ErrorInfo");
        assertThat(error.error().details().get(0).reason()).isEqualTo("API_KEY_INVALID");
    }

    @Test
    void readEitherSelectsClassByDiscriminator() throws Exception {
        byte[] error = "{\"error\":{\"code\":500,\"message\":\"boom\",\"status\":\"INTERNAL\"}}"
                .getBytes(StandardCharsets.UTF_8);
        byte[] count = "{\"totalTokens\":7,\"error\":null}".getBytes(StandardCharsets.UTF_8);

        Object decodedError = codec.readEither(error, CountTokensResponse.class, "error", ErrorResponse.class);
        Object decodedCount = codec.readEither(count, CountTokensResponse.class, "error", ErrorResponse.class);

        assertThat(decodedError).isInstanceOfSatisfying(ErrorResponse.class,
                e -> assertThat(e.error().message()).isEqualTo("boom"));
        assertThat(decodedCount).isInstanceOfSatisfying(CountTokensResponse.class,
                c -> assertThat(c.totalTokens()).isEqualTo(7));
        assertThatThrownBy(() -> codec.readEither("null".getBytes(StandardCharsets.UTF_8),
                CountTokensResponse.class, "error", ErrorResponse.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readEither("{\"totalTokens\":".getBytes(StandardCharsets.UTF_8),
                CountTokensResponse.class, "error", ErrorResponse.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void countTokensShapesDropModel() throws Exception {
        GenerateContentRequest request = GenerateContentRequest.builder()
                .model("models/gemini-pro")
                .addContent(Content.user("hi"))
                .build();

        JsonNode embedded = tree(CountTokensRequest.forApiVersion("v1beta", request).withoutModel());
        JsonNode legacy = tree(CountTokensRequest.forApiVersion("v1", request).withoutModel());

        assertThat(embedded.has("model")).isFalse();
        assertThat(embedded.at("/generateContentRequest").has("model")).isFalse();
        assertThat(embedded.at("/generateContentRequest/contents/0/parts/0/text").asText()).isEqualTo("hi");
        assertThat(legacy.has("model")).isFalse();
        assertThat(legacy.has("generateContentRequest")).isFalse();
        assertThat(legacy.at("/contents/0/parts/0/text").asText()).isEqualTo("hi");
    }

    @Test
    void providerIsDiscoverable() {
        JsonCodec discovered = JsonCodecs.discover().orElseThrow();

        assertThat(discovered).isInstanceOf(JacksonJsonCodec.class);
    }
}
