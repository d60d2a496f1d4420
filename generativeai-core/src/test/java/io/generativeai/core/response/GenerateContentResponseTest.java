package io.generativeai.core.response;

import io.generativeai.core.content.Content;
import io.generativeai.core.content.FunctionCall;
import io.generativeai.core.content.FunctionCallPart;
import io.generativeai.core.content.TextPart;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateContentResponseTest {

    @Test
    void textJoinsTextPartsOfFirstCandidate() {
        Content content = new Content("model", List.of(
                new TextPart("Hello"),
                new FunctionCallPart(new FunctionCall("lookup", Map.of("q", "x"))),
                new TextPart(", world")));
        GenerateContentResponse response = new GenerateContentResponse(
                List.of(new Candidate(content, FinishReason.STOP, null, null, null)), null, null);

        assertThat(response.text()).isEqualTo("Hello, world");
        assertThat(response.functionCalls()).extracting(FunctionCall::name).containsExactly("lookup");
    }

    @Test
    void blockedPromptHasNoTextButFeedback() {
        GenerateContentResponse response = new GenerateContentResponse(
                null, new PromptFeedback(BlockReason.SAFETY, null), null);

        assertThat(response.candidates()).isEmpty();
        assertThat(response.promptBlocked()).isTrue();
        assertThat(response.text()).isNull();
        assertThat(response.functionCalls()).isEmpty();
    }
}
