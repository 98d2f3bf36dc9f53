package com.linlay.toolseek.stream.sse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.model.ChatDelta;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ChatChunkEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChatChunkEncoder encoder = new ChatChunkEncoder(objectMapper);

    @Test
    void shouldEncodeReasoningChunkInOpenAiShape() throws Exception {
        JsonNode root = objectMapper.readTree(
                encoder.encodeChunk("chatcmpl-1", "deepseek-chat", 1700000000L, ChatDelta.reasoning("<python>")));

        assertThat(root.path("object").asText()).isEqualTo("chat.completion.chunk");
        assertThat(root.path("id").asText()).isEqualTo("chatcmpl-1");
        JsonNode choice = root.path("choices").get(0);
        assertThat(choice.path("delta").path("reasoning_content").asText()).isEqualTo("<python>");
        assertThat(choice.path("delta").has("content")).isFalse();
        assertThat(choice.path("finish_reason").isNull()).isTrue();
    }

    @Test
    void shouldEncodeErrorDeltaAsErrorObject() throws Exception {
        JsonNode root = objectMapper.readTree(
                encoder.encodeChunk("chatcmpl-1", "m", 1L, ChatDelta.error("boom")));

        assertThat(root.path("error").path("message").asText()).isEqualTo("boom");
        assertThat(root.has("choices")).isFalse();
    }

    @Test
    void shouldAggregateCompletion() throws Exception {
        JsonNode root = objectMapper.readTree(
                encoder.encodeCompletion("chatcmpl-2", "m", 1L, "r", "answer", null));

        assertThat(root.path("object").asText()).isEqualTo("chat.completion");
        JsonNode message = root.path("choices").get(0).path("message");
        assertThat(message.path("role").asText()).isEqualTo("assistant");
        assertThat(message.path("reasoning_content").asText()).isEqualTo("r");
        assertThat(message.path("content").asText()).isEqualTo("answer");
        assertThat(root.path("choices").get(0).path("finish_reason").asText()).isEqualTo("stop");
    }

    @Test
    void flushWriterShouldFrameEachDataLine() {
        SseFlushWriter writer = new SseFlushWriter();

        String frame = new String(writer.encode(ServerSentEvent.builder("a\nb").build()), StandardCharsets.UTF_8);

        assertThat(frame).isEqualTo("data: a\ndata: b\n\n");
    }

    @Test
    void flushWriterShouldEncodeOnlyDataField() {
        SseFlushWriter writer = new SseFlushWriter();

        String frame = new String(writer.encode(ServerSentEvent.builder("[DONE]").id("7").event("done").build()),
                StandardCharsets.UTF_8);

        assertThat(frame).isEqualTo("data: [DONE]\n\n");
    }
}
