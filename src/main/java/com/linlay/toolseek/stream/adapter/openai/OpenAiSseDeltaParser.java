package com.linlay.toolseek.stream.adapter.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.stream.sse.SsePayloadDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * OpenAI Compatible chat.completion.chunk 解析：reasoning_content / content / finish_reason，以及上游在流内返回的 error 对象。
 */
public class OpenAiSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSseDeltaParser.class);

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public ChatDelta parseOrNull(String rawChunk) {
        SsePayloadDecoder.Payload payload = SsePayloadDecoder.decodeEvent(rawChunk);
        if (payload == null || payload.done()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(payload.data());
            JsonNode errorNode = root.get("error");
            if (errorNode != null && !errorNode.isNull()) {
                return ChatDelta.error(errorMessage(errorNode));
            }
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                return null;
            }

            JsonNode firstChoice = choices.get(0);
            JsonNode deltaNode = firstChoice.path("delta");
            if (deltaNode.isMissingNode()) {
                deltaNode = firstChoice.path("message");
            }
            String reasoning = optionalText(deltaNode.get("reasoning_content"));
            String content = optionalText(deltaNode.get("content"));
            String finishReason = optionalText(firstChoice.get("finish_reason"));

            ChatDelta delta = new ChatDelta(
                    isEmpty(reasoning) ? null : reasoning,
                    isEmpty(content) ? null : content,
                    finishReason == null || finishReason.isBlank() ? null : finishReason,
                    null
            );
            return delta.isEmpty() ? null : delta;
        } catch (Exception ex) {
            log.warn("Failed to parse OpenAI SSE chunk: {}", rawChunk, ex);
            return null;
        }
    }

    private String errorMessage(JsonNode errorNode) {
        if (errorNode.isTextual()) {
            return errorNode.asText();
        }
        String message = optionalText(errorNode.get("message"));
        return message == null ? errorNode.toString() : message;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }
}
