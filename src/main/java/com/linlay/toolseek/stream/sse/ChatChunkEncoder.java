package com.linlay.toolseek.stream.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.toolseek.model.ChatDelta;

import java.util.Objects;
import java.util.UUID;

/**
 * 将 {@link ChatDelta} 编码为 OpenAI Compatible 的 chunk / completion JSON。
 */
public class ChatChunkEncoder {

    private final ObjectMapper objectMapper;

    public ChatChunkEncoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public static String newCompletionId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
    }

    public String encodeChunk(String completionId, String model, long createdEpochSeconds, ChatDelta delta) {
        if (delta.isError()) {
            return encodeError(delta.error());
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", completionId);
        root.put("object", "chat.completion.chunk");
        root.put("created", createdEpochSeconds);
        if (model != null) {
            root.put("model", model);
        }
        ObjectNode choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode deltaNode = choice.putObject("delta");
        if (delta.hasReasoning()) {
            deltaNode.put("reasoning_content", delta.reasoning());
        }
        if (delta.hasContent()) {
            deltaNode.put("content", delta.content());
        }
        if (delta.hasFinishReason()) {
            choice.put("finish_reason", delta.finishReason());
        } else {
            choice.putNull("finish_reason");
        }
        return write(root);
    }

    public String encodeCompletion(String completionId, String model, long createdEpochSeconds,
                                   String reasoning, String content, String finishReason) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", completionId);
        root.put("object", "chat.completion");
        root.put("created", createdEpochSeconds);
        if (model != null) {
            root.put("model", model);
        }
        ObjectNode choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode message = choice.putObject("message");
        message.put("role", "assistant");
        if (reasoning != null && !reasoning.isEmpty()) {
            message.put("reasoning_content", reasoning);
        }
        message.put("content", content == null ? "" : content);
        choice.put("finish_reason", finishReason == null ? "stop" : finishReason);
        return write(root);
    }

    public String encodeError(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("error").put("message", message == null ? "" : message);
        return write(root);
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode chat chunk", ex);
        }
    }
}
