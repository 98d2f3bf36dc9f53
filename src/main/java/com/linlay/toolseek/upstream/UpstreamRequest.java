package com.linlay.toolseek.upstream;

import com.linlay.toolseek.model.ChatMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次上游子请求。model 为空时使用配置的默认模型；parameters 为客户端透传的采样参数；stage 仅用于日志定位。
 */
public record UpstreamRequest(
        String model,
        List<ChatMessage> messages,
        Map<String, Object> parameters,
        String stage
) {

    public UpstreamRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        // 参数值允许为 null
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        stage = stage == null || stage.isBlank() ? "default" : stage;
    }

    public UpstreamRequest(String model, List<ChatMessage> messages, String stage) {
        this(model, messages, Map.of(), stage);
    }
}
