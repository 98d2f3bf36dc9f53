package com.linlay.toolseek.model.api;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Compatible chat completion 请求。除 model / messages / stream 外的字段（temperature、max_tokens 等）
 * 原样收集，转发给上游。
 */
public class ChatCompletionRequest {

    private final String model;
    @NotEmpty
    private final List<@Valid @NotNull RequestMessage> messages;
    private final Boolean stream;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    @JsonCreator
    public ChatCompletionRequest(
            @JsonProperty("model") String model,
            @JsonProperty("messages") List<RequestMessage> messages,
            @JsonProperty("stream") Boolean stream
    ) {
        this.model = model;
        this.messages = messages;
        this.stream = stream;
    }

    public String model() {
        return model;
    }

    public List<RequestMessage> messages() {
        return messages;
    }

    public Boolean stream() {
        return stream;
    }

    public boolean streaming() {
        return stream != null && stream;
    }

    @JsonAnySetter
    public void putParameter(String name, Object value) {
        parameters.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public record RequestMessage(
            @NotBlank
            String role,
            @NotNull
            String content
    ) {
    }
}
