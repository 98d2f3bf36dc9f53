package com.linlay.toolseek.model;

import java.util.Objects;

/**
 * 会话消息。prefix=true 表示一条未完成的 assistant 消息，用于让上游模型续写而不是开启新回合。
 */
public record ChatMessage(
        ChatRole role,
        String content,
        boolean prefix
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role cannot be null");
        content = content == null ? "" : content;
        if (prefix && role != ChatRole.ASSISTANT) {
            throw new IllegalArgumentException("Only assistant messages can be continuation prefixes");
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(ChatRole.SYSTEM, content, false);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(ChatRole.USER, content, false);
    }

    public static ChatMessage assistantPrefix(String content) {
        return new ChatMessage(ChatRole.ASSISTANT, content, true);
    }

    public ChatMessage withContent(String newContent) {
        return new ChatMessage(role, newContent, prefix);
    }
}
