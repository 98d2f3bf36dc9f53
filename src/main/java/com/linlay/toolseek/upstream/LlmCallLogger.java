package com.linlay.toolseek.upstream;

import com.linlay.toolseek.config.LlmInteractionLogProperties;
import com.linlay.toolseek.model.ChatMessage;
import org.slf4j.Logger;

import java.util.List;
import java.util.UUID;

/**
 * 上游调用日志工具：traceId 生成、消息摘要、耗时计算。
 */
class LlmCallLogger {

    private static final int PREVIEW_CHARS = 160;

    private final boolean enabled;
    private final boolean maskSensitive;

    LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
    }

    String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    String sanitizeText(String text) {
        return LlmLogSanitizer.maskText(text, maskSensitive);
    }

    void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    void logMessages(Logger logger, String traceId, String stage, List<ChatMessage> messages) {
        if (!enabled || !logger.isDebugEnabled() || messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            builder.append('[').append(i).append("] role=").append(message.role().value());
            if (message.prefix()) {
                builder.append(", prefix=true");
            }
            builder.append(", chars=").append(message.content().length())
                    .append(", tail=").append(sanitizeText(tail(message.content())))
                    .append('\n');
        }
        logger.debug("[{}][{}] upstream messages detail:\n{}", traceId, stage, builder);
    }

    private String tail(String text) {
        if (text.length() <= PREVIEW_CHARS) {
            return text;
        }
        return "..." + text.substring(text.length() - PREVIEW_CHARS);
    }
}
