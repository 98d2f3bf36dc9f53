package com.linlay.toolseek.model;

public record ChatDelta(
        String reasoning,
        String content,
        String finishReason,
        String error
) {

    public static ChatDelta reasoning(String text) {
        return new ChatDelta(text, null, null, null);
    }

    public static ChatDelta content(String text) {
        return new ChatDelta(null, text, null, null);
    }

    public static ChatDelta finish(String finishReason) {
        return new ChatDelta(null, null, finishReason, null);
    }

    public static ChatDelta error(String message) {
        return new ChatDelta(null, null, null, message == null || message.isBlank() ? "Upstream request failed" : message);
    }

    public boolean hasReasoning() {
        return reasoning != null && !reasoning.isEmpty();
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasFinishReason() {
        return finishReason != null && !finishReason.isBlank();
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isEmpty() {
        return !hasReasoning() && !hasContent() && !hasFinishReason() && !isError();
    }
}
