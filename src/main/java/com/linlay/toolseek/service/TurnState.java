package com.linlay.toolseek.service;

/**
 * 单个回合的续写状态。
 * <p>
 * prefix 是下一次子请求携带的 assistant 续写文本，只增不减；sentCursor 之前的部分已经下发给客户端，游标只前进。
 * 代码块打开期间，下发上限停在开标签位置，直到闭标签到达。
 */
final class TurnState {

    private final StringBuilder prefix;
    private final int seedLength;
    private int sentCursor;
    private boolean thinkingOpen = true;
    private int codeOpenAt = -1;
    private int codeBodyStart = -1;
    private int subRequests;
    private int executions;
    private boolean finishForwarded;
    private String upstreamFinishReason;
    private TurnPhase phase = TurnPhase.REQUESTING;

    TurnState(String seed) {
        String safeSeed = seed == null ? "" : seed;
        this.prefix = new StringBuilder(safeSeed);
        this.seedLength = safeSeed.length();
        this.sentCursor = safeSeed.length();
    }

    String prefix() {
        return prefix.toString();
    }

    String alreadySent() {
        return prefix.substring(0, sentCursor);
    }

    /**
     * prefix 中种子之后的部分，即模型在本回合真正生成（含拼接的执行输出）的文本。
     */
    String generated() {
        return prefix.substring(seedLength);
    }

    void append(String text) {
        if (text != null) {
            prefix.append(text);
        }
    }

    void openCodeBlock(String openTag) {
        codeOpenAt = prefix.length();
        prefix.append(openTag);
        codeBodyStart = prefix.length();
    }

    boolean inCodeBlock() {
        return codeOpenAt >= 0;
    }

    /**
     * 追加闭标签并返回代码块正文，之后整段代码块可以下发。
     */
    String closeCodeBlock(String closeTag) {
        if (!inCodeBlock()) {
            throw new IllegalStateException("No open code block");
        }
        String source = prefix.substring(codeBodyStart);
        prefix.append(closeTag);
        codeOpenAt = -1;
        codeBodyStart = -1;
        return source;
    }

    /**
     * 流在代码块未闭合时结束：放弃执行，已缓存的代码按普通文本下发。
     */
    void abandonCodeBlock() {
        codeOpenAt = -1;
        codeBodyStart = -1;
    }

    /**
     * 取出尚未下发且已确定的文本，并推进游标。
     */
    String takeForwardable() {
        int limit = inCodeBlock() ? codeOpenAt : prefix.length();
        if (limit <= sentCursor) {
            return "";
        }
        String text = prefix.substring(sentCursor, limit);
        sentCursor = limit;
        return text;
    }

    /**
     * 追加不对客户端可见的合成标记，游标直接越过它。调用前所有已确定文本必须已经下发。
     */
    void appendSynthetic(String marker) {
        if (sentCursor != prefix.length()) {
            throw new IllegalStateException("Synthetic marker appended before pending text was forwarded");
        }
        prefix.append(marker);
        sentCursor = prefix.length();
    }

    boolean thinkingOpen() {
        return thinkingOpen;
    }

    void closeThinking(String marker) {
        appendSynthetic(marker);
        thinkingOpen = false;
    }

    int beginSubRequest() {
        upstreamFinishReason = null;
        return ++subRequests;
    }

    int subRequests() {
        return subRequests;
    }

    int recordExecution() {
        return ++executions;
    }

    int executions() {
        return executions;
    }

    boolean finishForwarded() {
        return finishForwarded;
    }

    void markFinishForwarded() {
        finishForwarded = true;
    }

    /**
     * 记录当前子请求中上游给出的 finish_reason（如推理被 length 截断）。
     */
    void recordUpstreamFinishReason(String finishReason) {
        if (finishReason != null && !finishReason.isBlank()) {
            upstreamFinishReason = finishReason;
        }
    }

    String finishReasonOr(String fallback) {
        return upstreamFinishReason == null ? fallback : upstreamFinishReason;
    }

    TurnPhase phase() {
        return phase;
    }

    void transition(TurnPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Turn already ended in phase " + phase);
        }
        phase = next;
    }
}
