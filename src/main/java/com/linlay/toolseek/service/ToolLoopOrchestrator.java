package com.linlay.toolseek.service;

import com.linlay.toolseek.execution.ExecutionAdapter;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.model.ChatMessage;
import com.linlay.toolseek.stream.scan.ScanSegment;
import com.linlay.toolseek.stream.scan.TagScanner;
import com.linlay.toolseek.stream.scan.TagVocabulary;
import com.linlay.toolseek.upstream.UpstreamClient;
import com.linlay.toolseek.upstream.UpstreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 推理内代码执行的回合编排。
 * <p>
 * 一个客户端回合被拆成若干次上游子请求：每次子请求携带不断增长的 assistant prefix 续写。推理文本经
 * {@link TagScanner} 分类；代码块闭合时执行代码、把输出块拼到 prefix 后重启子请求；遇到推理结束标记时再重启一次，
 * 之后上游 delta 原样下发。每个字符只下发一次，每个代码块只执行一次。
 */
public class ToolLoopOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ToolLoopOrchestrator.class);

    private final UpstreamClient upstreamClient;
    private final ExecutionAdapter executionAdapter;
    private final ToolLoopPrompts prompts;
    private final TagVocabulary vocabulary;
    private final String codeTag;
    private final String endOfReasoningMarker;
    private final int maxSubRequests;

    public ToolLoopOrchestrator(
            UpstreamClient upstreamClient,
            ExecutionAdapter executionAdapter,
            ToolLoopPrompts prompts,
            String codeTag,
            String outputTag,
            String endOfReasoningMarker,
            int maxSubRequests
    ) {
        this.upstreamClient = Objects.requireNonNull(upstreamClient, "upstreamClient cannot be null");
        this.executionAdapter = Objects.requireNonNull(executionAdapter, "executionAdapter cannot be null");
        this.prompts = Objects.requireNonNull(prompts, "prompts cannot be null");
        this.vocabulary = TagVocabulary.of(codeTag, outputTag, endOfReasoningMarker);
        this.codeTag = codeTag;
        this.endOfReasoningMarker = endOfReasoningMarker;
        this.maxSubRequests = maxSubRequests > 0 ? maxSubRequests : 16;
    }

    public Flux<ChatDelta> runTurn(List<ChatMessage> conversation, ChatMessage userMessage, String model) {
        return runTurn(conversation, userMessage, model, Map.of());
    }

    public Flux<ChatDelta> runTurn(
            List<ChatMessage> conversation,
            ChatMessage userMessage,
            String model,
            Map<String, Object> parameters
    ) {
        List<ChatMessage> history = conversation == null ? List.of() : List.copyOf(conversation);
        Objects.requireNonNull(userMessage, "userMessage cannot be null");
        return Flux.<ChatDelta>create(sink -> {
            String turnId = "turn-" + UUID.randomUUID().toString().substring(0, 8);
            TurnContext context = new TurnContext(turnId, model, parameters, upstreamClient, executionAdapter);
            sink.onDispose(context::close);
            TurnState state = new TurnState(prompts.seedPrefix());
            try {
                runLoop(context, state, history, userMessage, sink);
            } catch (Exception ex) {
                log.warn("[{}] tool loop failed in phase {}", turnId, state.phase(), ex);
                if (!state.phase().isTerminal()) {
                    state.transition(TurnPhase.FAILED);
                }
                emit(sink, ChatDelta.error(errorMessage(ex)));
            }
            if (!sink.isCancelled()) {
                sink.complete();
            }
        }, FluxSink.OverflowStrategy.BUFFER).subscribeOn(Schedulers.boundedElastic());
    }

    private void runLoop(
            TurnContext context,
            TurnState state,
            List<ChatMessage> history,
            ChatMessage userMessage,
            FluxSink<ChatDelta> sink
    ) {
        while (!state.phase().isTerminal()) {
            if (sink.isCancelled()) {
                log.info("[{}] client disconnected after {} sub-requests", context.turnId(), state.subRequests());
                state.transition(TurnPhase.CANCELLED);
                return;
            }
            if (state.subRequests() >= maxSubRequests) {
                log.warn("[{}] tool loop exceeded {} sub-requests", context.turnId(), maxSubRequests);
                state.transition(TurnPhase.FAILED);
                emit(sink, ChatDelta.error("Tool loop exceeded " + maxSubRequests + " upstream sub-requests"));
                return;
            }

            state.transition(TurnPhase.REQUESTING);
            int index = state.beginSubRequest();
            UpstreamRequest request = new UpstreamRequest(
                    context.model(),
                    buildMessages(history, userMessage, state),
                    context.parameters(),
                    (state.thinkingOpen() ? "tool-loop-" : "tool-loop-answer-") + index
            );
            log.info("[{}] sub-request {} start, prefixChars={}, executions={}, thinkingOpen={}",
                    context.turnId(), index, state.prefix().length(), state.executions(), state.thinkingOpen());

            streamSubRequest(context, state, request, sink);
        }
        if (state.phase() == TurnPhase.DONE) {
            if (!state.finishForwarded()) {
                emit(sink, ChatDelta.finish(state.finishReasonOr("stop")));
            }
            log.info("[{}] turn done, subRequests={}, executions={}",
                    context.turnId(), state.subRequests(), state.executions());
        }
    }

    List<ChatMessage> buildMessages(List<ChatMessage> history, ChatMessage userMessage, TurnState state) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        messages.addAll(history);
        messages.add(userMessage.withContent(userMessage.content() + prompts.instruction()));
        messages.add(ChatMessage.assistantPrefix(state.prefix()));
        return messages;
    }

    /**
     * 消费一次子请求，结束时 phase 为 RESTARTING、DONE、FAILED 或 CANCELLED 之一。
     */
    private void streamSubRequest(
            TurnContext context,
            TurnState state,
            UpstreamRequest request,
            FluxSink<ChatDelta> sink
    ) {
        TagScanner scanner = new TagScanner(vocabulary);
        // 关闭 Stream 即取消上游订阅，重启前丢弃在途连接
        try (Stream<ChatDelta> deltas = context.upstream().stream(request).toStream()) {
            state.transition(TurnPhase.STREAMING);
            Iterator<ChatDelta> iterator = deltas.iterator();
            while (iterator.hasNext()) {
                ChatDelta delta = iterator.next();
                if (sink.isCancelled() || context.isClosed()) {
                    state.transition(TurnPhase.CANCELLED);
                    return;
                }
                if (delta.isError()) {
                    log.warn("[{}] upstream returned error: {}", context.turnId(), delta.error());
                    state.transition(TurnPhase.FAILED);
                    emit(sink, ChatDelta.error(delta.error()));
                    return;
                }
                if (!state.thinkingOpen()) {
                    if (!delta.isEmpty()) {
                        emit(sink, delta);
                    }
                    if (delta.hasFinishReason()) {
                        state.markFinishForwarded();
                    }
                    continue;
                }
                for (String text : reasoningSideText(delta)) {
                    for (ScanSegment segment : scanner.feed(text)) {
                        apply(segment, context, state, sink);
                        if (state.phase() == TurnPhase.RESTARTING) {
                            return;
                        }
                    }
                }
                state.recordUpstreamFinishReason(delta.finishReason());
                forward(state, sink);
            }
        } catch (RuntimeException ex) {
            if (state.phase().isTerminal()) {
                return;
            }
            if (sink.isCancelled()) {
                state.transition(TurnPhase.CANCELLED);
                return;
            }
            log.warn("[{}] sub-request {} failed: {}", context.turnId(), state.subRequests(), ex.getMessage());
            state.transition(TurnPhase.FAILED);
            emit(sink, ChatDelta.error(errorMessage(ex)));
            return;
        }

        if (state.thinkingOpen()) {
            for (ScanSegment segment : scanner.finish()) {
                state.append(segment.text());
            }
            if (state.inCodeBlock()) {
                log.info("[{}] stream ended inside an unclosed code block, forwarding it as text", context.turnId());
                state.abandonCodeBlock();
            }
            forward(state, sink);
        }
        state.transition(TurnPhase.DONE);
    }

    private void apply(ScanSegment segment, TurnContext context, TurnState state, FluxSink<ChatDelta> sink) {
        switch (segment.kind()) {
            case TEXT -> state.append(segment.text());
            case OPEN -> {
                if (segment.isOpen(codeTag)) {
                    state.openCodeBlock(segment.text());
                } else {
                    state.append(segment.text());
                }
            }
            case CLOSE -> {
                if (segment.isClose(codeTag) && state.inCodeBlock()) {
                    executeBlock(segment, context, state, sink);
                } else {
                    state.append(segment.text());
                }
            }
            case MARKER -> {
                if (segment.isMarker(endOfReasoningMarker)) {
                    state.transition(TurnPhase.FORWARDING);
                    forward(state, sink);
                    state.closeThinking(segment.text());
                    log.info("[{}] reasoning closed after {} executions, requesting final answer",
                            context.turnId(), state.executions());
                    state.transition(TurnPhase.RESTARTING);
                } else {
                    state.append(segment.text());
                }
            }
        }
    }

    private void executeBlock(ScanSegment closeTag, TurnContext context, TurnState state, FluxSink<ChatDelta> sink) {
        String source = state.closeCodeBlock(closeTag.text());
        forward(state, sink);

        state.transition(TurnPhase.EXECUTING);
        long startNanos = System.nanoTime();
        String output = context.execute(source);
        int execution = state.recordExecution();
        log.info("[{}] executed code block #{} in {} ms, outputChars={}",
                context.turnId(), execution, (System.nanoTime() - startNanos) / 1_000_000,
                output == null ? 0 : output.length());

        state.transition(TurnPhase.FORWARDING);
        state.append(prompts.formatOutputBlock(output));
        forward(state, sink);
        state.transition(TurnPhase.RESTARTING);
    }

    private List<String> reasoningSideText(ChatDelta delta) {
        List<String> texts = new ArrayList<>(2);
        if (delta.hasReasoning()) {
            texts.add(delta.reasoning());
        }
        if (delta.hasContent()) {
            texts.add(delta.content());
        }
        return texts;
    }

    private void forward(TurnState state, FluxSink<ChatDelta> sink) {
        String text = state.takeForwardable();
        if (!text.isEmpty()) {
            emit(sink, ChatDelta.reasoning(text));
        }
    }

    private void emit(FluxSink<ChatDelta> sink, ChatDelta delta) {
        if (!sink.isCancelled()) {
            sink.next(delta);
        }
    }

    private String errorMessage(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getMessage() == null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
