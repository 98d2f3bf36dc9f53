package com.linlay.toolseek.service;

import com.linlay.toolseek.config.ToolLoopProperties;
import com.linlay.toolseek.config.UpstreamProperties;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.model.ChatMessage;
import com.linlay.toolseek.model.ChatRole;
import com.linlay.toolseek.model.api.ChatCompletionRequest;
import com.linlay.toolseek.stream.sse.ChatChunkEncoder;
import com.linlay.toolseek.stream.sse.SsePayloadDecoder;
import com.linlay.toolseek.upstream.UpstreamClient;
import com.linlay.toolseek.upstream.UpstreamException;
import com.linlay.toolseek.upstream.UpstreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chat completion 入口编排。
 * <p>
 * 负责校验并规范化请求消息、选择工具循环或直通代理路径，并把 {@link ChatDelta} 流映射为 SSE 事件：
 * 成功结束追加 {@code [DONE]}，错误事件之后直接关闭流。
 */
@Service
public class ChatRelayService {

    private static final Logger log = LoggerFactory.getLogger(ChatRelayService.class);

    private final ToolLoopOrchestrator orchestrator;
    private final UpstreamClient upstreamClient;
    private final ChatChunkEncoder chunkEncoder;
    private final ToolLoopProperties toolLoopProperties;
    private final UpstreamProperties upstreamProperties;

    public ChatRelayService(
            ToolLoopOrchestrator orchestrator,
            UpstreamClient upstreamClient,
            ChatChunkEncoder chunkEncoder,
            ToolLoopProperties toolLoopProperties,
            UpstreamProperties upstreamProperties
    ) {
        this.orchestrator = orchestrator;
        this.upstreamClient = upstreamClient;
        this.chunkEncoder = chunkEncoder;
        this.toolLoopProperties = toolLoopProperties;
        this.upstreamProperties = upstreamProperties;
    }

    public record TurnRequest(
            String completionId,
            String model,
            List<ChatMessage> history,
            ChatMessage userMessage,
            Map<String, Object> parameters,
            boolean streaming,
            boolean toolLoop
    ) {

        public List<ChatMessage> conversation() {
            List<ChatMessage> messages = new ArrayList<>(history);
            messages.add(userMessage);
            return messages;
        }
    }

    public TurnRequest prepare(ChatCompletionRequest request) {
        if (request == null || request.messages() == null || request.messages().isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        List<ChatMessage> messages = new ArrayList<>();
        for (ChatCompletionRequest.RequestMessage message : request.messages()) {
            if (message == null) {
                throw new IllegalArgumentException("messages must not contain null entries");
            }
            messages.add(new ChatMessage(ChatRole.fromValue(message.role()), message.content(), false));
        }
        ChatMessage last = messages.get(messages.size() - 1);
        if (last.role() != ChatRole.USER) {
            throw new IllegalArgumentException("The last message must come from the user");
        }
        boolean toolLoop = toolLoopProperties.isEnabled();
        if (toolLoop && !request.streaming()) {
            throw new IllegalArgumentException("Code execution mode only supports stream=true");
        }
        // 上游模型固定为配置值，客户端传入的 model 只记录日志
        String model = upstreamProperties.getModel();
        if (StringUtils.hasText(request.model()) && !request.model().trim().equals(model)) {
            log.debug("client requested model={}, relaying with configured model={}", request.model(), model);
        }
        return new TurnRequest(
                ChatChunkEncoder.newCompletionId(),
                model,
                List.copyOf(messages.subList(0, messages.size() - 1)),
                last,
                request.parameters(),
                request.streaming(),
                toolLoop
        );
    }

    public Flux<ChatDelta> deltas(TurnRequest turn) {
        if (turn.toolLoop()) {
            return orchestrator.runTurn(turn.history(), turn.userMessage(), turn.model(), turn.parameters());
        }
        return upstreamClient.stream(new UpstreamRequest(turn.model(), turn.conversation(), turn.parameters(), "passthrough"))
                .onErrorResume(ex -> Flux.just(ChatDelta.error(ex.getMessage())))
                .takeUntil(ChatDelta::isError);
    }

    public Flux<ServerSentEvent<String>> stream(TurnRequest turn) {
        long created = Instant.now().getEpochSecond();
        AtomicBoolean failed = new AtomicBoolean(false);
        log.info("chat turn start completionId={}, model={}, historyMessages={}, toolLoop={}",
                turn.completionId(), turn.model(), turn.history().size(), turn.toolLoop());
        return deltas(turn)
                .doOnNext(delta -> {
                    if (delta.isError()) {
                        failed.set(true);
                    }
                })
                .map(delta -> ServerSentEvent.builder(
                        chunkEncoder.encodeChunk(turn.completionId(), turn.model(), created, delta)).build())
                .concatWith(Flux.defer(() -> failed.get()
                        ? Flux.<ServerSentEvent<String>>empty()
                        : Flux.just(ServerSentEvent.builder(SsePayloadDecoder.DONE_SENTINEL).build())))
                .doOnCancel(() -> log.info("chat turn canceled by client completionId={}", turn.completionId()));
    }

    /**
     * 非流式请求（仅直通模式）：聚合全部 delta 为一个 chat.completion 对象。
     */
    public Mono<String> complete(TurnRequest turn) {
        long created = Instant.now().getEpochSecond();
        return deltas(turn)
                .collectList()
                .map(deltas -> {
                    StringBuilder reasoning = new StringBuilder();
                    StringBuilder content = new StringBuilder();
                    String finishReason = null;
                    for (ChatDelta delta : deltas) {
                        if (delta.isError()) {
                            throw new UpstreamException(delta.error());
                        }
                        if (delta.hasReasoning()) {
                            reasoning.append(delta.reasoning());
                        }
                        if (delta.hasContent()) {
                            content.append(delta.content());
                        }
                        if (delta.hasFinishReason()) {
                            finishReason = delta.finishReason();
                        }
                    }
                    return chunkEncoder.encodeCompletion(turn.completionId(), turn.model(), created,
                            reasoning.toString(), content.toString(), finishReason);
                });
    }
}
