package com.linlay.toolseek.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.config.ToolLoopProperties;
import com.linlay.toolseek.config.UpstreamProperties;
import com.linlay.toolseek.execution.ExecutionAdapter;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.model.ChatMessage;
import com.linlay.toolseek.model.ChatRole;
import com.linlay.toolseek.model.api.ChatCompletionRequest;
import com.linlay.toolseek.model.api.ChatCompletionRequest.RequestMessage;
import com.linlay.toolseek.stream.sse.ChatChunkEncoder;
import com.linlay.toolseek.upstream.UpstreamClient;
import com.linlay.toolseek.upstream.UpstreamException;
import com.linlay.toolseek.upstream.UpstreamRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ChatRelayServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<UpstreamRequest> lastRequest = new AtomicReference<>();

    @Test
    void prepareShouldSplitHistoryAndApplyDefaultModel() {
        ChatRelayService service = newService(true, request -> Flux.empty());

        ChatRelayService.TurnRequest turn = service.prepare(new ChatCompletionRequest(
                " ",
                List.of(new RequestMessage("system", "be brief"),
                        new RequestMessage("user", "hi"),
                        new RequestMessage("assistant", "hello"),
                        new RequestMessage("user", "6*7?")),
                true));

        assertThat(turn.model()).isEqualTo("deepseek-chat");
        assertThat(turn.history()).extracting(ChatMessage::role).containsExactly(
                ChatRole.SYSTEM, ChatRole.USER, ChatRole.ASSISTANT);
        assertThat(turn.userMessage().content()).isEqualTo("6*7?");
        assertThat(turn.completionId()).startsWith("chatcmpl-");
        assertThat(turn.toolLoop()).isTrue();
    }

    @Test
    void prepareShouldPinConfiguredModelAndKeepSamplingParameters() throws Exception {
        ChatRelayService service = newService(false, request -> Flux.just(ChatDelta.content("ok")));
        ChatCompletionRequest request = objectMapper.readValue("""
                {"model":"gpt-4o","stream":true,"temperature":0.1,"max_tokens":5,
                 "messages":[{"role":"user","content":"hi"}]}
                """, ChatCompletionRequest.class);

        ChatRelayService.TurnRequest turn = service.prepare(request);
        service.deltas(turn).collectList().block(Duration.ofSeconds(5));

        assertThat(turn.model()).isEqualTo("deepseek-chat");
        assertThat(turn.parameters()).containsOnlyKeys("temperature", "max_tokens");
        assertThat(lastRequest.get().model()).isEqualTo("deepseek-chat");
        assertThat(lastRequest.get().parameters()).containsEntry("temperature", 0.1).containsEntry("max_tokens", 5);
    }

    @Test
    void prepareShouldRejectInvalidConversations() {
        ChatRelayService service = newService(true, request -> Flux.empty());

        assertThatThrownBy(() -> service.prepare(new ChatCompletionRequest(null, List.of(), true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.prepare(new ChatCompletionRequest(null,
                List.of(new RequestMessage("user", "a"), new RequestMessage("assistant", "b")), true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("last message");
        assertThatThrownBy(() -> service.prepare(new ChatCompletionRequest(null,
                List.of(new RequestMessage("tool", "a")), true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.prepare(new ChatCompletionRequest(null,
                List.of(new RequestMessage("user", "a")), false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stream=true");
    }

    @Test
    void passthroughStreamShouldRelayDeltasAndEndWithDone() throws Exception {
        ChatRelayService service = newService(false, request -> Flux.just(
                ChatDelta.reasoning("r"), ChatDelta.content("c"), ChatDelta.finish("stop")));
        ChatRelayService.TurnRequest turn = service.prepare(new ChatCompletionRequest("m",
                List.of(new RequestMessage("user", "hi")), true));

        List<String> events = service.stream(turn)
                .map(ServerSentEvent::data)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(events).hasSize(4);
        assertThat(objectMapper.readTree(events.get(0)).at("/choices/0/delta/reasoning_content").asText()).isEqualTo("r");
        assertThat(objectMapper.readTree(events.get(1)).at("/choices/0/delta/content").asText()).isEqualTo("c");
        assertThat(events.get(3)).isEqualTo("[DONE]");
        assertThat(lastRequest.get().messages()).hasSize(1);
        assertThat(lastRequest.get().messages().get(0).prefix()).isFalse();
    }

    @Test
    void passthroughStreamShouldEndWithErrorEventAndNoDone() throws Exception {
        ChatRelayService service = newService(false, request -> Flux.concat(
                Flux.just(ChatDelta.content("partial")),
                Flux.error(new UpstreamException("Upstream returned HTTP 503: busy"))));
        ChatRelayService.TurnRequest turn = service.prepare(new ChatCompletionRequest("m",
                List.of(new RequestMessage("user", "hi")), true));

        List<String> events = service.stream(turn)
                .map(ServerSentEvent::data)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(events).hasSize(2);
        JsonNode error = objectMapper.readTree(events.get(1));
        assertThat(error.at("/error/message").asText()).contains("HTTP 503");
        assertThat(events).doesNotContain("[DONE]");
    }

    @Test
    void completeShouldAggregatePassthroughDeltas() throws Exception {
        ChatRelayService service = newService(false, request -> Flux.just(
                ChatDelta.reasoning("think "), ChatDelta.reasoning("more"), ChatDelta.content("4"),
                ChatDelta.content("2"), ChatDelta.finish("length")));
        ChatRelayService.TurnRequest turn = service.prepare(new ChatCompletionRequest("m",
                List.of(new RequestMessage("user", "hi")), false));

        JsonNode completion = objectMapper.readTree(service.complete(turn).block(Duration.ofSeconds(5)));

        assertThat(completion.path("object").asText()).isEqualTo("chat.completion");
        assertThat(completion.at("/choices/0/message/reasoning_content").asText()).isEqualTo("think more");
        assertThat(completion.at("/choices/0/message/content").asText()).isEqualTo("42");
        assertThat(completion.at("/choices/0/finish_reason").asText()).isEqualTo("length");
    }

    @Test
    void completeShouldFailOnUpstreamError() {
        ChatRelayService service = newService(false, request -> Flux.just(ChatDelta.error("quota exceeded")));
        ChatRelayService.TurnRequest turn = service.prepare(new ChatCompletionRequest("m",
                List.of(new RequestMessage("user", "hi")), false));

        assertThatThrownBy(() -> service.complete(turn).block(Duration.ofSeconds(5)))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("quota exceeded");
    }

    private ChatRelayService newService(boolean toolLoop, Function<UpstreamRequest, Flux<ChatDelta>> script) {
        UpstreamClient upstream = request -> {
            lastRequest.set(request);
            return script.apply(request);
        };
        ToolLoopProperties toolLoopProperties = new ToolLoopProperties();
        toolLoopProperties.setEnabled(toolLoop);
        ToolLoopOrchestrator orchestrator = new ToolLoopOrchestrator(
                upstream,
                mock(ExecutionAdapter.class),
                new ToolLoopPrompts("python", "output", "</think>"),
                "python",
                "output",
                "</think>",
                16
        );
        return new ChatRelayService(orchestrator, upstream, new ChatChunkEncoder(objectMapper),
                toolLoopProperties, new UpstreamProperties());
    }
}
