package com.linlay.toolseek.controller;

import com.linlay.toolseek.config.UpstreamProperties;
import com.linlay.toolseek.model.api.ChatCompletionRequest;
import com.linlay.toolseek.service.ChatRelayService;
import com.linlay.toolseek.service.ChatRelayService.TurnRequest;
import com.linlay.toolseek.stream.sse.SseFlushWriter;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class ChatCompletionController {

    private final ChatRelayService chatRelayService;
    private final SseFlushWriter sseFlushWriter;
    private final UpstreamProperties upstreamProperties;

    public ChatCompletionController(
            ChatRelayService chatRelayService,
            SseFlushWriter sseFlushWriter,
            UpstreamProperties upstreamProperties
    ) {
        this.chatRelayService = chatRelayService;
        this.sseFlushWriter = sseFlushWriter;
        this.upstreamProperties = upstreamProperties;
    }

    @PostMapping("/chat/completions")
    public Mono<Void> chatCompletions(
            @Valid @RequestBody ChatCompletionRequest request,
            ServerHttpResponse response
    ) {
        TurnRequest turn = chatRelayService.prepare(request);
        if (turn.streaming()) {
            return sseFlushWriter.write(response, chatRelayService.stream(turn));
        }
        return chatRelayService.complete(turn)
                .flatMap(json -> {
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    return response.writeWith(Mono.just(
                            response.bufferFactory().wrap(json.getBytes(StandardCharsets.UTF_8))));
                });
    }

    @GetMapping("/models")
    public Map<String, Object> models() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("id", upstreamProperties.getModel());
        model.put("object", "model");
        model.put("owned_by", "toolseek");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", List.of(model));
        return body;
    }
}
