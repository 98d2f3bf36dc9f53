package com.linlay.toolseek.upstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.config.LlmInteractionLogProperties;
import com.linlay.toolseek.config.UpstreamProperties;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.model.ChatMessage;
import com.linlay.toolseek.stream.adapter.openai.OpenAiSseDeltaParser;
import com.linlay.toolseek.stream.sse.SsePayloadDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 原生 WebClient SSE 路径：直接构建 OpenAI Compatible 请求（支持 assistant prefix 续写），逐块解析 SSE delta。
 */
public class OpenAiCompatibleUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleUpstreamClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 500;
    private static final Set<String> RESERVED_BODY_FIELDS = Set.of("model", "messages", "stream");

    private final UpstreamProperties properties;
    private final LlmCallLogger callLogger;
    private final OpenAiSseDeltaParser deltaParser;
    private final WebClient webClient;

    public OpenAiCompatibleUpstreamClient(
            UpstreamProperties properties,
            ObjectMapper objectMapper,
            LlmInteractionLogProperties logProperties,
            ConnectionProvider connectionProvider
    ) {
        this.properties = properties;
        this.callLogger = new LlmCallLogger(logProperties);
        this.deltaParser = new OpenAiSseDeltaParser(objectMapper);
        this.webClient = buildWebClient(properties, connectionProvider);
    }

    @Override
    public Flux<ChatDelta> stream(UpstreamRequest request) {
        return Flux.defer(() -> {
            assertConfigured();
            String traceId = callLogger.generateTraceId();
            String stage = request.stage();
            String model = StringUtils.hasText(request.model()) ? request.model() : properties.getModel();
            Map<String, Object> body = buildRequestBody(model, request.messages(), request.parameters());
            long startNanos = System.nanoTime();
            AtomicInteger chunkCount = new AtomicInteger(0);
            AtomicBoolean firstChunkReceived = new AtomicBoolean(false);

            callLogger.info(log, "[{}][{}] upstream SSE request start model={}, messages={}, parameters={}",
                    traceId, stage, model, request.messages().size(), request.parameters().keySet());
            callLogger.logMessages(log, traceId, stage, request.messages());

            return webClient.post()
                    .uri(resolveCompletionsUri(properties.getBaseUrl()))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(status -> status.isError(), response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(errorBody -> Mono.error(new UpstreamException(
                                    "Upstream returned HTTP " + response.statusCode().value() + ": "
                                            + truncate(callLogger.sanitizeText(errorBody)),
                                    response.statusCode().value(),
                                    null
                            ))))
                    .bodyToFlux(String.class)
                    .doOnNext(chunk -> firstChunkReceived.set(true))
                    .retryWhen(Retry.max(1)
                            .filter(ex -> !firstChunkReceived.get() && isConnectionError(ex)))
                    .doOnNext(rawChunk -> {
                        chunkCount.incrementAndGet();
                        callLogger.debug(log, "[{}][{}][raw-delta] {}", traceId, stage, callLogger.sanitizeText(rawChunk));
                    })
                    .takeUntil(this::isDoneSentinel)
                    .<ChatDelta>handle((rawChunk, sink) -> {
                        ChatDelta delta = deltaParser.parseOrNull(rawChunk);
                        if (delta != null) {
                            sink.next(delta);
                        }
                    })
                    .timeout(Duration.ofMillis(properties.getStreamTimeoutMs()))
                    .onErrorMap(this::toUpstreamException)
                    .doOnComplete(() -> callLogger.info(log, "[{}][{}] upstream SSE stream finished in {} ms, chunks={}",
                            traceId, stage, callLogger.elapsedMs(startNanos), chunkCount.get()))
                    .doOnError(ex -> log.warn("[{}][{}] upstream SSE stream failed in {} ms: {}",
                            traceId, stage, callLogger.elapsedMs(startNanos), ex.getMessage()))
                    .doOnCancel(() -> callLogger.info(log, "[{}][{}] upstream SSE stream canceled in {} ms, chunks={}",
                            traceId, stage, callLogger.elapsedMs(startNanos), chunkCount.get()));
        });
    }

    Map<String, Object> buildRequestBody(String model, List<ChatMessage> messages, Map<String, Object> parameters) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        if (parameters != null) {
            parameters.forEach((name, value) -> {
                if (!RESERVED_BODY_FIELDS.contains(name)) {
                    request.put(name, value);
                }
            });
        }
        request.put("stream", true);
        request.put("messages", toRawMessages(messages));
        return request;
    }

    static String resolveCompletionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")
                || normalized.endsWith("/beta") || normalized.endsWith("/beta/")) {
            return "chat/completions";
        }
        return "v1/chat/completions";
    }

    private List<Map<String, Object>> toRawMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> raw = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("role", message.role().value());
            item.put("content", message.content());
            if (message.prefix()) {
                item.put("prefix", true);
            }
            raw.add(item);
        }
        return raw;
    }

    private WebClient buildWebClient(UpstreamProperties config, ConnectionProvider connectionProvider) {
        HttpClient httpClient = connectionProvider != null
                ? HttpClient.create(connectionProvider)
                : HttpClient.create();
        String baseUrl = config.getBaseUrl() == null ? "" : config.getBaseUrl().trim();
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(config.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private void assertConfigured() {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new UpstreamException("Missing toolseek.upstream.base-url");
        }
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new UpstreamException("Missing toolseek.upstream.api-key");
        }
    }

    private boolean isDoneSentinel(String rawChunk) {
        SsePayloadDecoder.Payload payload = SsePayloadDecoder.decodeEvent(rawChunk);
        return payload != null && payload.done();
    }

    private Throwable toUpstreamException(Throwable ex) {
        if (ex instanceof UpstreamException) {
            return ex;
        }
        if (ex instanceof TimeoutException) {
            return new UpstreamException("Upstream stream timed out after " + properties.getStreamTimeoutMs() + " ms", -1, ex);
        }
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new UpstreamException("Upstream request failed: " + message, -1, ex);
    }

    private boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException || ex instanceof WebClientRequestException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_BODY_CHARS) {
            return text;
        }
        return text.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
