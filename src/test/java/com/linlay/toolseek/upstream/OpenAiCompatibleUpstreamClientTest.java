package com.linlay.toolseek.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.config.LlmInteractionLogProperties;
import com.linlay.toolseek.config.UpstreamProperties;
import com.linlay.toolseek.model.ChatDelta;
import com.linlay.toolseek.model.ChatMessage;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCompatibleUpstreamClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldStreamDeltasAndSendContinuationPrefix() throws Exception {
        ArrayBlockingQueue<CapturedRequest> queue = new ArrayBlockingQueue<>(1);
        String sse = "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"Let me \"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"check\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"42\"},\"finish_reason\":\"stop\"}]}\n\n"
                + "data: [DONE]\n\n";
        startServer(200, sse, queue);

        OpenAiCompatibleUpstreamClient client = newClient("http://127.0.0.1:" + server.getAddress().getPort() + "/beta", "sk-test-key-123456");
        List<ChatDelta> deltas = client.stream(new UpstreamRequest(
                        "deepseek-chat",
                        List.of(ChatMessage.user("6*7?"), ChatMessage.assistantPrefix("<think>\n")),
                        "test"))
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(deltas).extracting(ChatDelta::reasoning).containsExactly("Let me ", "check", null);
        assertThat(deltas.get(2).content()).isEqualTo("42");
        assertThat(deltas.get(2).finishReason()).isEqualTo("stop");

        CapturedRequest captured = queue.poll(3, TimeUnit.SECONDS);
        assertThat(captured).isNotNull();
        assertThat(captured.path()).isEqualTo("/beta/chat/completions");
        assertThat(captured.authorization()).isEqualTo("Bearer sk-test-key-123456");
        JsonNode body = objectMapper.readTree(captured.body());
        assertThat(body.path("model").asText()).isEqualTo("deepseek-chat");
        assertThat(body.path("stream").asBoolean()).isTrue();
        JsonNode messages = body.path("messages");
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).has("prefix")).isFalse();
        assertThat(messages.get(1).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.get(1).path("prefix").asBoolean()).isTrue();
        assertThat(messages.get(1).path("content").asText()).isEqualTo("<think>\n");
    }

    @Test
    void shouldForwardClientSamplingParametersButKeepReservedFields() throws Exception {
        ArrayBlockingQueue<CapturedRequest> queue = new ArrayBlockingQueue<>(1);
        startServer(200, "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}\n\ndata: [DONE]\n\n", queue);
        OpenAiCompatibleUpstreamClient client = newClient("http://127.0.0.1:" + server.getAddress().getPort() + "/v1", "k");
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("temperature", 0.1);
        parameters.put("max_tokens", 5);
        parameters.put("stop", null);
        parameters.put("model", "client-model");
        parameters.put("stream", false);
        parameters.put("messages", List.of());

        client.stream(new UpstreamRequest("deepseek-chat", List.of(ChatMessage.user("hi")), parameters, "test"))
                .collectList()
                .block(Duration.ofSeconds(5));

        CapturedRequest captured = queue.poll(3, TimeUnit.SECONDS);
        assertThat(captured).isNotNull();
        JsonNode body = objectMapper.readTree(captured.body());
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.1);
        assertThat(body.path("max_tokens").asInt()).isEqualTo(5);
        assertThat(body.has("stop")).isTrue();
        assertThat(body.path("stop").isNull()).isTrue();
        assertThat(body.path("model").asText()).isEqualTo("deepseek-chat");
        assertThat(body.path("stream").asBoolean()).isTrue();
        assertThat(body.path("messages")).hasSize(1);
    }

    @Test
    void shouldRaiseUpstreamExceptionOnHttpError() throws Exception {
        startServer(401, "{\"error\":{\"message\":\"invalid key\"}}", new ArrayBlockingQueue<>(1));
        OpenAiCompatibleUpstreamClient client = newClient("http://127.0.0.1:" + server.getAddress().getPort() + "/v1", "bad-key");

        assertThatThrownBy(() -> client.stream(new UpstreamRequest("m", List.of(ChatMessage.user("hi")), "test"))
                .collectList()
                .block(Duration.ofSeconds(5)))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("HTTP 401")
                .satisfies(ex -> assertThat(((UpstreamException) ex).statusCode()).isEqualTo(401));
    }

    @Test
    void shouldSurfaceInStreamErrorEventAsErrorDelta() throws Exception {
        startServer(200, "data: {\"error\":{\"message\":\"overloaded\"}}\n\n", new ArrayBlockingQueue<>(1));
        OpenAiCompatibleUpstreamClient client = newClient("http://127.0.0.1:" + server.getAddress().getPort() + "/v1", "k");

        List<ChatDelta> deltas = client.stream(new UpstreamRequest("m", List.of(ChatMessage.user("hi")), "test"))
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(deltas).hasSize(1);
        assertThat(deltas.get(0).isError()).isTrue();
        assertThat(deltas.get(0).error()).isEqualTo("overloaded");
    }

    @Test
    void shouldFailFastWhenApiKeyMissing() {
        OpenAiCompatibleUpstreamClient client = newClient("https://api.deepseek.com/beta", "");

        assertThatThrownBy(() -> client.stream(new UpstreamRequest("m", List.of(ChatMessage.user("hi")), "test"))
                .blockLast(Duration.ofSeconds(2)))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    void shouldResolveCompletionsPathFromBaseUrl() {
        assertThat(OpenAiCompatibleUpstreamClient.resolveCompletionsUri("https://api.deepseek.com/beta")).isEqualTo("chat/completions");
        assertThat(OpenAiCompatibleUpstreamClient.resolveCompletionsUri("https://example.com/v1/")).isEqualTo("chat/completions");
        assertThat(OpenAiCompatibleUpstreamClient.resolveCompletionsUri("https://api.deepseek.com")).isEqualTo("v1/chat/completions");
    }

    private OpenAiCompatibleUpstreamClient newClient(String baseUrl, String apiKey) {
        UpstreamProperties properties = new UpstreamProperties();
        properties.setBaseUrl(baseUrl);
        properties.setApiKey(apiKey);
        properties.setStreamTimeoutMs(5000);
        return new OpenAiCompatibleUpstreamClient(properties, objectMapper, new LlmInteractionLogProperties(), null);
    }

    private void startServer(int status, String responseBody, ArrayBlockingQueue<CapturedRequest> queue) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = readBody(exchange.getRequestBody());
            queue.offer(new CapturedRequest(
                    exchange.getRequestURI().getPath(),
                    exchange.getRequestHeaders().getFirst("Authorization"),
                    body
            ));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type",
                    status == 200 ? "text/event-stream" : "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        });
        server.start();
    }

    private String readBody(InputStream inputStream) throws IOException {
        return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
    }

    private record CapturedRequest(String path, String authorization, String body) {
    }
}
