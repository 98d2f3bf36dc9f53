package com.linlay.toolseek.stream.sse;

import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * 逐事件 flush 的 SSE 写出器，关闭代理缓冲，保证每个 delta 到达即下发。
 */
public class SseFlushWriter {

    public Mono<Void> write(ServerHttpResponse response, Flux<ServerSentEvent<String>> events) {
        response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache, no-transform");
        response.getHeaders().set("Connection", "keep-alive");

        return response.writeAndFlushWith(
                events.map(this::encode)
                        .map(response.bufferFactory()::wrap)
                        .map(Mono::just)
        );
    }

    /**
     * 只编码 data 字段：多行载荷拆成多个 data 行，以空行结束事件。
     */
    byte[] encode(ServerSentEvent<String> event) {
        StringBuilder builder = new StringBuilder();
        String data = event.data() == null ? "" : event.data();
        for (String line : data.split("\\R", -1)) {
            builder.append("data: ").append(line).append('\n');
        }
        builder.append('\n');
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }
}
