package com.linlay.toolseek.stream.sse;

import java.util.ArrayList;
import java.util.List;

/**
 * SSE data 载荷解码。
 * <p>
 * 输入既可以是完整的 SSE 帧（含 {@code data:}/{@code event:} 等字段行），也可以是已被 HTTP 层拆好的裸载荷。
 * 空行被忽略，非 data 字段行被跳过，{@code [DONE]} 视为流终止而不是待解析的 JSON。
 */
public final class SsePayloadDecoder {

    public static final String DONE_SENTINEL = "[DONE]";

    private SsePayloadDecoder() {
    }

    public record Payload(String data, boolean done) {

        static final Payload DONE = new Payload(null, true);
    }

    /**
     * 解码单个事件。返回 null 表示该事件没有可用载荷（空行、注释或纯字段行）。
     */
    public static Payload decodeEvent(String rawEvent) {
        if (rawEvent == null || rawEvent.isBlank()) {
            return null;
        }
        String[] lines = rawEvent.split("\\R", -1);
        boolean framed = false;
        StringBuilder data = null;
        for (String line : lines) {
            if (isFieldLine(line)) {
                framed = true;
            }
            if (!line.startsWith("data:")) {
                continue;
            }
            String value = line.substring(5);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        String payload = framed ? (data == null ? null : data.toString().trim()) : rawEvent.trim();
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        if (DONE_SENTINEL.equals(payload)) {
            return Payload.DONE;
        }
        return new Payload(payload, false);
    }

    /**
     * 解码一整段 SSE 文本，按空行切分事件，遇到终止标记立即停止。
     */
    public static List<String> decodeStream(String body) {
        List<String> payloads = new ArrayList<>();
        if (body == null || body.isEmpty()) {
            return payloads;
        }
        StringBuilder event = new StringBuilder();
        for (String line : body.split("\\R", -1)) {
            if (!line.isBlank()) {
                event.append(line).append('\n');
                continue;
            }
            if (consume(event, payloads)) {
                return payloads;
            }
        }
        consume(event, payloads);
        return payloads;
    }

    private static boolean consume(StringBuilder event, List<String> payloads) {
        if (event.isEmpty()) {
            return false;
        }
        Payload payload = decodeEvent(event.toString());
        event.setLength(0);
        if (payload == null) {
            return false;
        }
        if (payload.done()) {
            return true;
        }
        payloads.add(payload.data());
        return false;
    }

    private static boolean isFieldLine(String line) {
        return line.startsWith("data:")
                || line.startsWith("event:")
                || line.startsWith("id:")
                || line.startsWith("retry:")
                || line.startsWith(":");
    }
}
