package com.linlay.toolseek.upstream;

import java.util.regex.Pattern;

/**
 * 上游交互日志脱敏工具，避免 Authorization、API Key 等字段在日志中明文输出。纯静态工具类，无状态。
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern SK_KEY_PATTERN = Pattern.compile("\\bsk-[A-Za-z0-9]{8,}\\b");

    private LlmLogSanitizer() {
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        masked = BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
        return SK_KEY_PATTERN.matcher(masked).replaceAll("sk-***");
    }
}
