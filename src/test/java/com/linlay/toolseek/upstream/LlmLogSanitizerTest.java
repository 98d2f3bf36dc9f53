package com.linlay.toolseek.upstream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmLogSanitizerTest {

    @Test
    void shouldMaskSecretsWhenEnabled() {
        String raw = "{\"api_key\":\"abc\"} Authorization: Bearer xyz.123 key=sk-abcdef1234567890";

        String masked = LlmLogSanitizer.maskText(raw, true);

        assertThat(masked).contains("\"api_key\":\"***\"");
        assertThat(masked).contains("Bearer ***");
        assertThat(masked).contains("sk-***");
        assertThat(masked).doesNotContain("abcdef1234567890");
    }

    @Test
    void shouldKeepTextWhenMaskingDisabled() {
        assertThat(LlmLogSanitizer.maskText("Bearer xyz", false)).isEqualTo("Bearer xyz");
        assertThat(LlmLogSanitizer.maskText(null, true)).isEmpty();
    }
}
