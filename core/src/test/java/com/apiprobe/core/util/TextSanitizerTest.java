package com.apiprobe.core.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class TextSanitizerTest {

    @Test
    void summary_is_simple_name_and_message() {
        assertThat(TextSanitizer.summarize(new IOException("connection refused")))
                .isEqualTo("IOException: connection refused");
        assertThat(TextSanitizer.summarize(new IllegalStateException()))
                .isEqualTo("IllegalStateException");
    }

    @Test
    void control_characters_become_spaces() {
        assertThat(TextSanitizer.sanitize("line1\nline2\r\n\tend", 200)).isEqualTo("line1 line2 end");
    }

    @Test
    void url_query_and_fragment_are_dropped() {
        String s = TextSanitizer.sanitize("GET https://api.example.com/v1/users?token=secret#frag failed", 200);
        assertThat(s).isEqualTo("GET https://api.example.com/v1/users failed");
    }

    @Test
    void long_text_is_truncated_with_ellipsis() {
        String s = TextSanitizer.sanitize("x".repeat(500), TextSanitizer.MAX_SUMMARY);
        assertThat(s).hasSize(200).endsWith("...");
    }
}
