package com.apiprobe.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigTest {

    @Test
    void defaults_are_applied() {
        ScanConfig cfg = ScanConfig.defaults().setTarget("https://api.example.com");
        cfg.validate();

        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.getRps()).isEqualTo(10);
        assertThat(cfg.getProbeTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.getCancelGrace()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getScanTimeout()).isNull();
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getProbes()).isEmpty();
        assertThat(cfg.getAdvisor().isEnabled()).isFalse();
        assertThat(cfg.getAdvisor().getApiKeyEnv()).isEqualTo("AZURE_OPENAI_API_KEY");
    }

    @Test
    void target_without_scheme_gets_https() {
        ScanConfig cfg = ScanConfig.defaults().setTarget("  api.example.com/v1 ");
        assertThat(cfg.getTarget()).isEqualTo("https://api.example.com/v1");
        assertThat(cfg.getTargetUri().getHost()).isEqualTo("api.example.com");
    }

    @Test
    void validate_rejects_missing_or_non_http_target() {
        assertThatThrownBy(() -> ScanConfig.defaults().validate()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ScanConfig.defaults().setTarget("ftp://files.example.com").validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http");
    }

    @Test
    void validate_rejects_bad_numbers() {
        assertThatThrownBy(() -> ScanConfig.defaults().setTarget("https://a.example").setRps(0).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScanConfig.defaults().setTarget("https://a.example")
                .setProbeTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScanConfig.defaults().setTarget("https://a.example")
                .setCancelGrace(Duration.ofMillis(-1)).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrency_is_floored_at_one() {
        assertThat(ScanConfig.defaults().setConcurrency(0).getConcurrency()).isEqualTo(1);
    }

    @Test
    void enabled_advisor_needs_endpoint_and_deployment() {
        ScanConfig cfg = ScanConfig.defaults().setTarget("https://a.example");
        cfg.getAdvisor().setEnabled(true);
        assertThatThrownBy(cfg::validate).hasMessageContaining("advisor.endpoint");

        cfg.getAdvisor().setEndpoint("https://res.openai.azure.com");
        assertThatThrownBy(cfg::validate).hasMessageContaining("advisor.deployment");

        cfg.getAdvisor().setDeployment("gpt-4o");
        cfg.validate();
    }

    @Test
    void advisor_timeout_is_checked_even_when_disabled() {
        ScanConfig cfg = ScanConfig.defaults().setTarget("https://a.example");
        cfg.getAdvisor().setEnabled(false).setTimeout(null);
        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("advisor.timeout");

        cfg.getAdvisor().setTimeout(Duration.ZERO);
        assertThatThrownBy(cfg::validate).hasMessageContaining("advisor.timeout");
    }

    @Test
    void headers_keep_order_and_are_read_only() {
        ScanConfig cfg = ScanConfig.defaults()
                .addHeader("Authorization", "Bearer t")
                .addHeader("X-Trace", "1");

        assertThat(cfg.getHeaders().keySet()).containsExactly("Authorization", "X-Trace");
        assertThatThrownBy(() -> cfg.getHeaders().put("a", "b")).isInstanceOf(UnsupportedOperationException.class);

        cfg.setHeaders(Map.of("Cookie", "s=1"));
        assertThat(cfg.getHeaders()).containsOnlyKeys("Cookie");
    }
}
