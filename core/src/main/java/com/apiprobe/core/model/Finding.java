package com.apiprobe.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * 프로브 1회가 남기는 단일 관측.
 *
 * 불변식: severity 는 status == VULNERABLE 일 때만 존재한다 (build() 에서 강제).
 * evidence 는 표시 전용 문자열이며 어떤 해석/실행도 하지 않는다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"test", "category", "status", "severity", "url", "method",
        "description", "evidence", "recommendation", "detected_at"})
public final class Finding {
    private final String test;
    private final String category;
    private final FindingStatus status;
    private final Severity severity;       // VULNERABLE 전용
    private final String url;              // 집계형 관측이면 null
    private final String method;
    private final String description;
    private final String evidence;
    private final String recommendation;
    private final Instant detectedAt;

    private Finding(Builder b) {
        this.test = b.test;
        this.category = b.category;
        this.status = b.status;
        this.severity = b.severity;
        this.url = b.url;
        this.method = b.method;
        this.description = b.description;
        this.evidence = b.evidence;
        this.recommendation = b.recommendation;
        this.detectedAt = (b.detectedAt == null ? Instant.now() : b.detectedAt);
    }

    @JsonProperty("test") public String getTest() { return test; }
    @JsonProperty("category") public String getCategory() { return category; }
    @JsonProperty("status") public FindingStatus getStatus() { return status; }
    @JsonProperty("severity") public Severity getSeverity() { return severity; }
    @JsonProperty("url") public String getUrl() { return url; }
    @JsonProperty("method") public String getMethod() { return method; }
    @JsonProperty("description") public String getDescription() { return description; }
    @JsonProperty("evidence") public String getEvidence() { return evidence; }
    @JsonProperty("recommendation") public String getRecommendation() { return recommendation; }
    @JsonProperty("detected_at") public Instant getDetectedAt() { return detectedAt; }

    @JsonIgnore
    public boolean isVulnerable() { return status == FindingStatus.VULNERABLE; }

    public static Builder builder() { return new Builder(); }

    public static Builder vulnerable(String test, String category, Severity severity) {
        return builder().test(test).category(category).status(FindingStatus.VULNERABLE).severity(severity);
    }

    public static Builder passed(String test, String category) {
        return builder().test(test).category(category).status(FindingStatus.PASSED);
    }

    public static Builder info(String test, String category) {
        return builder().test(test).category(category).status(FindingStatus.INFO);
    }

    /** 러너가 실패를 대신 기록할 때 쓰는 합성 ERROR 관측 */
    public static Finding error(String test, String category, String description) {
        return builder()
                .test(test)
                .category(category)
                .status(FindingStatus.ERROR)
                .description(description)
                .recommendation("Re-run the probe; check target reachability and probe logs.")
                .build();
    }

    @Override public String toString() {
        return "Finding{" + test + " " + status + (severity != null ? "/" + severity : "") + "}";
    }

    public static final class Builder {
        private String test;
        private String category;
        private FindingStatus status;
        private Severity severity;
        private String url;
        private String method;
        private String description;
        private String evidence;
        private String recommendation;
        private Instant detectedAt;

        public Builder test(String test) { this.test = test; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder status(FindingStatus status) { this.status = status; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder evidence(String evidence) { this.evidence = evidence; return this; }
        public Builder recommendation(String recommendation) { this.recommendation = recommendation; return this; }
        public Builder detectedAt(Instant detectedAt) { this.detectedAt = detectedAt; return this; }

        public Finding build() {
            Objects.requireNonNull(test, "test");
            if (test.isBlank()) throw new IllegalArgumentException("test must not be blank");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(status, "status");
            if (status == FindingStatus.VULNERABLE && severity == null) {
                throw new IllegalArgumentException("VULNERABLE finding requires a severity: " + test);
            }
            if (status != FindingStatus.VULNERABLE && severity != null) {
                throw new IllegalArgumentException(status + " finding must not carry a severity: " + test);
            }
            return new Finding(this);
        }
    }
}
