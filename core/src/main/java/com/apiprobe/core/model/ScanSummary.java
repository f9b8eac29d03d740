package com.apiprobe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;

/**
 * 결과 목록의 파생 카운터(캐시된 투영).
 * 언제든 {@link #of(Collection)} 로 results 만으로 다시 계산할 수 있어야 한다.
 *
 * 심각도 카운터는 VULNERABLE 관측만 센다. severity=INFO 인 VULNERABLE 은
 * vulnerabilities 에만 잡히고 심각도 버킷에는 들어가지 않는다.
 */
@JsonPropertyOrder({"total_tests", "vulnerabilities_found", "critical", "high", "medium", "low",
        "info", "passed", "errors"})
public record ScanSummary(
        @JsonProperty("total_tests") int total,
        @JsonProperty("vulnerabilities_found") int vulnerabilities,
        @JsonProperty("critical") int critical,
        @JsonProperty("high") int high,
        @JsonProperty("medium") int medium,
        @JsonProperty("low") int low,
        @JsonProperty("info") int info,
        @JsonProperty("passed") int passed,
        @JsonProperty("errors") int errors
) {
    public static final ScanSummary EMPTY = new ScanSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);

    public ScanSummary {
        if (total < 0 || vulnerabilities < 0 || critical < 0 || high < 0 || medium < 0
                || low < 0 || info < 0 || passed < 0 || errors < 0) {
            throw new IllegalArgumentException("summary counters must be >= 0");
        }
    }

    /** 결과 목록 전체에서 재계산 */
    public static ScanSummary of(Collection<Finding> results) {
        return EMPTY.plus(results);
    }

    /** 배치를 접은 새 요약을 반환 (this 는 불변) */
    public ScanSummary plus(Collection<Finding> batch) {
        if (batch == null || batch.isEmpty()) return this;
        int t = total, v = vulnerabilities, c = critical, h = high, m = medium, l = low;
        int in = info, p = passed, e = errors;
        for (Finding f : batch) {
            t++;
            switch (f.getStatus()) {
                case VULNERABLE -> {
                    v++;
                    switch (f.getSeverity()) {
                        case CRITICAL -> c++;
                        case HIGH -> h++;
                        case MEDIUM -> m++;
                        case LOW -> l++;
                        case INFO -> { /* 버킷 없음 */ }
                    }
                }
                case INFO -> in++;
                case PASSED -> p++;
                case ERROR -> e++;
            }
        }
        return new ScanSummary(t, v, c, h, m, l, in, p, e);
    }

    /** 심각도 버킷 조회 (INFO 는 버킷이 없으므로 0) */
    public int count(Severity severity) {
        if (severity == null) return 0;
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case INFO -> 0;
        };
    }

    public boolean hasVulnerabilities() { return vulnerabilities > 0; }
}
