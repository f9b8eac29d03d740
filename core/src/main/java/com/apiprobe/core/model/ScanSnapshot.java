package com.apiprobe.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 리포팅 경계로 넘기는 불변 세션 사본.
 * 모든 Exporter(JSON/HTML/PDF …)는 이 형태만 보고 렌더링한다.
 */
@JsonPropertyOrder({"scan_id", "target", "start_time", "end_time", "duration", "summary", "results"})
public record ScanSnapshot(
        @JsonProperty("scan_id") String scanId,
        @JsonProperty("target") String target,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("duration") String duration,
        @JsonProperty("summary") ScanSummary summary,
        @JsonProperty("results") List<Finding> results
) {
    public static final String IN_PROGRESS = "In progress";

    public ScanSnapshot {
        Objects.requireNonNull(scanId, "scanId");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(summary, "summary");
        results = List.copyOf(results);
        if (summary.total() != results.size()) {
            throw new IllegalStateException("torn snapshot: summary.total=" + summary.total()
                    + ", results=" + results.size());
        }
        if (duration == null) duration = formatDuration(startTime, endTime);
    }

    @JsonIgnore
    public boolean isFinalized() { return endTime != null; }

    /** VULNERABLE 관측을 심각도별로 묶는다 (CRITICAL → INFO 순) */
    public Map<Severity, List<Finding>> vulnerabilitiesBySeverity() {
        Map<Severity, List<Finding>> out = new LinkedHashMap<>();
        Severity[] all = Severity.values();
        for (int i = all.length - 1; i >= 0; i--) {
            Severity s = all[i];
            List<Finding> bucket = results.stream()
                    .filter(f -> f.isVulnerable() && f.getSeverity() == s)
                    .toList();
            if (!bucket.isEmpty()) out.put(s, bucket);
        }
        return out;
    }

    /** "12.34s" 또는 종료 전이면 "In progress" */
    public static String formatDuration(Instant start, Instant end) {
        if (start == null || end == null) return IN_PROGRESS;
        long ms = Math.max(0, Duration.between(start, end).toMillis());
        return String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
    }
}
