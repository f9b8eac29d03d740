package com.apiprobe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 0..100 위험 점수 + 구간 */
public record RiskScore(@JsonProperty("score") int value, @JsonProperty("level") RiskLevel level) {
    public RiskScore {
        if (value < 0 || value > 100) throw new IllegalArgumentException("risk score out of range: " + value);
        if (level == null) throw new IllegalArgumentException("level");
    }
}
