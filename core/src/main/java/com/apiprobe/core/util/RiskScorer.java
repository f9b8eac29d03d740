package com.apiprobe.core.util;

import com.apiprobe.core.model.RiskLevel;
import com.apiprobe.core.model.RiskScore;
import com.apiprobe.core.model.ScanSummary;
import com.apiprobe.core.model.Severity;

/**
 * 요약 → (0..100 점수, 구간). 순수 함수.
 * 점수 = critical*25 + high*15 + medium*8 + low*3, 100 에서 상한.
 * INFO/PASSED/ERROR 카운트는 점수에 들어가지 않는다.
 */
public final class RiskScorer {
    private RiskScorer() {}

    public static final int MAX_SCORE = 100;

    public static RiskScore score(ScanSummary summary) {
        if (summary == null) return new RiskScore(0, RiskLevel.LOW);
        long raw = 0;
        for (Severity s : new Severity[]{Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW}) {
            raw += (long) summary.count(s) * SeverityWeights.weightOf(s);
        }
        int value = (int) Math.min(raw, MAX_SCORE);
        return new RiskScore(value, levelOf(value));
    }

    /** >=75 CRITICAL, >=50 HIGH, >=25 MEDIUM, 그 외 LOW */
    public static RiskLevel levelOf(int score) {
        if (score >= 75) return RiskLevel.CRITICAL;
        if (score >= 50) return RiskLevel.HIGH;
        if (score >= 25) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
