package com.apiprobe.core.util;

import com.apiprobe.core.model.Severity;

public final class SeverityWeights {
    private SeverityWeights() {}

    /** 위험 점수 가중치: CRITICAL 25 / HIGH 15 / MEDIUM 8 / LOW 3 / INFO 0 */
    public static int weightOf(Severity s) {
        if (s == null) return 0;
        switch (s) {
            case CRITICAL: return 25;
            case HIGH:     return 15;
            case MEDIUM:   return 8;
            case LOW:      return 3;
            default:       return 0;
        }
    }
}
