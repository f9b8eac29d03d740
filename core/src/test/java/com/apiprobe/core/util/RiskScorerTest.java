package com.apiprobe.core.util;

import com.apiprobe.core.model.RiskLevel;
import com.apiprobe.core.model.RiskScore;
import com.apiprobe.core.model.ScanSummary;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskScorerTest {

    /** (critical, high, medium, low) 만 채운 요약 */
    private static ScanSummary sev(int c, int h, int m, int l) {
        int v = c + h + m + l;
        return new ScanSummary(v, v, c, h, m, l, 0, 0, 0);
    }

    @Test
    void one_critical_one_high_is_40_medium() {
        RiskScore r = RiskScorer.score(sev(1, 1, 0, 0));
        assertEquals(40, r.value());
        assertEquals(RiskLevel.MEDIUM, r.level());
    }

    @Test
    void three_critical_is_75_critical() {
        RiskScore r = RiskScorer.score(sev(3, 0, 0, 0));
        assertEquals(75, r.value());
        assertEquals(RiskLevel.CRITICAL, r.level());
    }

    @Test
    void thresholds_are_inclusive() {
        assertEquals(RiskLevel.LOW, RiskScorer.levelOf(24));
        assertEquals(RiskLevel.MEDIUM, RiskScorer.levelOf(25));
        assertEquals(RiskLevel.HIGH, RiskScorer.levelOf(50));
        assertEquals(RiskLevel.CRITICAL, RiskScorer.levelOf(75));
    }

    @Test
    void score_is_capped_at_100() {
        RiskScore r = RiskScorer.score(sev(50, 50, 50, 50));
        assertEquals(100, r.value());
        assertEquals(RiskLevel.CRITICAL, r.level());
    }

    @Test
    void passed_info_and_errors_do_not_move_the_score() {
        ScanSummary noisy = new ScanSummary(30, 0, 0, 0, 0, 0, 10, 10, 10);
        assertEquals(0, RiskScorer.score(noisy).value());
        assertEquals(RiskLevel.LOW, RiskScorer.score(noisy).level());
    }

    @Test
    void score_is_monotonic_in_every_severity_count() {
        for (int c = 0; c <= 4; c++) {
            for (int h = 0; h <= 4; h++) {
                for (int m = 0; m <= 4; m++) {
                    for (int l = 0; l <= 4; l++) {
                        int base = RiskScorer.score(sev(c, h, m, l)).value();
                        assertTrue(base <= 100);
                        assertTrue(RiskScorer.score(sev(c + 1, h, m, l)).value() >= base);
                        assertTrue(RiskScorer.score(sev(c, h + 1, m, l)).value() >= base);
                        assertTrue(RiskScorer.score(sev(c, h, m + 1, l)).value() >= base);
                        assertTrue(RiskScorer.score(sev(c, h, m, l + 1)).value() >= base);
                    }
                }
            }
        }
    }

    @Test
    void identical_summaries_give_identical_scores() {
        assertEquals(RiskScorer.score(sev(1, 2, 3, 4)), RiskScorer.score(sev(1, 2, 3, 4)));
    }
}
