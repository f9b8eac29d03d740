package com.apiprobe.core.service;

import com.apiprobe.core.model.RiskScore;
import com.apiprobe.core.model.ScanSnapshot;

import java.util.Objects;

/**
 * 스캔 1회의 최종 산출물.
 *
 * @param snapshot     FINALIZED 세션 스냅샷
 * @param risk         snapshot.summary 기반 위험 점수
 * @param planRationale 적용된 플랜의 근거 (플랜이 없으면 null)
 * @param planApplied  어드바이저 플랜이 순서 결정에 쓰였는지
 * @param cancelled    취소/전체 데드라인으로 일부 프로브가 생략되었을 수 있는지
 */
public record ScanOutcome(ScanSnapshot snapshot,
                          RiskScore risk,
                          String planRationale,
                          boolean planApplied,
                          boolean cancelled) {
    public ScanOutcome {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(risk, "risk");
    }
}
