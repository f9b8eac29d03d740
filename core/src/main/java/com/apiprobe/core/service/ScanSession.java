package com.apiprobe.core.service;

import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.ScanSnapshot;
import com.apiprobe.core.model.ScanSummary;
import com.apiprobe.core.model.SessionState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 스캔 1회의 누적 기록 (세션 집계기).
 *
 *  - results 는 append 전용, 순서 = 배치가 도착한 순서
 *  - summary 는 results 의 캐시된 투영이며 append 와 같은 임계구역에서만 바뀐다
 *  - 모든 변경/읽기는 this 모니터로 직렬화 → snapshot() 이 찢어진 상태를 볼 수 없다
 *  - CREATED → RUNNING → FINALIZED, FINALIZED 이후 append/finalize 는 {@link AlreadyFinalizedException}
 *
 * 전역 싱글턴이 아니라 오케스트레이터 호출 체인을 따라 명시적으로 전달된다.
 */
public final class ScanSession {

    private final String scanId;
    private final String target;
    private final Instant startTime;
    private final Clock clock;

    private final List<Finding> results = new ArrayList<>();
    private ScanSummary summary = ScanSummary.EMPTY;
    private SessionState state = SessionState.CREATED;
    private Instant endTime;

    public ScanSession(String target) {
        this(target, Clock.systemDefaultZone());
    }

    public ScanSession(String target, Clock clock) {
        this.target = Objects.requireNonNull(target, "target");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startTime = clock.instant();
        this.scanId = ScanIds.next(startTime, clock.getZone());
    }

    public String getScanId() { return scanId; }
    public String getTarget() { return target; }
    public Instant getStartTime() { return startTime; }

    public synchronized SessionState getState() { return state; }
    public synchronized ScanSummary getSummary() { return summary; }
    public synchronized Instant getEndTime() { return endTime; }
    public synchronized int size() { return results.size(); }

    /**
     * 배치를 results/summary 에 원자적으로 접는다.
     * 배치 검증(null 원소 등)은 변경 전에 끝나므로 실패해도 세션은 그대로다.
     */
    public synchronized void append(Collection<Finding> batch) {
        if (state == SessionState.FINALIZED) throw new AlreadyFinalizedException(scanId, "append");
        Objects.requireNonNull(batch, "batch");
        List<Finding> copy = List.copyOf(batch);   // null 원소면 NPE

        ScanSummary next = summary.plus(copy);
        results.addAll(copy);
        summary = next;
        state = SessionState.RUNNING;
    }

    /**
     * end_time 을 한 번만 기록한다. 두 번째 호출은 거부되고 첫 end_time 이 유지된다.
     * (Object#finalize 와 겹치지 않도록 이름을 분리)
     */
    public synchronized Instant finalizeSession() {
        if (state == SessionState.FINALIZED) throw new AlreadyFinalizedException(scanId, "finalize");
        endTime = clock.instant();
        state = SessionState.FINALIZED;
        return endTime;
    }

    public synchronized boolean isFinalized() { return state == SessionState.FINALIZED; }

    /** 불변 사본. 이후 세션이 바뀌어도 이미 내준 스냅샷은 변하지 않는다. */
    public synchronized ScanSnapshot snapshot() {
        return new ScanSnapshot(scanId, target, startTime, endTime, null, summary, results);
    }

    /** summary 가 results 에서 재계산한 값과 같은지 (진단/테스트용) */
    public synchronized boolean isConsistent() {
        return ScanSummary.of(results).equals(summary);
    }

    @Override public String toString() {
        return "ScanSession{" + scanId + " " + target + " " + getState() + "}";
    }
}
