package com.apiprobe.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). 결과/요약과는 별개의 관측용 값. */
public final class ScanStats {
    private final AtomicInteger probesRun = new AtomicInteger(0);     // 러너를 거친 프로브 수
    private final AtomicInteger probeErrors = new AtomicInteger(0);   // ERROR 로 끝난 프로브 수(타임아웃 포함)
    private final AtomicInteger probeTimeouts = new AtomicInteger(0);
    private final AtomicInteger skipped = new AtomicInteger(0);       // 취소로 시작하지 못한 프로브
    private final AtomicInteger dropped = new AtomicInteger(0);       // 유예 초과로 버려진 늦은 결과
    private final AtomicLong sumWallMs = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void probeFinished(long wallMs, boolean error, boolean timedOut) {
        probesRun.incrementAndGet();
        sumWallMs.addAndGet(Math.max(0, wallMs));
        if (error) probeErrors.incrementAndGet();
        if (timedOut) probeTimeouts.incrementAndGet();
    }
    public void probeSkipped() { skipped.incrementAndGet(); }
    public void resultDropped() { dropped.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        int run = probesRun.get();
        long avg = sumWallMs.get() / Math.max(1, run);
        return new Snapshot(run, probeErrors.get(), probeTimeouts.get(), skipped.get(), dropped.get(),
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(int probesRun,
                           int probeErrors,
                           int probeTimeouts,
                           int probesSkipped,
                           int resultsDropped,
                           int maxObservedConcurrency,
                           long avgProbeMs) {}
}
