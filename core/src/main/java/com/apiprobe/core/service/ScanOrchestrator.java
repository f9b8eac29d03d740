package com.apiprobe.core.service;

import com.apiprobe.core.api.PlanAdvisor;
import com.apiprobe.core.api.PlanAdvisor.Advice;
import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.RiskScore;
import com.apiprobe.core.model.ScanConfig;
import com.apiprobe.core.model.ScanPlan;
import com.apiprobe.core.model.ScanSnapshot;
import com.apiprobe.core.model.ScanStats;
import com.apiprobe.core.scanner.ExecutionOrder;
import com.apiprobe.core.scanner.ProbeRegistry;
import com.apiprobe.core.scanner.ProbeRunner;
import com.apiprobe.core.util.NamedThreadFactory;
import com.apiprobe.core.util.ProgressListener;
import com.apiprobe.core.util.RiskScorer;
import com.apiprobe.core.util.StructuredLog;
import com.apiprobe.core.util.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스캔 오케스트레이터:
 *  - 선택(registry.select) → 플랜 조언(선택, 실패 시 등록 순서) → 실행 순서 결정
 *  - 고정 스레드풀(동시성=concurrency) + 역압 큐로 프로브 실행, 결과는 세션에 배치 단위로 append
 *  - 취소 플래그/전체 데드라인 → 시작 전 작업 생략, 유예 후 진행 중 작업 interrupt, 늦은 결과는 버림
 *  - 세션 finalize → 스냅샷 + 위험 점수
 *
 * 한 인스턴스로 여러 번 run() 할 수 있고 close() 로 프로브 실행 스레드를 정리한다.
 */
public final class ScanOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanOrchestrator.class);

    private static final long POLL_MS = 50;

    private final ScanConfig config;
    private final ProbeRegistry registry;
    private final PlanAdvisor advisor;
    private final ProbeRunner runner;
    private final Clock clock;

    private volatile ScanStats stats = new ScanStats();

    public ScanOrchestrator(ScanConfig config, ProbeRegistry registry, PlanAdvisor advisor) {
        this(config, registry, advisor, new ProbeRunner(), Clock.systemDefaultZone());
    }

    /** DI/테스트용 */
    public ScanOrchestrator(ScanConfig config, ProbeRegistry registry, PlanAdvisor advisor,
                            ProbeRunner runner, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.advisor = (advisor != null ? advisor : PlanAdvisor.NONE);
        this.runner = Objects.requireNonNull(runner, "runner");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /* =========================
       실행 API (오버로드 3종)
       ========================= */

    public ScanOutcome run() {
        return run(ProgressListener.NONE, null);
    }

    public ScanOutcome run(ProgressListener listener) {
        return run(listener, null);
    }

    /**
     * @throws com.apiprobe.core.scanner.InvalidSelectionException 선택 이름이 레지스트리에 없을 때 (실행 전)
     * @throws CancellationException 프로브를 하나도 제출하기 전에 취소가 관측되었을 때
     */
    public ScanOutcome run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean cancel = (cancelFlag != null) ? cancelFlag : new AtomicBoolean(false);
        final ScanStats st = new ScanStats();
        this.stats = st;

        // ---- 0) 선택 (모르는 이름이면 여기서 실패, 아무것도 실행하지 않음) ----
        final List<ProbeDescriptor> selected = registry.select(config.getProbes());
        final URI target = config.getTargetUri();
        final Map<String, String> headers = config.getHeaders();
        final int cc = Math.max(1, config.getConcurrency());
        final Instant scanDeadline = (config.getScanTimeout() == null)
                ? null : clock.instant().plus(config.getScanTimeout());

        checkCancel(cancel, scanDeadline);

        LOG.info("Scan start: target={}, probes={}, rps={}, cc={}, headers={}",
                config.getTarget(), selected.size(), config.getRps(), cc, headers.size());
        SLOG.info("scan-start",
                "target", config.getTarget(),
                "probes", selected.size(),
                "rps", config.getRps(),
                "cc", cc,
                "headerNames", String.join(",", headers.keySet()));

        // ---- 1) 플랜 조언 (plan phase) ----
        safeProgress(pl, 0.0, "plan", 0, selected.size());
        Advice advice = requestPlan(target, headers, selected);
        ScanPlan plan = advice.plan().orElse(null);
        List<ProbeDescriptor> order = ExecutionOrder.resolve(selected, plan, registry);

        checkCancel(cancel, scanDeadline);

        // 세션은 취소 검사를 통과한 뒤 만든다 (위에서 던지면 스냅샷 없음)
        final ScanSession session = new ScanSession(config.getTarget(), clock);
        final int total = order.size();
        safeProgress(pl, 0.0, "probe", 0, total);

        // ---- 2) 고정 스레드풀(+역압) 구성 ----
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("scan-worker"),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("Executor shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final Sink sink = new Sink(session, st);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);
        // 프로브 이름 → 작업. 종료 후 작업 스레드에서 새어 나온 오류를 확인한다
        final Map<String, Future<?>> workers = new LinkedHashMap<>();
        boolean cancelled = false;

        try {
            // ---- 3) 작업 제출 ----
            for (ProbeDescriptor d : order) {
                if (isCancelled(cancel, scanDeadline)) {
                    cancelled = true;
                    break;
                }
                try {
                    workers.put(d.name(), exec.submit(() -> {
                        if (isCancelled(cancel, scanDeadline)) {
                            st.probeSkipped();
                            return;
                        }
                        int cur = inFlight.incrementAndGet();
                        st.observeConcurrency(cur);
                        try {
                            ProbeRunner.Outcome o = runner.run(d, target, headers, probeTimeout(scanDeadline));
                            st.probeFinished(o.wallMs(), o.failed(), o.timedOut());
                            if (sink.offer(d, o.findings())) {
                                SLOG.info("probe-done",
                                        "probe", d.name(),
                                        "findings", o.findings().size(),
                                        "failed", o.failed(),
                                        "wallMs", o.wallMs());
                                int n = done.incrementAndGet();
                                safeProgress(pl, (double) n / Math.max(1, total), "probe", n, total);
                            }
                        } finally {
                            inFlight.decrementAndGet();
                        }
                    }));
                } catch (RejectedExecutionException rex) {
                    // 제출 대기 중 interrupt → 취소로 본다
                    cancelled = true;
                    break;
                }
            }
            // 제출하지 못한 나머지도 생략으로 센다
            for (int i = workers.size(); i < total; i++) st.probeSkipped();

            if (workers.isEmpty() && total > 0) {
                // 아무것도 제출하지 못함 → 스냅샷 없이 취소
                exec.shutdownNow();
                SLOG.info("scan-cancelled", "scanId", session.getScanId(), "submitted", 0);
                throw new CancellationException("Scan cancelled before any probe was submitted");
            }

            // ---- 4) 완료 또는 취소 대기 ----
            exec.shutdown();
            cancelled |= awaitOrCancel(exec, cancel, scanDeadline);
            // 폴링 사이에 큐 작업이 전부 건너뛰어졌을 수도 있다
            cancelled |= st.snapshot().probesSkipped() > 0;

            if (cancelled) {
                // 큐에 남은 작업은 시작 시 플래그를 보고 건너뛴다. 유예 후에도 남으면 interrupt
                Duration grace = config.getCancelGrace();
                if (!awaitQuietly(exec, grace)) {
                    sink.close();
                    List<Runnable> never = exec.shutdownNow();
                    for (int i = 0; i < never.size(); i++) st.probeSkipped();
                    LOG.warn("Cancel grace {} ms elapsed; interrupting {} in-flight probe(s)",
                            grace.toMillis(), inFlight.get());
                    awaitQuietly(exec, Duration.ofSeconds(1));
                }
            }
        } finally {
            sink.close();
            if (!exec.isTerminated()) exec.shutdownNow();
        }

        int workerErrors = drainWorkerErrors(workers);

        // ---- 5) finalize ----
        session.finalizeSession();
        ScanSnapshot snap = session.snapshot();
        RiskScore risk = RiskScorer.score(snap.summary());
        safeProgress(pl, 1.0, "finalize", done.get(), total);

        ScanStats.Snapshot rt = st.snapshot();
        if (cancelled) {
            LOG.warn("Scan cancelled: {} of {} probe(s) recorded", done.get(), total);
            SLOG.warn("scan-cancelled",
                    "scanId", snap.scanId(),
                    "recorded", done.get(),
                    "total", total,
                    "skipped", rt.probesSkipped(),
                    "dropped", rt.resultsDropped());
        }
        LOG.info("Scan done. scanId={}, findings={}, vulnerabilities={}, risk={}/{}, maxObservedCC={}",
                snap.scanId(), snap.summary().total(), snap.summary().vulnerabilities(),
                risk.value(), risk.level(), rt.maxObservedConcurrency());
        SLOG.info("scan-done",
                "scanId", snap.scanId(),
                "findings", snap.summary().total(),
                "vulnerabilities", snap.summary().vulnerabilities(),
                "errors", snap.summary().errors(),
                "risk", risk.value(),
                "level", risk.level().name(),
                "duration", snap.duration(),
                "maxObservedCC", rt.maxObservedConcurrency(),
                "workerErrors", workerErrors,
                "cancelled", cancelled);

        String rationale = (plan == null) ? null : plan.rationale();
        return new ScanOutcome(snap, risk, rationale, plan != null, cancelled);
    }

    /**
     * 끝난 작업의 예외를 꺼내 기록한다. 러너는 VirtualMachineError 외에는 던지지 않으므로
     * 여기 걸리는 것은 작업 스레드를 빠져나간 오류뿐이다. 아직 돌고 있거나 취소된 작업은 건너뛴다.
     */
    static int drainWorkerErrors(Map<String, Future<?>> workers) {
        int errors = 0;
        for (Map.Entry<String, Future<?>> e : workers.entrySet()) {
            Future<?> f = e.getValue();
            if (!f.isDone() || f.isCancelled()) continue;
            try {
                f.get();
            } catch (ExecutionException ee) {
                errors++;
                Throwable cause = (ee.getCause() != null ? ee.getCause() : ee);
                LOG.warn("Worker for probe {} failed: {}", e.getKey(), TextSanitizer.summarize(cause));
                SLOG.warn("worker-error", "probe", e.getKey(), "summary", TextSanitizer.summarize(cause));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return errors;
    }

    /* =========================
       플랜 조언
       ========================= */

    /** 별도 데몬 스레드에서 advisor 타임아웃까지만 기다린다. 예외/null/지연은 모두 unavailable */
    private Advice requestPlan(URI target, Map<String, String> headers, List<ProbeDescriptor> selected) {
        if (advisor == PlanAdvisor.NONE || selected.isEmpty()) {
            return Advice.unavailable("advisor disabled");
        }
        Duration timeout = config.getAdvisor().getTimeout();
        ExecutorService one = Executors.newSingleThreadExecutor(new NamedThreadFactory("plan-advisor"));
        Future<Advice> f = one.submit(() -> advisor.propose(target, headers, List.copyOf(selected)));
        Advice advice;
        try {
            advice = f.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (advice == null) advice = Advice.unavailable("advisor returned no advice");
        } catch (TimeoutException te) {
            f.cancel(true);
            advice = Advice.unavailable("advisor timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException ee) {
            Throwable cause = (ee.getCause() != null ? ee.getCause() : ee);
            advice = Advice.unavailable(TextSanitizer.summarize(cause));
        } catch (InterruptedException ie) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            advice = Advice.unavailable("interrupted while waiting for advisor");
        } finally {
            one.shutdownNow();
        }

        if (advice.isAvailable()) {
            ScanPlan p = advice.plan().get();
            LOG.info("Plan received: {}", p.priorityOrder());
            SLOG.info("plan-received",
                    "order", String.join(",", p.priorityOrder()),
                    "rationaleChars", p.rationale().length());
        } else {
            LOG.info("Plan unavailable ({}); using registry order", advice.reason());
            SLOG.info("plan-unavailable", "reason", advice.reason());
        }
        return advice;
    }

    /* =========================
       대기/취소 헬퍼
       ========================= */

    /** @return 취소가 관측되었으면 true, 모든 작업이 끝났으면 false */
    private boolean awaitOrCancel(ExecutorService exec, AtomicBoolean cancel, Instant scanDeadline) {
        try {
            while (!exec.awaitTermination(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (isCancelled(cancel, scanDeadline)) return true;
            }
            return false;
        } catch (InterruptedException ie) {
            // 호출 스레드 interrupt 도 취소 신호로 본다
            Thread.currentThread().interrupt();
            cancel.set(true);
            return true;
        }
    }

    private static boolean awaitQuietly(ExecutorService exec, Duration d) {
        try {
            return exec.awaitTermination(Math.max(0, d.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return exec.isTerminated();
        }
    }

    private boolean isCancelled(AtomicBoolean flag, Instant scanDeadline) {
        if (flag.get()) return true;
        return scanDeadline != null && !clock.instant().isBefore(scanDeadline);
    }

    private void checkCancel(AtomicBoolean flag, Instant scanDeadline) {
        if (Thread.currentThread().isInterrupted() || isCancelled(flag, scanDeadline)) {
            throw new CancellationException("Scan cancelled before any probe was submitted");
        }
    }

    /** 프로브 데드라인: probeTimeout 과 전체 데드라인까지 남은 시간 중 작은 값 */
    private Duration probeTimeout(Instant scanDeadline) {
        Duration t = config.getProbeTimeout();
        if (scanDeadline == null) return t;
        Duration left = Duration.between(clock.instant(), scanDeadline);
        if (left.compareTo(t) >= 0) return t;
        return left.toMillis() < 1 ? Duration.ofMillis(1) : left;
    }

    private static void safeProgress(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed in phase {}: {}", phase, e.toString());
        }
    }

    public ScanStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    @Override
    public void close() {
        runner.close();
    }

    /**
     * 세션 쓰기 관문. close() 이후의 늦은 결과는 append 하지 않고 버린다.
     * close 와 offer 가 같은 락을 쓰므로 finalize 이후 append 는 일어나지 않는다.
     */
    private static final class Sink {
        private final ScanSession session;
        private final ScanStats stats;
        private boolean closed;

        Sink(ScanSession session, ScanStats stats) {
            this.session = session;
            this.stats = stats;
        }

        synchronized boolean offer(ProbeDescriptor d, List<Finding> findings) {
            if (closed) {
                stats.resultDropped();
                LOG.warn("Dropping late result of probe {} ({} finding(s))", d.name(), findings.size());
                SLOG.warn("late-result-dropped", "probe", d.name(), "findings", findings.size());
                return false;
            }
            session.append(findings);
            return true;
        }

        synchronized void close() {
            closed = true;
        }
    }
}
