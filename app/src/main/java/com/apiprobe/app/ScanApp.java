package com.apiprobe.app;

import com.apiprobe.core.advisor.LlmPlanAdvisor;
import com.apiprobe.core.api.PlanAdvisor;
import com.apiprobe.core.http.ProbeHttp;
import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.ScanConfig;
import com.apiprobe.core.model.ScanSnapshot;
import com.apiprobe.core.model.ScanSummary;
import com.apiprobe.core.model.Severity;
import com.apiprobe.core.scanner.ProbeRegistry;
import com.apiprobe.core.scanner.probes.BuiltinProbes;
import com.apiprobe.core.service.ScanOrchestrator;
import com.apiprobe.core.service.ScanOutcome;
import com.apiprobe.core.service.export.JsonReportExporter;
import com.apiprobe.core.util.LoggingConfigurator;
import com.apiprobe.core.util.RateLimiter;
import com.apiprobe.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 비대화형 실행 진입점.
 *   java -jar apiprobe-app.jar [scan.yml]
 *
 * 종료 코드: 0 취약점 없음, 1 취약점 발견, 2 설정/선택 오류, 3 보고서 쓰기 실패, 130 시작 전 취소
 * 프로세스 종료 신호(Ctrl+C)는 셧다운 훅에서 취소 플래그로 바뀌고, 훅은 보고서가 써질 때까지 잠시 기다린다.
 */
public final class ScanApp {

    private static final Logger LOG = LoggerFactory.getLogger(ScanApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_VULNERABLE = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_REPORT = 3;
    static final int EXIT_CANCELLED = 130;

    private final Function<ScanConfig, PlanAdvisor> advisorFactory;

    public ScanApp() {
        this(cfg -> cfg.getAdvisor().isEnabled() ? new LlmPlanAdvisor(cfg.getAdvisor()) : PlanAdvisor.NONE);
    }

    /** 테스트용: 어드바이저 주입 */
    ScanApp(Function<ScanConfig, PlanAdvisor> advisorFactory) {
        this.advisorFactory = Objects.requireNonNull(advisorFactory, "advisorFactory");
    }

    public static void main(String[] args) {
        int code = new ScanApp().run(args, System.out, System.err);
        System.exit(code);
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length > 1) {
            err.println("Usage: apiprobe [scan.yml]");
            return EXIT_CONFIG;
        }
        Path yaml = Path.of(args.length == 1 ? args[0] : "scan.yml");

        ScanConfig cfg;
        try {
            cfg = YamlConfigLoader.load(yaml);
        } catch (IOException | RuntimeException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        LoggingConfigurator.init(cfg.getOutputDir().resolve("logs"));
        LOG.info("Config loaded from {}", yaml.toAbsolutePath());

        final AtomicBoolean cancel = new AtomicBoolean(false);
        final CountDownLatch finished = new CountDownLatch(1);
        final long hookWaitMs = cfg.getCancelGrace().toMillis() + 5_000;
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                finished.await(hookWaitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "scan-cancel-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            ProbeHttp http = new ProbeHttp(cfg, RateLimiter.perSecond(cfg.getRps()));
            ProbeRegistry registry = BuiltinProbes.registry(http);
            PlanAdvisor advisor = advisorFactory.apply(cfg);

            ScanOutcome outcome;
            try (ScanOrchestrator orch = new ScanOrchestrator(cfg, registry, advisor)) {
                outcome = orch.run((p, phase, done, total) ->
                        LOG.debug("progress phase={} {}/{}", phase, done, total), cancel);
            } catch (CancellationException ce) {
                err.println("Scan cancelled before any probe ran.");
                return EXIT_CANCELLED;
            } catch (IllegalArgumentException iae) {
                // 모르는 프로브 이름 등
                err.println("Config error: " + iae.getMessage());
                return EXIT_CONFIG;
            }

            Path report;
            try {
                report = new JsonReportExporter().export(cfg.getOutputDir(), outcome.snapshot(),
                        outcome.risk(), outcome.planRationale());
            } catch (IOException e) {
                LOG.error("Report export failed", e);
                err.println("Report export failed: " + e.getMessage());
                printSummary(out, outcome, null);
                return EXIT_REPORT;
            }

            printSummary(out, outcome, report);
            return outcome.snapshot().summary().hasVulnerabilities() ? EXIT_VULNERABLE : EXIT_OK;

        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                LOG.debug("JVM shutdown in progress; keeping cancel hook");
            }
        }
    }

    static void printSummary(PrintStream out, ScanOutcome o, Path report) {
        ScanSnapshot s = o.snapshot();
        ScanSummary sum = s.summary();
        out.println("==== Scan " + s.scanId() + " ====");
        out.println("Target:    " + s.target());
        out.println("Duration:  " + s.duration() + (o.cancelled() ? " (cancelled)" : ""));
        if (o.planApplied()) {
            out.println("Plan:      " + (o.planRationale() == null || o.planRationale().isBlank()
                    ? "advisor order applied" : o.planRationale()));
        }
        out.println("Risk:      " + o.risk().value() + "/100 (" + o.risk().level() + ")");
        out.printf("Findings:  %d total, %d vulnerable (C%d H%d M%d L%d), %d passed, %d info, %d errors%n",
                sum.total(), sum.vulnerabilities(), sum.critical(), sum.high(), sum.medium(), sum.low(),
                sum.passed(), sum.info(), sum.errors());

        for (Map.Entry<Severity, List<Finding>> e : s.vulnerabilitiesBySeverity().entrySet()) {
            for (Finding f : e.getValue()) {
                out.println("  [" + e.getKey() + "] " + f.getCategory() + " " + f.getTest()
                        + (f.getDescription() == null ? "" : ": " + f.getDescription()));
            }
        }
        if (report != null) out.println("Report:    " + report.toAbsolutePath());
    }
}
