package com.apiprobe.core.scanner;

import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.FindingStatus;
import com.apiprobe.core.util.NamedThreadFactory;
import com.apiprobe.core.util.StructuredLog;
import com.apiprobe.core.util.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 프로브 1개를 격리 실행한다.
 *  - 정상 반환: 관측 목록을 그대로 통과 (빈 목록이면 PASSED 하나를 합성)
 *  - 예외/타임아웃/null 반환: ERROR 관측 정확히 1건 합성
 * 어떤 경우에도 예외를 호출자에게 던지지 않으며 결과는 비어 있지 않다.
 *
 * 데드라인 강제를 위해 프로브는 러너 소유의 데몬 스레드에서 돌고,
 * 호출 스레드는 데드라인까지만 기다린다(초과 시 interrupt).
 */
public final class ProbeRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeRunner.class);
    private static final StructuredLog SLOG = StructuredLog.get(ProbeRunner.class);

    static final String NO_OBSERVATIONS = "Probe completed with no observations.";

    private final ExecutorService exec;

    public ProbeRunner() {
        this(Executors.newCachedThreadPool(new NamedThreadFactory("probe-exec")));
    }

    /** 테스트/임베딩용: 실행 스레드 풀 주입 */
    public ProbeRunner(ExecutorService exec) {
        this.exec = Objects.requireNonNull(exec, "exec");
    }

    /** 한 번의 실행 결과 */
    public record Outcome(ProbeDescriptor probe,
                          List<Finding> findings,
                          boolean failed,
                          boolean timedOut,
                          long wallMs) {}

    public Outcome run(ProbeDescriptor d, URI target, Map<String, String> headers, Duration timeout) {
        Objects.requireNonNull(d, "descriptor");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timeout, "timeout");
        final Map<String, String> hdrs = (headers == null ? Map.of() : Map.copyOf(headers));

        long t0 = System.nanoTime();
        Instant deadline = Instant.now().plus(timeout);
        Future<List<Finding>> f = null;
        try {
            f = exec.submit(() -> d.probe().execute(target, hdrs, deadline));
            List<Finding> out = f.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (out == null) {
                throw new ProbeExecutionException(d.name(), "Probe returned no result (null)", null, false);
            }
            for (Finding x : out) {
                if (x == null) {
                    throw new ProbeExecutionException(d.name(), "Probe returned a null finding", null, false);
                }
            }
            List<Finding> findings = out.isEmpty() ? List.of(noObservations(d)) : List.copyOf(out);
            return new Outcome(d, findings, false, false, elapsedMs(t0));

        } catch (TimeoutException te) {
            f.cancel(true);
            String msg = "Timed out after " + timeout.toMillis() + " ms";
            return failed(d, new ProbeExecutionException(d.name(), msg, te, true), t0);

        } catch (ExecutionException ee) {
            Throwable cause = (ee.getCause() != null ? ee.getCause() : ee);
            if (cause instanceof VirtualMachineError vme) throw vme;
            return failed(d, new ProbeExecutionException(d.name(), TextSanitizer.summarize(cause), cause, false), t0);

        } catch (InterruptedException ie) {
            // 호출 스레드가 중단됨(취소 유예 초과 등): 프로브도 같이 멈춘다
            if (f != null) f.cancel(true);
            Thread.currentThread().interrupt();
            return failed(d, new ProbeExecutionException(d.name(), "Interrupted before completion", ie, false), t0);

        } catch (CancellationException | RejectedExecutionException e) {
            return failed(d, new ProbeExecutionException(d.name(), TextSanitizer.summarize(e), e, false), t0);

        } catch (ProbeExecutionException pe) {
            return failed(d, pe, t0);
        }
    }

    private Outcome failed(ProbeDescriptor d, ProbeExecutionException pe, long t0) {
        long ms = elapsedMs(t0);
        LOG.warn("Probe {} failed after {} ms: {}", d.name(), ms, pe.getMessage());
        SLOG.warn("probe-error",
                "probe", d.name(),
                "timeout", pe.isTimeout(),
                "wallMs", ms,
                "summary", pe.getMessage());
        Finding err = Finding.error(d.name(), d.category(), pe.getMessage());
        return new Outcome(d, List.of(err), true, pe.isTimeout(), ms);
    }

    private static Finding noObservations(ProbeDescriptor d) {
        return Finding.builder()
                .test(d.name())
                .category(d.category())
                .status(FindingStatus.PASSED)
                .description(NO_OBSERVATIONS)
                .build();
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
