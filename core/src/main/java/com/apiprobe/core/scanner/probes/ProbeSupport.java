package com.apiprobe.core.scanner.probes;

import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** 내장 프로브 공용 헬퍼 */
final class ProbeSupport {
    private ProbeSupport() {}

    /** 데드라인이 지났거나 interrupt 되었으면 중단 */
    static void checkDeadline(Instant deadline) throws TimeoutException, InterruptedException {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("probe interrupted");
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new TimeoutException("probe deadline reached");
        }
    }

    static String header(HttpResponse<?> r, String name) {
        return r.headers().firstValue(name).orElse("");
    }

    static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    /** "HTTP 200" */
    static String statusLine(HttpResponse<?> r) {
        return "HTTP " + r.statusCode();
    }
}
