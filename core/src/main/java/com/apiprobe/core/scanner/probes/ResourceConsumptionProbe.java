package com.apiprobe.core.scanner.probes;

import com.apiprobe.core.api.Probe;
import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.http.ProbeHttp;
import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.Severity;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * API4 Unrestricted Resource Consumption:
 * 짧은 GET 버스트(재시도 없음)를 보내 429 또는 rate-limit 헤더가 한 번이라도 보이는지 본다.
 */
public final class ResourceConsumptionProbe implements Probe {

    public static final String NAME = "API4";
    public static final String CATEGORY = "API4:2023";
    public static final String TITLE = "Unrestricted Resource Consumption";

    static final int DEFAULT_BURST = 10;

    private final ProbeHttp http;
    private final int burst;

    public ResourceConsumptionProbe(ProbeHttp http) {
        this(http, DEFAULT_BURST);
    }

    public ResourceConsumptionProbe(ProbeHttp http, int burst) {
        this.http = Objects.requireNonNull(http, "http");
        if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
        this.burst = burst;
    }

    public ProbeDescriptor descriptor() {
        return new ProbeDescriptor(NAME, CATEGORY, TITLE, Severity.MEDIUM, this);
    }

    @Override
    public List<Finding> execute(URI target, Map<String, String> headers, Instant deadline) throws Exception {
        int sent = 0;
        for (int i = 0; i < burst; i++) {
            ProbeSupport.checkDeadline(deadline);
            HttpResponse<String> rsp = http.getOnce(target, headers);
            sent++;
            String signal = limitSignal(rsp);
            if (signal != null) {
                return List.of(Finding.passed("Rate Limiting", CATEGORY)
                        .url(target.toString())
                        .method("GET")
                        .description("Rate limiting observed after " + sent + " request(s).")
                        .evidence(signal)
                        .build());
            }
        }
        return List.of(Finding.vulnerable("Rate Limiting", CATEGORY, Severity.MEDIUM)
                .url(target.toString())
                .method("GET")
                .description("No rate limiting observed across a burst of " + sent + " requests.")
                .evidence(ProbeHttp.requestLine("GET", target) + " x" + sent + " -> no 429, no rate-limit headers")
                .recommendation("Enforce per-client request quotas and return 429 with Retry-After or RateLimit headers.")
                .build());
    }

    /** 429 또는 X-RateLimit-* / RateLimit-* / Retry-After 헤더. 없으면 null */
    static String limitSignal(HttpResponse<?> rsp) {
        if (rsp.statusCode() == 429) return "HTTP 429 Too Many Requests";
        HttpHeaders h = rsp.headers();
        for (String name : h.map().keySet()) {
            String ln = ProbeSupport.lower(name);
            if (ln.startsWith("x-ratelimit-") || ln.startsWith("ratelimit") || ln.equals("retry-after")) {
                return name + ": " + h.firstValue(name).orElse("");
            }
        }
        return null;
    }
}
