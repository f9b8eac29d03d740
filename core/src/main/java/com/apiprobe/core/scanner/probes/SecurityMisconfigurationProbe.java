package com.apiprobe.core.scanner.probes;

import com.apiprobe.core.api.Probe;
import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.http.ProbeHttp;
import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.Severity;

import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * API8 Security Misconfiguration:
 *  1) GET 응답의 보안 헤더 부재 → 헤더당 VULNERABLE LOW (HSTS 는 https 대상만)
 *  2) 합성 Origin 으로 CORS 프리플라이트: ACAO='*' 또는 Origin 반사 + credentials 허용 → VULNERABLE HIGH
 * 아무것도 없으면 PASSED 하나.
 */
public final class SecurityMisconfigurationProbe implements Probe {

    public static final String NAME = "API8";
    public static final String CATEGORY = "API8:2023";
    public static final String TITLE = "Security Misconfiguration";

    static final String SYNTHETIC_ORIGIN = "https://apiprobe.example"; // 안전한 합성 origin

    static final List<String> REQUIRED_HEADERS = List.of(
            "X-Content-Type-Options",
            "X-Frame-Options",
            "Content-Security-Policy",
            "Strict-Transport-Security");

    private final ProbeHttp http;

    public SecurityMisconfigurationProbe(ProbeHttp http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public ProbeDescriptor descriptor() {
        return new ProbeDescriptor(NAME, CATEGORY, TITLE, Severity.MEDIUM, this);
    }

    @Override
    public List<Finding> execute(URI target, Map<String, String> headers, Instant deadline) throws Exception {
        List<Finding> out = new ArrayList<>();
        boolean https = "https".equalsIgnoreCase(target.getScheme());

        // 1) 보안 헤더
        ProbeSupport.checkDeadline(deadline);
        HttpResponse<String> rsp = http.get(target, headers);
        String req = ProbeHttp.requestLine("GET", target);
        for (String name : REQUIRED_HEADERS) {
            if (name.equals("Strict-Transport-Security") && !https) continue;
            if (ProbeSupport.header(rsp, name).isBlank()) {
                out.add(Finding.vulnerable("Missing Security Headers", CATEGORY, Severity.LOW)
                        .url(target.toString())
                        .method("GET")
                        .description("Security header missing: " + name + ".")
                        .evidence(req + "\n" + name + ": (absent)")
                        .recommendation("Send " + name + " on every API response.")
                        .build());
            }
        }

        // 2) CORS 프리플라이트
        ProbeSupport.checkDeadline(deadline);
        HttpResponse<String> pre = http.preflight(target, headers, SYNTHETIC_ORIGIN, "GET");
        String acao = ProbeSupport.header(pre, "Access-Control-Allow-Origin");
        String acac = ProbeSupport.header(pre, "Access-Control-Allow-Credentials");
        boolean creds = "true".equalsIgnoreCase(acac.trim());
        boolean wildcard = "*".equals(acao.trim());
        boolean reflected = SYNTHETIC_ORIGIN.equalsIgnoreCase(acao.trim());
        if (creds && (wildcard || reflected)) {
            out.add(Finding.vulnerable("CORS Misconfiguration", CATEGORY, Severity.HIGH)
                    .url(target.toString())
                    .method("OPTIONS")
                    .description(wildcard
                            ? "CORS misconfiguration: ACAO='*' with credentials allowed."
                            : "CORS misconfiguration: arbitrary Origin reflected with credentials allowed.")
                    .evidence(ProbeHttp.requestLine("OPTIONS", target) + "\n"
                            + "Origin: " + SYNTHETIC_ORIGIN + "\n"
                            + "Access-Control-Allow-Origin: " + acao + "\n"
                            + "Access-Control-Allow-Credentials: " + acac)
                    .recommendation("Allow-list trusted origins explicitly and never combine credentials with wildcard or reflected origins.")
                    .build());
        }

        if (out.isEmpty()) {
            out.add(Finding.passed("Security Configuration", CATEGORY)
                    .url(target.toString())
                    .method("GET")
                    .description("Security headers present and CORS policy does not expose credentials.")
                    .build());
        }
        return out;
    }
}
