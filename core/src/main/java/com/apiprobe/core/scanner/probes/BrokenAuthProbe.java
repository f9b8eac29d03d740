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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * API2 Broken Authentication:
 * 설정된 인증 헤더를 뺀 채 대상을 다시 요청한다.
 * 2xx → 인증 없이 접근 가능(VULNERABLE HIGH), 401/403 → PASSED, 인증 헤더가 애초에 없으면 INFO.
 */
public final class BrokenAuthProbe implements Probe {

    public static final String NAME = "API2";
    public static final String CATEGORY = "API2:2023";
    public static final String TITLE = "Broken Authentication";

    static final Set<String> AUTH_HEADERS = Set.of("authorization", "x-api-key", "api-key", "cookie");

    private final ProbeHttp http;

    public BrokenAuthProbe(ProbeHttp http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public ProbeDescriptor descriptor() {
        return new ProbeDescriptor(NAME, CATEGORY, TITLE, Severity.HIGH, this);
    }

    @Override
    public List<Finding> execute(URI target, Map<String, String> headers, Instant deadline) throws Exception {
        Map<String, String> stripped = new LinkedHashMap<>();
        List<String> removed = new ArrayList<>();
        headers.forEach((k, v) -> {
            if (AUTH_HEADERS.contains(ProbeSupport.lower(k))) removed.add(k);
            else stripped.put(k, v);
        });

        if (removed.isEmpty()) {
            return List.of(Finding.info(TITLE, CATEGORY)
                    .url(target.toString())
                    .method("GET")
                    .description("No authentication header configured; unauthenticated replay not applicable.")
                    .recommendation("Configure the API credentials in scan headers to test authentication enforcement.")
                    .build());
        }

        ProbeSupport.checkDeadline(deadline);
        HttpResponse<String> rsp = http.get(target, stripped);
        int status = rsp.statusCode();
        String evidence = ProbeHttp.requestLine("GET", target) + " without " + String.join(", ", removed)
                + " -> " + ProbeSupport.statusLine(rsp);

        if (ProbeHttp.is2xx(status)) {
            return List.of(Finding.vulnerable("Unauthenticated Access", CATEGORY, Severity.HIGH)
                    .url(target.toString())
                    .method("GET")
                    .description("Endpoint answered " + status + " after the authentication headers were removed.")
                    .evidence(evidence)
                    .recommendation("Require and validate credentials on every request; reject missing or invalid tokens with 401.")
                    .build());
        }
        if (status == 401 || status == 403) {
            return List.of(Finding.passed("Unauthenticated Access", CATEGORY)
                    .url(target.toString())
                    .method("GET")
                    .description("Request without credentials was rejected (" + status + ").")
                    .evidence(evidence)
                    .build());
        }
        return List.of(Finding.info("Unauthenticated Access", CATEGORY)
                .url(target.toString())
                .method("GET")
                .description("Unexpected status " + status + " for unauthenticated replay; manual review suggested.")
                .evidence(evidence)
                .build());
    }
}
