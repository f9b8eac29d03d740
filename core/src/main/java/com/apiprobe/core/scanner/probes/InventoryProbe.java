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
import java.util.Set;

/**
 * API9 Improper Inventory Management:
 * 대상 origin 의 잘 알려진 문서/디버그 경로를 GET 해 200 이면 노출로 본다.
 */
public final class InventoryProbe implements Probe {

    public static final String NAME = "API9";
    public static final String CATEGORY = "API9:2023";
    public static final String TITLE = "Improper Inventory Management";

    static final List<String> PATHS = List.of(
            "/api-docs", "/swagger.json", "/openapi.json", "/v2/api-docs", "/debug", "/.env");

    /** 비밀/내부 상태가 새는 경로 */
    static final Set<String> HIGH_RISK = Set.of("/debug", "/.env");

    private final ProbeHttp http;

    public InventoryProbe(ProbeHttp http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public ProbeDescriptor descriptor() {
        return new ProbeDescriptor(NAME, CATEGORY, TITLE, Severity.MEDIUM, this);
    }

    @Override
    public List<Finding> execute(URI target, Map<String, String> headers, Instant deadline) throws Exception {
        List<Finding> out = new ArrayList<>();
        for (String path : PATHS) {
            ProbeSupport.checkDeadline(deadline);
            URI url = ProbeHttp.resolvePath(target, path);
            HttpResponse<String> rsp = http.get(url, headers);
            if (rsp.statusCode() != 200) continue;

            Severity sev = HIGH_RISK.contains(path) ? Severity.HIGH : Severity.MEDIUM;
            out.add(Finding.vulnerable("Exposed Endpoint", CATEGORY, sev)
                    .url(url.toString())
                    .method("GET")
                    .description("Undocumented or internal endpoint is publicly reachable: " + path)
                    .evidence(ProbeHttp.requestLine("GET", url) + " -> HTTP 200")
                    .recommendation("Remove or restrict " + path + " in production and keep an inventory of exposed API hosts and versions.")
                    .build());
        }
        if (out.isEmpty()) {
            out.add(Finding.passed("Exposed Endpoint", CATEGORY)
                    .url(target.toString())
                    .method("GET")
                    .description("None of " + PATHS.size() + " well-known documentation/debug paths are exposed.")
                    .build());
        }
        return out;
    }
}
