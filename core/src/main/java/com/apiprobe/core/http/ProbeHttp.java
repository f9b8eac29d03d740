package com.apiprobe.core.http;

import com.apiprobe.core.model.ScanConfig;
import com.apiprobe.core.util.DefaultSleeper;
import com.apiprobe.core.util.RateLimiter;
import com.apiprobe.core.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 내장 프로브가 공유하는 읽기 전용 HTTP 헬퍼.
 *  - GET/HEAD/OPTIONS 만 (본문 변경 요청 없음)
 *  - 시도마다 공유 RateLimiter 토큰을 먼저 얻는다 → 타깃 전체 rps 상한
 *  - 429/5xx/전송 실패는 RetryPolicy 로 재시도, 숫자형 Retry-After 는 30s 상한으로 존중
 *  - 마지막 응답(429 포함)은 그대로 프로브에 돌려준다. 판단은 프로브 몫.
 */
public final class ProbeHttp {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);
    private static final String DEFAULT_ACCEPT = "application/json, */*;q=0.8";

    private final HttpSender sender;
    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration requestTimeout;

    public ProbeHttp(ScanConfig cfg, RateLimiter limiter) {
        this(cfg, limiter, new DefaultRetryPolicy(), new DefaultSleeper());
    }

    public ProbeHttp(ScanConfig cfg, RateLimiter limiter, RetryPolicy retryPolicy, Sleeper sleeper) {
        Objects.requireNonNull(cfg, "cfg");
        Duration t = cfg.getProbeTimeout();
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(cfg.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(t)
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.requestTimeout = t;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public ProbeHttp(HttpSender sender, RateLimiter limiter, RetryPolicy retryPolicy,
                     Sleeper sleeper, Duration requestTimeout) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    // ============ 전송 ============
    public HttpResponse<String> get(URI url, Map<String, String> headers) throws IOException, InterruptedException {
        return send("GET", url, headers, retryPolicy);
    }

    public HttpResponse<String> head(URI url, Map<String, String> headers) throws IOException, InterruptedException {
        return send("HEAD", url, headers, retryPolicy);
    }

    public HttpResponse<String> options(URI url, Map<String, String> headers) throws IOException, InterruptedException {
        return send("OPTIONS", url, headers, retryPolicy);
    }

    /** 재시도 없이 한 번만 (429 를 그대로 관찰해야 할 때) */
    public HttpResponse<String> getOnce(URI url, Map<String, String> headers) throws IOException, InterruptedException {
        return send("GET", url, headers, RetryPolicy.NONE);
    }

    /** CORS 프리플라이트 */
    public HttpResponse<String> preflight(URI url, Map<String, String> headers, String origin, String method)
            throws IOException, InterruptedException {
        Map<String, String> h = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        if (origin != null && !origin.isBlank()) h.put("Origin", origin);
        if (method != null && !method.isBlank()) h.put("Access-Control-Request-Method", method);
        return options(url, h);
    }

    // ============ 내부 공통 ============
    private HttpResponse<String> send(String method, URI url, Map<String, String> headers, RetryPolicy policy)
            throws IOException, InterruptedException {
        Objects.requireNonNull(url, "url");
        HttpRequest req = build(method, url, headers);

        int attempt = 1;
        while (true) {
            limiter.acquire();
            HttpResponse<String> resp = null;
            IOException failure = null;
            try {
                resp = sender.send(req);
            } catch (IOException e) {
                failure = e;
            }
            int status = (resp == null ? -1 : resp.statusCode());
            if (!policy.shouldRetry(status, attempt)) {
                if (failure != null) throw failure;
                return resp;
            }
            sleeper.sleep(resolveRetryAfterOr(policy.nextDelay(attempt), resp));
            attempt++;
        }
    }

    private HttpRequest build(String method, URI url, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .method(method, HttpRequest.BodyPublishers.noBody());
        // 합리적 기본 Accept (케이스 무시)
        boolean hasAccept = headers != null && headers.keySet().stream().anyMatch(k -> k.equalsIgnoreCase("Accept"));
        if (!hasAccept) b.header("Accept", DEFAULT_ACCEPT);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (!RESTRICTED.contains(k.toLowerCase(Locale.ROOT))) b.header(k, v);
            });
        }
        return b.build();
    }

    /** JDK HttpClient 가 직접 설정을 거부하는 헤더 */
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");

    /** Retry-After 헤더를 존중하되 과도한 대기는 30초로 상한 */
    static Duration resolveRetryAfterOr(Duration fallback, HttpResponse<String> resp) {
        if (resp == null) return fallback;
        Optional<String> v = resp.headers().firstValue("Retry-After");
        if (v.isEmpty()) return fallback;
        try {
            long sec = Long.parseLong(v.get().trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException ignore) {
            // HTTP-date 형태는 fallback
            return fallback;
        }
    }

    // ============ Evidence helpers ============
    /** "GET https://example.com/a HTTP/1.1" */
    public static String requestLine(String method, URI url) {
        String m = (method == null || method.isEmpty()) ? "GET" : method;
        return m + " " + url + " HTTP/1.1";
    }

    /** 같은 origin 의 다른 경로 (쿼리/프래그먼트 제거) */
    public static URI resolvePath(URI target, String path) {
        Objects.requireNonNull(target, "target");
        String p = (path == null || path.isEmpty()) ? "/" : (path.startsWith("/") ? path : "/" + path);
        String port = target.getPort() > 0 ? ":" + target.getPort() : "";
        return URI.create(target.getScheme() + "://" + target.getHost() + port + p);
    }

    public static boolean is2xx(int status) { return status >= 200 && status < 300; }
}
