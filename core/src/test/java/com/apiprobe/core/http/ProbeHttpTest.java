package com.apiprobe.core.http;

import com.apiprobe.core.util.RateLimiter;
import com.apiprobe.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ProbeHttpTest {

    private static final URI URL = URI.create("https://api.example.com/v1/users");

    /** 테스트용 Sleeper: sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URL; }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    /** 지터 없는 정책: 1→250ms, 2→500ms */
    private static final RetryPolicy FIXED = new RetryPolicy() {
        @Override public boolean shouldRetry(int status, int attempt) {
            return (status == 429 || status == -1 || status >= 500) && attempt < 3;
        }
        @Override public Duration nextDelay(int attempt) { return Duration.ofMillis(250L * (1L << (attempt - 1))); }
        @Override public int maxAttempts() { return 3; }
    };

    private static ProbeHttp http(ProbeHttp.HttpSender sender, RetryPolicy policy, Sleeper sleeper) {
        return new ProbeHttp(sender, new RateLimiter(100, 100), policy, sleeper, Duration.ofSeconds(2));
    }

    @Test
    void retryAfter_is_honored_on_429_and_succeeds_on_second_attempt() throws Exception {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> calls.incrementAndGet() == 1
                ? new Resp(429, Map.of("Retry-After", List.of("1")), "slow down")
                : new Resp(200, Map.of(), "ok");
        TestSleeper sleeper = new TestSleeper();

        HttpResponse<String> resp = http(sender, FIXED, sleeper).get(URL, Map.of());

        assertEquals(200, resp.statusCode());
        assertEquals(2, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.sleeps);
    }

    @Test
    void retryAfter_is_capped_at_thirty_seconds() throws Exception {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> calls.incrementAndGet() == 1
                ? new Resp(503, Map.of("Retry-After", List.of("3600")), "")
                : new Resp(200, Map.of(), "ok");
        TestSleeper sleeper = new TestSleeper();

        http(sender, FIXED, sleeper).get(URL, Map.of());

        assertEquals(List.of(Duration.ofSeconds(30)), sleeper.sleeps);
    }

    @Test
    void http_date_retryAfter_falls_back_to_policy_delay() throws Exception {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> calls.incrementAndGet() == 1
                ? new Resp(429, Map.of("Retry-After", List.of("Wed, 21 Oct 2015 07:28:00 GMT")), "")
                : new Resp(200, Map.of(), "ok");
        TestSleeper sleeper = new TestSleeper();

        http(sender, FIXED, sleeper).get(URL, Map.of());

        assertEquals(List.of(Duration.ofMillis(250)), sleeper.sleeps);
    }

    @Test
    void last_429_is_returned_to_caller_after_max_attempts() throws Exception {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> {
            calls.incrementAndGet();
            return new Resp(429, Map.of(), "");
        };
        TestSleeper sleeper = new TestSleeper();

        HttpResponse<String> resp = http(sender, FIXED, sleeper).get(URL, Map.of());

        assertEquals(429, resp.statusCode());
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(500)), sleeper.sleeps);
    }

    @Test
    void getOnce_does_not_retry() throws Exception {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> {
            calls.incrementAndGet();
            return new Resp(429, Map.of(), "");
        };
        TestSleeper sleeper = new TestSleeper();

        assertEquals(429, http(sender, FIXED, sleeper).getOnce(URL, Map.of()).statusCode());
        assertEquals(1, calls.get());
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void transport_failure_is_retried_then_rethrown() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeHttp.HttpSender sender = req -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        };

        assertThrows(ConnectException.class, () -> http(sender, FIXED, new TestSleeper()).get(URL, Map.of()));
        assertEquals(3, calls.get());
    }

    @Test
    void request_carries_headers_and_default_accept() throws Exception {
        List<HttpRequest> seen = new ArrayList<>();
        ProbeHttp.HttpSender sender = req -> {
            seen.add(req);
            return new Resp(204, Map.of(), "");
        };
        ProbeHttp http = http(sender, RetryPolicy.NONE, new TestSleeper());

        http.get(URL, Map.of("Authorization", "Bearer t", "Host", "evil.example"));
        http.preflight(URL, Map.of(), "https://origin.example", "GET");

        HttpRequest get = seen.get(0);
        assertEquals("GET", get.method());
        assertEquals(Optional.of("Bearer t"), get.headers().firstValue("Authorization"));
        assertEquals(Optional.of("application/json, */*;q=0.8"), get.headers().firstValue("Accept"));
        assertTrue(get.headers().firstValue("Host").isEmpty());

        HttpRequest pre = seen.get(1);
        assertEquals("OPTIONS", pre.method());
        assertEquals(Optional.of("https://origin.example"), pre.headers().firstValue("Origin"));
        assertEquals(Optional.of("GET"), pre.headers().firstValue("Access-Control-Request-Method"));
    }

    @Test
    void interrupted_sleep_propagates() {
        ProbeHttp.HttpSender sender = req -> new Resp(503, Map.of(), "");
        Sleeper interrupting = d -> { throw new InterruptedException("cancelled"); };

        assertThrows(InterruptedException.class, () -> http(sender, FIXED, interrupting).get(URL, Map.of()));
    }

    @Test
    void evidence_helpers() {
        assertEquals("HEAD https://api.example.com/v1/users HTTP/1.1", ProbeHttp.requestLine("HEAD", URL));
        assertEquals(URI.create("https://api.example.com/.env"),
                ProbeHttp.resolvePath(URI.create("https://api.example.com/v1/users?x=1"), ".env"));
        assertEquals(URI.create("http://localhost:8080/debug"),
                ProbeHttp.resolvePath(URI.create("http://localhost:8080/api"), "/debug"));
        assertTrue(ProbeHttp.is2xx(204));
        assertFalse(ProbeHttp.is2xx(301));
    }
}
