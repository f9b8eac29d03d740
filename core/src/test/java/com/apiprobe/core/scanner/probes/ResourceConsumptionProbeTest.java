package com.apiprobe.core.scanner.probes;

import com.apiprobe.core.model.Finding;
import com.apiprobe.core.model.FindingStatus;
import com.apiprobe.core.model.Severity;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ResourceConsumptionProbeTest {

    static HttpServer s;
    static int port;
    static final AtomicInteger limitedHits = new AtomicInteger();
    static final AtomicInteger freeHits = new AtomicInteger();

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        port = s.getAddress().getPort();

        // 3번째 요청부터 429
        s.createContext("/limited", ex -> StubHttp.respond(ex, limitedHits.incrementAndGet() >= 3 ? 429 : 200, "{}"));
        // 제한 없음
        s.createContext("/free", ex -> {
            freeHits.incrementAndGet();
            StubHttp.respond(ex, 200, "{}");
        });
        // 제한 헤더만 노출
        s.createContext("/quota", ex -> {
            ex.getResponseHeaders().add("X-RateLimit-Limit", "100");
            StubHttp.respond(ex, 200, "{}");
        });
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    @BeforeEach
    void reset() {
        limitedHits.set(0);
        freeHits.set(0);
    }

    private static URI url(String path) { return URI.create("http://127.0.0.1:" + port + path); }

    private static ResourceConsumptionProbe probe(int burst) {
        return new ResourceConsumptionProbe(StubHttp.http(port), burst);
    }

    @Test
    void status_429_within_burst_passes() throws Exception {
        List<Finding> out = probe(10).execute(url("/limited"), Map.of(), Instant.now().plusSeconds(10));

        assertEquals(FindingStatus.PASSED, out.get(0).getStatus());
        assertThat(out.get(0).getDescription()).contains("after 3 request(s)");
        assertEquals(3, limitedHits.get());
    }

    @Test
    void rate_limit_headers_count_as_limiting() throws Exception {
        List<Finding> out = probe(10).execute(url("/quota"), Map.of(), Instant.now().plusSeconds(10));

        assertEquals(FindingStatus.PASSED, out.get(0).getStatus());
        assertThat(out.get(0).getEvidence()).containsIgnoringCase("x-ratelimit-limit");
    }

    @Test
    void full_burst_without_limiting_is_vulnerable() throws Exception {
        List<Finding> out = probe(6).execute(url("/free"), Map.of(), Instant.now().plusSeconds(10));

        assertEquals(1, out.size());
        assertEquals(FindingStatus.VULNERABLE, out.get(0).getStatus());
        assertEquals(Severity.MEDIUM, out.get(0).getSeverity());
        assertEquals(6, freeHits.get());
    }

    @Test
    void expired_deadline_stops_the_burst() {
        assertThrows(TimeoutException.class,
                () -> probe(10).execute(url("/free"), Map.of(), Instant.now().minusSeconds(1)));
        assertEquals(0, freeHits.get());
    }

    @Test
    void burst_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> probe(0));
    }
}
