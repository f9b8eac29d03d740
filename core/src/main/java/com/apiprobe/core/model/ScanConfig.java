package com.apiprobe.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 스캔 설정 (scan.yml 매핑 대상). 엔진 호출 전에 완성되는 순수 값 객체이며
 * 엔진은 여기 없는 값을 대화형으로 묻지 않는다.
 */
public final class ScanConfig {

    /** YAML `advisor:` 섹션. 기본 비활성 */
    public static final class AdvisorCfg {
        private boolean enabled = false;
        private String endpoint;                         // https://<resource>.openai.azure.com
        private String deployment;
        private String apiVersion = "2024-02-01";
        private String apiKeyEnv = "AZURE_OPENAI_API_KEY"; // 키 자체는 설정 파일에 두지 않는다
        private Duration timeout = Duration.ofSeconds(20);

        public boolean isEnabled() { return enabled; }
        public AdvisorCfg setEnabled(boolean enabled) { this.enabled = enabled; return this; }

        public String getEndpoint() { return endpoint; }
        public AdvisorCfg setEndpoint(String endpoint) { this.endpoint = endpoint; return this; }

        public String getDeployment() { return deployment; }
        public AdvisorCfg setDeployment(String deployment) { this.deployment = deployment; return this; }

        public String getApiVersion() { return apiVersion; }
        public AdvisorCfg setApiVersion(String apiVersion) { this.apiVersion = apiVersion; return this; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public AdvisorCfg setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; return this; }

        public Duration getTimeout() { return timeout; }
        public AdvisorCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }
        public AdvisorCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    }

    // ---------- 기본 필드 ----------
    private String target;                                   // 필수
    private final Map<String, String> headers = new LinkedHashMap<>();
    private List<String> probes = List.of();                 // 비어 있으면 레지스트리 전체
    private int concurrency = 4;                             // 워커 풀 크기
    private int rps = 10;                                    // 타깃 요청 상한
    private Duration probeTimeout = Duration.ofSeconds(30);  // 프로브 1개 데드라인
    private Duration cancelGrace = Duration.ofSeconds(5);    // 취소 후 진행 중 작업 유예
    private Duration scanTimeout;                            // null 이면 전체 데드라인 없음
    private boolean followRedirects = false;
    private Path outputDir = Path.of("out");

    private AdvisorCfg advisor = new AdvisorCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public URI getTargetUri() { return URI.create(target); }
    public Map<String, String> getHeaders() { return Collections.unmodifiableMap(headers); }
    public List<String> getProbes() { return probes; }
    public int getConcurrency() { return concurrency; }
    public int getRps() { return rps; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public Duration getCancelGrace() { return cancelGrace; }
    public Duration getScanTimeout() { return scanTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Path getOutputDir() { return outputDir; }
    public AdvisorCfg getAdvisor() { return advisor; }

    // ---------- fluent setters ----------
    public ScanConfig setTarget(String target) { this.target = normalizeTarget(target); return this; }

    public ScanConfig setHeaders(Map<String, String> headers) {
        this.headers.clear();
        if (headers != null) headers.forEach(this::addHeader);
        return this;
    }

    public ScanConfig addHeader(String name, String value) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("header name must not be blank");
        this.headers.put(name.trim(), value == null ? "" : value.trim());
        return this;
    }

    public ScanConfig setProbes(List<String> probes) {
        this.probes = (probes == null ? List.of() : List.copyOf(probes));
        return this;
    }

    public ScanConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public ScanConfig setRps(int rps) { this.rps = rps; return this; }
    public ScanConfig setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; return this; }
    public ScanConfig setProbeTimeoutMs(long ms) { this.probeTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public ScanConfig setCancelGrace(Duration cancelGrace) { this.cancelGrace = cancelGrace; return this; }
    public ScanConfig setCancelGraceMs(long ms) { this.cancelGrace = Duration.ofMillis(Math.max(0, ms)); return this; }
    public ScanConfig setScanTimeout(Duration scanTimeout) { this.scanTimeout = scanTimeout; return this; }
    public ScanConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public ScanConfig setAdvisor(AdvisorCfg advisor) { this.advisor = (advisor != null ? advisor : new AdvisorCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        URI u;
        try {
            u = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target is not a valid URL: " + target, e);
        }
        String scheme = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("target must be http(s): " + target);
        if (u.getHost() == null || u.getHost().isBlank())
            throw new IllegalArgumentException("target has no host: " + target);

        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero())
            throw new IllegalArgumentException("probeTimeout must be > 0");
        if (cancelGrace == null || cancelGrace.isNegative())
            throw new IllegalArgumentException("cancelGrace must be >= 0");
        if (scanTimeout != null && (scanTimeout.isNegative() || scanTimeout.isZero()))
            throw new IllegalArgumentException("scanTimeout must be > 0 when set");
        Objects.requireNonNull(outputDir, "outputDir");

        Objects.requireNonNull(advisor, "advisor");
        if (advisor.isEnabled()) {
            if (advisor.getEndpoint() == null || advisor.getEndpoint().isBlank())
                throw new IllegalArgumentException("advisor.endpoint is required when advisor is enabled");
            if (advisor.getDeployment() == null || advisor.getDeployment().isBlank())
                throw new IllegalArgumentException("advisor.deployment is required when advisor is enabled");
        }
        // 주입된 어드바이저는 enabled 와 무관하게 이 값을 쓴다
        if (advisor.getTimeout() == null || advisor.getTimeout().isNegative() || advisor.getTimeout().isZero())
            throw new IllegalArgumentException("advisor.timeout must be > 0");
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    /** 스킴이 없으면 https:// 를 붙인다 */
    static String normalizeTarget(String raw) {
        if (raw == null) return null;
        String t = raw.trim();
        if (t.isEmpty()) return t;
        String lower = t.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) t = "https://" + t;
        return t;
    }
}
