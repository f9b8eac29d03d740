package com.apiprobe.core.util;

import com.apiprobe.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * 루트 scan.yml을 읽어 ScanConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://api.example.com"
 * headers:                       # map 또는 ["Authorization: Bearer x", ...]
 *   Authorization: "Bearer ..."
 * probes: [API2, API8]           # 또는 "API2,API8", 생략 시 전체
 * concurrency: 4
 * rps: 10
 * probeTimeoutMs: 30000
 * cancelGraceMs: 5000
 * scanTimeoutMs: 600000          # 옵션, 없으면 전체 데드라인 없음
 * followRedirects: false
 * output:
 *   dir: "out"
 *
 * # LLM 계획 조언(옵션)
 * advisor:
 *   enabled: true
 *   endpoint: "https://my-resource.openai.azure.com"
 *   deployment: "gpt-4o"
 *   apiVersion: "2024-02-01"
 *   apiKeyEnv: "AZURE_OPENAI_API_KEY"
 *   timeoutMs: 20000
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(in);
        }
    }

    /** 스트림 버전 (클래스패스 리소스/테스트용). validate() 까지 끝난 설정을 돌려준다 */
    public static ScanConfig parse(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ScanConfig cfg = ScanConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지 → target 누락으로 validate 실패
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setHeaders(map, "headers", cfg);
        setStringList(map, "probes", cfg::setProbes);
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "rps", cfg::setRps);
        setDurationMs(map, "probeTimeoutMs", cfg::setProbeTimeout);
        setDurationMs(map, "cancelGraceMs", cfg::setCancelGrace);
        setDurationMs(map, "scanTimeoutMs", cfg::setScanTimeout);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);

        // 2) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }

        // 3) advisor.*
        Map<String, Object> adv = getMap(map, "advisor");
        if (adv != null) {
            var a = cfg.getAdvisor();
            setBoolean(adv, "enabled", a::setEnabled);
            setString(adv, "endpoint", a::setEndpoint);
            setString(adv, "deployment", a::setDeployment);
            setString(adv, "apiVersion", a::setApiVersion);
            setString(adv, "apiKeyEnv", a::setApiKeyEnv);
            setDurationMs(adv, "timeoutMs", a::setTimeout);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /** headers: {K: V} 또는 ["K: V", ...] */
    private static void setHeaders(Map<?, ?> map, String key, ScanConfig cfg) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, val) -> cfg.addHeader(String.valueOf(k), val == null ? "" : String.valueOf(val)));
            return;
        }
        if (v instanceof List<?> list) {
            for (Object o : list) {
                if (o == null) continue;
                String line = String.valueOf(o);
                int i = line.indexOf(':');
                if (i <= 0) throw new IllegalArgumentException("header must be 'Name: value': " + line);
                cfg.addHeader(line.substring(0, i), line.substring(i + 1));
            }
            return;
        }
        throw new IllegalArgumentException("headers must be a map or a list of 'Name: value'");
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            List<String> out = new ArrayList<>();
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
            setter.accept(List.copyOf(out));
        }
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        // 음수/0 은 그대로 넘겨 validate() 에서 거부되게 한다
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
