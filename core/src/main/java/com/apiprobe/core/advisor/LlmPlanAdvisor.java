package com.apiprobe.core.advisor;

import com.apiprobe.core.api.PlanAdvisor;
import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.ScanConfig.AdvisorCfg;
import com.apiprobe.core.model.ScanPlan;
import com.apiprobe.core.util.JsonMappers;
import com.apiprobe.core.util.TextSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Azure OpenAI 호환 chat completions 로 실행 우선순위를 받아오는 어드바이저.
 *
 * 요청: POST {endpoint}/openai/deployments/{deployment}/chat/completions?api-version=..., 헤더 api-key
 * 응답 content(JSON): recommended_order | priority_order, rationale | reasoning | priority_tests[].reason
 *
 * 실패(키 없음, 비 2xx, 깨진 JSON, 키 누락, 타임아웃)는 모두 {@link Advice#unavailable(String)}.
 * API 키와 대상 헤더 값은 프롬프트/로그에 넣지 않는다 (헤더는 이름만).
 */
public final class LlmPlanAdvisor implements PlanAdvisor {

    private static final Logger LOG = LoggerFactory.getLogger(LlmPlanAdvisor.class);

    static final double TEMPERATURE = 0.4;
    static final String SYSTEM_PROMPT =
            "You are an expert penetration tester planning API security assessments.";

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final AdvisorCfg cfg;
    private final String apiKey;
    private final HttpSender sender;
    private final ObjectMapper mapper = JsonMappers.shared();

    /** 키는 cfg.apiKeyEnv 가 가리키는 환경 변수에서 읽는다 */
    public LlmPlanAdvisor(AdvisorCfg cfg) {
        this(cfg, System.getenv(Objects.requireNonNull(cfg, "cfg").getApiKeyEnv()), defaultSender(cfg.getTimeout()));
    }

    public LlmPlanAdvisor(AdvisorCfg cfg, String apiKey, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = apiKey;
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(Duration timeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public Advice propose(URI target, Map<String, String> headers, List<ProbeDescriptor> selected) {
        if (apiKey == null || apiKey.isBlank()) {
            return Advice.unavailable("API key not set (env " + cfg.getApiKeyEnv() + ")");
        }
        try {
            String body = mapper.writeValueAsString(requestBody(target, headers, selected));
            HttpRequest req = HttpRequest.newBuilder(completionsUri(cfg))
                    .timeout(cfg.getTimeout())
                    .header("Content-Type", "application/json")
                    .header("api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> resp = sender.send(req);
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                LOG.warn("Plan advisor returned HTTP {}", status);
                return Advice.unavailable("advisor HTTP " + status);
            }
            return parseCompletion(resp.body());

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Advice.unavailable("interrupted");
        } catch (IOException | RuntimeException e) {
            LOG.warn("Plan advisor call failed: {}", TextSanitizer.summarize(e));
            return Advice.unavailable(TextSanitizer.summarize(e));
        }
    }

    // ============ 요청 ============
    static URI completionsUri(AdvisorCfg cfg) {
        String base = cfg.getEndpoint().trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base
                + "/openai/deployments/" + URLEncoder.encode(cfg.getDeployment().trim(), StandardCharsets.UTF_8)
                + "/chat/completions?api-version=" + URLEncoder.encode(cfg.getApiVersion(), StandardCharsets.UTF_8));
    }

    ObjectNode requestBody(URI target, Map<String, String> headers, List<ProbeDescriptor> selected) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", buildPrompt(target, headers, selected));
        root.put("temperature", TEMPERATURE);
        root.putObject("response_format").put("type", "json_object");
        return root;
    }

    static String buildPrompt(URI target, Map<String, String> headers, List<ProbeDescriptor> selected) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Create an optimal execution order for these API security tests.\n\n");
        sb.append("Target: ").append(TextSanitizer.stripUrlQueries(String.valueOf(target))).append('\n');
        if (headers != null && !headers.isEmpty()) {
            sb.append("Request header names: ").append(String.join(", ", headers.keySet())).append('\n');
        }
        sb.append("\nAvailable tests (OWASP API Security Top 10):\n");
        for (ProbeDescriptor d : selected) {
            sb.append("- ").append(d.name()).append(" [").append(d.category()).append("] ")
              .append(d.title()).append('\n');
        }
        sb.append("\nRespond in JSON format:\n")
          .append("{\"recommended_order\": [\"<test name>\", ...], \"rationale\": \"<brief explanation>\"}\n")
          .append("Use only the test names listed above.");
        return sb.toString();
    }

    // ============ 응답 ============
    Advice parseCompletion(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return Advice.unavailable("malformed advisor response");
        }
        JsonNode content = (root == null) ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            return Advice.unavailable("advisor response has no message content");
        }
        try {
            return parsePlan(mapper.readTree(content.asText()));
        } catch (JsonProcessingException e) {
            return Advice.unavailable("advisor content is not JSON");
        }
    }

    /** 플랜 JSON → Advice. 순서 배열이 없으면 unavailable */
    static Advice parsePlan(JsonNode plan) {
        if (plan == null || !plan.isObject()) return Advice.unavailable("advisor plan is not an object");

        JsonNode order = plan.get("recommended_order");
        if (order == null || !order.isArray()) order = plan.get("priority_order");
        if (order == null || !order.isArray()) return Advice.unavailable("advisor plan has no order");

        List<String> names = new ArrayList<>();
        for (JsonNode n : order) {
            if (n.isTextual()) names.add(n.asText());
        }
        return Advice.of(new ScanPlan(names, rationaleOf(plan)));
    }

    private static String rationaleOf(JsonNode plan) {
        for (String key : List.of("rationale", "reasoning")) {
            JsonNode r = plan.get(key);
            if (r != null && r.isTextual() && !r.asText().isBlank()) return r.asText();
        }
        JsonNode tests = plan.get("priority_tests");
        if (tests != null && tests.isArray()) {
            List<String> reasons = new ArrayList<>();
            for (JsonNode t : tests) {
                String reason = t.path("reason").asText("");
                if (!reason.isBlank()) reasons.add(reason);
            }
            return String.join("; ", reasons);
        }
        return "";
    }
}
