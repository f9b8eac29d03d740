package com.apiprobe.core.service.export;

import static com.apiprobe.core.service.export.ReportNaming.context;
import static com.apiprobe.core.service.export.ReportNaming.jsonPath;
import static com.apiprobe.core.service.export.ReportNaming.reportsDir;

import com.apiprobe.core.model.RiskScore;
import com.apiprobe.core.model.ScanSnapshot;
import com.apiprobe.core.util.JsonMappers;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;

/**
 * 보고서형 JSON Exporter.
 * 세션 스냅샷은 snake_case 그대로 session 아래에 싣고, 위험 점수/플랜 근거를 메타로 덧붙인다.
 */
public final class JsonReportExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportExporter.class);

    public static final String REPORT_VERSION = "1.0";

    private final ObjectMapper mapper = JsonMappers.create().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param baseDir   출력 루트 (null이면 "out")
     * @param snapshot  FINALIZED 세션 스냅샷
     * @param risk      위험 점수
     * @param rationale 플랜 근거 (없으면 null)
     * @return 생성된 파일의 경로
     */
    public Path export(Path baseDir, ScanSnapshot snapshot, RiskScore risk, String rationale) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(risk, "risk");

        var ctx = context(baseDir, snapshot.target(), snapshot.startTime());
        Files.createDirectories(reportsDir(ctx));
        Path outFile = jsonPath(ctx);

        String json = toJson(snapshot, risk, rationale);
        Files.writeString(outFile, json, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        LOG.info("JSON report written: {} ({} findings)", outFile, snapshot.results().size());
        return outFile;
    }

    public String toJson(ScanSnapshot snapshot, RiskScore risk, String rationale) throws IOException {
        Report r = new Report(REPORT_VERSION, Instant.now(), risk, rationale, snapshot);
        return mapper.writeValueAsString(r) + System.lineSeparator();
    }

    @JsonPropertyOrder({"report_version", "generated_at", "risk", "plan_rationale", "session"})
    public record Report(@JsonProperty("report_version") String reportVersion,
                  @JsonProperty("generated_at") Instant generatedAt,
                  @JsonProperty("risk") RiskScore risk,
                  @JsonProperty("plan_rationale") String planRationale,
                  @JsonProperty("session") ScanSnapshot session) {}
}
