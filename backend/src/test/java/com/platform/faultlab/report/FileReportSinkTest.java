package com.platform.faultlab.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.faultlab.config.FaultLabProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileReportSinkTest {

    @TempDir
    Path reportDir;

    private FaultLabProperties properties;
    private FileReportSink sink;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        properties = new FaultLabProperties();
        properties.getReport().setDirectory(reportDir.resolve("reports").toString());
        sink = new FileReportSink(properties, objectMapper);
    }

    @Test
    void savesMarkdownAndJsonWithTimestampedNames() throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalOps", 1000);
        summary.put("errors", 2);
        ReportSection latency = new ReportSection("Latency", List.of(
            row("operation", "insert", "mongodb", 0.01234, "cassandra", 0.5)));

        List<Path> written = sink.save("performance", "20240101_120000", summary,
            Map.of("mongo", Map.of("errors", 2)), latency);

        assertThat(written).extracting(p -> p.getFileName().toString())
            .containsExactly("performance_20240101_120000.md", "performance_20240101_120000.json");
        String markdown = Files.readString(written.get(0));
        assertThat(markdown)
            .startsWith("# Performance Report (20240101_120000)")
            .contains("- **totalOps**: 1000")
            .contains("## Latency")
            .contains("- operation: insert | mongodb: 0.0123 | cassandra: 0.5000");
        JsonNode json = objectMapper.readTree(written.get(1).toFile());
        assertThat(json.path("mongo").path("errors").asInt()).isEqualTo(2);
    }

    @Test
    void listsNewestNameFirstAndFindsLatestByModificationTime() throws IOException {
        sink.save("performance", "20240101_000000", Map.of(), Map.of());
        sink.save("performance", "20240102_000000", Map.of(), Map.of());
        Path older = reportDir.resolve("reports/performance_20240101_000000.md");
        Files.setLastModifiedTime(older, FileTime.from(Instant.now().plusSeconds(60)));

        assertThat(sink.listReports()).containsExactly(
            "performance_20240102_000000.md", "performance_20240102_000000.json",
            "performance_20240101_000000.md", "performance_20240101_000000.json");
        assertThat(sink.latestReport()).contains(older);
    }

    @Test
    void missingDirectoryMeansNoReports() {
        assertThat(sink.listReports()).isEmpty();
        assertThat(sink.latestReport()).isEmpty();
    }

    @Test
    void findRejectsPathsOutsideReportDirectory() throws IOException {
        sink.save("performance", "20240101_000000", Map.of(), Map.of());
        Files.writeString(reportDir.resolve("secret.txt"), "x");

        assertThat(sink.find("performance_20240101_000000.json")).isPresent();
        assertThat(sink.find("../secret.txt")).isEmpty();
        assertThat(sink.find("missing.md")).isEmpty();
    }

    @Test
    void disabledSinkWritesNothing() {
        properties.getReport().setEnabled(false);

        assertThat(sink.save("performance", "20240101_000000", Map.of(), Map.of())).isEmpty();
        assertThat(Files.exists(reportDir.resolve("reports"))).isFalse();
    }

    @Test
    void timestampIsUtc() {
        assertThat(FileReportSink.timestamp(Instant.parse("2024-03-05T07:08:09Z"))).isEqualTo("20240305_070809");
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
