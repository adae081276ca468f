package com.platform.faultlab.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.error.ReportPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes reports as {@code <prefix>_<timestamp>.md} and {@code <prefix>_<timestamp>.json}
 * in the configured report directory.
 */
@Slf4j
@Component
public class FileReportSink implements ReportSink {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final FaultLabProperties properties;
    private final ObjectMapper objectMapper;

    public FileReportSink(FaultLabProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    @Override
    public List<Path> save(String prefix, String timestamp, Map<String, Object> summary,
                           Object details, ReportSection... sections) {
        if (!properties.getReport().isEnabled()) {
            log.debug("Reports disabled, not saving {}_{}", prefix, timestamp);
            return List.of();
        }
        Path directory = directory();
        List<Path> written = new ArrayList<>();

        Path markdown = directory.resolve(prefix + "_" + timestamp + ".md");
        try {
            Files.createDirectories(directory);
            Files.writeString(markdown, renderMarkdown(prefix, timestamp, summary, sections), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportPersistenceException(markdown, e);
        }
        written.add(markdown);
        log.info("Markdown report saved at {}", markdown);

        Path json = directory.resolve(prefix + "_" + timestamp + ".json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(json.toFile(), details);
        } catch (IOException e) {
            throw new ReportPersistenceException(json, e);
        }
        written.add(json);
        log.info("JSON report saved at {}", json);
        return written;
    }

    @Override
    public List<String> listReports() {
        Path directory = directory();
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ReportPersistenceException(directory, e);
        }
    }

    @Override
    public Optional<Path> latestReport() {
        Path directory = directory();
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                .max(Comparator.comparing((Path p) -> p.toFile().lastModified())
                    .thenComparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            throw new ReportPersistenceException(directory, e);
        }
    }

    @Override
    public Optional<Path> find(String fileName) {
        Path directory = directory().toAbsolutePath().normalize();
        Path candidate = directory.resolve(fileName).normalize();
        if (!candidate.startsWith(directory) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    String renderMarkdown(String prefix, String timestamp, Map<String, Object> summary,
                          ReportSection... sections) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(title(prefix)).append(" Report (").append(timestamp).append(")\n\n");

        md.append("## Summary\n");
        summary.forEach((key, value) ->
            md.append("- **").append(key).append("**: ").append(format(value)).append('\n'));

        for (ReportSection section : sections) {
            md.append("\n## ").append(section.title()).append('\n');
            for (Map<String, Object> row : section.rows()) {
                md.append("- ").append(row.entrySet().stream()
                    .map(e -> e.getKey() + ": " + format(e.getValue()))
                    .collect(Collectors.joining(" | "))).append('\n');
            }
        }
        return md.toString();
    }

    private static String title(String prefix) {
        return prefix.isEmpty() ? prefix : prefix.substring(0, 1).toUpperCase(Locale.ROOT) + prefix.substring(1);
    }

    private static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.4f", ((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    private Path directory() {
        return Paths.get(properties.getReport().getDirectory());
    }
}
