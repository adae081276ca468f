package com.platform.faultlab.api;

import com.platform.faultlab.benchmark.BenchmarkConfig;
import com.platform.faultlab.benchmark.ConsistencyLevel;
import com.platform.faultlab.benchmark.TestType;
import com.platform.faultlab.error.ResourceNotFoundException;
import com.platform.faultlab.report.ReportSink;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for saved reports.
 */
@RestController
@RequestMapping("/api/report")
@RequiredArgsConstructor
@CrossOrigin(origins = "${faultlab.cors.allowed-origins:*}")
public class ReportController {

    private static final MediaType MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final ReportSink reportSink;
    private final PerformanceService performanceService;

    /**
     * List report file names, newest first.
     */
    @GetMapping
    public ResponseEntity<List<String>> listReports() {
        return ResponseEntity.ok(reportSink.listReports());
    }

    @GetMapping("/latest")
    public ResponseEntity<Map<String, String>> latestReport() {
        Path latest = reportSink.latestReport()
            .orElseThrow(() -> ResourceNotFoundException.report("latest"));
        return ResponseEntity.ok(Map.of("latestReport", latest.toString()));
    }

    /**
     * Run a benchmark with default settings and save its report.
     */
    @PostMapping("/generate")
    public ResponseEntity<Map<String, Object>> generate() {
        PerformanceResponse response = performanceService.run(
            new BenchmarkConfig(1000, 100, ConsistencyLevel.EVENTUAL, TestType.MIXED));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Report generated successfully");
        body.put("benchmarkId", response.summary().benchmarkId());
        body.put("reports", response.reports());
        return ResponseEntity.ok(body);
    }

    /**
     * Download one report.
     */
    @GetMapping("/{fileName:.+}")
    public ResponseEntity<Resource> getReport(@PathVariable String fileName) {
        Path path = reportSink.find(fileName)
            .orElseThrow(() -> ResourceNotFoundException.report(fileName));
        MediaType type = fileName.endsWith(".json") ? MediaType.APPLICATION_JSON : MARKDOWN;
        return ResponseEntity.ok().contentType(type).body(new FileSystemResource(path));
    }
}
