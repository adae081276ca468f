package com.platform.faultlab.report;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists run reports and reads them back.
 */
public interface ReportSink {

    /**
     * Save a run as a Markdown summary plus a JSON document of its details.
     *
     * @param prefix report kind, e.g. performance
     * @param timestamp UTC timestamp in yyyyMMdd_HHmmss form
     * @return paths written, empty when reports are disabled
     * @throws com.platform.faultlab.error.ReportPersistenceException if a file cannot be written
     */
    List<Path> save(String prefix, String timestamp, Map<String, Object> summary,
                    Object details, ReportSection... sections);

    /**
     * Report file names, newest name first.
     */
    List<String> listReports();

    /**
     * Most recently modified report.
     */
    Optional<Path> latestReport();

    /**
     * Resolve a report by file name, if it exists.
     */
    Optional<Path> find(String fileName);
}
