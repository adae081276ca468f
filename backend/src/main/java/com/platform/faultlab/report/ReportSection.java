package com.platform.faultlab.report;

import java.util.List;
import java.util.Map;

/**
 * A titled series of rows rendered as a Markdown list.
 */
public record ReportSection(String title, List<Map<String, Object>> rows) {

    public ReportSection {
        rows = List.copyOf(rows);
    }
}
