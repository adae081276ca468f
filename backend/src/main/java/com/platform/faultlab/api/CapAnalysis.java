package com.platform.faultlab.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static CAP scorecard of the two stores.
 */
public final class CapAnalysis {

    public record Property(String level, String description, int score) {}

    public record Scorecard(Property consistency, Property availability, Property partitionTolerance,
                            String capClassification) {}

    private static final Map<String, Scorecard> SCORECARDS;

    static {
        Map<String, Scorecard> scorecards = new LinkedHashMap<>();
        scorecards.put("mongodb", new Scorecard(
            new Property("Strong", "ACID transactions", 90),
            new Property("High", "Automatic failover", 75),
            new Property("High", "Replica sets", 85),
            "CP"));
        scorecards.put("cassandra", new Scorecard(
            new Property("Tunable", "Configurable consistency", 60),
            new Property("Very High", "No single point of failure", 95),
            new Property("Very High", "Designed for partitions", 95),
            "AP"));
        SCORECARDS = Collections.unmodifiableMap(scorecards);
    }

    private CapAnalysis() {
    }

    public static Map<String, Scorecard> scorecards() {
        return SCORECARDS;
    }
}
