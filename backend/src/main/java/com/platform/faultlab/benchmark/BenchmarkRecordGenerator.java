package com.platform.faultlab.benchmark;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates synthetic device records for benchmark workloads.
 */
@Component
public class BenchmarkRecordGenerator {

    static final List<String> STATUSES = List.of("ACTIVE", "INACTIVE", "MAINTENANCE");
    static final List<String> TYPES = List.of("sensor", "actuator", "controller");

    /**
     * Generate {@code count} records named "Device 0" to "Device count-1".
     */
    public List<Map<String, Object>> generate(int count) {
        Random random = ThreadLocalRandom.current();
        String timestamp = LocalDateTime.now(ZoneOffset.UTC).toString();
        List<Map<String, Object>> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("id", UUID.randomUUID().toString());
            record.put("name", "Device " + i);
            record.put("status", STATUSES.get(random.nextInt(STATUSES.size())));
            record.put("type", TYPES.get(random.nextInt(TYPES.size())));
            record.put("value", random.nextDouble() * 100);
            record.put("timestamp", timestamp);
            records.add(record);
        }
        return records;
    }
}
