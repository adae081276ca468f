package com.platform.faultlab.benchmark;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkRecordGeneratorTest {

    @Test
    void recordsAreNamedInOrderWithValuesInRange() {
        List<Map<String, Object>> records = new BenchmarkRecordGenerator().generate(50);

        assertThat(records).hasSize(50);
        assertThat(records.get(0)).containsEntry("name", "Device 0");
        assertThat(records.get(49)).containsEntry("name", "Device 49");
        assertThat(records).allSatisfy(record -> {
            assertThat(record).containsOnlyKeys("id", "name", "status", "type", "value", "timestamp");
            assertThat((String) record.get("id")).hasSize(36);
            assertThat(BenchmarkRecordGenerator.STATUSES).contains((String) record.get("status"));
            assertThat(BenchmarkRecordGenerator.TYPES).contains((String) record.get("type"));
            assertThat((Double) record.get("value")).isBetween(0.0, 100.0);
        });
        assertThat(records).extracting(r -> r.get("id")).doesNotHaveDuplicates();
    }

    @Test
    void configRejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new BenchmarkConfig(0, 10, ConsistencyLevel.EVENTUAL, TestType.MIXED))
            .hasMessageContaining("operationCount");
        assertThatThrownBy(() -> new BenchmarkConfig(10, 1001, ConsistencyLevel.EVENTUAL, TestType.MIXED))
            .hasMessageContaining("batchSize");
        assertThat(new BenchmarkConfig(10, 3, null, null).batchCount()).isEqualTo(4);
        assertThat(TestType.fromValue("Update")).isEqualTo(TestType.UPDATE);
    }
}
