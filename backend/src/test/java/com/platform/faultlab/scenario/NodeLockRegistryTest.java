package com.platform.faultlab.scenario;

import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.ResolutionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeLockRegistryTest {

    private final NodeLockRegistry registry = new NodeLockRegistry();

    @Test
    void overlappingLeaseIsRejectedWithBusyNodesSorted() {
        try (NodeLockRegistry.Lease lease = registry.acquire(List.of("mongo2", "mongo1"))) {
            assertThat(lease.getNodes()).containsExactly("mongo2", "mongo1");

            assertThatThrownBy(() -> registry.acquire(List.of("cassandra1", "mongo2", "mongo1")))
                .isInstanceOf(ResolutionException.class)
                .hasMessageEndingWith("mongo1,mongo2")
                .extracting(e -> ((ResolutionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NODE_BUSY);
            assertThat(registry.isHeld("cassandra1")).isFalse();
        }
        assertThat(registry.isHeld("mongo1")).isFalse();
        assertThat(registry.isHeld("mongo2")).isFalse();
    }

    @Test
    void disjointLeasesCoexist() {
        NodeLockRegistry.Lease first = registry.acquire(List.of("mongo1"));
        NodeLockRegistry.Lease second = registry.acquire(List.of("cassandra1"));

        assertThat(registry.isHeld("mongo1")).isTrue();
        assertThat(registry.isHeld("cassandra1")).isTrue();

        first.close();
        second.close();
        assertThat(registry.acquire(List.of("mongo1", "cassandra1")).getNodes()).hasSize(2);
    }

    @Test
    void closingTwiceDoesNotReleaseAnotherScenariosLease() {
        NodeLockRegistry.Lease stale = registry.acquire(List.of("mongo3"));
        stale.close();
        NodeLockRegistry.Lease current = registry.acquire(List.of("mongo3"));

        stale.close();

        assertThat(registry.isHeld("mongo3")).isTrue();
        current.close();
        assertThat(registry.isHeld("mongo3")).isFalse();
    }
}
