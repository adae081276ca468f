package com.platform.faultlab.infra;

import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.InjectionException;
import com.platform.faultlab.error.OrchestratorException;
import com.platform.faultlab.error.ResolutionException;
import com.platform.faultlab.infra.docker.DockerConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InfrastructureControllerTest {

    private static final String NETWORK = "distributed_db_network";

    private OrchestratorBackend backend;
    private DockerConfig config;
    private InfrastructureController controller;

    @BeforeEach
    void setUp() {
        backend = mock(OrchestratorBackend.class);
        config = new DockerConfig();
        controller = new InfrastructureController(backend, config, new FaultLabProperties(),
            new MetricsRegistry(new SimpleMeterRegistry()));
    }

    @Nested
    class Synthetic {

        @BeforeEach
        void unreachableOrchestrator() {
            when(backend.ping()).thenReturn(false);
        }

        @Test
        void modeIsDetectedOnce() {
            assertThat(controller.getMode()).isEqualTo(InfraMode.SYNTHETIC);
            assertThat(controller.isSynthetic()).isTrue();
            controller.getMode();

            verify(backend).ping();
        }

        @Test
        void disabledDockerSkipsPing() {
            config.setEnabled(false);

            assertThat(controller.getMode()).isEqualTo(InfraMode.SYNTHETIC);
            verify(backend, never()).ping();
        }

        @Test
        void restartedNodeReportsStoppedWhileBooting() {
            controller.stop("mongo1");
            assertThat(controller.status("mongo1")).isEqualTo(NodeState.STOPPED);

            controller.start("mongo1");

            assertThat(controller.status("mongo1")).isEqualTo(NodeState.STOPPED);
            assertThat(controller.status("mongo1")).isEqualTo(NodeState.STOPPED);
            assertThat(controller.status("mongo1")).isEqualTo(NodeState.RUNNING);
            verify(backend, never()).stopContainer(anyString(), anyInt());
        }

        @Test
        void partitionTogglesMembership() {
            assertThat(controller.resolveNetwork(List.of("cassandra1"))).isEqualTo(NETWORK);

            controller.disconnect("cassandra1", NETWORK);
            assertThat(controller.inspect("cassandra1").orElseThrow().isMemberOf(NETWORK)).isFalse();

            controller.connect("cassandra1", NETWORK);
            assertThat(controller.inspect("cassandra1").orElseThrow().isMemberOf(NETWORK)).isTrue();
        }

        @Test
        void missingSyntheticNetworkFailsResolution() {
            config.setSyntheticNetworkAvailable(false);

            assertThatThrownBy(() -> controller.resolveNetwork(List.of("mongo1")))
                .isInstanceOf(ResolutionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NETWORK_UNRESOLVED);
        }

        @Test
        void uptimeIsMarkedSynthetic() {
            NodeUptime uptime = controller.uptime("mongo2");

            assertThat(uptime.status()).isEqualTo("synthetic");
            assertThat(uptime.seconds()).isBetween(3600L, 72 * 3600L + 5);
            assertThat(uptime.error()).isNull();
        }

        @Test
        void unknownNamesAreAnsweredWithoutBeingSimulated() {
            controller.uptime("mongo1");

            for (int i = 0; i < 100; i++) {
                NodeUptime uptime = controller.uptime("ghost" + i);
                assertThat(uptime.error()).isEqualTo("Container ghost" + i + " not found");
                assertThat(uptime.seconds()).isNull();
            }
            assertThat(controller.status("ghost0")).isEqualTo(NodeState.UNKNOWN);
            assertThat(controller.inspect("ghost0")).isEmpty();
            assertThat(controller.syntheticNodeCount()).isEqualTo(1);
        }

        @Test
        void unknownNodeCannotBeStoppedOrPartitioned() {
            assertThatThrownBy(() -> controller.stop("redis1"))
                .isInstanceOf(ResolutionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TARGET_UNRESOLVED);
            assertThatThrownBy(() -> controller.disconnect("redis1", NETWORK))
                .isInstanceOf(ResolutionException.class);
            assertThatThrownBy(() -> controller.requireNode("redis1"))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TARGET_UNRESOLVED);
            assertThat(controller.syntheticNodeCount()).isZero();
        }

        @Test
        void unknownFirstTargetCannotResolveNetwork() {
            config.setSyntheticNetworkAvailable(false);

            assertThatThrownBy(() -> controller.resolveNetwork(List.of("redis1")))
                .isInstanceOf(ResolutionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NETWORK_UNRESOLVED);
            assertThat(controller.syntheticNodeCount()).isZero();
        }

        @Test
        void restoreBringsBackStoppedAndIsolatedNodes() {
            controller.stop("mongo1");
            controller.disconnect("cassandra2", NETWORK);
            controller.status("mongo3");

            List<String> restored = controller.restore(List.of("mongo1", "cassandra2", "mongo3", "never-seen"));

            assertThat(restored).containsExactly("mongo1", "cassandra2");
            assertThat(controller.status("mongo1")).isEqualTo(NodeState.RUNNING);
        }
    }

    @Nested
    class Live {

        @BeforeEach
        void reachableOrchestrator() {
            when(backend.ping()).thenReturn(true);
        }

        @Test
        void stopFailureBecomesInjectionFailure() {
            doThrow(new OrchestratorException("stop", 500, "boom"))
                .when(backend).stopContainer("mongo1", 5);

            assertThatThrownBy(() -> controller.stop("mongo1"))
                .isInstanceOf(InjectionException.class)
                .hasMessageContaining("mongo1")
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INJECTION_FAILED);
        }

        @Test
        void startFailureBecomesRestorationFailure() {
            doThrow(new OrchestratorException("start", 500, "boom"))
                .when(backend).startContainer("mongo1");

            assertThatThrownBy(() -> controller.start("mongo1"))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.RESTORATION_FAILED);
        }

        @Test
        void statusIsUnknownWhenInspectFails() {
            when(backend.inspectContainer("mongo1")).thenThrow(new OrchestratorException("inspect", 500, "boom"));
            when(backend.inspectContainer("mongo2")).thenReturn(Optional.empty());

            assertThat(controller.status("mongo1")).isEqualTo(NodeState.UNKNOWN);
            assertThat(controller.status("mongo2")).isEqualTo(NodeState.UNKNOWN);
        }

        @Test
        void disconnectVerifiesMembership() {
            when(backend.inspectContainer("cassandra1"))
                .thenReturn(Optional.of(node("cassandra1", NETWORK)))
                .thenReturn(Optional.of(node("cassandra1")));

            controller.disconnect("cassandra1", NETWORK);

            verify(backend).disconnect(NETWORK, "cassandra1");
        }

        @Test
        void disconnectThatDidNotTakeFailsVerification() {
            when(backend.inspectContainer("cassandra1")).thenReturn(Optional.of(node("cassandra1", NETWORK)));

            assertThatThrownBy(() -> controller.disconnect("cassandra1", NETWORK))
                .isInstanceOf(InjectionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PARTITION_VERIFICATION_FAILED);
        }

        @Test
        void connectingAnAttachedNodeIsNoOp() {
            when(backend.inspectContainer("cassandra1")).thenReturn(Optional.of(node("cassandra1", NETWORK)));

            controller.connect("cassandra1", NETWORK);

            verify(backend, never()).connect(anyString(), anyString());
        }

        @Test
        void networkFallsBackToFirstTargetNetwork() {
            when(backend.networkExists(NETWORK)).thenReturn(false);
            when(backend.inspectContainer("mongo1")).thenReturn(Optional.of(node("mongo1", "project_default")));

            assertThat(controller.resolveNetwork(List.of("mongo1", "mongo2"))).isEqualTo("project_default");
        }

        @Test
        void unresolvableNetworkFails() {
            when(backend.networkExists(NETWORK)).thenReturn(false);
            when(backend.inspectContainer("mongo1")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> controller.resolveNetwork(List.of("mongo1")))
                .isInstanceOf(ResolutionException.class);
        }

        @Test
        void requireNodeFailsForUnknownContainer() {
            when(backend.inspectContainer("mongo9")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> controller.requireNode("mongo9"))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("mongo9");
        }

        @Test
        void uptimeReportsErrorsInsteadOfThrowing() {
            when(backend.inspectContainer("mongo1")).thenReturn(Optional.empty());
            when(backend.inspectContainer("mongo2"))
                .thenReturn(Optional.of(new NodeStatus("mongo2", NodeState.RUNNING, Set.of(), Instant.now().minusSeconds(7200))));

            assertThat(controller.uptime("mongo1").error()).isEqualTo("Container mongo1 not found");
            NodeUptime uptime = controller.uptime("mongo2");
            assertThat(uptime.status()).isEqualTo("running");
            assertThat(uptime.hours()).isEqualTo(2.0);
        }

        private NodeStatus node(String name, String... networks) {
            return new NodeStatus(name, NodeState.RUNNING, Set.of(networks), Instant.now());
        }
    }
}
