package com.platform.faultlab.store;

import com.platform.faultlab.config.ExecutorConfig;
import com.platform.faultlab.config.StoreConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;

import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoreBootstrapTest {

    private StoreDriver mongo;
    private StoreDriver cassandra;
    private StoreConfig storeConfig;
    private List<Runnable> submitted;
    private TaskExecutor capturingExecutor;

    @BeforeEach
    void setUp() {
        mongo = mock(StoreDriver.class);
        when(mongo.getStoreId()).thenReturn(StoreId.MONGODB);
        cassandra = mock(StoreDriver.class);
        when(cassandra.getStoreId()).thenReturn(StoreId.CASSANDRA);
        storeConfig = new StoreConfig();
        submitted = new ArrayList<>();
        capturingExecutor = submitted::add;
    }

    @Test
    void readyEventSubmitsOneConnectPerStore() {
        when(mongo.connect()).thenReturn(StoreOutcome.ok());
        when(mongo.ensureTable("failure_monitor")).thenReturn(StoreOutcome.ok());
        when(cassandra.connect()).thenReturn(StoreOutcome.ok());
        when(cassandra.ensureTable("devices")).thenReturn(StoreOutcome.ok());
        StoreBootstrap bootstrap = new StoreBootstrap(List.of(mongo, cassandra), storeConfig, capturingExecutor);

        bootstrap.onApplicationReady();

        assertThat(submitted).hasSize(2);
        verify(mongo, never()).connect();
        submitted.forEach(Runnable::run);
        verify(mongo).ensureTable("failure_monitor");
        verify(cassandra).ensureTable("devices");
    }

    @Test
    void unreachableStoreSkipsTableCreation() {
        when(cassandra.connect()).thenReturn(StoreOutcome.failed("All host(s) tried for query failed"));
        StoreBootstrap bootstrap = new StoreBootstrap(List.of(cassandra), storeConfig, capturingExecutor);

        bootstrap.connect(cassandra);

        verify(cassandra, never()).ensureTable(anyString());
    }

    @Test
    void disabledStartupConnectSubmitsNothing() {
        storeConfig.setConnectOnStartup(false);
        StoreBootstrap bootstrap = new StoreBootstrap(List.of(mongo, cassandra), storeConfig, capturingExecutor);

        bootstrap.onApplicationReady();

        assertThat(submitted).isEmpty();
    }

    @Test
    void connectRetriesRunOutsideTheBenchmarkPool() {
        Parameter executorParameter = StoreBootstrap.class.getConstructors()[0].getParameters()[2];

        assertThat(executorParameter.getAnnotation(Qualifier.class).value())
            .isEqualTo(ExecutorConfig.STARTUP_EXECUTOR)
            .isNotEqualTo(ExecutorConfig.BENCHMARK_EXECUTOR);
    }
}
