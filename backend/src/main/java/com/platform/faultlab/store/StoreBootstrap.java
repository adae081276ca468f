package com.platform.faultlab.store;

import com.platform.faultlab.config.ExecutorConfig;
import com.platform.faultlab.config.StoreConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Opens both store sessions in the background once the application is ready,
 * on a dedicated startup pool so long connect retries never delay benchmark work.
 * A store that cannot be reached is retried lazily on its next use.
 */
@Slf4j
@Component
public class StoreBootstrap {

    /**
     * Probe table per store, created up front so the first probe measures a plain write.
     */
    static final Map<StoreId, String> PROBE_TABLES = Map.of(
        StoreId.MONGODB, "failure_monitor",
        StoreId.CASSANDRA, "devices"
    );

    private final List<StoreDriver> drivers;
    private final StoreConfig storeConfig;
    private final TaskExecutor executor;

    public StoreBootstrap(
            List<StoreDriver> drivers,
            StoreConfig storeConfig,
            @Qualifier(ExecutorConfig.STARTUP_EXECUTOR) TaskExecutor executor) {
        this.drivers = drivers;
        this.storeConfig = storeConfig;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!storeConfig.isConnectOnStartup()) {
            log.info("Store connection on startup disabled");
            return;
        }
        for (StoreDriver driver : drivers) {
            executor.execute(() -> connect(driver));
        }
    }

    void connect(StoreDriver driver) {
        StoreId store = driver.getStoreId();
        StoreOutcome<Void> connected = driver.connect();
        if (connected.isFailure()) {
            log.warn("{} not reachable at startup: {}", store.getDisplayName(), connected.error());
            return;
        }
        StoreOutcome<Void> table = driver.ensureTable(PROBE_TABLES.get(store));
        if (table.isFailure()) {
            log.warn("Failed to create {} probe table: {}", store.getDisplayName(), table.error());
            return;
        }
        log.info("{} ready", store.getDisplayName());
    }
}
