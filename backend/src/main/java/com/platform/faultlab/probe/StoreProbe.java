package com.platform.faultlab.probe;

import com.platform.faultlab.store.StoreId;

import java.util.concurrent.CompletableFuture;

/**
 * Bounded write+read health check against one store.
 */
public interface StoreProbe {

    StoreId getStoreId();

    /**
     * Run one probe. The returned future always completes normally, within the probe timeout.
     */
    CompletableFuture<ProbeResult> probeAsync();
}
