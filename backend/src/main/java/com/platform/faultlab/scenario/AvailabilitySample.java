package com.platform.faultlab.scenario;

import com.platform.faultlab.probe.ProbeResult;
import com.platform.faultlab.store.StoreId;

/**
 * Availability of one store during one monitoring tick.
 */
public record AvailabilitySample(int tick, StoreId store, boolean success, Double latencyMs, String error) {

    public static AvailabilitySample of(int tick, StoreId store, ProbeResult result) {
        return new AvailabilitySample(tick, store, result.success(), result.latencyMs(), result.error());
    }

    public static AvailabilitySample failed(int tick, StoreId store, String error) {
        return new AvailabilitySample(tick, store, false, null, error);
    }

    public static final String NOT_TESTED = "Not tested";

    /**
     * Sample for a store that was not probed. Never reported as available.
     */
    public static AvailabilitySample untested(int tick, StoreId store) {
        return new AvailabilitySample(tick, store, false, null, NOT_TESTED);
    }
}
