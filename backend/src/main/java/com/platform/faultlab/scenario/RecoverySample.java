package com.platform.faultlab.scenario;

import com.platform.faultlab.store.StoreId;

/**
 * Whether a store was back online during one recovery-watch tick.
 */
public record RecoverySample(int tick, StoreId store, boolean storeOnline) {
}
