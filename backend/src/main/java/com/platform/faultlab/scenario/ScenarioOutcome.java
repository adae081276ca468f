package com.platform.faultlab.scenario;

/**
 * Final outcome of a scenario.
 */
public enum ScenarioOutcome {
    /**
     * Injected, monitored, restored and (for node failures) recovered.
     */
    SUCCESS,

    /**
     * Ran to completion but restoration failed, recovery was not observed, or the run was interrupted.
     */
    PARTIAL_FAILURE,

    /**
     * Aborted while preparing or injecting. Nothing is left mutated.
     */
    FAILED
}
