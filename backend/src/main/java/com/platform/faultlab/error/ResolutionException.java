package com.platform.faultlab.error;

import java.util.Collection;

/**
 * Raised while preparing a scenario when targets, network or node locks cannot be obtained.
 * Nothing has been mutated when this is thrown.
 */
public class ResolutionException extends FaultLabException {

    public ResolutionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ResolutionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ResolutionException networkUnresolved(String configuredNetwork, String firstTarget) {
        return new ResolutionException(ErrorCode.NETWORK_UNRESOLVED, String.format(
            "Network resolution failed: network '%s' not found and node '%s' lists no network",
            configuredNetwork, firstTarget));
    }

    public static ResolutionException targetUnresolved(String node, String reason) {
        return new ResolutionException(ErrorCode.TARGET_UNRESOLVED,
            String.format("Target node '%s' could not be resolved: %s", node, reason));
    }

    public static ResolutionException nodeBusy(Collection<String> nodes) {
        return new ResolutionException(ErrorCode.NODE_BUSY,
            "Nodes already targeted by a running scenario: " + String.join(",", nodes));
    }
}
