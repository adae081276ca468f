package com.platform.faultlab.probe;

/**
 * Outcome of one probe. Latency is present only on success.
 */
public record ProbeResult(boolean success, Double latencyMs, String error) {

    public static ProbeResult ok(double latencyMs) {
        return new ProbeResult(true, latencyMs, null);
    }

    public static ProbeResult failed(String error) {
        return new ProbeResult(false, null, error);
    }
}
