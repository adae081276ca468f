package com.platform.faultlab.infra;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uptime of a node, or the reason it could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeUptime(Long seconds, Double hours, String status, String error) {

    public static NodeUptime of(long seconds, String status) {
        long clamped = Math.max(0, seconds);
        return new NodeUptime(clamped, Math.round(clamped / 36.0) / 100.0, status, null);
    }

    public static NodeUptime error(String error) {
        return new NodeUptime(null, null, null, error);
    }
}
