package com.platform.faultlab.infra.docker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTOs for Docker Engine API communication.
 */
public class DockerModels {

    /**
     * Response of GET /containers/{id}/json (the fields we read).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerInspect {
        @JsonProperty("Name")
        private String name;

        @JsonProperty("State")
        private ContainerState state;

        @JsonProperty("NetworkSettings")
        private NetworkSettings networkSettings;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerState {
        @JsonProperty("Status")
        private String status;

        @JsonProperty("Running")
        private boolean running;

        @JsonProperty("StartedAt")
        private String startedAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NetworkSettings {
        @JsonProperty("Networks")
        private Map<String, Object> networks;
    }

    /**
     * Body of POST /networks/{id}/connect.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectRequest {
        @JsonProperty("Container")
        private String container;
    }

    /**
     * Body of POST /networks/{id}/disconnect.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DisconnectRequest {
        @JsonProperty("Container")
        private String container;

        @JsonProperty("Force")
        private boolean force;
    }
}
