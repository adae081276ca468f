package com.platform.faultlab.infra.docker;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the Docker Engine API.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "faultlab.docker")
public class DockerConfig {

    /**
     * Whether to use a real Docker Engine. When false the controller always runs synthetic.
     */
    private boolean enabled = true;

    /**
     * Full base URL of the Engine API (e.g. http://docker-socket-proxy:2375). Overrides host and port.
     */
    private String url;

    private String host = "docker-socket-proxy";

    private int port = 2375;

    /**
     * Engine API version prefix.
     */
    private String apiVersion = "v1.43";

    private int connectionTimeoutMs = 2000;

    private int readTimeoutMs = 15000;

    /**
     * Well-known network the store nodes are attached to.
     */
    private String network = "distributed_db_network";

    /**
     * Grace period before a stopped container is killed.
     */
    private int stopTimeoutSeconds = 5;

    /**
     * Whether the configured network exists in synthetic mode.
     */
    private boolean syntheticNetworkAvailable = true;

    /**
     * Get the versioned Engine API base URL.
     */
    public String getApiUrl() {
        String base = url != null && !url.isBlank() ? url : String.format("http://%s:%d", host, port);
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return apiVersion == null || apiVersion.isBlank() ? base : base + "/" + apiVersion;
    }
}
