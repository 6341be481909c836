package dev.factories.model;

/**
 * The Prometheus component of a monitoring stack.
 */
public record InfraSpec(
    boolean enabled,
    String image,
    String scrapeInterval,
    String retentionTime,
    int port,
    String partition, // nullable
    ResourceRequest resources
) {
    public static final String COMPONENT_NAME = "prometheus";
    public static final String DEFAULT_IMAGE = "docker://prom/prometheus:latest";
    public static final String DEFAULT_SCRAPE_INTERVAL = "15s";
    public static final String DEFAULT_RETENTION = "24h";
    public static final int DEFAULT_PORT = 9090;

    public static InfraSpec defaults() {
        return new InfraSpec(true, DEFAULT_IMAGE, DEFAULT_SCRAPE_INTERVAL, DEFAULT_RETENTION,
            DEFAULT_PORT, null, new ResourceRequest(2, 4, 0));
    }
}
