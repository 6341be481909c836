package dev.factories.model;

/**
 * A named dependency whose network endpoint must be known before the dependent job runs.
 * <p>
 * Resolution tries, in order: the direct {@code endpoint}, a discovery record
 * under {@link #discoveryKey()}, then polling the scheduler for {@code jobHandle}.
 */
public record TargetSpec(
    String name,
    String endpoint, // nullable, "host:port"
    String serviceName, // nullable, discovery key; the target name is used when absent
    String jobHandle, // nullable
    int port,
    String metricsPath
) {
    public static final int DEFAULT_PORT = 8000;
    public static final String DEFAULT_METRICS_PATH = "/metrics";

    public String discoveryKey() {
        return serviceName != null && !serviceName.isBlank() ? serviceName : name;
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public boolean hasJobHandle() {
        return jobHandle != null && !jobHandle.isBlank();
    }

    public TargetSpec withJobHandle(String handle) {
        return new TargetSpec(name, endpoint, serviceName, handle, port, metricsPath);
    }

    public static TargetSpec ofHandle(String name, String handle) {
        return new TargetSpec(name, null, null, handle, DEFAULT_PORT, DEFAULT_METRICS_PATH);
    }
}
