package dev.factories.model;

/**
 * Resources requested from the scheduler for a single job.
 */
public record ResourceRequest(
    int cpuCores,
    int memoryGb,
    int gpuCount
) {
    public static final int DEFAULT_CPU_CORES = 1;
    public static final int DEFAULT_MEMORY_GB = 4;

    public static ResourceRequest defaults() {
        return new ResourceRequest(DEFAULT_CPU_CORES, DEFAULT_MEMORY_GB, 0);
    }
}
