package dev.factories.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Last known location of a published service. A hint only: the job behind it
 * may have ended since it was written.
 */
public record DiscoveryRecord(
    String serviceName,
    String jobId,
    String node,
    List<Integer> ports,
    String instanceId,
    Instant updatedAt
) {
    public DiscoveryRecord {
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    /** A record without a node or ports cannot be connected to. */
    public boolean isComplete() {
        return node != null && !node.isBlank() && !ports.isEmpty();
    }

    /**
     * Connectable address, preferring {@code preferredPort} when the record lists it.
     */
    public Optional<String> endpoint(int preferredPort) {
        if (!isComplete()) {
            return Optional.empty();
        }
        int port = ports.contains(preferredPort) ? preferredPort : ports.get(0);
        return Optional.of(node + ":" + port);
    }

    public DiscoveryRecord withNode(String newNode, Instant now) {
        return new DiscoveryRecord(serviceName, jobId, newNode, ports, instanceId, now);
    }
}
