package dev.factories.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of an instance at one point in time.
 */
public record InstanceSnapshot(
    String id,
    String recipeName,
    RecipeKind kind,
    InstanceStatus status,
    String handle,
    Map<String, String> endpoints,
    Map<String, ComponentSnapshot> components,
    Map<String, String> metadata,
    List<InstanceStatus> history,
    Instant createdAt,
    Instant completedAt
) {
    public String shortId() {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    public Duration uptime(Instant now) {
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(createdAt, end);
    }
}
