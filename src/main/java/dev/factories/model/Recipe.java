package dev.factories.model;

import java.util.List;
import java.util.Optional;

/**
 * A validated, immutable description of something to deploy on the cluster.
 */
public record Recipe(
    String name,
    String description,
    RecipeKind kind,
    ExecutionUnit execution,
    ResourceRequest resources,
    List<TargetSpec> targets,
    SchedulingHints scheduling,
    String serviceName, // nullable, name the deployed service is published under
    Workload workload, // nullable, client recipes only
    InfraSpec infra // nullable, monitor recipes only
) {
    public Recipe {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public boolean hasTargets() {
        return !targets.isEmpty();
    }

    public Optional<String> discoveryName() {
        return serviceName == null || serviceName.isBlank() ? Optional.empty() : Optional.of(serviceName);
    }

    public Optional<TargetSpec> target(String targetName) {
        return targets.stream().filter(t -> t.name().equals(targetName)).findFirst();
    }
}
