package dev.factories.engine;

import dev.factories.discovery.DiscoveryStore;
import dev.factories.model.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates recipes before they are cached. Everything a submission would trip
 * over later is caught here.
 */
public final class RecipeValidator {

    private static final Set<String> VALID_PATTERNS = Set.of(Workload.CLOSED_LOOP, Workload.OPEN_LOOP);
    private static final Set<String> VALID_PROTOCOLS = Set.of("http", "https");

    static final int MAX_CONCURRENT_USERS = 1000;
    static final int MAX_DURATION_SECONDS = 5000;

    private RecipeValidator() {}

    /**
     * Validate a recipe. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(Recipe recipe) {
        var errors = new ArrayList<String>();

        if (recipe.name() == null || recipe.name().isBlank()) {
            errors.add("Recipe name is required");
        }

        if (recipe.serviceName() != null && !DiscoveryStore.isValidServiceName(recipe.serviceName())) {
            errors.add("service_name '%s' cannot be used as a discovery name".formatted(recipe.serviceName()));
        }

        checkResources("orchestration.resources", recipe.resources(), errors);
        for (Integer port : recipe.execution().ports()) {
            checkPort("service.ports", port, errors);
        }

        switch (recipe.kind()) {
            case SERVICE -> {
                if (!recipe.execution().hasCommand()) {
                    errors.add("service.command must be a non-empty string");
                }
            }
            case CLIENT -> validateClient(recipe, errors);
            case MONITOR -> validateMonitor(recipe, errors);
        }

        var names = new HashSet<String>();
        for (TargetSpec target : recipe.targets()) {
            if (target.name() == null || target.name().isBlank()) {
                errors.add("Every target needs a name");
                continue;
            }
            if (!names.add(target.name())) {
                errors.add("Duplicate target name '%s'".formatted(target.name()));
            }
            checkPort("target '%s' port".formatted(target.name()), target.port(), errors);
            if (target.hasEndpoint() && !isHostPort(target.endpoint())) {
                errors.add("Target '%s' endpoint must look like host:port, got '%s'"
                    .formatted(target.name(), target.endpoint()));
            }
            if (!target.hasEndpoint() && !DiscoveryStore.isValidServiceName(target.discoveryKey())) {
                errors.add("Target '%s' service '%s' cannot be used as a discovery name"
                    .formatted(target.name(), target.discoveryKey()));
            }
        }

        return errors;
    }

    private static void validateClient(Recipe recipe, List<String> errors) {
        Workload workload = recipe.workload();
        if (workload == null) {
            errors.add("Client recipes require a workload section");
            return;
        }
        if (!recipe.hasTargets()) {
            errors.add("Client recipes require a target");
        }
        if (!VALID_PATTERNS.contains(workload.pattern())) {
            errors.add("Unsupported workload pattern '%s'. Valid patterns: %s"
                .formatted(workload.pattern(), VALID_PATTERNS));
        }
        if (!VALID_PROTOCOLS.contains(workload.protocol())) {
            errors.add("Unsupported protocol '%s'".formatted(workload.protocol()));
        }
        if (workload.durationSeconds() <= 0) {
            errors.add("workload.duration_seconds must be positive");
        } else if (workload.durationSeconds() > MAX_DURATION_SECONDS) {
            errors.add("Duration exceeds reasonable limit (%d seconds)".formatted(MAX_DURATION_SECONDS));
        }
        if (workload.concurrentUsers() <= 0) {
            errors.add("workload.concurrent_users must be positive");
        } else if (workload.concurrentUsers() > MAX_CONCURRENT_USERS) {
            errors.add("Concurrent users exceeds reasonable limit (%d)".formatted(MAX_CONCURRENT_USERS));
        }
        if (workload.thinkTimeMs() < 0 || workload.requestsPerUser() < 0) {
            errors.add("workload.think_time_ms and workload.requests_per_user must not be negative");
        }
    }

    private static void validateMonitor(Recipe recipe, List<String> errors) {
        if (!recipe.hasTargets()) {
            errors.add("At least one target is required");
        }
        InfraSpec infra = recipe.infra();
        if (infra == null) {
            errors.add("Monitor recipes require a prometheus section");
            return;
        }
        checkPort("prometheus.port", infra.port(), errors);
        checkResources("prometheus.resources", infra.resources(), errors);
        if (infra.enabled() && (infra.image() == null || infra.image().isBlank())) {
            errors.add("prometheus.image must be set when prometheus is enabled");
        }
    }

    private static void checkResources(String path, ResourceRequest resources, List<String> errors) {
        if (resources.cpuCores() < 1) {
            errors.add("%s.cpu_cores must be at least 1, got %d".formatted(path, resources.cpuCores()));
        }
        if (resources.memoryGb() < 1) {
            errors.add("%s.memory_gb must be at least 1, got %d".formatted(path, resources.memoryGb()));
        }
        if (resources.gpuCount() < 0) {
            errors.add("%s.gpu_count must not be negative, got %d".formatted(path, resources.gpuCount()));
        }
    }

    private static void checkPort(String path, int port, List<String> errors) {
        if (port < 1 || port > 65535) {
            errors.add("%s must be a valid TCP port (1-65535), got %d".formatted(path, port));
        }
    }

    static boolean isHostPort(String endpoint) {
        int colon = endpoint.lastIndexOf(':');
        if (colon <= 0 || colon == endpoint.length() - 1) {
            return false;
        }
        try {
            int port = Integer.parseInt(endpoint.substring(colon + 1));
            return port >= 1 && port <= 65535;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
