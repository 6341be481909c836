package dev.factories.engine;

import dev.factories.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecipeValidatorTest {

    @Test
    void validServiceReturnsNoErrors() {
        assertThat(RecipeValidator.validate(service("./serve.sh", List.of(8000)))).isEmpty();
    }

    @Test
    void serviceNeedsACommand() {
        var errors = RecipeValidator.validate(service("  ", List.of()));
        assertThat(errors).anyMatch(e -> e.contains("service.command"));
    }

    @Test
    void detectsOutOfRangePorts() {
        var errors = RecipeValidator.validate(service("run", List.of(0, 70000)));
        assertThat(errors).filteredOn(e -> e.contains("service.ports")).hasSize(2);
    }

    @Test
    void detectsBadResources() {
        Recipe recipe = new Recipe("svc", null, RecipeKind.SERVICE,
            new ExecutionUnit("run", null, null, Map.of(), List.of()),
            new ResourceRequest(0, 0, -1), List.of(), SchedulingHints.none(), null, null, null);

        assertThat(RecipeValidator.validate(recipe))
            .anyMatch(e -> e.contains("cpu_cores"))
            .anyMatch(e -> e.contains("memory_gb"))
            .anyMatch(e -> e.contains("gpu_count"));
    }

    @Test
    void clientNeedsTargetAndSaneWorkload() {
        var workload = new Workload("zigzag", 9000, 0, -1, 10, "ftp", Map.of(), Map.of(), "./results");
        Recipe recipe = new Recipe("bench", null, RecipeKind.CLIENT, ExecutionUnit.empty(),
            ResourceRequest.defaults(), List.of(), SchedulingHints.none(), null, workload, null);

        assertThat(RecipeValidator.validate(recipe))
            .anyMatch(e -> e.contains("require a target"))
            .anyMatch(e -> e.contains("Unsupported workload pattern 'zigzag'"))
            .anyMatch(e -> e.contains("Unsupported protocol 'ftp'"))
            .anyMatch(e -> e.contains("Duration exceeds"))
            .anyMatch(e -> e.contains("concurrent_users must be positive"))
            .anyMatch(e -> e.contains("must not be negative"));
    }

    @Test
    void clientWithoutWorkloadIsRejected() {
        Recipe recipe = new Recipe("bench", null, RecipeKind.CLIENT, ExecutionUnit.empty(),
            ResourceRequest.defaults(), List.of(target("t", null)), SchedulingHints.none(), null, null, null);

        assertThat(RecipeValidator.validate(recipe)).containsExactly("Client recipes require a workload section");
    }

    @Test
    void monitorNeedsTargetsAndPrometheus() {
        Recipe recipe = new Recipe("mon", null, RecipeKind.MONITOR, ExecutionUnit.empty(),
            ResourceRequest.defaults(), List.of(), SchedulingHints.none(), null, null, null);

        assertThat(RecipeValidator.validate(recipe))
            .contains("At least one target is required", "Monitor recipes require a prometheus section");
    }

    @Test
    void enabledPrometheusNeedsAnImage() {
        var infra = new InfraSpec(true, " ", "15s", "24h", 9090, null, new ResourceRequest(2, 4, 0));
        Recipe recipe = new Recipe("mon", null, RecipeKind.MONITOR, ExecutionUnit.empty(),
            ResourceRequest.defaults(), List.of(target("a", "h:1")), SchedulingHints.none(), null, null, infra);

        assertThat(RecipeValidator.validate(recipe)).anyMatch(e -> e.contains("prometheus.image"));
    }

    @Test
    void detectsDuplicateAndMalformedTargets() {
        Recipe recipe = new Recipe("mon", null, RecipeKind.MONITOR, ExecutionUnit.empty(),
            ResourceRequest.defaults(),
            List.of(target("a", "10.0.0.1:8000"), target("a", "no-port"), target("b", "host:99999")),
            SchedulingHints.none(), null, null, InfraSpec.defaults());

        assertThat(RecipeValidator.validate(recipe))
            .anyMatch(e -> e.contains("Duplicate target name 'a'"))
            .anyMatch(e -> e.contains("'no-port'"))
            .anyMatch(e -> e.contains("'host:99999'"));
    }

    @Test
    void rejectsServiceNameThatCannotBeADiscoveryFile() {
        Recipe recipe = new Recipe("svc", null, RecipeKind.SERVICE,
            new ExecutionUnit("run", null, null, Map.of(), List.of(8000)),
            ResourceRequest.defaults(), List.of(), SchedulingHints.none(), "team/a", null, null);

        assertThat(RecipeValidator.validate(recipe)).anyMatch(e -> e.contains("service_name 'team/a'"));
    }

    @Test
    void rejectsTargetDiscoveryKeysThatCannotBeLookedUp() {
        var byService = new TargetSpec("svc", null, "team/a", null, 8000, TargetSpec.DEFAULT_METRICS_PATH);
        var byName = new TargetSpec("../up", null, null, null, 8000, TargetSpec.DEFAULT_METRICS_PATH);
        var direct = new TargetSpec("a/b", "10.0.0.1:8000", null, null, 8000, TargetSpec.DEFAULT_METRICS_PATH);
        Recipe recipe = new Recipe("mon", null, RecipeKind.MONITOR, ExecutionUnit.empty(),
            ResourceRequest.defaults(), List.of(byService, byName, direct), SchedulingHints.none(),
            null, null, InfraSpec.defaults());

        assertThat(RecipeValidator.validate(recipe))
            .anyMatch(e -> e.contains("Target 'svc' service 'team/a'"))
            .anyMatch(e -> e.contains("Target '../up' service '../up'"))
            .noneMatch(e -> e.contains("Target 'a/b'"));
    }

    @Test
    void recognisesHostPort() {
        assertThat(RecipeValidator.isHostPort("node-1:8000")).isTrue();
        assertThat(RecipeValidator.isHostPort("node-1:")).isFalse();
        assertThat(RecipeValidator.isHostPort(":8000")).isFalse();
        assertThat(RecipeValidator.isHostPort("node-1:http")).isFalse();
    }

    private static Recipe service(String command, List<Integer> ports) {
        return new Recipe("svc", "A service", RecipeKind.SERVICE,
            new ExecutionUnit(command, null, null, Map.of(), ports),
            ResourceRequest.defaults(), List.of(), SchedulingHints.none(), "svc", null, null);
    }

    private static TargetSpec target(String name, String endpoint) {
        return new TargetSpec(name, endpoint, null, null, TargetSpec.DEFAULT_PORT, TargetSpec.DEFAULT_METRICS_PATH);
    }
}
