package dev.factories.engine;

import dev.factories.error.FactoryException;
import dev.factories.error.NotFoundException;
import dev.factories.model.Component;
import dev.factories.model.Instance;
import dev.factories.model.InstanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceRegistryTest {

    @TempDir
    Path tempDir;

    private Path recipeDir;
    private Path stateFile;
    private RecipeStore recipes;
    private ManualClock clock;
    private InstanceRegistry registry;

    @BeforeEach
    void setUp() {
        recipeDir = tempDir.resolve("recipes");
        TestRecipes.write(recipeDir, "bench-a", TestRecipes.BENCH_A);
        TestRecipes.write(recipeDir, "mon-1", TestRecipes.MON_1);
        stateFile = tempDir.resolve("state").resolve("instances.json");
        recipes = new RecipeStore(recipeDir);
        clock = new ManualClock();
        registry = new InstanceRegistry(stateFile, recipes, clock);
    }

    @Test
    void missingStateFileMeansEmptyRegistry() {
        assertThat(registry.reload()).isZero();
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void roundTripsInstancesWithComponentsAndHistory() {
        Instance service = Instance.create("bench-a", recipes.load("bench-a"), clock.instant());
        service.assignHandle("1000");
        registry.create(service);
        registry.update(service.id(), InstanceStatus.STARTING);
        service.putEndpoint("bench-a", "node-1:8000");
        service.putMetadata("node", "node-1");
        registry.persist();

        Instance monitor = Instance.create("mon-1", recipes.load("mon-1"), clock.instant());
        Component prometheus = monitor.addComponent("prometheus");
        prometheus.assignHandle("1001");
        prometheus.setEndpoint("node-2:9090");
        prometheus.transitionTo(InstanceStatus.RUNNING);
        registry.create(monitor);
        clock.advance(Duration.ofMinutes(3));
        registry.update(monitor.id(), InstanceStatus.CANCELED);

        var reloaded = InstanceRegistry.open(stateFile, new RecipeStore(recipeDir), clock);

        assertThat(reloaded.all()).hasSize(2);
        Instance restoredService = reloaded.get(service.id()).orElseThrow();
        assertThat(restoredService.status()).isEqualTo(InstanceStatus.STARTING);
        assertThat(restoredService.handle()).isEqualTo("1000");
        assertThat(restoredService.endpoints()).containsEntry("bench-a", "node-1:8000");
        assertThat(restoredService.metadata()).containsEntry("node", "node-1");
        assertThat(restoredService.history()).containsExactly(InstanceStatus.SUBMITTED, InstanceStatus.STARTING);
        assertThat(restoredService.createdAt()).isEqualTo(service.createdAt());

        Instance restoredMonitor = reloaded.get(monitor.id()).orElseThrow();
        assertThat(restoredMonitor.status()).isEqualTo(InstanceStatus.CANCELED);
        assertThat(restoredMonitor.completedAt()).isEqualTo(clock.instant());
        assertThat(restoredMonitor.component("prometheus")).hasValueSatisfying(c -> {
            assertThat(c.handle()).isEqualTo("1001");
            assertThat(c.endpoint()).isEqualTo("node-2:9090");
            assertThat(c.status()).isEqualTo(InstanceStatus.RUNNING);
        });
    }

    @Test
    void stateFileIsVersionedSnakeCaseJson() throws IOException {
        Instance service = Instance.create("bench-a", recipes.load("bench-a"), clock.instant());
        registry.create(service);

        String json = Files.readString(stateFile);

        assertThat(json)
            .contains("\"version\" : 1")
            .contains("\"recipe_name\" : \"bench-a\"")
            .contains("\"created_at\" : \"2024-05-01T12:00:00Z\"");
    }

    @Test
    void skipsInstancesWhoseRecipeDisappeared() throws IOException {
        registry.create(Instance.create("bench-a", recipes.load("bench-a"), clock.instant()));
        Instance monitor = Instance.create("mon-1", recipes.load("mon-1"), clock.instant());
        registry.create(monitor);
        Files.delete(recipeDir.resolve("bench-a.yaml"));

        var reloaded = InstanceRegistry.open(stateFile, new RecipeStore(recipeDir), clock);

        assertThat(reloaded.all()).extracting(Instance::id).containsExactly(monitor.id());
    }

    @Test
    void corruptStateFileIsReported() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, "{ not json");

        assertThatThrownBy(() -> registry.reload())
            .isInstanceOf(FactoryException.class)
            .hasMessageContaining("Corrupt");
    }

    @Test
    void updateIgnoresBackwardTransitions() {
        Instance service = Instance.create("bench-a", recipes.load("bench-a"), clock.instant());
        registry.create(service);

        assertThat(registry.update(service.id(), InstanceStatus.RUNNING)).isTrue();
        assertThat(registry.update(service.id(), InstanceStatus.STARTING)).isFalse();
        assertThat(registry.update(service.id(), InstanceStatus.COMPLETED)).isTrue();
        assertThat(registry.update(service.id(), InstanceStatus.FAILED)).isFalse();
        assertThat(service.status()).isEqualTo(InstanceStatus.COMPLETED);
    }

    @Test
    void updateOfUnknownInstanceFails() {
        assertThatThrownBy(() -> registry.update("missing", InstanceStatus.RUNNING))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void requireAcceptsUniquePrefix() {
        Instance a = new Instance("abc-111", "bench-a", recipes.load("bench-a"), clock.instant());
        Instance b = new Instance("abd-222", "bench-a", recipes.load("bench-a"), clock.instant());
        registry.create(a);
        registry.create(b);

        assertThat(registry.require("abc")).isSameAs(a);
        assertThat(registry.require("abd-222")).isSameAs(b);
        assertThatThrownBy(() -> registry.require("ab"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("ambiguous");
        assertThatThrownBy(() -> registry.require("zzz"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void pruneRemovesTerminalInstancesAndPersists() {
        Instance done = Instance.create("bench-a", recipes.load("bench-a"), clock.instant());
        Instance live = Instance.create("bench-a", recipes.load("bench-a"), clock.instant());
        registry.create(done);
        registry.create(live);
        registry.update(done.id(), InstanceStatus.FAILED);

        assertThat(registry.prune()).isEqualTo(1);
        assertThat(registry.listByStatus(InstanceStatus.SUBMITTED)).containsExactly(live);
        assertThat(InstanceRegistry.open(stateFile, recipes, clock).all()).hasSize(1);
    }

    @Test
    void rejectsDuplicateIds() {
        Instance service = new Instance("same", "bench-a", recipes.load("bench-a"), clock.instant());
        registry.create(service);

        assertThatThrownBy(() -> registry.create(service))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
