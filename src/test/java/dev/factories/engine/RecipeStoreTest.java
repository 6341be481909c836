package dev.factories.engine;

import dev.factories.error.FactoryException;
import dev.factories.error.NotFoundException;
import dev.factories.error.RecipeValidationException;
import dev.factories.model.Recipe;
import dev.factories.model.RecipeInfo;
import dev.factories.model.RecipeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeStoreTest {

    @TempDir
    Path dir;

    private RecipeStore store;

    @BeforeEach
    void setUp() {
        TestRecipes.write(dir, "bench-a", TestRecipes.BENCH_A);
        TestRecipes.write(dir.resolve("monitors"), "mon-1", TestRecipes.MON_1);
        TestRecipes.write(dir.resolve("clients"), "load-vllm", TestRecipes.CLIENT_BY_SERVICE);
        store = new RecipeStore(dir);
    }

    @Test
    void listsRecipesAcrossKindDirectories() throws IOException {
        Files.writeString(dir.resolve("notes.txt"), "not a recipe");

        assertThat(store.list()).containsExactly("bench-a", "load-vllm", "mon-1");
    }

    @Test
    void loadsAndCachesByName() {
        Recipe first = store.load("mon-1");

        assertThat(first.kind()).isEqualTo(RecipeKind.MONITOR);
        assertThat(store.load("mon-1")).isSameAs(first);

        store.evict("mon-1");
        assertThat(store.load("mon-1")).isNotSameAs(first);
    }

    @Test
    void unknownRecipeIsNotFound() {
        assertThatThrownBy(() -> store.load("nope"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void pathLikeNamesAreNotFound() {
        assertThatThrownBy(() -> store.load("../etc/passwd"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void unusableDiscoveryNamesFailAtLoadTime() {
        TestRecipes.write(dir, "mon-team", """
            name: mon-team
            kind: monitor
            targets:
              - name: svc
                service: team/a
            prometheus:
              port: 9090
            """);

        assertThatThrownBy(() -> store.load("mon-team"))
            .isInstanceOfSatisfying(RecipeValidationException.class,
                e -> assertThat(e.errors()).anyMatch(error -> error.contains("team/a")));
    }

    @Test
    void invalidRecipeReportsEveryError() {
        TestRecipes.write(dir, "broken", """
            name: broken
            kind: client
            workload:
              pattern: zigzag
              concurrent_users: 5000
            """);

        assertThatThrownBy(() -> store.load("broken"))
            .isInstanceOfSatisfying(RecipeValidationException.class, e -> {
                assertThat(e.recipeName()).isEqualTo("broken");
                assertThat(e.errors()).hasSizeGreaterThanOrEqualTo(3);
            });
    }

    @Test
    void unparseableRecipeIsAValidationError() {
        TestRecipes.write(dir, "garbled", "name: [unterminated\n");

        assertThatThrownBy(() -> store.load("garbled"))
            .isInstanceOf(RecipeValidationException.class);
    }

    @Test
    void infoSummarisesRecipe() {
        RecipeInfo info = store.info("load-vllm");

        assertThat(info.kind()).isEqualTo(RecipeKind.CLIENT);
        assertThat(info.command()).isEqualTo("open-loop workload, 4 users for 60s");
        assertThat(info.targets()).containsExactly("target");
        assertThat(info.file()).isEqualTo(dir.resolve("clients").resolve("load-vllm.yaml"));
    }

    @Test
    void templatesLoadAsValidRecipes() {
        for (RecipeKind kind : RecipeKind.values()) {
            String name = "new-" + kind.label();
            Path file = store.createTemplate(name, kind);

            assertThat(file).exists();
            assertThat(store.load(name).kind()).isEqualTo(kind);
        }
    }

    @Test
    void templateNeverOverwrites() {
        TestRecipes.write(dir, "taken", TestRecipes.BENCH_A);

        assertThatThrownBy(() -> store.createTemplate("taken", RecipeKind.SERVICE))
            .isInstanceOf(FactoryException.class)
            .hasMessageContaining("already exists");
    }
}
