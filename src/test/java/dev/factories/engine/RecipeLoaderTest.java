package dev.factories.engine;

import dev.factories.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeLoaderTest {

    @Test
    void loadsServiceRecipe() throws IOException {
        String yaml = """
            name: vllm-server
            description: vLLM inference server
            kind: service
            service_name: vllm
            service:
              image: docker://vllm/vllm-openai:latest
              command: vllm serve facebook/opt-125m
              working_dir: ./work
              env:
                HF_HOME: /scratch/hf
                EMPTY: null
              ports: [8000, "8001"]
            orchestration:
              resources:
                cpu_cores: 8
                memory_gb: 32
                gpu_count: 1
                partition: gpu
              time_limit: "02:00:00"
            """;

        Recipe recipe = RecipeLoader.loadFromString(yaml);

        assertThat(recipe.name()).isEqualTo("vllm-server");
        assertThat(recipe.kind()).isEqualTo(RecipeKind.SERVICE);
        assertThat(recipe.discoveryName()).contains("vllm");
        assertThat(recipe.execution().image()).isEqualTo("docker://vllm/vllm-openai:latest");
        assertThat(recipe.execution().workingDirectory()).isEqualTo("./work");
        assertThat(recipe.execution().env()).containsExactly(
            org.assertj.core.api.Assertions.entry("HF_HOME", "/scratch/hf"),
            org.assertj.core.api.Assertions.entry("EMPTY", ""));
        assertThat(recipe.execution().ports()).containsExactly(8000, 8001);
        assertThat(recipe.resources()).isEqualTo(new ResourceRequest(8, 32, 1));
        assertThat(recipe.scheduling().partition()).isEqualTo("gpu");
        assertThat(recipe.scheduling().timeLimit()).isEqualTo("02:00:00");
        assertThat(recipe.scheduling().account()).isNull();
        assertThat(recipe.targets()).isEmpty();
        assertThat(recipe.workload()).isNull();
        assertThat(recipe.infra()).isNull();
    }

    @Test
    void loadsClientRecipeWithSingleTarget() throws IOException {
        String yaml = """
            name: bench
            target:
              service: vllm
              protocol: https
              port: 8443
            workload:
              pattern: open-loop
              duration_seconds: 90
              concurrent_users: 16
              think_time_ms: 50
            payload:
              model: opt
              max_tokens: 20
            headers:
              Authorization: Bearer x
            output:
              destination: /scratch/results
            """;

        Recipe recipe = RecipeLoader.loadFromString(yaml);

        assertThat(recipe.kind()).isEqualTo(RecipeKind.CLIENT);
        assertThat(recipe.targets()).singleElement().satisfies(target -> {
            assertThat(target.name()).isEqualTo("target");
            assertThat(target.discoveryKey()).isEqualTo("vllm");
            assertThat(target.port()).isEqualTo(8443);
            assertThat(target.metricsPath()).isEqualTo(TargetSpec.DEFAULT_METRICS_PATH);
        });
        Workload workload = recipe.workload();
        assertThat(workload.pattern()).isEqualTo(Workload.OPEN_LOOP);
        assertThat(workload.durationSeconds()).isEqualTo(90);
        assertThat(workload.concurrentUsers()).isEqualTo(16);
        assertThat(workload.thinkTimeMs()).isEqualTo(50);
        assertThat(workload.requestsPerUser()).isEqualTo(100);
        assertThat(workload.protocol()).isEqualTo("https");
        assertThat(workload.payload()).containsEntry("max_tokens", 20);
        assertThat(workload.headers()).containsEntry("Authorization", "Bearer x");
        assertThat(workload.outputDestination()).isEqualTo("/scratch/results");
    }

    @Test
    void loadsMonitorRecipeWithDefaults() throws IOException {
        String yaml = """
            name: mon
            targets:
              - name: svc-a
                endpoint: 10.0.0.5:8000
              - name: svc-b
                job_id: "4242"
                metrics_path: /stats
              - node-9:9100
            prometheus:
              port: 9191
            """;

        Recipe recipe = RecipeLoader.loadFromString(yaml);

        assertThat(recipe.kind()).isEqualTo(RecipeKind.MONITOR);
        assertThat(recipe.targets()).extracting(TargetSpec::name).containsExactly("svc-a", "svc-b", "mon");
        assertThat(recipe.target("svc-a")).hasValueSatisfying(t -> assertThat(t.endpoint()).isEqualTo("10.0.0.5:8000"));
        assertThat(recipe.target("svc-b")).hasValueSatisfying(t -> {
            assertThat(t.jobHandle()).isEqualTo("4242");
            assertThat(t.metricsPath()).isEqualTo("/stats");
        });
        InfraSpec infra = recipe.infra();
        assertThat(infra.enabled()).isTrue();
        assertThat(infra.port()).isEqualTo(9191);
        assertThat(infra.image()).isEqualTo(InfraSpec.DEFAULT_IMAGE);
        assertThat(infra.scrapeInterval()).isEqualTo(InfraSpec.DEFAULT_SCRAPE_INTERVAL);
        assertThat(infra.resources()).isEqualTo(new ResourceRequest(2, 4, 0));
    }

    @Test
    void fileNameIsTheFallbackName(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("quick.yml"), """
            service:
              command: ./run.sh
            """);

        Recipe recipe = RecipeLoader.loadFromFile(file);

        assertThat(recipe.name()).isEqualTo("quick");
        assertThat(recipe.kind()).isEqualTo(RecipeKind.SERVICE);
        assertThat(recipe.resources()).isEqualTo(ResourceRequest.defaults());
    }

    @Test
    void jsonIsAccepted() throws IOException {
        Recipe recipe = RecipeLoader.loadFromString("""
            {"name": "j", "kind": "server", "service": {"command": "run"}}
            """);

        assertThat(recipe.kind()).isEqualTo(RecipeKind.SERVICE);
        assertThat(recipe.execution().command()).isEqualTo("run");
    }

    @Test
    void rejectsNonNumericResources() {
        assertThatThrownBy(() -> RecipeLoader.loadFromString("""
            name: bad
            service:
              command: run
            orchestration:
              resources:
                cpu_cores: lots
            """))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orchestration.resources.cpu_cores");
    }

    @Test
    void rejectsUnknownKind() {
        assertThatThrownBy(() -> RecipeLoader.loadFromString("name: x\nkind: batch\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batch");
    }

    @Test
    void rejectsEmptyDocument() {
        assertThatThrownBy(() -> RecipeLoader.loadFromString(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
