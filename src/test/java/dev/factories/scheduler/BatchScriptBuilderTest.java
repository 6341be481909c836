package dev.factories.scheduler;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatchScriptBuilderTest {

    @Test
    void rendersDirectivesAndCommand() {
        var env = new LinkedHashMap<String, String>();
        env.put("HF_HOME", "/scratch/hf");
        env.put("GREETING", "say \"hi\"");
        var job = new JobDescription("vllm_1234abcd", "02:00:00", "gpu", "ml-team", "normal", 1, 8, 32, 2,
            Path.of("/work/dir"), env, List.of("env/release/2024.1", "Apptainer/1.3.6"),
            "vllm serve opt", Path.of("/logs/vllm_1234abcd_%j.log"), Map.of("Recipe", "vllm"));

        String script = BatchScriptBuilder.build(job);

        assertThat(script).startsWith("#!/bin/bash -l\n");
        assertThat(script)
            .contains("#SBATCH --job-name=vllm_1234abcd\n")
            .contains("#SBATCH --output=/logs/vllm_1234abcd_%j.log\n")
            .contains("#SBATCH --error=/logs/vllm_1234abcd_%j.log\n")
            .contains("#SBATCH --time=02:00:00\n")
            .contains("#SBATCH --partition=gpu\n")
            .contains("#SBATCH --account=ml-team\n")
            .contains("#SBATCH --qos=normal\n")
            .contains("#SBATCH --cpus-per-task=8\n")
            .contains("#SBATCH --mem=32G\n")
            .contains("#SBATCH --gres=gpu:2\n")
            .contains("echo \"Recipe = vllm\"")
            .contains("cd \"/work/dir\"")
            .contains("module load Apptainer/1.3.6\n")
            .contains("export HF_HOME=\"/scratch/hf\"\n")
            .contains("export GREETING=\"say \\\"hi\\\"\"\n")
            .contains("vllm serve opt\n")
            .endsWith("exit $EXIT_CODE\n");
        assertThat(script.indexOf("module load")).isLessThan(script.indexOf("vllm serve opt"));
    }

    @Test
    void envValuesAreNotExpandedByTheShell() {
        var env = new LinkedHashMap<String, String>();
        env.put("TOKEN", "a$b");
        env.put("GREETING", "`whoami`");
        var job = new JobDescription("svc", "01:00:00", "cpu", null, "default", 1, 1, 4, 0,
            Path.of("/work"), env, List.of(), "./run.sh", null, Map.of("Note", "costs $5"));

        String script = BatchScriptBuilder.build(job);

        assertThat(script)
            .contains("export TOKEN=\"a\\$b\"\n")
            .contains("export GREETING=\"\\`whoami\\`\"\n")
            .contains("echo \"Note = costs \\$5\"\n")
            .contains("echo \"Job ID   = $SLURM_JOB_ID\"");
    }

    @Test
    void omitsOptionalDirectives() {
        var job = new JobDescription("svc", "01:00:00", "cpu", null, "default", 1, 1, 4, 0,
            Path.of("/work"), Map.of(), List.of(), "./run.sh", null, Map.of());

        String script = BatchScriptBuilder.build(job);

        assertThat(script)
            .doesNotContain("--account")
            .doesNotContain("--gres")
            .doesNotContain("--output")
            .doesNotContain("module load");
    }
}
