package dev.factories.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.factories.config.FactoriesConfig;
import dev.factories.error.FactoryException;
import dev.factories.model.InfraSpec;
import dev.factories.model.Instance;
import dev.factories.model.Recipe;
import dev.factories.model.ResourceRequest;
import dev.factories.model.SchedulingHints;
import dev.factories.model.Workload;
import dev.factories.scheduler.JobDescription;
import dev.factories.util.Mappers;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the scheduler job for each kind of deployment. Recipe scheduling
 * hints win over the configured SLURM defaults.
 */
public final class JobDescriptions {

    private final FactoriesConfig.Slurm slurm;
    private final FactoriesConfig.Client client;
    private final Path baseDirectory;
    private final ObjectMapper json = Mappers.compactMapper();

    /**
     * @param baseDirectory directory relative working directories and log paths are resolved against
     */
    public JobDescriptions(FactoriesConfig.Slurm slurm, FactoriesConfig.Client client, Path baseDirectory) {
        this.slurm = slurm;
        this.client = client;
        this.baseDirectory = baseDirectory.toAbsolutePath();
    }

    public JobDescription forService(Instance instance, Recipe recipe) {
        String jobName = jobName(recipe.name(), instance);
        String command = recipe.execution().command();
        List<String> modules = List.of();
        if (recipe.execution().image() != null && !recipe.execution().image().isBlank()) {
            command = "apptainer exec " + recipe.execution().image() + " " + command;
            modules = containerModules();
        }

        var banner = banner(instance, recipe);
        if (!recipe.execution().ports().isEmpty()) {
            banner.put("Ports", recipe.execution().ports().toString());
        }
        return job(jobName, recipe.scheduling(), null, recipe.resources(), workingDirectory(recipe),
            recipe.execution().env(), modules, command, banner);
    }

    public JobDescription forClient(Instance instance, Recipe recipe, String targetEndpoint) {
        String jobName = jobName(recipe.name(), instance);
        Workload workload = recipe.workload();
        Path outputDir = baseDirectory.resolve(workload.outputDestination());
        Path outputFile = outputDir.resolve("%s_%s_results.json".formatted(recipe.name(), shortId(instance)));

        String command = "mkdir -p \"%s\"\n\n".formatted(outputDir)
            + client.runnerCommand() + " \\\n"
            + "    --endpoint \"" + targetEndpoint + "\" \\\n"
            + "    --pattern \"" + workload.pattern() + "\" \\\n"
            + "    --duration " + workload.durationSeconds() + " \\\n"
            + "    --concurrent-users " + workload.concurrentUsers() + " \\\n"
            + "    --think-time " + workload.thinkTimeMs() + " \\\n"
            + "    --requests-per-user " + workload.requestsPerUser() + " \\\n"
            + "    --payload " + singleQuote(toJson(workload.payload())) + " \\\n"
            + "    --headers " + singleQuote(toJson(workload.headers())) + " \\\n"
            + "    --output \"" + outputFile + "\"";

        var banner = banner(instance, recipe);
        banner.put("Target", targetEndpoint);
        banner.put("Pattern", workload.pattern());
        return job(jobName, recipe.scheduling(), null, recipe.resources(), workingDirectory(recipe),
            recipe.execution().env(), List.of(), command, banner);
    }

    /**
     * Prometheus job for a monitor instance. The scrape config must already be in {@code configDir}.
     */
    public JobDescription forInfra(Instance instance, Recipe recipe, Path configDir, Path dataDir) {
        InfraSpec infra = recipe.infra();
        String jobName = InfraSpec.COMPONENT_NAME + "_" + shortId(instance);
        String command = """
            mkdir -p "%1$s" "%2$s"
            chmod 777 "%2$s"

            IMAGE_CACHE="%3$s"
            mkdir -p "$IMAGE_CACHE"
            IMAGE_FILE="$IMAGE_CACHE/prometheus_latest.sif"
            if [ ! -f "$IMAGE_FILE" ]; then
                echo "Pulling Prometheus image..."
                apptainer pull "$IMAGE_FILE" %4$s
            fi

            echo "Prometheus UI: http://$(hostname):%5$d"
            apptainer exec \\
                --bind "%1$s":/etc/prometheus \\
                --bind "%2$s":/prometheus \\
                "$IMAGE_FILE" \\
                /bin/prometheus \\
                --config.file=/etc/prometheus/prometheus.yml \\
                --storage.tsdb.path=/prometheus \\
                --storage.tsdb.retention.time=%6$s \\
                --web.listen-address=0.0.0.0:%5$d
            """.formatted(configDir.toAbsolutePath(), dataDir.toAbsolutePath(),
                baseDirectory.resolve(slurm.imageCache()), infra.image(), infra.port(), infra.retentionTime());

        var banner = banner(instance, recipe);
        banner.put("Component", InfraSpec.COMPONENT_NAME);
        banner.put("Port", String.valueOf(infra.port()));
        return job(jobName, recipe.scheduling(), infra.partition(), infra.resources(), baseDirectory,
            Map.of(), containerModules(), command, banner);
    }

    private JobDescription job(String jobName, SchedulingHints hints, String partitionOverride,
                               ResourceRequest resources, Path workingDirectory, Map<String, String> env,
                               List<String> modules, String command, Map<String, String> banner) {
        SchedulingHints h = hints == null ? SchedulingHints.none() : hints;
        String partition = firstNonBlank(partitionOverride, firstNonBlank(h.partition(), slurm.partition()));
        Path outputLog = baseDirectory.resolve(slurm.logDirectory()).resolve(jobName + "_%j.log");
        return new JobDescription(jobName,
            firstNonBlank(h.timeLimit(), slurm.timeLimit()),
            partition,
            firstNonBlank(h.account(), slurm.account()),
            firstNonBlank(h.qos(), slurm.qos()),
            1, resources.cpuCores(), resources.memoryGb(), resources.gpuCount(),
            workingDirectory, env, modules, command, outputLog, banner);
    }

    private LinkedHashMap<String, String> banner(Instance instance, Recipe recipe) {
        var banner = new LinkedHashMap<String, String>();
        banner.put("Instance ID", instance.id());
        banner.put("Recipe", recipe.name());
        return banner;
    }

    private List<String> containerModules() {
        return List.of(slurm.moduleEnv(), slurm.apptainerModule());
    }

    private Path workingDirectory(Recipe recipe) {
        String dir = recipe.execution().workingDirectory();
        return dir == null || dir.isBlank() ? baseDirectory : baseDirectory.resolve(dir);
    }

    private String toJson(Map<String, ?> value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FactoryException("Cannot encode workload settings as JSON", e);
        }
    }

    private static String jobName(String recipeName, Instance instance) {
        return recipeName + "_" + shortId(instance);
    }

    private static String shortId(Instance instance) {
        return instance.id().length() > 8 ? instance.id().substring(0, 8) : instance.id();
    }

    static String singleQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
