package dev.factories.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved runtime configuration. Built by {@link ConfigLoader} from
 * {@code config/factories.yml}, environment variables and built-in defaults.
 */
public record FactoriesConfig(
    Slurm slurm,
    Paths paths,
    Polling polling,
    Client client
) {

    /** Scheduler submission defaults. Recipe hints override per job. */
    public record Slurm(
        String account, // nullable, the --account directive is omitted when unset
        String partition,
        String qos,
        String timeLimit,
        String moduleEnv,
        String apptainerModule,
        String imageCache,
        Path logDirectory,
        Duration commandTimeout
    ) {
        public static final String DEFAULT_PARTITION = "cpu";
        public static final String DEFAULT_QOS = "default";
        public static final String DEFAULT_TIME_LIMIT = "04:00:00";
        public static final String DEFAULT_MODULE_ENV = "env/release/2024.1";
        public static final String DEFAULT_APPTAINER_MODULE = "Apptainer/1.3.6-GCCcore-13.3.0";
        public static final String DEFAULT_IMAGE_CACHE = "./containers";
        public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);
    }

    public record Paths(
        Path recipes,
        Path stateFile,
        Path discoveryDir,
        Path monitorOutput
    ) {}

    /** Poll loop timing for endpoint and placement resolution. */
    public record Polling(
        Duration interval,
        Duration resolveTimeout,
        Duration placementTimeout
    ) {
        public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
        public static final Duration DEFAULT_RESOLVE_TIMEOUT = Duration.ofSeconds(60);
        public static final Duration DEFAULT_PLACEMENT_TIMEOUT = Duration.ofMinutes(5);
    }

    public record Client(
        String runnerCommand
    ) {
        public static final String DEFAULT_RUNNER_COMMAND = "python -m src.client.workload_runner";
    }

    public FactoriesConfig withRecipes(Path recipes) {
        return new FactoriesConfig(slurm,
            new Paths(recipes, paths.stateFile(), paths.discoveryDir(), paths.monitorOutput()),
            polling, client);
    }

    public FactoriesConfig withAccount(String account) {
        return new FactoriesConfig(
            new Slurm(account, slurm.partition(), slurm.qos(), slurm.timeLimit(), slurm.moduleEnv(),
                slurm.apptainerModule(), slurm.imageCache(), slurm.logDirectory(), slurm.commandTimeout()),
            paths, polling, client);
    }
}
