package dev.factories.cli;

import ch.qos.logback.classic.Level;
import dev.factories.config.ConfigLoader;
import dev.factories.config.Durations;
import dev.factories.config.FactoriesConfig;
import dev.factories.engine.OrchestrationManager;
import dev.factories.error.FactoryException;
import dev.factories.model.DeployOptions;
import dev.factories.model.InstanceSnapshot;
import dev.factories.model.InstanceStatus;
import dev.factories.model.RecipeInfo;
import dev.factories.model.RecipeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry point for ai-factories.
 */
@Command(
    name = "ai-factories",
    mixinStandardHelpOptions = true,
    version = "ai-factories 0.1.0",
    description = "Deploy services, benchmark clients and monitors onto a SLURM cluster.",
    subcommands = DiscoveryCli.class
)
public class FactoriesCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FactoriesCli.class);
    private static final String ROW = "%-10s %-24s %-8s %-10s %-10s %s%n";

    @Spec
    private CommandSpec spec;

    @Option(names = "--config", description = "Config file (default: ${DEFAULT-VALUE})",
        defaultValue = "config/factories.yml")
    private Path configFile;

    @Option(names = "--recipes", description = "Recipe directory, overrides the config file")
    private Path recipesDir;

    @Option(names = "--account", description = "SLURM account, overrides config and SLURM_ACCOUNT")
    private String account;

    private OrchestrationManager manager;

    public FactoriesCli() {}

    FactoriesCli(OrchestrationManager manager) {
        this.manager = manager;
    }

    /**
     * Build the command line with the error mapping used by {@code main}:
     * 0 on success, 1 for a failed operation, 2 for bad usage.
     */
    public static CommandLine commandLine(FactoriesCli cli) {
        var commandLine = new CommandLine(cli);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof FactoryException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                log.debug("Command failed", ex);
                return 1;
            }
            if (ex instanceof IllegalArgumentException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                return 2;
            }
            throw ex;
        });
        return commandLine;
    }

    @Option(names = {"-v", "--verbose"}, description = "Log debug detail")
    void setVerbose(boolean verbose) {
        if (verbose && LoggerFactory.getLogger("dev.factories") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(out());
        return 0;
    }

    @Command(name = "deploy", description = "Deploy a recipe")
    int deploy(
        @Parameters(paramLabel = "RECIPE") String recipe,
        @Option(names = "--count", defaultValue = "1", description = "Number of instances") int count,
        @Option(names = "--target", description = "Target job id, as name=jobId") Map<String, String> targets,
        @Option(names = "--wait", description = "Wait until the job runs on a node") boolean wait,
        @Option(names = "--resolve-timeout", description = "e.g. 60s, 5m") String resolveTimeout,
        @Option(names = "--placement-timeout", description = "e.g. 60s, 5m") String placementTimeout
    ) {
        if (count < 1) {
            throw new IllegalArgumentException("--count must be at least 1");
        }
        DeployOptions options = new DeployOptions(
            targets == null ? Map.of() : new LinkedHashMap<>(targets),
            parseDuration(resolveTimeout), parseDuration(placementTimeout), wait);

        for (int i = 0; i < count; i++) {
            InstanceSnapshot instance = manager().deploy(recipe, options);
            out().printf("Deployed %s as instance %s (%s%s)%n", recipe, instance.id(), instance.status().label(),
                instance.handle() == null ? "" : ", job " + instance.handle());
            instance.endpoints().forEach((name, endpoint) -> out().printf("  %s -> %s%n", name, endpoint));
            instance.components().values().forEach(c -> out().printf("  %s: job %s (%s)%n",
                c.name(), c.handle(), c.status().label()));
        }
        return 0;
    }

    @Command(name = "stop", description = "Cancel an instance's jobs")
    int stop(@Parameters(paramLabel = "INSTANCE", description = "Instance id or unique prefix") String id) {
        manager().stop(id);
        out().printf("Stopped %s%n", id);
        return 0;
    }

    @Command(name = "stop-all", description = "Cancel every live instance")
    int stopAll() {
        List<String> stopped = manager().stopAll();
        out().printf("Stopped %d instance(s)%n", stopped.size());
        return 0;
    }

    @Command(name = "status", description = "Refresh and show instance status")
    int status(@Parameters(paramLabel = "INSTANCE", arity = "0..1") String id) {
        if (id != null) {
            printDetail(manager().refreshStatus(id));
            return 0;
        }
        printTable(manager().refreshAll());
        return 0;
    }

    @Command(name = "list", description = "List recorded instances without querying the scheduler")
    int list(@Option(names = "--status", description = "Only instances in this status") String status) {
        Optional<InstanceStatus> filter = status == null
            ? Optional.empty()
            : Optional.of(InstanceStatus.valueOf(status.toUpperCase(Locale.ROOT)));
        printTable(manager().list(filter));
        return 0;
    }

    @Command(name = "recipes", description = "List available recipes")
    int recipes() {
        var names = manager().listAvailableRecipes();
        if (names.isEmpty()) {
            out().println("No recipes found");
            return 0;
        }
        names.forEach(name -> out().println("  " + name));
        return 0;
    }

    @Command(name = "info", description = "Show a recipe")
    int info(@Parameters(paramLabel = "RECIPE") String recipe) {
        RecipeInfo info = manager().getRecipeInfo(recipe);
        out().printf("Name:        %s%n", info.name());
        out().printf("Kind:        %s%n", info.kind().label());
        out().printf("Description: %s%n", info.description());
        out().printf("Runs:        %s%n", info.command());
        if (!info.targets().isEmpty()) {
            out().printf("Targets:     %s%n", String.join(", ", info.targets()));
        }
        if (info.kind() == RecipeKind.MONITOR) {
            out().printf("Prometheus:  %s%n", info.infraEnabled() ? "enabled" : "disabled");
        }
        if (info.file() != null) {
            out().printf("File:        %s%n", info.file());
        }
        return 0;
    }

    @Command(name = "template", description = "Write a starter recipe")
    int template(
        @Parameters(paramLabel = "NAME") String name,
        @Option(names = "--kind", defaultValue = "service", description = "service, client or monitor") String kind
    ) {
        Path file = manager().createRecipeTemplate(name, RecipeKind.parse(kind));
        out().printf("Created %s%n", file);
        return 0;
    }

    @Command(name = "prune", description = "Forget finished instances")
    int prune() {
        out().printf("Removed %d finished instance(s)%n", manager().prune());
        return 0;
    }

    OrchestrationManager manager() {
        if (manager == null) {
            FactoriesConfig config = ConfigLoader.load(configFile, System.getenv());
            if (recipesDir != null) {
                config = config.withRecipes(recipesDir);
            }
            if (account != null) {
                config = config.withAccount(account);
            }
            manager = OrchestrationManager.create(config);
        }
        return manager;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private void printTable(List<InstanceSnapshot> instances) {
        if (instances.isEmpty()) {
            out().println("No instances");
            return;
        }
        out().printf(ROW, "ID", "RECIPE", "KIND", "STATUS", "JOB", "ENDPOINTS");
        for (InstanceSnapshot instance : instances) {
            out().printf(ROW, instance.shortId(), instance.recipeName(), instance.kind().label(),
                instance.status().label(), instance.handle() == null ? "-" : instance.handle(),
                instance.endpoints().isEmpty() ? "-" : String.join(", ", instance.endpoints().values()));
        }
    }

    private void printDetail(InstanceSnapshot instance) {
        out().printf("Instance:  %s%n", instance.id());
        out().printf("Recipe:    %s (%s)%n", instance.recipeName(), instance.kind().label());
        out().printf("Status:    %s%n", instance.status().label());
        if (instance.handle() != null) {
            out().printf("Job:       %s%n", instance.handle());
        }
        out().printf("Uptime:    %s%n", formatDuration(instance.uptime(Instant.now())));
        instance.endpoints().forEach((name, endpoint) -> out().printf("Endpoint:  %s -> %s%n", name, endpoint));
        instance.components().values().forEach(c -> out().printf("Component: %s job %s %s%s%n",
            c.name(), c.handle(), c.status().label(), c.endpoint() == null ? "" : " at " + c.endpoint()));
        instance.metadata().forEach((key, value) -> out().printf("  %s: %s%n", key, value));
    }

    private static Duration parseDuration(String value) {
        return value == null ? null : Durations.parse(value);
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        return "%dh%02dm%02ds".formatted(seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
