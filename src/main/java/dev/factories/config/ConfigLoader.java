package dev.factories.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.factories.error.FactoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Loads {@link FactoriesConfig}. Precedence, highest first: environment
 * variables, the YAML file, built-in defaults. A missing file is not an error.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final Path DEFAULT_CONFIG_FILE = Path.of("config", "factories.yml");
    public static final String HOME_ENV = "AI_FACTORIES_HOME";

    private ConfigLoader() {}

    public static FactoriesConfig load(Path configFile, Map<String, String> env) {
        JsonNode root = readTree(configFile);
        Path home = env.containsKey(HOME_ENV)
            ? Path.of(env.get(HOME_ENV))
            : Path.of(System.getProperty("user.home"), ".ai-factories");

        JsonNode slurmNode = root.path("slurm");
        var slurm = new FactoriesConfig.Slurm(
            firstNonBlank(env.get("SLURM_ACCOUNT"), text(slurmNode, "account", null)),
            firstNonBlank(env.get("SLURM_PARTITION"),
                text(slurmNode, "partition", FactoriesConfig.Slurm.DEFAULT_PARTITION)),
            firstNonBlank(env.get("SLURM_QOS"), text(slurmNode, "qos", FactoriesConfig.Slurm.DEFAULT_QOS)),
            firstNonBlank(env.get("SLURM_TIME_LIMIT"),
                text(slurmNode, "time_limit", FactoriesConfig.Slurm.DEFAULT_TIME_LIMIT)),
            text(slurmNode, "module_env", FactoriesConfig.Slurm.DEFAULT_MODULE_ENV),
            text(slurmNode, "apptainer_module", FactoriesConfig.Slurm.DEFAULT_APPTAINER_MODULE),
            text(slurmNode, "image_cache", FactoriesConfig.Slurm.DEFAULT_IMAGE_CACHE),
            Path.of(text(slurmNode, "log_directory", "logs")),
            duration(slurmNode, "command_timeout", FactoriesConfig.Slurm.DEFAULT_COMMAND_TIMEOUT));

        JsonNode pathsNode = root.path("paths");
        var paths = new FactoriesConfig.Paths(
            Path.of(text(pathsNode, "recipes", "recipes")),
            path(pathsNode, "state_file", home.resolve("instances.json")),
            path(pathsNode, "discovery_dir", home.resolve("discover")),
            path(pathsNode, "monitor_output", home.resolve("monitors")));

        JsonNode pollingNode = root.path("polling");
        var polling = new FactoriesConfig.Polling(
            duration(pollingNode, "interval", FactoriesConfig.Polling.DEFAULT_INTERVAL),
            duration(pollingNode, "resolve_timeout", FactoriesConfig.Polling.DEFAULT_RESOLVE_TIMEOUT),
            duration(pollingNode, "placement_timeout", FactoriesConfig.Polling.DEFAULT_PLACEMENT_TIMEOUT));

        var client = new FactoriesConfig.Client(
            text(root.path("client"), "runner_command", FactoriesConfig.Client.DEFAULT_RUNNER_COMMAND));

        if (slurm.account() == null) {
            log.warn("SLURM account not set (SLURM_ACCOUNT or slurm.account); jobs may be rejected");
        }
        return new FactoriesConfig(slurm, paths, polling, client);
    }

    public static FactoriesConfig defaults() {
        return load(null, Map.of());
    }

    private static JsonNode readTree(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            log.debug("Config file not found: {}, using defaults", configFile);
            return MissingNode.getInstance();
        }
        try {
            JsonNode root = YAML.readTree(configFile.toFile());
            return root == null ? MissingNode.getInstance() : root;
        } catch (IOException e) {
            throw new FactoryException("Failed to read config file " + configFile, e);
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? fallback : value.asText();
    }

    private static Path path(JsonNode node, String field, Path fallback) {
        String value = text(node, field, null);
        return value == null ? fallback : Path.of(value);
    }

    private static Duration duration(JsonNode node, String field, Duration fallback) {
        String value = text(node, field, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Durations.parse(value);
        } catch (RuntimeException e) {
            throw new FactoryException("Invalid duration for '%s': %s".formatted(field, value), e);
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
