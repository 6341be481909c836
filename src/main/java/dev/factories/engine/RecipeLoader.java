package dev.factories.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.factories.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Parses recipe files (YAML, or JSON as a YAML subset) into {@link Recipe} records.
 * Structural problems such as non-numeric resource values are reported as
 * {@link IllegalArgumentException}; semantic checks live in {@link RecipeValidator}.
 */
public final class RecipeLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern WHOLE_NUMBER = Pattern.compile("-?\\d{1,9}");

    private RecipeLoader() {}

    /**
     * Load a single recipe from a file. The file name (without extension) is the
     * recipe name when the document does not declare one.
     */
    public static Recipe loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseRecipe(root, stem(path));
    }

    /**
     * Load a single recipe from a YAML or JSON string.
     */
    public static Recipe loadFromString(String text) throws IOException {
        JsonNode root = MAPPER.readTree(text);
        return parseRecipe(root, null);
    }

    private static Recipe parseRecipe(JsonNode root, String fallbackName) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Recipe document is empty");
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Recipe document must be a mapping");
        }

        String name = root.has("name") ? text(root, "name") : fallbackName;
        String description = text(root, "description");
        RecipeKind kind = root.hasNonNull("kind") ? RecipeKind.parse(root.get("kind").asText()) : inferKind(root);

        JsonNode service = root.path("service");
        JsonNode orchestration = root.path("orchestration");
        JsonNode resources = orchestration.path("resources");

        ExecutionUnit execution = new ExecutionUnit(
            text(service, "command"),
            text(service, "image"),
            text(service, "working_dir"),
            stringMap(service.path("env")),
            intList(service.path("ports"), "service.ports"));

        var resourceRequest = new ResourceRequest(
            intValue(resources, "cpu_cores", ResourceRequest.DEFAULT_CPU_CORES, "orchestration.resources"),
            intValue(resources, "memory_gb", ResourceRequest.DEFAULT_MEMORY_GB, "orchestration.resources"),
            intValue(resources, "gpu_count", 0, "orchestration.resources"));

        var scheduling = new SchedulingHints(
            firstText(orchestration, resources, "partition"),
            firstText(orchestration, resources, "account"),
            firstText(orchestration, resources, "qos"),
            firstText(orchestration, resources, "time_limit"));

        List<TargetSpec> targets = parseTargets(root, name);
        Workload workload = kind == RecipeKind.CLIENT ? parseWorkload(root) : null;
        InfraSpec infra = kind == RecipeKind.MONITOR ? parseInfra(root) : null;

        return new Recipe(name, description, kind, execution, resourceRequest, targets, scheduling,
            text(root, "service_name"), workload, infra);
    }

    private static RecipeKind inferKind(JsonNode root) {
        if (root.has("prometheus") || root.has("infra")) {
            return RecipeKind.MONITOR;
        }
        if (root.has("workload")) {
            return RecipeKind.CLIENT;
        }
        return RecipeKind.SERVICE;
    }

    private static List<TargetSpec> parseTargets(JsonNode root, String recipeName) {
        var targets = new ArrayList<TargetSpec>();
        for (JsonNode node : root.path("targets")) {
            if (node.isTextual()) {
                // shorthand: a bare "host:port"
                targets.add(new TargetSpec(recipeName, node.asText(), null, null,
                    TargetSpec.DEFAULT_PORT, TargetSpec.DEFAULT_METRICS_PATH));
            } else {
                targets.add(parseTarget(node, text(node, "name")));
            }
        }
        // client recipes describe their single target under "target"
        JsonNode single = root.path("target");
        if (single.isObject()) {
            String name = Objects.requireNonNullElse(text(single, "name"), "target");
            targets.add(parseTarget(single, name));
        }
        return targets;
    }

    private static TargetSpec parseTarget(JsonNode node, String name) {
        String serviceName = text(node, "service_name");
        if (serviceName == null) {
            serviceName = text(node, "service");
        }
        String metricsPath = text(node, "metrics_path");
        return new TargetSpec(
            name,
            text(node, "endpoint"),
            serviceName,
            text(node, "job_id"),
            intValue(node, "port", TargetSpec.DEFAULT_PORT, "target"),
            metricsPath == null ? TargetSpec.DEFAULT_METRICS_PATH : metricsPath);
    }

    private static Workload parseWorkload(JsonNode root) {
        JsonNode node = root.path("workload");
        String pattern = text(node, "pattern");
        String protocol = text(root.path("target"), "protocol");
        String output = text(root.path("output"), "destination");
        return new Workload(
            pattern == null ? Workload.CLOSED_LOOP : pattern,
            intValue(node, "duration_seconds", 60, "workload"),
            intValue(node, "concurrent_users", 1, "workload"),
            intValue(node, "think_time_ms", 0, "workload"),
            intValue(node, "requests_per_user", 100, "workload"),
            protocol == null ? "http" : protocol,
            objectMap(root.path("payload")),
            stringMap(root.path("headers")),
            output == null ? Workload.DEFAULT_OUTPUT : output);
    }

    private static InfraSpec parseInfra(JsonNode root) {
        JsonNode node = root.has("infra") ? root.path("infra") : root.path("prometheus");
        InfraSpec defaults = InfraSpec.defaults();
        JsonNode resources = node.path("resources");
        String image = text(node, "image");
        String scrapeInterval = text(node, "scrape_interval");
        String retention = text(node, "retention_time");
        return new InfraSpec(
            !node.has("enabled") || node.get("enabled").asBoolean(true),
            image == null ? defaults.image() : image,
            scrapeInterval == null ? defaults.scrapeInterval() : scrapeInterval,
            retention == null ? defaults.retentionTime() : retention,
            intValue(node, "port", defaults.port(), "prometheus"),
            text(node, "partition"),
            new ResourceRequest(
                intValue(resources, "cpu_cores", defaults.resources().cpuCores(), "prometheus.resources"),
                intValue(resources, "memory_gb", defaults.resources().memoryGb(), "prometheus.resources"),
                intValue(resources, "gpu_count", 0, "prometheus.resources")));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode primary, JsonNode secondary, String field) {
        String value = text(primary, field);
        return value != null ? value : text(secondary, field);
    }

    private static int intValue(JsonNode node, String field, int fallback, String context) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        return toInt(value, context + "." + field);
    }

    private static int toInt(JsonNode value, String path) {
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.asInt();
        }
        if (value.isTextual() && WHOLE_NUMBER.matcher(value.asText().trim()).matches()) {
            return Integer.parseInt(value.asText().trim());
        }
        throw new IllegalArgumentException("%s must be a whole number, got '%s'".formatted(path, value.asText()));
    }

    private static List<Integer> intList(JsonNode node, String path) {
        var values = new ArrayList<Integer>();
        for (JsonNode item : node) {
            values.add(toInt(item, path));
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        var values = new LinkedHashMap<String, String>();
        for (var entry : node.properties()) {
            JsonNode value = entry.getValue();
            values.put(entry.getKey(), value.isNull() ? "" : value.asText());
        }
        return values;
    }

    private static Map<String, Object> objectMap(JsonNode node) {
        if (!node.isObject()) {
            return Map.of();
        }
        return MAPPER.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
