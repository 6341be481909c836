package dev.factories.engine;

import dev.factories.model.Recipe;
import dev.factories.model.TargetSpec;
import dev.factories.util.AtomicFiles;
import dev.factories.util.Mappers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the {@code prometheus.yml} scrape configuration for a monitor.
 */
public final class PrometheusConfigWriter {

    public static final String FILE_NAME = "prometheus.yml";

    private PrometheusConfigWriter() {}

    /**
     * @param endpoints resolved {@code host:port} per target name, in scrape order
     */
    public static Map<String, Object> render(Recipe recipe, Map<String, String> endpoints) {
        String interval = recipe.infra().scrapeInterval();

        var global = new LinkedHashMap<String, Object>();
        global.put("scrape_interval", interval);
        global.put("evaluation_interval", interval);

        List<Map<String, Object>> scrapeConfigs = new ArrayList<>();
        endpoints.forEach((name, hostPort) -> {
            String metricsPath = recipe.target(name)
                .map(TargetSpec::metricsPath)
                .orElse(TargetSpec.DEFAULT_METRICS_PATH);
            var job = new LinkedHashMap<String, Object>();
            job.put("job_name", name);
            job.put("static_configs", List.of(Map.of("targets", List.of(hostPort))));
            job.put("metrics_path", metricsPath);
            job.put("scrape_interval", interval);
            scrapeConfigs.add(job);
        });

        var config = new LinkedHashMap<String, Object>();
        config.put("global", global);
        config.put("scrape_configs", scrapeConfigs);
        return config;
    }

    public static Path write(Path configDir, Recipe recipe, Map<String, String> endpoints) throws IOException {
        Path file = configDir.resolve(FILE_NAME);
        AtomicFiles.write(file, Mappers.yamlMapper().writeValueAsBytes(render(recipe, endpoints)));
        return file;
    }
}
