package dev.factories.engine;

import dev.factories.model.RecipeKind;

/**
 * Starter recipe documents written by {@code ai-factories template}.
 */
final class RecipeTemplates {

    private RecipeTemplates() {}

    static String forKind(String name, RecipeKind kind) {
        return switch (kind) {
            case SERVICE -> """
                name: %s
                description: Describe the service this recipe deploys.
                kind: service
                service_name: %s
                service:
                  command: python -m http.server 8000
                  working_dir: ./
                  env:
                    EXAMPLE_ENV: value
                  ports: [8000]
                orchestration:
                  resources:
                    cpu_cores: 2
                    memory_gb: 4
                """.formatted(name, name);
            case CLIENT -> """
                name: %s
                description: Describe the benchmark this recipe runs.
                kind: client
                target:
                  service: my-service
                  protocol: http
                  port: 8000
                workload:
                  pattern: closed-loop
                  duration_seconds: 60
                  concurrent_users: 4
                  think_time_ms: 0
                  requests_per_user: 100
                output:
                  destination: ./results
                orchestration:
                  resources:
                    cpu_cores: 1
                    memory_gb: 2
                """.formatted(name);
            case MONITOR -> """
                name: %s
                description: Describe what this monitoring stack watches.
                kind: monitor
                targets:
                  - name: my-service
                    port: 8000
                    metrics_path: /metrics
                prometheus:
                  enabled: true
                  image: docker://prom/prometheus:latest
                  scrape_interval: 15s
                  retention_time: 24h
                  port: 9090
                  resources:
                    cpu_cores: 2
                    memory_gb: 4
                """.formatted(name);
        };
    }
}
