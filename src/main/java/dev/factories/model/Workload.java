package dev.factories.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load pattern a benchmark client applies to its target.
 */
public record Workload(
    String pattern,
    int durationSeconds,
    int concurrentUsers,
    int thinkTimeMs,
    int requestsPerUser,
    String protocol,
    Map<String, Object> payload,
    Map<String, String> headers,
    String outputDestination
) {
    public static final String CLOSED_LOOP = "closed-loop";
    public static final String OPEN_LOOP = "open-loop";
    public static final String DEFAULT_OUTPUT = "./results";

    public Workload {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
