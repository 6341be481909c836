package dev.factories.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What actually runs inside the scheduler allocation.
 */
public record ExecutionUnit(
    String command,
    String image, // nullable, container image to run the command in
    String workingDirectory, // nullable, defaults to the submitting directory
    Map<String, String> env,
    List<Integer> ports
) {
    public ExecutionUnit {
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    public static ExecutionUnit empty() {
        return new ExecutionUnit(null, null, null, Map.of(), List.of());
    }

    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }
}
