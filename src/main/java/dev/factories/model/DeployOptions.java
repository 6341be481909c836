package dev.factories.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call deploy settings. Null timeouts fall back to the configured defaults.
 */
public record DeployOptions(
    Map<String, String> targetHandles,
    Duration resolveTimeout,
    Duration placementTimeout,
    boolean waitForPlacement
) {
    public DeployOptions {
        targetHandles = targetHandles == null ? Map.of() : Map.copyOf(targetHandles);
    }

    public static DeployOptions defaults() {
        return new DeployOptions(Map.of(), null, null, false);
    }

    public DeployOptions withTargetHandle(String target, String handle) {
        var handles = new LinkedHashMap<>(targetHandles);
        handles.put(target, handle);
        return new DeployOptions(handles, resolveTimeout, placementTimeout, waitForPlacement);
    }

    public DeployOptions withTimeouts(Duration resolve, Duration placement) {
        return new DeployOptions(targetHandles, resolve, placement, waitForPlacement);
    }

    public DeployOptions waitingForPlacement() {
        return new DeployOptions(targetHandles, resolveTimeout, placementTimeout, true);
    }
}
