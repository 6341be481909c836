package dev.factories.model;

/**
 * Per-recipe scheduling overrides. Any null field falls back to the configured default.
 */
public record SchedulingHints(
    String partition,
    String account,
    String qos,
    String timeLimit
) {
    public static SchedulingHints none() {
        return new SchedulingHints(null, null, null, null);
    }
}
