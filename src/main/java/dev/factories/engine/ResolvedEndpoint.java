package dev.factories.engine;

/**
 * A target's connectable address and where it came from.
 */
public record ResolvedEndpoint(
    String target,
    String hostPort,
    Source source
) {
    public enum Source {
        DIRECT,
        DISCOVERY,
        SCHEDULER
    }
}
