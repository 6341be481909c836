package dev.factories.model;

import java.util.Locale;

/**
 * What a recipe deploys, which decides how the orchestration manager drives it.
 */
public enum RecipeKind {
    /** A long-running service, optionally published for discovery. */
    SERVICE,
    /** A benchmark client that needs its target endpoint before it can be submitted. */
    CLIENT,
    /** A monitoring stack: an infra component deployed once every target resolved. */
    MONITOR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RecipeKind parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "service", "server" -> SERVICE;
            case "client", "benchmark" -> CLIENT;
            case "monitor", "monitoring" -> MONITOR;
            default -> throw new IllegalArgumentException("Unknown recipe kind: " + value);
        };
    }
}
