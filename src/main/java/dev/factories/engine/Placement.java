package dev.factories.engine;

/**
 * A scheduler job confirmed running on {@code node}.
 */
public record Placement(String handle, String node) {}
