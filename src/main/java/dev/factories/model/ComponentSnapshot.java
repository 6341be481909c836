package dev.factories.model;

public record ComponentSnapshot(
    String name,
    String handle,
    String endpoint,
    InstanceStatus status
) {}
