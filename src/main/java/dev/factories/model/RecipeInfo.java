package dev.factories.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a recipe for listings.
 */
public record RecipeInfo(
    String name,
    RecipeKind kind,
    String description,
    String command,
    List<String> targets,
    boolean infraEnabled,
    Path file
) {}
