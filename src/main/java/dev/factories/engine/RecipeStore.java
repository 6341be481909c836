package dev.factories.engine;

import dev.factories.error.FactoryException;
import dev.factories.error.NotFoundException;
import dev.factories.error.RecipeValidationException;
import dev.factories.model.Recipe;
import dev.factories.model.RecipeInfo;
import dev.factories.model.RecipeKind;
import dev.factories.model.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Named access to the recipes in a directory. Recipes live directly in the
 * directory or in a per-kind sub-directory ({@code servers/}, {@code clients/},
 * {@code monitors/}). Loaded recipes are validated and cached by name.
 */
public final class RecipeStore {

    private static final Logger log = LoggerFactory.getLogger(RecipeStore.class);

    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");
    private static final List<String> KIND_DIRECTORIES = List.of("servers", "clients", "monitors");

    private final Path directory;
    private final Map<String, Recipe> cache = new HashMap<>();

    public RecipeStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Load, validate and cache a recipe.
     *
     * @throws NotFoundException if no recipe file has this name
     * @throws RecipeValidationException if the file cannot be parsed or is invalid
     */
    public Recipe load(String name) {
        Recipe cached = cache.get(name);
        if (cached != null) {
            return cached;
        }

        Path file = find(name).orElseThrow(() -> new NotFoundException("Recipe not found: " + name));
        Recipe recipe;
        try {
            recipe = RecipeLoader.loadFromFile(file);
        } catch (IOException e) {
            throw new RecipeValidationException(name, "unreadable file " + file + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new RecipeValidationException(name, e.getMessage(), e);
        }

        List<String> errors = RecipeValidator.validate(recipe);
        if (!errors.isEmpty()) {
            throw new RecipeValidationException(name, errors);
        }

        cache.put(name, recipe);
        log.debug("Loaded {} recipe {} from {}", recipe.kind().label(), name, file);
        return recipe;
    }

    /**
     * Names of every recipe file, without loading them.
     */
    public SortedSet<String> list() {
        var names = new TreeSet<String>();
        for (Path dir : searchDirectories()) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(RecipeStore::hasRecipeExtension)
                    .map(fileName -> fileName.substring(0, fileName.lastIndexOf('.')))
                    .forEach(names::add);
            } catch (IOException e) {
                throw new FactoryException("Failed to list recipes in " + dir, e);
            }
        }
        return names;
    }

    public RecipeInfo info(String name) {
        Recipe recipe = load(name);
        String command = switch (recipe.kind()) {
            case SERVICE -> recipe.execution().command();
            case CLIENT -> recipe.workload().pattern() + " workload, "
                + recipe.workload().concurrentUsers() + " users for " + recipe.workload().durationSeconds() + "s";
            case MONITOR -> recipe.infra().enabled() ? recipe.infra().image() : "(prometheus disabled)";
        };
        List<String> targets = recipe.targets().stream().map(TargetSpec::name).toList();
        boolean infraEnabled = recipe.infra() != null && recipe.infra().enabled();
        return new RecipeInfo(recipe.name(), recipe.kind(),
            recipe.description() == null ? "No description" : recipe.description(),
            command, targets, infraEnabled, find(name).orElse(null));
    }

    /**
     * Write a starter recipe of the given kind.
     *
     * @return the created file
     */
    public Path createTemplate(String name, RecipeKind kind) {
        checkName(name);
        Path destination = directory.resolve(name + ".yaml");
        try {
            Files.createDirectories(directory);
            Files.writeString(destination, RecipeTemplates.forKind(name, kind), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW);
        } catch (FileAlreadyExistsException e) {
            throw new FactoryException("Recipe already exists: " + destination, e);
        } catch (IOException e) {
            throw new FactoryException("Failed to write recipe template " + destination, e);
        }
        log.info("Created {} recipe template {}", kind.label(), destination);
        return destination;
    }

    public Optional<Path> find(String name) {
        checkName(name);
        for (Path dir : searchDirectories()) {
            for (String extension : EXTENSIONS) {
                Path candidate = dir.resolve(name + extension);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    public void evict(String name) {
        cache.remove(name);
    }

    public void clearCache() {
        cache.clear();
    }

    private List<Path> searchDirectories() {
        var dirs = new ArrayList<Path>();
        dirs.add(directory);
        KIND_DIRECTORIES.forEach(sub -> dirs.add(directory.resolve(sub)));
        return dirs;
    }

    private static boolean hasRecipeExtension(String fileName) {
        return EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new NotFoundException("Recipe not found: " + name);
        }
    }
}
