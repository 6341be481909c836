package dev.factories.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.factories.error.FactoryException;
import dev.factories.error.NotFoundException;
import dev.factories.model.Component;
import dev.factories.model.Instance;
import dev.factories.model.InstanceStatus;
import dev.factories.model.Recipe;
import dev.factories.util.AtomicFiles;
import dev.factories.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every instance this tool has deployed, mirrored to a single JSON state file.
 * <p>
 * The file is rewritten whole after every mutation, so a restarted process
 * sees the same set of instances. Entries whose recipe can no longer be
 * loaded are skipped on reload. One writer per state file is assumed.
 */
public final class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    static final int FORMAT_VERSION = 1;

    private final Path stateFile;
    private final RecipeStore recipes;
    private final Clock clock;
    private final ObjectMapper mapper = Mappers.documentMapper();
    private final Map<String, Instance> instances = new LinkedHashMap<>();

    public InstanceRegistry(Path stateFile, RecipeStore recipes, Clock clock) {
        this.stateFile = stateFile;
        this.recipes = recipes;
        this.clock = clock;
    }

    /**
     * Open the registry and load whatever the state file already holds.
     */
    public static InstanceRegistry open(Path stateFile, RecipeStore recipes, Clock clock) {
        var registry = new InstanceRegistry(stateFile, recipes, clock);
        registry.reload();
        return registry;
    }

    public Path stateFile() {
        return stateFile;
    }

    public void create(Instance instance) {
        if (instances.containsKey(instance.id())) {
            throw new IllegalArgumentException("Instance already registered: " + instance.id());
        }
        instances.put(instance.id(), instance);
        persist();
    }

    /**
     * Move an instance to {@code status} if the lifecycle allows it.
     *
     * @return true if the status changed
     * @throws NotFoundException for an unknown id
     */
    public boolean update(String id, InstanceStatus status) {
        Instance instance = instances.get(id);
        if (instance == null) {
            throw new NotFoundException("Instance not found: " + id);
        }
        boolean changed = instance.transitionTo(status, clock.instant());
        if (changed) {
            persist();
        } else {
            log.debug("Ignored transition of {} from {} to {}", id, instance.status(), status);
        }
        return changed;
    }

    public Optional<Instance> get(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    /**
     * Look up by full id or by an unambiguous id prefix.
     *
     * @throws NotFoundException when nothing, or more than one instance, matches
     */
    public Instance require(String idOrPrefix) {
        Instance exact = instances.get(idOrPrefix);
        if (exact != null) {
            return exact;
        }
        if (idOrPrefix == null || idOrPrefix.isBlank()) {
            throw new NotFoundException("Instance not found: " + idOrPrefix);
        }
        List<Instance> matches = instances.values().stream()
            .filter(i -> i.id().startsWith(idOrPrefix))
            .toList();
        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.isEmpty()) {
            throw new NotFoundException("Instance not found: " + idOrPrefix);
        }
        throw new NotFoundException("Instance id prefix '%s' is ambiguous (%d matches)"
            .formatted(idOrPrefix, matches.size()));
    }

    public List<Instance> listByStatus(InstanceStatus status) {
        return instances.values().stream().filter(i -> i.status() == status).toList();
    }

    public List<Instance> all() {
        return List.copyOf(instances.values());
    }

    /**
     * Drop every terminal instance.
     *
     * @return number of instances removed
     */
    public int prune() {
        int before = instances.size();
        instances.values().removeIf(Instance::isTerminal);
        int removed = before - instances.size();
        if (removed > 0) {
            persist();
            log.info("Pruned {} finished instance(s)", removed);
        }
        return removed;
    }

    public void persist() {
        var entries = instances.values().stream().map(InstanceRegistry::toEntry).toList();
        try {
            AtomicFiles.write(stateFile, mapper.writeValueAsBytes(new StateDocument(FORMAT_VERSION, entries)));
        } catch (IOException e) {
            throw new FactoryException("Failed to write instance state to " + stateFile, e);
        }
    }

    /**
     * Replace in-memory state with the contents of the state file.
     *
     * @return number of instances loaded
     * @throws FactoryException if the file exists but cannot be parsed
     */
    public int reload() {
        instances.clear();
        if (!Files.exists(stateFile)) {
            log.debug("No state file at {}, starting empty", stateFile);
            return 0;
        }

        StateDocument document;
        try {
            document = mapper.readValue(stateFile.toFile(), StateDocument.class);
        } catch (IOException e) {
            throw new FactoryException("Corrupt instance state file " + stateFile, e);
        }
        if (document.version() > FORMAT_VERSION) {
            throw new FactoryException("State file %s has version %d, newer than supported %d"
                .formatted(stateFile, document.version(), FORMAT_VERSION));
        }

        for (InstanceEntry entry : document.instances() == null ? List.<InstanceEntry>of() : document.instances()) {
            Recipe recipe;
            try {
                recipe = recipes.load(entry.recipeName());
            } catch (FactoryException e) {
                log.warn("Skipping instance {}: recipe {} unavailable ({})",
                    entry.id(), entry.recipeName(), e.getMessage());
                continue;
            }
            instances.put(entry.id(), fromEntry(entry, recipe));
        }
        log.debug("Loaded {} instance(s) from {}", instances.size(), stateFile);
        return instances.size();
    }

    private static InstanceEntry toEntry(Instance instance) {
        var components = new LinkedHashMap<String, ComponentEntry>();
        instance.components().forEach(c ->
            components.put(c.name(), new ComponentEntry(c.handle(), c.endpoint(), c.status())));
        return new InstanceEntry(instance.id(), instance.recipeName(), instance.status(), instance.handle(),
            instance.createdAt(), instance.completedAt(), instance.endpoints(), instance.metadata(),
            components, instance.history());
    }

    private static Instance fromEntry(InstanceEntry entry, Recipe recipe) {
        var components = new ArrayList<Component>();
        if (entry.components() != null) {
            entry.components().forEach((name, c) ->
                components.add(new Component(name, c.handle(), c.endpoint(), c.status())));
        }
        return Instance.restore(entry.id(), entry.recipeName(), recipe, entry.status(), entry.handle(),
            entry.createdAt(), entry.completedAt(),
            entry.endpoints() == null ? Map.of() : entry.endpoints(),
            entry.metadata() == null ? Map.of() : entry.metadata(),
            components, entry.history());
    }

    record StateDocument(int version, List<InstanceEntry> instances) {}

    record InstanceEntry(
        String id,
        String recipeName,
        InstanceStatus status,
        String handle,
        Instant createdAt,
        Instant completedAt,
        Map<String, String> endpoints,
        Map<String, String> metadata,
        Map<String, ComponentEntry> components,
        List<InstanceStatus> history
    ) {}

    record ComponentEntry(String handle, String endpoint, InstanceStatus status) {}
}
