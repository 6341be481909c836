package dev.factories.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable runtime record for one deployed recipe.
 * <p>
 * Once the status is terminal only {@link #putMetadata} is accepted;
 * every other mutation is rejected with {@link IllegalStateException}.
 */
public final class Instance {
    private final String id;
    private final String recipeName;
    private final Recipe recipe;
    private final Instant createdAt;
    private InstanceStatus status;
    private String handle;
    private Instant completedAt;
    private final Map<String, String> endpoints = new LinkedHashMap<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private final Map<String, Component> components = new LinkedHashMap<>();
    private final List<InstanceStatus> history = new ArrayList<>();

    public Instance(String id, String recipeName, Recipe recipe, Instant createdAt) {
        this.id = id;
        this.recipeName = recipeName;
        this.recipe = recipe;
        this.createdAt = createdAt;
        this.status = InstanceStatus.SUBMITTED;
        this.history.add(InstanceStatus.SUBMITTED);
    }

    public static Instance create(String recipeName, Recipe recipe, Instant now) {
        return new Instance(UUID.randomUUID().toString(), recipeName, recipe, now);
    }

    /**
     * Rebuild an instance read back from durable storage.
     */
    public static Instance restore(String id, String recipeName, Recipe recipe, InstanceStatus status,
                                   String handle, Instant createdAt, Instant completedAt,
                                   Map<String, String> endpoints, Map<String, String> metadata,
                                   Collection<Component> components, List<InstanceStatus> history) {
        var instance = new Instance(id, recipeName, recipe, createdAt);
        instance.status = status;
        instance.handle = handle;
        instance.completedAt = completedAt;
        instance.endpoints.putAll(endpoints);
        instance.metadata.putAll(metadata);
        components.forEach(c -> instance.components.put(c.name(), c));
        instance.history.clear();
        if (history == null || history.isEmpty()) {
            instance.history.add(status);
        } else {
            instance.history.addAll(history);
        }
        return instance;
    }

    public String id() { return id; }
    public String recipeName() { return recipeName; }
    public Recipe recipe() { return recipe; }
    public RecipeKind kind() { return recipe.kind(); }
    public Instant createdAt() { return createdAt; }
    public InstanceStatus status() { return status; }
    public String handle() { return handle; }
    public Instant completedAt() { return completedAt; }
    public Map<String, String> endpoints() { return Collections.unmodifiableMap(endpoints); }
    public Map<String, String> metadata() { return Collections.unmodifiableMap(metadata); }
    public List<InstanceStatus> history() { return Collections.unmodifiableList(history); }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Move to {@code next} if the lifecycle allows it; stamps the completion
     * time when a terminal state is entered.
     *
     * @return true when the status changed
     */
    public boolean transitionTo(InstanceStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        this.history.add(next);
        if (next.isTerminal()) {
            this.completedAt = now;
        }
        return true;
    }

    public void assignHandle(String handle) {
        requireLive("assign a handle");
        this.handle = handle;
    }

    public void putEndpoint(String name, String hostPort) {
        requireLive("record an endpoint");
        endpoints.put(name, hostPort);
    }

    public void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public Component addComponent(String name) {
        requireLive("add a component");
        if (components.containsKey(name)) {
            throw new IllegalStateException("Instance %s already has a component named %s".formatted(id, name));
        }
        var component = new Component(name);
        components.put(name, component);
        return component;
    }

    public Optional<Component> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public Collection<Component> components() {
        return Collections.unmodifiableCollection(components.values());
    }

    public List<Component> liveComponents() {
        return components.values().stream()
            .filter(Component::isLive)
            .filter(c -> c.handle() != null)
            .toList();
    }

    public InstanceSnapshot snapshot() {
        var componentSnapshots = new LinkedHashMap<String, ComponentSnapshot>();
        components.forEach((name, c) -> componentSnapshots.put(name, c.snapshot()));
        return new InstanceSnapshot(id, recipeName, recipe.kind(), status, handle,
            Collections.unmodifiableMap(new LinkedHashMap<>(endpoints)),
            Collections.unmodifiableMap(componentSnapshots),
            Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
            List.copyOf(history), createdAt, completedAt);
    }

    private void requireLive(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                "Cannot %s on instance %s: status is %s".formatted(action, id, status));
        }
    }
}
