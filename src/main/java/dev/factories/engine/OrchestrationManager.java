package dev.factories.engine;

import dev.factories.config.FactoriesConfig;
import dev.factories.discovery.DiscoveryStore;
import dev.factories.error.FactoryException;
import dev.factories.error.NotFoundException;
import dev.factories.error.PartialFailureException;
import dev.factories.error.ResolutionTimeoutException;
import dev.factories.error.SchedulerException;
import dev.factories.model.Component;
import dev.factories.model.DeployOptions;
import dev.factories.model.DiscoveryRecord;
import dev.factories.model.InfraSpec;
import dev.factories.model.Instance;
import dev.factories.model.InstanceSnapshot;
import dev.factories.model.InstanceStatus;
import dev.factories.model.Recipe;
import dev.factories.model.RecipeInfo;
import dev.factories.model.RecipeKind;
import dev.factories.model.TargetSpec;
import dev.factories.scheduler.JobState;
import dev.factories.scheduler.JobStatus;
import dev.factories.scheduler.ProcessCommandRunner;
import dev.factories.scheduler.SchedulerGateway;
import dev.factories.scheduler.SlurmGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Public face of the tool: deploys recipes, tracks their instances and tears them down.
 * <p>
 * Every mutation is persisted through the {@link InstanceRegistry} before the
 * call returns. Instances are driven through the lifecycle in
 * {@link InstanceStatus}; scheduler states that are not understood never move
 * an instance.
 */
public final class OrchestrationManager {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationManager.class);

    public static final String NODE = "node";
    public static final String ERROR = "error";
    public static final String PROMETHEUS_URL = "prometheus_url";

    private final RecipeStore recipes;
    private final SchedulerGateway gateway;
    private final EndpointResolver resolver;
    private final InstanceRegistry registry;
    private final DiscoveryStore discovery;
    private final JobDescriptions jobs;
    private final Path monitorOutput;
    private final FactoriesConfig.Polling polling;
    private final Clock clock;

    public OrchestrationManager(RecipeStore recipes, SchedulerGateway gateway, EndpointResolver resolver,
                                InstanceRegistry registry, DiscoveryStore discovery, JobDescriptions jobs,
                                Path monitorOutput, FactoriesConfig.Polling polling, Clock clock) {
        this.recipes = recipes;
        this.gateway = gateway;
        this.resolver = resolver;
        this.registry = registry;
        this.discovery = discovery;
        this.jobs = jobs;
        this.monitorOutput = monitorOutput;
        this.polling = polling;
        this.clock = clock;
    }

    /**
     * Wire a manager against the real SLURM CLI and the configured file locations.
     */
    public static OrchestrationManager create(FactoriesConfig config) {
        Clock clock = Clock.systemUTC();
        var recipes = new RecipeStore(config.paths().recipes());
        var gateway = new SlurmGateway(new ProcessCommandRunner(), config.slurm().commandTimeout(), null);
        var discovery = new DiscoveryStore(config.paths().discoveryDir());
        var resolver = new EndpointResolver(gateway, discovery, config.polling().interval(), clock, Sleeper.SYSTEM);
        var registry = InstanceRegistry.open(config.paths().stateFile(), recipes, clock);
        var jobs = new JobDescriptions(config.slurm(), config.client(), Path.of(""));
        return new OrchestrationManager(recipes, gateway, resolver, registry, discovery, jobs,
            config.paths().monitorOutput(), config.polling(), clock);
    }

    // ---- deploy ----

    public InstanceSnapshot deploy(String recipeName) {
        return deploy(recipeName, DeployOptions.defaults());
    }

    /**
     * Deploy one instance of a recipe.
     *
     * @throws NotFoundException for an unknown recipe
     * @throws dev.factories.error.RecipeValidationException for an invalid recipe
     * @throws ResolutionTimeoutException when a target cannot be resolved; nothing is recorded
     * @throws SchedulerException when the job cannot be submitted; a FAILED instance is recorded
     * @throws PartialFailureException when part of a composite deployment failed
     */
    public InstanceSnapshot deploy(String recipeName, DeployOptions options) {
        Recipe recipe = recipes.load(recipeName);
        DeployOptions opts = options == null ? DeployOptions.defaults() : options;
        List<TargetSpec> targets = applyTargetHandles(recipe, opts.targetHandles());
        log.info("Deploying {} recipe {}", recipe.kind().label(), recipeName);

        return switch (recipe.kind()) {
            case SERVICE -> deployService(recipeName, recipe, opts);
            case CLIENT -> deployClient(recipeName, recipe, targets, opts);
            case MONITOR -> deployMonitor(recipeName, recipe, targets, opts);
        };
    }

    private InstanceSnapshot deployService(String recipeName, Recipe recipe, DeployOptions opts) {
        Instance instance = Instance.create(recipeName, recipe, clock.instant());
        String handle = submitSingle(instance, () -> gateway.submit(jobs.forService(instance, recipe)));
        if (opts.waitForPlacement()) {
            awaitSinglePlacement(instance, handle, opts);
        }
        return instance.snapshot();
    }

    private InstanceSnapshot deployClient(String recipeName, Recipe recipe, List<TargetSpec> targets,
                                          DeployOptions opts) {
        Map<String, String> endpoints = resolveTargets(recipeName, targets, resolveTimeout(opts));
        String primary = endpoints.values().iterator().next();

        Instance instance = Instance.create(recipeName, recipe, clock.instant());
        endpoints.forEach(instance::putEndpoint);
        String handle = submitSingle(instance, () -> gateway.submit(jobs.forClient(instance, recipe, primary)));
        if (opts.waitForPlacement()) {
            awaitSinglePlacement(instance, handle, opts);
        }
        return instance.snapshot();
    }

    private InstanceSnapshot deployMonitor(String recipeName, Recipe recipe, List<TargetSpec> targets,
                                           DeployOptions opts) {
        Map<String, String> endpoints = resolveTargets(recipeName, targets, resolveTimeout(opts));
        List<String> targetNames = List.copyOf(endpoints.keySet());

        Instance instance = Instance.create(recipeName, recipe, clock.instant());
        endpoints.forEach(instance::putEndpoint);

        InfraSpec infra = recipe.infra();
        if (infra == null || !infra.enabled()) {
            registry.create(instance);
            instance.transitionTo(InstanceStatus.RUNNING, clock.instant());
            registry.persist();
            log.info("Monitor {} tracking {} without Prometheus", instance.id(), targetNames);
            return instance.snapshot();
        }

        Component prometheus = instance.addComponent(InfraSpec.COMPONENT_NAME);
        String handle;
        try {
            Path outputDir = monitorOutput.resolve(instance.id());
            Path configDir = outputDir.resolve("config");
            PrometheusConfigWriter.write(configDir, recipe, endpoints);
            handle = gateway.submit(jobs.forInfra(instance, recipe, configDir, outputDir.resolve("data")));
        } catch (IOException | FactoryException e) {
            prometheus.transitionTo(InstanceStatus.FAILED);
            fail(instance, e.getMessage());
            registry.create(instance);
            throw new PartialFailureException(
                "Monitor %s (instance %s): Prometheus submission failed: %s"
                    .formatted(recipeName, instance.id(), e.getMessage()),
                targetNames, List.of(InfraSpec.COMPONENT_NAME), e);
        }

        prometheus.assignHandle(handle);
        registry.create(instance);
        prometheus.transitionTo(InstanceStatus.STARTING);
        instance.transitionTo(InstanceStatus.STARTING, clock.instant());
        registry.persist();
        log.info("Monitor {} submitted Prometheus as job {}", instance.id(), handle);

        if (opts.waitForPlacement()) {
            try {
                Placement placement = resolver.awaitPlacement(handle, placementTimeout(opts));
                placeComponent(instance, prometheus, placement.node());
                registry.persist();
            } catch (ResolutionTimeoutException e) {
                CancelOutcome rollback = cancelAll(instance);
                fail(instance, "Prometheus was not placed: " + e.getMessage());
                registry.persist();
                throw new PartialFailureException(
                    "Monitor %s (instance %s): Prometheus was not placed, rolled back %s"
                        .formatted(recipeName, instance.id(), rollback.succeeded()),
                    targetNames, rollback.failed().isEmpty() ? List.of(InfraSpec.COMPONENT_NAME) : rollback.failed(), e);
            }
        }
        return instance.snapshot();
    }

    private String submitSingle(Instance instance, SubmitAction submit) {
        String handle;
        try {
            handle = submit.submit();
        } catch (FactoryException e) {
            fail(instance, e.getMessage());
            registry.create(instance);
            throw new SchedulerException("Deploy of %s failed (instance %s): %s"
                .formatted(instance.recipeName(), instance.id(), e.getMessage()), e);
        }
        instance.assignHandle(handle);
        registry.create(instance);
        instance.transitionTo(InstanceStatus.STARTING, clock.instant());
        registry.persist();
        log.info("Instance {} of {} submitted as job {}", instance.id(), instance.recipeName(), handle);
        return handle;
    }

    private void awaitSinglePlacement(Instance instance, String handle, DeployOptions opts) {
        Placement placement;
        try {
            placement = resolver.awaitPlacement(handle, placementTimeout(opts));
        } catch (ResolutionTimeoutException e) {
            CancelOutcome rollback = cancelAll(instance);
            fail(instance, "Job was not placed: " + e.getMessage());
            registry.persist();
            throw new ResolutionTimeoutException("Deploy of %s (instance %s) rolled back: %s%s"
                .formatted(instance.recipeName(), instance.id(), e.getMessage(),
                    rollback.failed().isEmpty() ? "" : "; cancel failed for " + rollback.failed()), e);
        }
        placeInstance(instance, placement.node());
        registry.persist();
    }

    private List<TargetSpec> applyTargetHandles(Recipe recipe, Map<String, String> handles) {
        var targets = new ArrayList<>(recipe.targets());
        handles.forEach((name, handle) -> {
            int index = indexOf(targets, name);
            if (index >= 0) {
                targets.set(index, targets.get(index).withJobHandle(handle));
            } else {
                targets.add(TargetSpec.ofHandle(name, handle));
            }
        });
        return targets;
    }

    private static int indexOf(List<TargetSpec> targets, String name) {
        for (int i = 0; i < targets.size(); i++) {
            if (targets.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private Map<String, String> resolveTargets(String recipeName, List<TargetSpec> targets, Duration timeout) {
        if (targets.isEmpty()) {
            throw new ResolutionTimeoutException("Recipe %s has no targets to resolve".formatted(recipeName));
        }
        var endpoints = new LinkedHashMap<String, String>();
        for (TargetSpec target : targets) {
            try {
                endpoints.put(target.name(), resolver.resolve(target, timeout).hostPort());
            } catch (ResolutionTimeoutException e) {
                throw new ResolutionTimeoutException("Recipe %s: target '%s' could not be resolved: %s"
                    .formatted(recipeName, target.name(), e.getMessage()), e);
            }
        }
        return endpoints;
    }

    // ---- stop ----

    /**
     * Cancel every job of an instance.
     *
     * @return true once the instance is terminal; an already-terminal instance is left untouched
     * @throws NotFoundException for an unknown id
     * @throws PartialFailureException when some cancellation failed; the rest were still attempted
     */
    public boolean stop(String instanceId) {
        Instance instance = registry.require(instanceId);
        if (instance.isTerminal()) {
            log.debug("Instance {} already {}", instance.id(), instance.status().label());
            return true;
        }

        CancelOutcome outcome = cancelAll(instance);
        if (outcome.failed().isEmpty()) {
            instance.transitionTo(InstanceStatus.CANCELED, clock.instant());
            clearOwnDiscovery(instance);
            registry.persist();
            log.info("Stopped instance {} of {}", instance.id(), instance.recipeName());
            return true;
        }

        fail(instance, "Cancellation failed for " + outcome.failed());
        registry.persist();
        throw new PartialFailureException("Stop of instance %s (%s) incomplete"
            .formatted(instance.id(), instance.recipeName()), outcome.succeeded(), outcome.failed());
    }

    /**
     * Stop every live instance.
     *
     * @return ids of the instances stopped
     * @throws PartialFailureException naming the instances that could not be stopped
     */
    public List<String> stopAll() {
        var stopped = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (Instance instance : registry.all()) {
            if (instance.isTerminal()) {
                continue;
            }
            try {
                stop(instance.id());
                stopped.add(instance.id());
            } catch (FactoryException e) {
                failed.add(instance.id() + ": " + e.getMessage());
            }
        }
        if (!failed.isEmpty()) {
            throw new PartialFailureException("Not every instance could be stopped", stopped, failed);
        }
        return stopped;
    }

    private CancelOutcome cancelAll(Instance instance) {
        var succeeded = new ArrayList<String>();
        var failed = new ArrayList<String>();

        for (Component component : instance.components()) {
            if (!component.isLive()) {
                continue;
            }
            if (component.handle() == null) {
                component.transitionTo(InstanceStatus.CANCELED);
                continue;
            }
            String label = "%s (job %s)".formatted(component.name(), component.handle());
            if (cancel(instance, component.handle(), label, failed)) {
                component.transitionTo(InstanceStatus.CANCELED);
                succeeded.add(label);
            }
        }

        if (instance.handle() != null) {
            String label = "job " + instance.handle();
            if (cancel(instance, instance.handle(), label, failed)) {
                succeeded.add(label);
            }
        }
        return new CancelOutcome(succeeded, failed);
    }

    private boolean cancel(Instance instance, String handle, String label, List<String> failed) {
        try {
            if (!gateway.cancel(handle)) {
                log.debug("Job {} of instance {} was already gone", handle, instance.id());
            }
            return true;
        } catch (SchedulerException e) {
            log.error("Failed to cancel {} of instance {}: {}", label, instance.id(), e.getMessage());
            failed.add(label + ": " + e.getMessage());
            return false;
        }
    }

    // ---- status ----

    /**
     * Query the scheduler for an instance and apply any state change.
     */
    public InstanceSnapshot refreshStatus(String instanceId) {
        Instance instance = registry.require(instanceId);
        if (!instance.isTerminal() && refresh(instance)) {
            registry.persist();
        }
        return instance.snapshot();
    }

    /**
     * Refresh every live instance. A failing query leaves its instance unchanged.
     */
    public List<InstanceSnapshot> refreshAll() {
        boolean changed = false;
        for (Instance instance : registry.all()) {
            if (instance.isTerminal()) {
                continue;
            }
            try {
                changed |= refresh(instance);
            } catch (FactoryException e) {
                log.warn("Could not refresh instance {}: {}", instance.id(), e.getMessage());
            }
        }
        if (changed) {
            registry.persist();
        }
        return registry.all().stream().map(Instance::snapshot).toList();
    }

    private boolean refresh(Instance instance) {
        boolean changed = false;
        if (instance.handle() != null) {
            Optional<JobStatus> status = query(instance, instance.handle());
            if (status.isPresent()) {
                changed = applyStatus(instance, status.get());
            }
        }

        for (Component component : instance.liveComponents()) {
            Optional<JobStatus> status = query(instance, component.handle());
            if (status.isPresent()) {
                changed |= applyComponentStatus(instance, component, status.get());
            }
        }
        Optional<Component> infra = instance.component(InfraSpec.COMPONENT_NAME);
        if (infra.isPresent() && instance.transitionTo(infra.get().status(), clock.instant())) {
            log.info("Instance {} is now {}", instance.id(), instance.status().label());
            changed = true;
        }
        return changed;
    }

    private Optional<JobStatus> query(Instance instance, String handle) {
        try {
            return Optional.of(gateway.queryStatus(handle));
        } catch (SchedulerException e) {
            log.warn("Status query for job {} of instance {} failed: {}", handle, instance.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean applyStatus(Instance instance, JobStatus status) {
        Optional<InstanceStatus> next = toInstanceStatus(status.state());
        if (next.isEmpty()) {
            log.debug("Job {} of instance {} reported an unknown state", instance.handle(), instance.id());
            return false;
        }
        if (next.get() == InstanceStatus.RUNNING && status.hasNode()) {
            return placeInstance(instance, status.node());
        }
        if (instance.transitionTo(next.get(), clock.instant())) {
            log.info("Instance {} is now {}", instance.id(), instance.status().label());
            return true;
        }
        return false;
    }

    private boolean applyComponentStatus(Instance instance, Component component, JobStatus status) {
        Optional<InstanceStatus> next = toInstanceStatus(status.state());
        if (next.isEmpty()) {
            return false;
        }
        if (next.get() == InstanceStatus.RUNNING && status.hasNode()) {
            return placeComponent(instance, component, status.node());
        }
        return component.transitionTo(next.get());
    }

    /**
     * Record that a single-job instance runs on {@code node}; services publish their location.
     */
    private boolean placeInstance(Instance instance, String node) {
        boolean moved = instance.status().canTransitionTo(InstanceStatus.RUNNING);
        if (!moved && node.equals(instance.metadata().get(NODE))) {
            return false;
        }
        instance.putMetadata(NODE, node);

        Recipe recipe = instance.recipe();
        if (instance.kind() == RecipeKind.SERVICE && !instance.isTerminal()) {
            List<Integer> ports = recipe.execution().ports();
            if (!ports.isEmpty()) {
                instance.putEndpoint(recipe.discoveryName().orElse(recipe.name()), node + ":" + ports.get(0));
            }
            recipe.discoveryName().ifPresent(service -> publish(
                new DiscoveryRecord(service, instance.handle(), node, ports, instance.id(), clock.instant())));
        }
        instance.transitionTo(InstanceStatus.RUNNING, clock.instant());
        log.info("Instance {} running on {}", instance.id(), node);
        return true;
    }

    private boolean placeComponent(Instance instance, Component component, String node) {
        String hostPort = node + ":" + instance.recipe().infra().port();
        boolean moved = component.transitionTo(InstanceStatus.RUNNING);
        if (!moved && hostPort.equals(component.endpoint())) {
            return false;
        }
        component.setEndpoint(hostPort);
        if (!instance.isTerminal()) {
            instance.putEndpoint(component.name(), hostPort);
        }
        instance.putMetadata(NODE, node);
        instance.putMetadata(PROMETHEUS_URL, "http://" + hostPort);
        instance.transitionTo(InstanceStatus.RUNNING, clock.instant());
        log.info("{} of instance {} running at {}", component.name(), instance.id(), hostPort);
        return true;
    }

    private static Optional<InstanceStatus> toInstanceStatus(JobState state) {
        return switch (state) {
            case PENDING -> Optional.of(InstanceStatus.SUBMITTED);
            case STARTING -> Optional.of(InstanceStatus.STARTING);
            case RUNNING -> Optional.of(InstanceStatus.RUNNING);
            case COMPLETED -> Optional.of(InstanceStatus.COMPLETED);
            case FAILED -> Optional.of(InstanceStatus.FAILED);
            case CANCELED -> Optional.of(InstanceStatus.CANCELED);
            case UNKNOWN -> Optional.empty();
        };
    }

    // ---- queries ----

    public List<InstanceSnapshot> list(Optional<InstanceStatus> status) {
        List<Instance> instances = status.map(registry::listByStatus).orElseGet(registry::all);
        return instances.stream().map(Instance::snapshot).toList();
    }

    public InstanceSnapshot get(String instanceId) {
        return registry.require(instanceId).snapshot();
    }

    /**
     * Remove finished instances from the registry.
     */
    public int prune() {
        return registry.prune();
    }

    public SortedSet<String> listAvailableRecipes() {
        return recipes.list();
    }

    public RecipeInfo getRecipeInfo(String recipeName) {
        return recipes.info(recipeName);
    }

    public Path createRecipeTemplate(String recipeName, RecipeKind kind) {
        return recipes.createTemplate(recipeName, kind);
    }

    // ---- discovery ----

    public List<DiscoveryRecord> listDiscovered() {
        var records = new ArrayList<DiscoveryRecord>();
        for (String service : discovery.listServices()) {
            discovery.lookup(service).ifPresent(records::add);
        }
        return records;
    }

    public boolean clearDiscovered(String serviceName) {
        return discovery.clear(serviceName);
    }

    /**
     * Re-query the scheduler for a service's job and rewrite its discovery record.
     *
     * @param handle job to query; null to use the job already recorded
     * @throws NotFoundException when there is neither a record nor a handle
     * @throws FactoryException when the job is not running on a node
     */
    public DiscoveryRecord updateDiscovery(String serviceName, String handle) {
        Optional<DiscoveryRecord> existing = discovery.lookup(serviceName);
        String jobId = handle != null ? handle : existing.map(DiscoveryRecord::jobId).orElse(null);
        if (jobId == null) {
            throw new NotFoundException("No discovery record or job id for service " + serviceName);
        }

        JobStatus status = gateway.queryStatus(jobId);
        if (!status.isPlaced()) {
            throw new FactoryException("Job %s of %s is %s, not running on a node"
                .formatted(jobId, serviceName, status.state()));
        }

        List<Integer> ports = existing.map(DiscoveryRecord::ports).orElse(List.of());
        if (ports.isEmpty()) {
            log.warn("No ports known for {}, assuming {}", serviceName, TargetSpec.DEFAULT_PORT);
            ports = List.of(TargetSpec.DEFAULT_PORT);
        }
        String instanceId = existing.map(DiscoveryRecord::instanceId).orElse(null);
        var record = new DiscoveryRecord(serviceName, jobId, status.node(), ports, instanceId, clock.instant());
        discovery.publish(record);
        return record;
    }

    private void publish(DiscoveryRecord record) {
        try {
            discovery.publish(record);
        } catch (FactoryException e) {
            log.warn("Could not publish {}: {}", record.serviceName(), e.getMessage());
        }
    }

    private void clearOwnDiscovery(Instance instance) {
        Optional<String> service = instance.recipe().discoveryName();
        if (instance.kind() != RecipeKind.SERVICE || service.isEmpty()) {
            return;
        }
        discovery.lookup(service.get())
            .filter(record -> instance.id().equals(record.instanceId()))
            .ifPresent(record -> discovery.clear(record.serviceName()));
    }

    private void fail(Instance instance, String error) {
        instance.putMetadata(ERROR, error);
        instance.transitionTo(InstanceStatus.FAILED, clock.instant());
    }

    private Duration resolveTimeout(DeployOptions opts) {
        return opts.resolveTimeout() != null ? opts.resolveTimeout() : polling.resolveTimeout();
    }

    private Duration placementTimeout(DeployOptions opts) {
        return opts.placementTimeout() != null ? opts.placementTimeout() : polling.placementTimeout();
    }

    @FunctionalInterface
    private interface SubmitAction {
        String submit();
    }

    private record CancelOutcome(List<String> succeeded, List<String> failed) {}
}
