/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeConditionBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Taint;
import io.fabric8.kubernetes.api.model.TaintBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.kubesim.common.InvariantViolationException;
import io.kubesim.common.MetricsProvider;
import io.kubesim.common.MicrometerMetricsProvider;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.metrics.ControllerMetricsHolder;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.autoscaler.HorizontalPodAutoscalerController;
import io.kubesim.simulator.autoscaler.MetricsFeed;
import io.kubesim.simulator.controller.Controller;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.controller.CronJobController;
import io.kubesim.simulator.controller.DaemonSetController;
import io.kubesim.simulator.controller.DeploymentController;
import io.kubesim.simulator.controller.EndpointsController;
import io.kubesim.simulator.controller.GarbageCollector;
import io.kubesim.simulator.controller.JobController;
import io.kubesim.simulator.controller.ReplicaSetController;
import io.kubesim.simulator.controller.StatefulSetController;
import io.kubesim.simulator.disruption.DisruptionController;
import io.kubesim.simulator.disruption.DrainResult;
import io.kubesim.simulator.disruption.EvictionResult;
import io.kubesim.simulator.event.Event;
import io.kubesim.simulator.event.EventRecorder;
import io.kubesim.simulator.lifecycle.AnnotationProbeOutcomePolicy;
import io.kubesim.simulator.lifecycle.NodeLifecycleController;
import io.kubesim.simulator.lifecycle.PodLifecycleController;
import io.kubesim.simulator.lifecycle.ProbeOutcomePolicy;
import io.kubesim.simulator.model.Annotations;
import io.kubesim.simulator.model.FailureMode;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.NameGenerator;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.scheduler.NodeEligibility;
import io.kubesim.simulator.scheduler.Scheduler;
import io.kubesim.simulator.scheduler.SchedulingStrategy;
import io.kubesim.simulator.storage.StorageController;
import io.kubesim.simulator.store.ClusterStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the simulator. It holds the cluster state and runs the controllers one tick at a time.
 * <p>
 * All mutations are validated before anything changes and throw {@link InvalidResourceException} when they are
 * refused. Everything returned to the caller is a copy: changing it has no effect on the simulated cluster.
 * <p>
 * The simulator is single-threaded. Its methods must not be called concurrently.
 */
public class ClusterSimulator {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClusterSimulator.class);

    private static final List<String> POD_PHASES = List.of(PodUtils.PHASE_PENDING, PodUtils.PHASE_RUNNING,
            PodUtils.PHASE_SUCCEEDED, PodUtils.PHASE_FAILED, PodUtils.PHASE_TERMINATING);

    private final SimulatorConfig config;
    private final SimulatedClock clock;
    private final ClusterStore store;
    private final EventRecorder events;
    private final MetricsFeed metricsFeed = new MetricsFeed();

    private final StorageController storage;
    private final Scheduler scheduler;
    private final NodeLifecycleController nodeLifecycle;
    private final PodLifecycleController podLifecycle;
    private final DeploymentController deployments;
    private final List<Controller> workloadControllers;
    private final HorizontalPodAutoscalerController autoscaler;
    private final GarbageCollector garbageCollector;
    private final DisruptionController disruption;
    private final EndpointsController endpoints;

    private final MeterRegistry meterRegistry;
    private final Timer tickTimer;
    private final Map<String, AtomicInteger> podGauges = new LinkedHashMap<>();

    /**
     * Constructs the simulator with the default configuration
     */
    public ClusterSimulator() {
        this(SimulatorConfig.defaultConfig(), new MicrometerMetricsProvider());
    }

    /**
     * Constructs the simulator
     *
     * @param config            Simulator configuration
     * @param metricsProvider   Metrics provider
     */
    public ClusterSimulator(SimulatorConfig config, MetricsProvider metricsProvider) {
        this(config, metricsProvider, new AnnotationProbeOutcomePolicy());
    }

    /**
     * Constructs the simulator with a custom source of probe results
     *
     * @param config                Simulator configuration
     * @param metricsProvider       Metrics provider
     * @param probeOutcomePolicy    Decides the outcome of the container probes
     */
    public ClusterSimulator(SimulatorConfig config, MetricsProvider metricsProvider, ProbeOutcomePolicy probeOutcomePolicy) {
        this.config = config;
        this.clock = new SimulatedClock(config.getStartTime(), config.getTickDuration());

        NameGenerator names = new NameGenerator(config.getRandomSeed());
        this.store = new ClusterStore(clock, names, config.getDefaultNodeCapacity());
        this.events = new EventRecorder(clock, config.getEventLogCapacity());

        ControllerContext context = new ControllerContext(store, clock, events, config, names, metricsProvider);

        this.storage = new StorageController(context);
        this.scheduler = new Scheduler(context, SchedulingStrategy.forName(config.getSchedulingStrategy()));
        this.nodeLifecycle = new NodeLifecycleController(context);
        this.podLifecycle = new PodLifecycleController(context, probeOutcomePolicy);
        this.deployments = new DeploymentController(context);
        this.workloadControllers = List.of(
                deployments,
                new ReplicaSetController(context),
                new StatefulSetController(context),
                new DaemonSetController(context),
                new CronJobController(context),
                new JobController(context));
        this.autoscaler = new HorizontalPodAutoscalerController(context, metricsFeed);
        this.garbageCollector = new GarbageCollector(context, metricsFeed);
        this.disruption = new DisruptionController(context);
        this.endpoints = new EndpointsController(context);

        this.meterRegistry = metricsProvider.meterRegistry();
        this.tickTimer = metricsProvider.timer(ControllerMetricsHolder.METRICS_PREFIX + "tick.duration", "The time one simulation tick takes", Tags.empty());
        for (String phase : POD_PHASES) {
            podGauges.put(phase, metricsProvider.gauge(ControllerMetricsHolder.METRICS_PREFIX + "pods", "Number of pods in the phase", Tags.of("phase", phase)));
        }

        LOGGER.info("Simulator created with {}", config);
    }

    //////////
    // Ticks
    //////////

    /**
     * Runs one tick: advances the clock and runs all controllers in their fixed order
     *
     * @throws InvariantViolationException When a controller broke an invariant of the cluster
     */
    public void tick() throws InvariantViolationException {
        long tick = clock.advance();
        LOGGER.debug("Tick {} started at {}", tick, clock.timestamp());

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            run(storage);
            run(scheduler);
            run(nodeLifecycle);
            run(podLifecycle);
            workloadControllers.forEach(this::run);
            run(autoscaler);
            run(garbageCollector);

            for (Controller controller : workloadControllers) {
                controller.updateStatus();
            }
            disruption.reconcile();
            endpoints.reconcile();
        } catch (InvariantViolationException e) {
            LOGGER.error("Tick {} failed with an invariant violation", tick, e);
            throw e;
        } finally {
            sample.stop(tickTimer);
        }

        updatePodGauges();
        LOGGER.debug("Tick {} finished", tick);
    }

    /**
     * Runs several ticks
     *
     * @param ticks     Number of ticks
     *
     * @throws InvariantViolationException When a controller broke an invariant of the cluster
     */
    public void tick(int ticks) throws InvariantViolationException {
        if (ticks < 0) {
            throw new IllegalArgumentException("The number of ticks cannot be negative");
        }

        for (int i = 0; i < ticks; i++) {
            tick();
        }
    }

    private void run(Controller controller) {
        LOGGER.debug("Running {} in tick {}", controller.name(), clock.tick());
        controller.reconcile();
    }

    private void updatePodGauges() {
        podGauges.values().forEach(gauge -> gauge.set(0));

        for (Pod pod : store.list(Pod.class)) {
            AtomicInteger gauge = podGauges.get(PodUtils.phase(pod));
            if (gauge != null) {
                gauge.incrementAndGet();
            }
        }
    }

    //////////
    // Mutations
    //////////

    /**
     * Creates a resource
     *
     * @param resource  Resource
     * @param <T>       Type of the resource
     *
     * @return  Copy of the created resource
     *
     * @throws InvalidResourceException When the resource is invalid or exists already
     */
    public <T extends HasMetadata> T create(T resource) throws InvalidResourceException {
        T created = store.create(resource);
        LOGGER.info("Created {} {}", ResourceKind.forResource(created).kind(), NamespaceAndName.of(created));
        return ModelUtils.deepCopy(created);
    }

    /**
     * Replaces the desired state of a resource
     *
     * @param resource  Resource
     * @param <T>       Type of the resource
     *
     * @return  Copy of the updated resource
     *
     * @throws InvalidResourceException When the resource is invalid or does not exist
     */
    public <T extends HasMetadata> T update(T resource) throws InvalidResourceException {
        T updated = store.update(resource);
        LOGGER.info("Updated {} {}", ResourceKind.forResource(updated).kind(), NamespaceAndName.of(updated));
        return ModelUtils.deepCopy(updated);
    }

    /**
     * Deletes a resource. The resource is marked for deletion and removed by the garbage collector once its
     * dependents are gone.
     *
     * @param kind      Kind
     * @param namespace Namespace
     * @param name      Name
     *
     * @throws InvalidResourceException When the resource does not exist
     */
    public void delete(ResourceKind kind, String namespace, String name) throws InvalidResourceException {
        if (store.markDeleted(kind, namespace, name)) {
            LOGGER.info("Deleting {} {}", kind.kind(), new NamespaceAndName(namespace, name));
        }
    }

    /**
     * Changes the number of replicas of a Deployment, ReplicaSet or StatefulSet
     *
     * @param kind      Kind of the workload
     * @param namespace Namespace
     * @param name      Name
     * @param replicas  New number of replicas
     *
     * @throws InvalidResourceException When the workload does not exist, cannot be scaled or the number is negative
     */
    public void scale(ResourceKind kind, String namespace, String name, int replicas) throws InvalidResourceException {
        if (replicas < 0) {
            throw new InvalidResourceException("The number of replicas cannot be negative");
        }

        HasMetadata resource = existing(kind, namespace, name);

        if (resource instanceof Deployment deployment) {
            deployment.getSpec().setReplicas(replicas);
        } else if (resource instanceof ReplicaSet rs) {
            rs.getSpec().setReplicas(replicas);
        } else if (resource instanceof StatefulSet sts) {
            sts.getSpec().setReplicas(replicas);
        } else {
            throw new InvalidResourceException(kind.kind() + " cannot be scaled");
        }

        store.touch(resource, true);
        LOGGER.info("Scaled {} {} to {} replicas", kind.kind(), NamespaceAndName.of(resource), replicas);
    }

    /**
     * Changes the image of the first container of a Deployment, which starts a rollout
     *
     * @param namespace     Namespace
     * @param deployment    Name of the Deployment
     * @param image         New image
     *
     * @throws InvalidResourceException When the Deployment does not exist or the image is empty
     */
    public void setImage(String namespace, String deployment, String image) throws InvalidResourceException {
        if (image == null || image.isBlank()) {
            throw new InvalidResourceException("The image cannot be empty");
        }

        Deployment current = (Deployment) existing(ResourceKind.DEPLOYMENT, namespace, deployment);
        Container container = current.getSpec().getTemplate().getSpec().getContainers().get(0);

        if (!image.equals(container.getImage())) {
            container.setImage(image);
            store.touch(current, true);
            LOGGER.info("Deployment {} image set to {}", NamespaceAndName.of(current), image);
        }
    }

    /**
     * Rolls a Deployment back to its previous revision
     *
     * @param namespace     Namespace
     * @param deployment    Name of the Deployment
     *
     * @throws InvalidResourceException When the Deployment does not exist or has no previous revision
     */
    public void undo(String namespace, String deployment) throws InvalidResourceException {
        undo(namespace, deployment, null);
    }

    /**
     * Rolls a Deployment back to a given revision
     *
     * @param namespace     Namespace
     * @param deployment    Name of the Deployment
     * @param revision      Revision or null for the previous revision
     *
     * @throws InvalidResourceException When the Deployment or the revision does not exist
     */
    public void undo(String namespace, String deployment, Long revision) throws InvalidResourceException {
        deployments.undo((Deployment) existing(ResourceKind.DEPLOYMENT, namespace, deployment), revision);
    }

    /**
     * Adds a Ready node
     *
     * @param name      Name of the node
     * @param capacity  Maximal number of pods on the node
     *
     * @return  Copy of the created node
     *
     * @throws InvalidResourceException When the node exists already or the capacity is not positive
     */
    public Node addNode(String name, int capacity) throws InvalidResourceException {
        if (capacity <= 0) {
            throw new InvalidResourceException("Node capacity has to be positive");
        }

        return create(new NodeBuilder()
                .withNewMetadata()
                    .withName(name)
                .endMetadata()
                .withNewSpec()
                .endSpec()
                .withNewStatus()
                    .withCapacity(Map.of("pods", new Quantity(String.valueOf(capacity))))
                .endStatus()
                .build());
    }

    /**
     * Changes the readiness of a node
     *
     * @param name      Name of the node
     * @param ready     New readiness
     *
     * @throws InvalidResourceException When the node does not exist
     */
    public void setNodeReady(String name, boolean ready) throws InvalidResourceException {
        Node node = (Node) existing(ResourceKind.NODE, null, name);

        if (NodeEligibility.isReady(node) == ready) {
            return;
        }

        List<NodeCondition> conditions = new ArrayList<>();
        if (node.getStatus().getConditions() != null) {
            node.getStatus().getConditions().stream().filter(condition -> !"Ready".equals(condition.getType())).forEach(conditions::add);
        }

        conditions.add(new NodeConditionBuilder()
                .withType("Ready")
                .withStatus(ready ? "True" : "False")
                .withReason(ready ? "KubeletReady" : "NodeStatusUnknown")
                .withLastTransitionTime(clock.timestamp())
                .build());
        node.getStatus().setConditions(conditions);
        store.touch(node, false);

        LOGGER.info("Node {} is now {}", name, ready ? "Ready" : "NotReady");
    }

    /**
     * Adds or replaces a taint of a node
     *
     * @param name      Name of the node
     * @param key       Taint key
     * @param value     Taint value (may be null)
     * @param effect    NoSchedule, PreferNoSchedule or NoExecute
     *
     * @throws InvalidResourceException When the node does not exist or the taint is invalid
     */
    public void taint(String name, String key, String value, String effect) throws InvalidResourceException {
        if (key == null || key.isBlank()) {
            throw new InvalidResourceException("Taint key cannot be empty");
        } else if (!List.of(NodeEligibility.EFFECT_NO_SCHEDULE, NodeEligibility.EFFECT_PREFER_NO_SCHEDULE, NodeEligibility.EFFECT_NO_EXECUTE).contains(effect)) {
            throw new InvalidResourceException("Unsupported taint effect " + effect);
        }

        Node node = (Node) existing(ResourceKind.NODE, null, name);
        List<Taint> taints = new ArrayList<>(NodeEligibility.taints(node));
        taints.removeIf(taint -> key.equals(taint.getKey()) && effect.equals(taint.getEffect()));
        taints.add(new TaintBuilder().withKey(key).withValue(value).withEffect(effect).withTimeAdded(clock.timestamp()).build());

        node.getSpec().setTaints(taints);
        store.touch(node, true);
        LOGGER.info("Node {} tainted with {}={}:{}", name, key, value, effect);
    }

    /**
     * Removes taints of a node
     *
     * @param name      Name of the node
     * @param key       Taint key
     * @param effect    Effect of the removed taint or null to remove the key with all effects
     *
     * @throws InvalidResourceException When the node does not exist or has no such taint
     */
    public void untaint(String name, String key, String effect) throws InvalidResourceException {
        Node node = (Node) existing(ResourceKind.NODE, null, name);
        List<Taint> taints = new ArrayList<>(NodeEligibility.taints(node));

        if (!taints.removeIf(taint -> key.equals(taint.getKey()) && (effect == null || effect.equals(taint.getEffect())))) {
            throw new InvalidResourceException("Node " + name + " has no taint " + key);
        }

        node.getSpec().setTaints(taints);
        store.touch(node, true);
        LOGGER.info("Removed taint {} from node {}", key, name);
    }

    /**
     * Marks a node unschedulable
     *
     * @param name  Name of the node
     *
     * @throws InvalidResourceException When the node does not exist
     */
    public void cordon(String name) throws InvalidResourceException {
        disruption.cordon((Node) existing(ResourceKind.NODE, null, name), true);
    }

    /**
     * Marks a node schedulable again
     *
     * @param name  Name of the node
     *
     * @throws InvalidResourceException When the node does not exist
     */
    public void uncordon(String name) throws InvalidResourceException {
        disruption.cordon((Node) existing(ResourceKind.NODE, null, name), false);
    }

    /**
     * Makes a pod fail in the given way from the next tick on
     *
     * @param namespace Namespace
     * @param pod       Name of the pod
     * @param mode      Failure mode
     *
     * @throws InvalidResourceException When the pod does not exist
     */
    public void injectFailure(String namespace, String pod, FailureMode mode) throws InvalidResourceException {
        Objects.requireNonNull(mode, "Failure mode cannot be null");
        annotate(ResourceKind.POD, namespace, pod, Annotations.ANNO_FAILURE_MODE, mode.value());
    }

    /**
     * Removes an injected failure, so that the pod can recover
     *
     * @param namespace Namespace
     * @param pod       Name of the pod
     *
     * @throws InvalidResourceException When the pod does not exist
     */
    public void clearFailure(String namespace, String pod) throws InvalidResourceException {
        annotate(ResourceKind.POD, namespace, pod, Annotations.ANNO_FAILURE_MODE, null);
    }

    /**
     * Sets or removes an annotation of a resource. Annotations do not change the spec of the resource.
     *
     * @param kind      Kind
     * @param namespace Namespace
     * @param name      Name
     * @param key       Annotation key
     * @param value     Annotation value or null to remove the annotation
     *
     * @throws InvalidResourceException When the resource does not exist
     */
    public void annotate(ResourceKind kind, String namespace, String name, String key, String value) throws InvalidResourceException {
        HasMetadata resource = existing(kind, namespace, name);
        Annotations.annotate(resource, key, value);
        store.touch(resource, false);
    }

    //////////
    // Operations
    //////////

    /**
     * Evicts a pod unless a PodDisruptionBudget forbids it
     *
     * @param namespace Namespace
     * @param pod       Name of the pod
     *
     * @return  Result of the eviction
     *
     * @throws InvalidResourceException When the pod does not exist
     */
    public EvictionResult evict(String namespace, String pod) throws InvalidResourceException {
        return disruption.evict(namespace, pod);
    }

    /**
     * Cordons a node and evicts its pods, respecting the PodDisruptionBudgets
     *
     * @param node  Name of the node
     *
     * @return  Evicted and blocked pods
     *
     * @throws InvalidResourceException When the node does not exist
     */
    public DrainResult drain(String node) throws InvalidResourceException {
        return disruption.drain(node);
    }

    /**
     * Reports the CPU utilization of a pod. The last reported value is used by the autoscalers.
     *
     * @param namespace Namespace
     * @param pod       Name of the pod
     * @param percent   Utilization in percent of the requested CPU
     *
     * @throws InvalidResourceException When the pod does not exist or the value is negative
     */
    public void reportCpuUtilization(String namespace, String pod, int percent) throws InvalidResourceException {
        HasMetadata resource = existing(ResourceKind.POD, namespace, pod);
        metricsFeed.report(resource.getMetadata().getUid(), percent);
    }

    //////////
    // Queries
    //////////

    /**
     * @param kind      Kind
     * @param namespace Namespace
     * @param name      Name
     * @param <T>       Type of the resource
     *
     * @return  Copy of the resource or null when it does not exist
     */
    @SuppressWarnings("unchecked")
    public <T extends HasMetadata> T get(ResourceKind kind, String namespace, String name) {
        HasMetadata resource = store.get(kind, namespace, name);
        return resource != null ? (T) ModelUtils.deepCopy(resource) : null;
    }

    /**
     * @param kind  Kind
     * @param <T>   Type of the resources
     *
     * @return  Copies of all resources of the kind in creation order
     */
    @SuppressWarnings("unchecked")
    public <T extends HasMetadata> List<T> list(ResourceKind kind) {
        return store.list(kind).stream().map(resource -> (T) ModelUtils.deepCopy(resource)).toList();
    }

    /**
     * @param namespace Namespace of the Service
     * @param service   Name of the Service
     *
     * @return  Names of the pods which back the Service
     */
    public List<String> endpoints(String namespace, String service) {
        return endpoints.endpointNames(namespaceOrDefault(namespace), service);
    }

    /**
     * @param namespace Namespace of the Service
     * @param service   Name of the Service
     *
     * @return  Endpoints object of the Service or null when the Service is unknown
     */
    public Endpoints endpointsObject(String namespace, String service) {
        return endpoints.endpoints(namespaceOrDefault(namespace), service);
    }

    /**
     * @return  The event log, oldest first
     */
    public List<Event> events() {
        return events.events();
    }

    /**
     * @param reason    Event reason
     *
     * @return  Events with the reason, oldest first
     */
    public List<Event> events(String reason) {
        return events.events(reason);
    }

    /**
     * @return  The number of ticks run so far
     */
    public long currentTick() {
        return clock.tick();
    }

    /**
     * @return  The current simulated time
     */
    public Instant now() {
        return clock.now();
    }

    /**
     * @return  The configuration of this simulator
     */
    public SimulatorConfig config() {
        return config;
    }

    private HasMetadata existing(ResourceKind kind, String namespace, String name) throws InvalidResourceException {
        HasMetadata resource = store.get(kind, namespace, name);

        if (resource == null) {
            throw new InvalidResourceException(kind.kind() + " " + (kind.isNamespaced() ? new NamespaceAndName(namespaceOrDefault(namespace), name) : name) + " not found");
        } else if (PodUtils.isTombstoned(resource)) {
            throw new InvalidResourceException(kind.kind() + " " + NamespaceAndName.of(resource) + " is being deleted");
        }

        return resource;
    }

    private static String namespaceOrDefault(String namespace) {
        return namespace == null || namespace.isEmpty() ? ClusterStore.DEFAULT_NAMESPACE : namespace;
    }
}
