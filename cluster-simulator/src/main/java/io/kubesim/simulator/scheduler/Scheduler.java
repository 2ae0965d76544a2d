/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.metrics.ControllerMetricsHolder;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.controller.Controller;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.event.EventRecorder;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.storage.StorageController;
import io.kubesim.simulator.store.ClusterStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Binds pending pods to nodes. Pods are taken in creation order, so that earlier pods get the free capacity first.
 * A pod which cannot be placed stays Pending with the PodScheduled condition explaining why, and it is retried in
 * the next tick. Pods mounting a claim which is not bound are not placed until the claim is bound. Bound pods are
 * never moved.
 */
public class Scheduler implements Controller {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Scheduler.class);

    /**
     * Reason used in the PodScheduled condition of pods which cannot be placed
     */
    public static final String REASON_UNSCHEDULABLE = "Unschedulable";

    private final ClusterStore store;
    private final SimulatedClock clock;
    private final EventRecorder events;
    private final SchedulingStrategy strategy;
    private final ControllerMetricsHolder metrics;

    /**
     * Constructs the scheduler
     *
     * @param context   Controller context
     * @param strategy  Strategy choosing among the eligible nodes
     */
    public Scheduler(ControllerContext context, SchedulingStrategy strategy) {
        this.store = context.store();
        this.clock = context.clock();
        this.events = context.events();
        this.strategy = strategy;
        this.metrics = new ControllerMetricsHolder(ResourceKind.POD.kind(), context.metrics());
    }

    @Override
    public String name() {
        return "Scheduler";
    }

    @Override
    public void reconcile() {
        List<Node> nodes = store.list(Node.class).stream().filter(node -> !PodUtils.isTombstoned(node)).toList();
        Map<String, Integer> allocated = NodeEligibility.allocatedPods(store);

        for (Pod pod : store.list(Pod.class)) {
            if (pod.getSpec().getNodeName() != null || !PodUtils.isLive(pod)) {
                continue;
            }

            Reconciliation reconciliation = Reconciliation.forTick(clock.tick(), "Scheduler", pod.getMetadata().getNamespace(), pod.getMetadata().getName());
            metrics.reconciliationsCounter(pod.getMetadata().getNamespace()).increment();

            String unboundClaim = StorageController.unboundClaim(store, pod);
            if (unboundClaim != null) {
                markUnschedulable(reconciliation, pod, "persistentvolumeclaim \"" + unboundClaim + "\" not bound");
                metrics.failedReconciliationsCounter(pod.getMetadata().getNamespace()).increment();
                continue;
            }

            schedule(reconciliation, pod, nodes, allocated);
        }
    }

    private void schedule(Reconciliation reconciliation, Pod pod, List<Node> nodes, Map<String, Integer> allocated) {
        List<Node> eligible = new ArrayList<>();
        Map<String, Integer> reasons = new TreeMap<>();

        for (Node node : nodes) {
            String reason = NodeEligibility.ineligibilityReason(pod.getSpec().getTolerations(), node);

            if (reason == null
                    && allocated.getOrDefault(node.getMetadata().getName(), 0) >= NodeEligibility.capacity(node, store.defaultNodeCapacity())) {
                reason = NodeEligibility.REASON_TOO_MANY_PODS;
            }

            if (reason == null) {
                eligible.add(node);
            } else {
                reasons.merge(reason, 1, Integer::sum);
            }
        }

        if (eligible.isEmpty()) {
            markUnschedulable(reconciliation, pod, failureMessage(nodes.size(), reasons));
            metrics.failedReconciliationsCounter(pod.getMetadata().getNamespace()).increment();
        } else {
            Node node = strategy.selectNode(pod, eligible, allocated);
            bind(reconciliation, pod, node);
            allocated.merge(node.getMetadata().getName(), 1, Integer::sum);
            metrics.successfulReconciliationsCounter(pod.getMetadata().getNamespace()).increment();
        }
    }

    private void bind(Reconciliation reconciliation, Pod pod, Node node) {
        String nodeName = node.getMetadata().getName();

        pod.getSpec().setNodeName(nodeName);
        PodUtils.setCondition(pod, PodUtils.CONDITION_POD_SCHEDULED, true, null, null, clock.timestamp());
        store.touch(pod, false);

        LOGGER.debugCr(reconciliation, "Pod bound to node {} using the {} strategy", nodeName, strategy.getName());
        events.normal(pod, "Scheduled", "Successfully assigned " + pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName() + " to " + nodeName);
    }

    private void markUnschedulable(Reconciliation reconciliation, Pod pod, String message) {
        PodCondition existing = PodUtils.condition(pod, PodUtils.CONDITION_POD_SCHEDULED);
        boolean sameMessage = existing != null && Objects.equals(existing.getMessage(), message);

        PodUtils.setCondition(pod, PodUtils.CONDITION_POD_SCHEDULED, false, REASON_UNSCHEDULABLE, message, clock.timestamp());

        if (!sameMessage) {
            store.touch(pod, false);
            LOGGER.debugCr(reconciliation, "Pod cannot be scheduled: {}", message);
            events.warning(pod, "FailedScheduling", message);
        }
    }

    /**
     * Builds the message explaining why a pod cannot be scheduled
     *
     * @param nodeCount     Number of nodes in the cluster
     * @param reasons       Number of nodes per ineligibility reason
     *
     * @return  Message in the format used by the Kubernetes scheduler
     */
    static String failureMessage(int nodeCount, Map<String, Integer> reasons) {
        if (nodeCount == 0) {
            return "no nodes available to schedule pods";
        }

        return "0/" + nodeCount + " nodes are available: "
                + reasons.entrySet().stream()
                    .map(entry -> entry.getValue() + " " + entry.getKey())
                    .collect(Collectors.joining(", "))
                + ".";
    }
}
