/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.disruption;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudget;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudgetStatus;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.Util;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.controller.AbstractController;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.controller.WorkloadUtils;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Guards voluntary disruptions with PodDisruptionBudgets. Evictions are refused when they would take the number of
 * healthy pods selected by a budget below its desired healthy count. The regular reconciliation recomputes the
 * budget status.
 */
public class DisruptionController extends AbstractController<PodDisruptionBudget> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DisruptionController.class);

    /**
     * Condition type reporting whether disruptions are allowed
     */
    public static final String CONDITION_DISRUPTION_ALLOWED = "DisruptionAllowed";

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public DisruptionController(ControllerContext context) {
        super(PodDisruptionBudget.class, context);
    }

    /**
     * Tries to evict a pod
     *
     * @param namespace Namespace of the pod
     * @param podName   Name of the pod
     *
     * @return  Result of the eviction
     *
     * @throws InvalidResourceException When the pod does not exist
     */
    public EvictionResult evict(String namespace, String podName) throws InvalidResourceException {
        Pod pod = store.get(Pod.class, namespace, podName);

        if (pod == null) {
            throw new InvalidResourceException("Pod " + new NamespaceAndName(namespace, podName) + " not found");
        }

        return evict(pod);
    }

    private EvictionResult evict(Pod pod) {
        String name = pod.getMetadata().getName();

        if (PodUtils.isTombstoned(pod)) {
            return new EvictionResult(name, true, null, "Pod is already being deleted");
        }

        for (PodDisruptionBudget pdb : store.list(PodDisruptionBudget.class, pod.getMetadata().getNamespace())) {
            if (PodUtils.isTombstoned(pdb) || !Labels.matchesSelector(pdb.getSpec().getSelector(), pod.getMetadata().getLabels())) {
                continue;
            }

            Budget budget = budget(pdb);
            int healthyAfter = budget.currentHealthy() - (PodUtils.isHealthy(pod) ? 1 : 0);

            if (healthyAfter < budget.desiredHealthy()) {
                String message = "Cannot evict pod as it would violate the pod's disruption budget " + NamespaceAndName.of(pdb);
                LOGGER.info("Eviction of pod {} refused: {} healthy pods would remain, {} are required by {}",
                        NamespaceAndName.of(pod), healthyAfter, budget.desiredHealthy(), NamespaceAndName.of(pdb));
                events.warning(pod, "EvictionBlocked", message);
                return new EvictionResult(name, false, pdb.getMetadata().getName(), message);
            }
        }

        store.markDeleted(pod);
        LOGGER.info("Evicted pod {}", NamespaceAndName.of(pod));
        events.normal(pod, "Evicted", "Evicted pod " + NamespaceAndName.of(pod));
        return new EvictionResult(name, true, null, "Evicted");
    }

    /**
     * Cordons a node and evicts its pods. DaemonSet pods are ignored. Pods whose eviction is refused are reported and
     * left running.
     *
     * @param nodeName  Name of the node
     *
     * @return  Result of the drain
     *
     * @throws InvalidResourceException When the node does not exist
     */
    public DrainResult drain(String nodeName) throws InvalidResourceException {
        Node node = store.get(Node.class, null, nodeName);

        if (node == null) {
            throw new InvalidResourceException("Node " + nodeName + " not found");
        }

        cordon(node, true);

        List<String> evicted = new ArrayList<>();
        List<String> blocked = new ArrayList<>();

        for (Pod pod : store.list(Pod.class)) {
            if (!nodeName.equals(pod.getSpec().getNodeName())
                    || !PodUtils.isLive(pod)
                    || ModelUtils.isControlledByKind(pod, ResourceKind.DAEMON_SET)) {
                continue;
            }

            EvictionResult result = evict(pod);
            if (result.evicted()) {
                evicted.add(result.pod());
            } else {
                blocked.add(result.pod());
            }
        }

        LOGGER.info("Drained node {}: {} pods evicted, {} blocked", nodeName, evicted.size(), blocked.size());
        return new DrainResult(nodeName, List.copyOf(evicted), List.copyOf(blocked));
    }

    /**
     * Marks a node as (un)schedulable
     *
     * @param node          The live node
     * @param unschedulable True to cordon, false to uncordon
     */
    public void cordon(Node node, boolean unschedulable) {
        if (unschedulable == Boolean.TRUE.equals(node.getSpec().getUnschedulable())) {
            return;
        }

        node.getSpec().setUnschedulable(unschedulable);
        store.touch(node, true);

        String status = unschedulable ? "NodeNotSchedulable" : "NodeSchedulable";
        events.normal(node, status, "Node " + node.getMetadata().getName() + " status is now: " + status);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, PodDisruptionBudget pdb) {
        Budget budget = budget(pdb);
        int disruptionsAllowed = Math.max(0, budget.currentHealthy() - budget.desiredHealthy());

        PodDisruptionBudgetStatus previous = pdb.getStatus();
        PodDisruptionBudgetStatus status = new PodDisruptionBudgetStatus();
        status.setCurrentHealthy(budget.currentHealthy());
        status.setDesiredHealthy(budget.desiredHealthy());
        status.setExpectedPods(budget.expectedPods());
        status.setDisruptionsAllowed(disruptionsAllowed);
        status.setObservedGeneration(pdb.getMetadata().getGeneration());
        status.setConditions(List.of(disruptionAllowedCondition(previous, disruptionsAllowed > 0)));

        if (!Objects.equals(previous, status)) {
            LOGGER.debugCr(reconciliation, "Budget status: {} healthy, {} desired, {} disruptions allowed",
                    budget.currentHealthy(), budget.desiredHealthy(), disruptionsAllowed);
            pdb.setStatus(status);
            store.touch(pdb, false);
        }
    }

    private Condition disruptionAllowedCondition(PodDisruptionBudgetStatus previous, boolean allowed) {
        String status = allowed ? "True" : "False";
        Condition existing = previous != null && previous.getConditions() != null
                ? previous.getConditions().stream().filter(condition -> CONDITION_DISRUPTION_ALLOWED.equals(condition.getType())).findFirst().orElse(null)
                : null;

        return new ConditionBuilder()
                .withType(CONDITION_DISRUPTION_ALLOWED)
                .withStatus(status)
                .withReason(allowed ? "SufficientPods" : "InsufficientPods")
                .withLastTransitionTime(existing != null && status.equals(existing.getStatus()) ? existing.getLastTransitionTime() : clock.timestamp())
                .build();
    }

    /**
     * Evaluates a budget against the current pods
     *
     * @param pdb   The budget
     *
     * @return  Healthy, desired healthy and expected pod counts
     */
    Budget budget(PodDisruptionBudget pdb) {
        List<Pod> selected = store.list(Pod.class, pdb.getMetadata().getNamespace()).stream()
                .filter(PodUtils::isLive)
                .filter(pod -> Labels.matchesSelector(pdb.getSpec().getSelector(), pod.getMetadata().getLabels()))
                .toList();

        int healthy = WorkloadUtils.healthy(selected);
        int expected = expectedPods(selected);

        IntOrString minAvailable = pdb.getSpec().getMinAvailable();
        int desiredHealthy;

        if (minAvailable != null) {
            desiredHealthy = Util.scaledValueFromIntOrPercent(minAvailable, expected, true);
        } else {
            desiredHealthy = Math.max(0, expected - Util.scaledValueFromIntOrPercent(pdb.getSpec().getMaxUnavailable(), expected, true));
        }

        return new Budget(healthy, desiredHealthy, expected);
    }

    /**
     * The expected count is the desired scale of the controllers of the selected pods. Pods without a scalable
     * controller count themselves.
     */
    private int expectedPods(List<Pod> selected) {
        Set<String> countedOwners = new HashSet<>();
        int expected = 0;

        for (Pod pod : selected) {
            OwnerReference reference = ModelUtils.controllerOf(pod);
            HasMetadata owner = reference != null ? store.getByUid(reference.getUid()) : null;

            if (owner instanceof ReplicaSet rs) {
                OwnerReference rsReference = ModelUtils.controllerOf(rs);
                HasMetadata rsOwner = rsReference != null ? store.getByUid(rsReference.getUid()) : null;

                if (rsOwner instanceof Deployment deployment) {
                    if (countedOwners.add(deployment.getMetadata().getUid())) {
                        expected += WorkloadUtils.replicas(deployment.getSpec().getReplicas());
                    }
                } else if (countedOwners.add(rs.getMetadata().getUid())) {
                    expected += WorkloadUtils.replicas(rs.getSpec().getReplicas());
                }
            } else if (owner instanceof StatefulSet sts) {
                if (countedOwners.add(sts.getMetadata().getUid())) {
                    expected += WorkloadUtils.replicas(sts.getSpec().getReplicas());
                }
            } else {
                expected++;
            }
        }

        return expected;
    }

    /**
     * Evaluated budget
     *
     * @param currentHealthy    Healthy selected pods
     * @param desiredHealthy    Minimal number of healthy pods
     * @param expectedPods      Expected number of selected pods
     */
    record Budget(int currentHealthy, int desiredHealthy, int expectedPods) { }
}
