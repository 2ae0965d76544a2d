/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Toleration;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetStatus;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.Util;
import io.kubesim.common.model.Labels;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.TemplateHash;
import io.kubesim.simulator.scheduler.NodeEligibility;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one pod of a DaemonSet on every eligible node. The pods are bound to their nodes directly, they do not go
 * through the scheduler. Template updates replace the pods node by node.
 */
public class DaemonSetController extends AbstractController<DaemonSet> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DaemonSetController.class);

    private static final IntOrString DEFAULT_MAX_UNAVAILABLE = new IntOrString(1);

    // DaemonSet UID and node name pairs for which the failed placement was reported
    private final Set<String> reportedPlacementFailures = new HashSet<>();

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public DaemonSetController(ControllerContext context) {
        super(DaemonSet.class, context);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, DaemonSet ds) {
        String revision = revision(ds);
        List<Node> eligible = eligibleNodes(ds);
        Set<String> eligibleNames = new HashSet<>();
        eligible.forEach(node -> eligibleNames.add(node.getMetadata().getName()));

        for (Pod pod : WorkloadUtils.controlledPods(store, ds)) {
            if (PodUtils.isFailed(pod) && store.markDeleted(pod)) {
                LOGGER.infoCr(reconciliation, "Failed pod {} will be replaced", pod.getMetadata().getName());
            }
        }

        // Keep one live pod per eligible node
        Map<String, Pod> podsByNode = new LinkedHashMap<>();
        for (Pod pod : WorkloadUtils.livePods(store, ds)) {
            String nodeName = pod.getSpec().getNodeName();

            if (nodeName == null || !eligibleNames.contains(nodeName)) {
                deletePod(reconciliation, ds, pod, "node " + nodeName + " is not eligible");
            } else if (podsByNode.containsKey(nodeName)) {
                deletePod(reconciliation, ds, pod, "duplicate pod on node " + nodeName);
            } else {
                podsByNode.put(nodeName, pod);
            }
        }

        if (!"OnDelete".equals(updateStrategyType(ds))) {
            rollingUpdate(reconciliation, ds, eligible, podsByNode, revision);
        }

        Map<String, Integer> allocated = NodeEligibility.allocatedPods(store);

        for (Node node : eligible) {
            String nodeName = node.getMetadata().getName();
            String placementKey = ds.getMetadata().getUid() + "/" + nodeName;

            if (podsByNode.containsKey(nodeName)) {
                continue;
            }

            if (allocated.getOrDefault(nodeName, 0) >= NodeEligibility.capacity(node, store.defaultNodeCapacity())) {
                if (reportedPlacementFailures.add(placementKey)) {
                    events.warning(ds, "FailedPlacement", "failed to place pod on \"" + nodeName + "\": Node didn't have enough resource: pods");
                }

                continue;
            }

            reportedPlacementFailures.remove(placementKey);
            createPod(reconciliation, ds, nodeName, revision);
            allocated.merge(nodeName, 1, Integer::sum);
        }
    }

    private void rollingUpdate(Reconciliation reconciliation, DaemonSet ds, List<Node> eligible, Map<String, Pod> podsByNode, String revision) {
        int maxUnavailable = Math.max(1, Util.scaledValueFromIntOrPercent(maxUnavailable(ds), eligible.size(), true));
        int unavailable = 0;

        for (Node node : eligible) {
            Pod pod = podsByNode.get(node.getMetadata().getName());

            if (pod == null || !PodUtils.isHealthy(pod)) {
                unavailable++;
            }
        }

        for (Node node : eligible) {
            Pod pod = podsByNode.get(node.getMetadata().getName());

            if (pod == null || revision.equals(revision(pod))) {
                continue;
            }

            if (!PodUtils.isHealthy(pod)) {
                // Outdated pods which are not available anyway can go right away
                deletePod(reconciliation, ds, pod, "update to revision " + revision);
                podsByNode.remove(node.getMetadata().getName());
            } else if (unavailable < maxUnavailable) {
                deletePod(reconciliation, ds, pod, "update to revision " + revision);
                podsByNode.remove(node.getMetadata().getName());
                unavailable++;
            }
        }
    }

    private List<Node> eligibleNodes(DaemonSet ds) {
        List<Toleration> tolerations = ds.getSpec().getTemplate().getSpec().getTolerations();

        return store.list(Node.class).stream()
                .filter(node -> !PodUtils.isTombstoned(node))
                .filter(node -> NodeEligibility.ineligibilityReason(tolerations, node) == null)
                .toList();
    }

    private void createPod(Reconciliation reconciliation, DaemonSet ds, String nodeName, String revision) {
        String namespace = ds.getMetadata().getNamespace();
        String name = WorkloadUtils.freePodName(store, context.names(), namespace, ds.getMetadata().getName());

        Pod pod = ModelUtils.podFromTemplate(ds.getSpec().getTemplate(), namespace, name, ds, Labels.EMPTY.with(Labels.CONTROLLER_REVISION_HASH_LABEL, revision));
        pod.getSpec().setNodeName(nodeName);

        Pod created = store.create(pod);
        PodUtils.setCondition(created, PodUtils.CONDITION_POD_SCHEDULED, true, null, null, clock.timestamp());

        LOGGER.infoCr(reconciliation, "Created pod {} on node {}", name, nodeName);
        events.normal(ds, "SuccessfulCreate", "Created pod: " + name);
    }

    private void deletePod(Reconciliation reconciliation, DaemonSet ds, Pod pod, String reason) {
        store.markDeleted(pod);
        LOGGER.infoCr(reconciliation, "Deleting pod {} ({})", pod.getMetadata().getName(), reason);
        events.normal(ds, "SuccessfulDelete", "Deleted pod: " + pod.getMetadata().getName());
    }

    @Override
    protected void updateStatus(DaemonSet ds) {
        String revision = revision(ds);
        Set<String> eligibleNames = new HashSet<>();
        eligibleNodes(ds).forEach(node -> eligibleNames.add(node.getMetadata().getName()));

        List<Pod> live = WorkloadUtils.livePods(store, ds);
        List<Pod> scheduled = live.stream().filter(pod -> eligibleNames.contains(pod.getSpec().getNodeName())).toList();
        int available = WorkloadUtils.healthy(scheduled);

        DaemonSetStatus status = new DaemonSetStatus();
        status.setDesiredNumberScheduled(eligibleNames.size());
        status.setCurrentNumberScheduled(scheduled.size());
        status.setNumberMisscheduled(live.size() - scheduled.size());
        status.setNumberReady((int) scheduled.stream().filter(PodUtils::isReady).count());
        status.setNumberAvailable(available);
        status.setNumberUnavailable(Math.max(0, eligibleNames.size() - available));
        status.setUpdatedNumberScheduled((int) scheduled.stream().filter(pod -> revision.equals(revision(pod))).count());
        status.setObservedGeneration(ds.getMetadata().getGeneration());

        if (!Objects.equals(status, ds.getStatus())) {
            ds.setStatus(status);
            store.touch(ds, false);
        }
    }

    private static String revision(DaemonSet ds) {
        return TemplateHash.of(ds.getSpec().getTemplate());
    }

    private static String revision(Pod pod) {
        return Labels.fromResource(pod).toMap().get(Labels.CONTROLLER_REVISION_HASH_LABEL);
    }

    private static String updateStrategyType(DaemonSet ds) {
        return ds.getSpec().getUpdateStrategy() != null && ds.getSpec().getUpdateStrategy().getType() != null
                ? ds.getSpec().getUpdateStrategy().getType() : "RollingUpdate";
    }

    private static IntOrString maxUnavailable(DaemonSet ds) {
        if (ds.getSpec().getUpdateStrategy() != null
                && ds.getSpec().getUpdateStrategy().getRollingUpdate() != null
                && ds.getSpec().getUpdateStrategy().getRollingUpdate().getMaxUnavailable() != null) {
            return ds.getSpec().getUpdateStrategy().getRollingUpdate().getMaxUnavailable();
        }

        return DEFAULT_MAX_UNAVAILABLE;
    }
}
