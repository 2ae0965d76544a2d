/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;
import io.kubesim.common.InvariantViolationException;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.TemplateHash;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Manages StatefulSet pods with stable identities. Pod {@code <name>-<i>} always stands for ordinal {@code i}. With
 * the OrderedReady policy pods are created in ascending and removed in descending ordinal order, one at a time.
 * Template updates replace the pods in place, starting from the highest ordinal.
 */
public class StatefulSetController extends AbstractController<StatefulSet> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StatefulSetController.class);

    private static final String PARALLEL = "Parallel";
    private static final String ON_DELETE = "OnDelete";

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public StatefulSetController(ControllerContext context) {
        super(StatefulSet.class, context);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, StatefulSet sts) {
        String namespace = sts.getMetadata().getNamespace();
        String updateRevision = updateRevision(sts);
        boolean ordered = !PARALLEL.equals(sts.getSpec().getPodManagementPolicy());
        int replicas = WorkloadUtils.replicas(sts.getSpec().getReplicas());

        List<Pod> controlled = WorkloadUtils.controlledPods(store, sts);
        for (Pod pod : controlled) {
            if (PodUtils.isFailed(pod) && store.markDeleted(pod)) {
                LOGGER.infoCr(reconciliation, "Failed pod {} will be recreated", pod.getMetadata().getName());
            }
        }

        Map<Integer, Pod> live = livePodsByOrdinal(sts, controlled);
        boolean terminating = controlled.stream().anyMatch(PodUtils::isTombstoned);

        // Create the missing ordinals, lowest first
        for (int ordinal = 0; ordinal < replicas; ordinal++) {
            if (live.containsKey(ordinal)) {
                continue;
            }

            String name = podName(sts, ordinal);
            if (store.get(Pod.class, namespace, name) != null) {
                // The previous pod with this identity was not removed yet
                if (ordered) {
                    break;
                }

                continue;
            }

            if (ordered && !lowerOrdinalsHealthy(live, ordinal)) {
                LOGGER.debugCr(reconciliation, "Waiting for the pods below ordinal {} to become ready", ordinal);
                break;
            }

            createPod(reconciliation, sts, ordinal, updateRevision);

            if (ordered) {
                return;
            }
        }

        // Remove the ordinals above the desired replicas, highest first
        List<Pod> excess = live.entrySet().stream()
                .filter(entry -> entry.getKey() >= replicas)
                .sorted(Map.Entry.<Integer, Pod>comparingByKey().reversed())
                .map(Map.Entry::getValue)
                .toList();

        if (!excess.isEmpty()) {
            if (ordered) {
                if (!terminating) {
                    deletePod(reconciliation, sts, excess.get(0), "scale down");
                }
            } else {
                excess.forEach(pod -> deletePod(reconciliation, sts, pod, "scale down"));
            }

            return;
        }

        if (!ON_DELETE.equals(updateStrategyType(sts)) && !terminating) {
            rollingUpdate(reconciliation, sts, live, replicas, updateRevision);
        }
    }

    private void rollingUpdate(Reconciliation reconciliation, StatefulSet sts, Map<Integer, Pod> live, int replicas, String updateRevision) {
        int partition = partition(sts);

        for (int ordinal = replicas - 1; ordinal >= partition; ordinal--) {
            Pod pod = live.get(ordinal);

            if (pod == null || updateRevision.equals(revision(pod))) {
                continue;
            }

            boolean othersHealthy = live.values().stream().filter(other -> other != pod).allMatch(PodUtils::isHealthy);

            if (othersHealthy && live.size() >= replicas) {
                deletePod(reconciliation, sts, pod, "update to revision " + updateRevision);
            } else {
                LOGGER.debugCr(reconciliation, "Waiting for all pods to become ready before updating pod {}", pod.getMetadata().getName());
            }

            return;
        }
    }

    private Map<Integer, Pod> livePodsByOrdinal(StatefulSet sts, List<Pod> controlled) {
        Map<Integer, Pod> live = new TreeMap<>();

        for (Pod pod : controlled) {
            if (!PodUtils.isLive(pod)) {
                continue;
            }

            int ordinal = ordinal(sts, pod);
            if (ordinal < 0) {
                continue;
            }

            Pod existing = live.put(ordinal, pod);
            if (existing != null) {
                throw new InvariantViolationException("StatefulSet " + NamespaceAndName.of(sts) + " has two live pods with ordinal " + ordinal
                        + ": " + existing.getMetadata().getName() + " and " + pod.getMetadata().getName());
            }
        }

        return live;
    }

    private static boolean lowerOrdinalsHealthy(Map<Integer, Pod> live, int ordinal) {
        for (int i = 0; i < ordinal; i++) {
            Pod pod = live.get(i);

            if (pod == null || !PodUtils.isHealthy(pod)) {
                return false;
            }
        }

        return true;
    }

    private void createPod(Reconciliation reconciliation, StatefulSet sts, int ordinal, String revision) {
        String name = podName(sts, ordinal);
        Labels extraLabels = Labels.EMPTY
                .with(Labels.CONTROLLER_REVISION_HASH_LABEL, revision)
                .with(Labels.STATEFULSET_POD_NAME_LABEL, name);

        Pod pod = ModelUtils.podFromTemplate(sts.getSpec().getTemplate(), sts.getMetadata().getNamespace(), name, sts, extraLabels);
        pod.getSpec().setHostname(name);
        pod.getSpec().setSubdomain(sts.getSpec().getServiceName());

        store.create(pod);
        LOGGER.infoCr(reconciliation, "Created pod {} with revision {}", name, revision);
        events.normal(sts, "SuccessfulCreate", "create Pod " + name + " in StatefulSet " + sts.getMetadata().getName() + " successful");
    }

    private void deletePod(Reconciliation reconciliation, StatefulSet sts, Pod pod, String reason) {
        store.markDeleted(pod);
        LOGGER.infoCr(reconciliation, "Deleting pod {} ({})", pod.getMetadata().getName(), reason);
        events.normal(sts, "SuccessfulDelete", "delete Pod " + pod.getMetadata().getName() + " in StatefulSet " + sts.getMetadata().getName() + " successful");
    }

    @Override
    protected void updateStatus(StatefulSet sts) {
        List<Pod> live = WorkloadUtils.livePods(store, sts);
        String updateRevision = updateRevision(sts);
        StatefulSetStatus previous = sts.getStatus() != null ? sts.getStatus() : new StatefulSetStatus();
        int updated = (int) live.stream().filter(pod -> updateRevision.equals(revision(pod))).count();

        String currentRevision = previous.getCurrentRevision();
        if (currentRevision == null || (updated == live.size() && updated == WorkloadUtils.replicas(sts.getSpec().getReplicas()))) {
            currentRevision = updateRevision;
        }

        String current = currentRevision;
        StatefulSetStatus status = new StatefulSetStatus();
        status.setReplicas(live.size());
        status.setReadyReplicas((int) live.stream().filter(PodUtils::isReady).count());
        status.setAvailableReplicas(WorkloadUtils.healthy(live));
        status.setCurrentReplicas((int) live.stream().filter(pod -> current.equals(revision(pod))).count());
        status.setUpdatedReplicas(updated);
        status.setCurrentRevision(currentRevision);
        status.setUpdateRevision(updateRevision);
        status.setObservedGeneration(sts.getMetadata().getGeneration());

        if (!Objects.equals(previous, status)) {
            sts.setStatus(status);
            store.touch(sts, false);
        }
    }

    /**
     * @param sts       StatefulSet
     * @param ordinal   Ordinal
     *
     * @return  Name of the pod with the given ordinal
     */
    public static String podName(StatefulSet sts, int ordinal) {
        return sts.getMetadata().getName() + "-" + ordinal;
    }

    private static int ordinal(StatefulSet sts, Pod pod) {
        String prefix = sts.getMetadata().getName() + "-";
        String name = pod.getMetadata().getName();

        if (!name.startsWith(prefix)) {
            return -1;
        }

        try {
            return Integer.parseInt(name.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String updateRevision(StatefulSet sts) {
        return sts.getMetadata().getName() + "-" + TemplateHash.of(sts.getSpec().getTemplate());
    }

    private static String revision(Pod pod) {
        return Labels.fromResource(pod).toMap().get(Labels.CONTROLLER_REVISION_HASH_LABEL);
    }

    private static String updateStrategyType(StatefulSet sts) {
        return sts.getSpec().getUpdateStrategy() != null && sts.getSpec().getUpdateStrategy().getType() != null
                ? sts.getSpec().getUpdateStrategy().getType() : "RollingUpdate";
    }

    private static int partition(StatefulSet sts) {
        if (sts.getSpec().getUpdateStrategy() != null
                && sts.getSpec().getUpdateStrategy().getRollingUpdate() != null
                && sts.getSpec().getUpdateStrategy().getRollingUpdate().getPartition() != null) {
            return sts.getSpec().getUpdateStrategy().getRollingUpdate().getPartition();
        }

        return 0;
    }
}
