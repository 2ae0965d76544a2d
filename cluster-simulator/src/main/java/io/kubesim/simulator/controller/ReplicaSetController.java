/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetStatus;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.Labels;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the number of live pods controlled by a ReplicaSet equal to its desired replicas. Failed pods do not count:
 * they are tombstoned and replaced.
 */
public class ReplicaSetController extends AbstractController<ReplicaSet> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ReplicaSetController.class);

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public ReplicaSetController(ControllerContext context) {
        super(ReplicaSet.class, context);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, ReplicaSet replicaSet) {
        adoptOrphans(reconciliation, replicaSet);

        for (Pod pod : WorkloadUtils.controlledPods(store, replicaSet)) {
            if (PodUtils.isFailed(pod) && store.markDeleted(pod)) {
                LOGGER.infoCr(reconciliation, "Failed pod {} will be replaced", pod.getMetadata().getName());
            }
        }

        List<Pod> live = WorkloadUtils.livePods(store, replicaSet);
        int desired = WorkloadUtils.replicas(replicaSet.getSpec().getReplicas());
        int diff = desired - live.size();

        if (diff > 0) {
            LOGGER.debugCr(reconciliation, "Too few replicas, need {}, creating {}", desired, diff);

            for (int i = 0; i < diff; i++) {
                createPod(replicaSet);
            }
        } else if (diff < 0) {
            LOGGER.debugCr(reconciliation, "Too many replicas, need {}, deleting {}", desired, -diff);

            List<Pod> deletionOrder = live.stream()
                    .sorted(Comparator.comparing(PodUtils::isReady)
                            .thenComparing(Comparator.comparingLong(store::sequence).reversed()))
                    .limit(-diff)
                    .toList();

            for (Pod pod : deletionOrder) {
                store.markDeleted(pod);
                events.normal(replicaSet, "SuccessfulDelete", "Deleted pod: " + pod.getMetadata().getName());
            }
        }
    }

    private void adoptOrphans(Reconciliation reconciliation, ReplicaSet replicaSet) {
        LabelSelector selector = replicaSet.getSpec().getSelector();

        for (Pod pod : store.list(Pod.class, replicaSet.getMetadata().getNamespace())) {
            if (ModelUtils.controllerOf(pod) == null
                    && PodUtils.isLive(pod)
                    && Labels.matchesSelector(selector, pod.getMetadata().getLabels())) {
                store.setOwner(pod, replicaSet);
                LOGGER.infoCr(reconciliation, "Adopted orphan pod {}", pod.getMetadata().getName());
            }
        }
    }

    private void createPod(ReplicaSet replicaSet) {
        String namespace = replicaSet.getMetadata().getNamespace();
        String name = WorkloadUtils.freePodName(store, context.names(), namespace, replicaSet.getMetadata().getName());

        Pod pod = store.create(ModelUtils.podFromTemplate(replicaSet.getSpec().getTemplate(), namespace, name, replicaSet, Labels.EMPTY));
        events.normal(replicaSet, "SuccessfulCreate", "Created pod: " + pod.getMetadata().getName());
    }

    @Override
    protected void updateStatus(ReplicaSet replicaSet) {
        List<Pod> live = WorkloadUtils.livePods(store, replicaSet);
        Map<String, String> templateLabels = replicaSet.getSpec().getTemplate().getMetadata() != null
                ? replicaSet.getSpec().getTemplate().getMetadata().getLabels() : null;

        ReplicaSetStatus status = new ReplicaSetStatus();
        status.setReplicas(live.size());
        status.setFullyLabeledReplicas((int) live.stream()
                .filter(pod -> templateLabels == null || templateLabels.isEmpty() || Labels.matchesSelector(templateLabels, pod.getMetadata().getLabels()))
                .count());
        status.setReadyReplicas((int) live.stream().filter(PodUtils::isReady).count());
        status.setAvailableReplicas(WorkloadUtils.healthy(live));
        status.setObservedGeneration(replicaSet.getMetadata().getGeneration());

        if (!Objects.equals(status, replicaSet.getStatus())) {
            replicaSet.setStatus(status);
            store.touch(replicaSet, false);
        }
    }
}
