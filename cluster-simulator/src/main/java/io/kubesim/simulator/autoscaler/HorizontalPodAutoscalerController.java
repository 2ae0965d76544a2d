/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.autoscaler;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.autoscaling.v1.CrossVersionObjectReference;
import io.fabric8.kubernetes.api.model.autoscaling.v1.HorizontalPodAutoscaler;
import io.fabric8.kubernetes.api.model.autoscaling.v1.HorizontalPodAutoscalerStatus;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.simulator.controller.AbstractController;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.controller.WorkloadUtils;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scales Deployments based on the average CPU utilization of their pods. The desired replica count is
 * {@code ceil(current * utilization / target)} clamped to the HPA range. Scaling happens at most once per
 * stabilization window.
 */
public class HorizontalPodAutoscalerController extends AbstractController<HorizontalPodAutoscaler> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(HorizontalPodAutoscalerController.class);

    private static final int DEFAULT_TARGET_CPU_UTILIZATION = 80;

    private final MetricsFeed metricsFeed;
    private final int stabilizationTicks;
    // Last reported target resolution failure per HPA UID
    private final Map<String, String> reportedFailures = new HashMap<>();

    /**
     * Constructs the controller
     *
     * @param context       Controller context
     * @param metricsFeed   CPU utilization samples
     */
    public HorizontalPodAutoscalerController(ControllerContext context, MetricsFeed metricsFeed) {
        super(HorizontalPodAutoscaler.class, context);
        this.metricsFeed = metricsFeed;
        this.stabilizationTicks = context.config().getHpaStabilizationTicks();
    }

    @Override
    public void reconcile() {
        Set<String> hpaUids = store.list(HorizontalPodAutoscaler.class).stream()
                .filter(hpa -> !PodUtils.isTombstoned(hpa))
                .map(hpa -> hpa.getMetadata().getUid())
                .collect(Collectors.toSet());
        reportedFailures.keySet().retainAll(hpaUids);

        super.reconcile();
    }

    /**
     * @return  Number of HPAs whose target resolution failure is currently remembered
     */
    /* test */ int reportedFailureCount() {
        return reportedFailures.size();
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, HorizontalPodAutoscaler hpa) {
        CrossVersionObjectReference target = hpa.getSpec().getScaleTargetRef();
        String namespace = hpa.getMetadata().getNamespace();

        if (!ResourceKind.DEPLOYMENT.kind().equals(target.getKind())) {
            failedGetScale(reconciliation, hpa, "the HPA controller was unable to get the target's current scale: unsupported kind " + target.getKind());
            return;
        }

        Deployment deployment = store.get(Deployment.class, namespace, target.getName());
        if (deployment == null || PodUtils.isTombstoned(deployment)) {
            failedGetScale(reconciliation, hpa, "the HPA controller was unable to get the target's current scale: deployments.apps \"" + target.getName() + "\" not found");
            return;
        }

        reportedFailures.remove(hpa.getMetadata().getUid());

        HorizontalPodAutoscalerStatus previous = hpa.getStatus() != null ? hpa.getStatus() : new HorizontalPodAutoscalerStatus();
        HorizontalPodAutoscalerStatus status = new HorizontalPodAutoscalerStatus();
        status.setLastScaleTime(previous.getLastScaleTime());
        status.setObservedGeneration(hpa.getMetadata().getGeneration());

        int current = WorkloadUtils.replicas(deployment.getSpec().getReplicas());
        int min = hpa.getSpec().getMinReplicas() != null ? hpa.getSpec().getMinReplicas() : 1;
        int max = hpa.getSpec().getMaxReplicas();
        Double utilization = averageUtilization(deployment);

        int desired;
        if (utilization == null) {
            desired = clamp(current, min, max);
        } else {
            int targetUtilization = hpa.getSpec().getTargetCPUUtilizationPercentage() != null
                    ? hpa.getSpec().getTargetCPUUtilizationPercentage() : DEFAULT_TARGET_CPU_UTILIZATION;
            int proposed = (int) Math.ceil(current * utilization / targetUtilization);
            desired = clamp(proposed, min, max);
        }

        status.setCurrentCPUUtilizationPercentage(utilization != null ? (int) Math.round(utilization) : null);
        status.setCurrentReplicas(current);
        status.setDesiredReplicas(desired);

        if (desired != current && isStabilized(previous)) {
            deployment.getSpec().setReplicas(desired);
            store.touch(deployment, true);
            status.setLastScaleTime(clock.timestamp());

            String reason = utilization == null
                    ? "replica count outside of the allowed range"
                    : "cpu resource utilization (percentage of request) " + (desired > current ? "above" : "below") + " target";
            LOGGER.infoCr(reconciliation, "Rescaling Deployment {} from {} to {} ({})", target.getName(), current, desired, reason);
            events.normal(hpa, "SuccessfulRescale", "New size: " + desired + "; reason: " + reason);
        }

        if (!Objects.equals(previous, status)) {
            hpa.setStatus(status);
            store.touch(hpa, false);
        }
    }

    private boolean isStabilized(HorizontalPodAutoscalerStatus status) {
        return status.getLastScaleTime() == null
                || clock.tick() - clock.tickOf(status.getLastScaleTime()) >= stabilizationTicks;
    }

    private Double averageUtilization(Deployment deployment) {
        List<Pod> pods = new ArrayList<>();

        for (ReplicaSet rs : store.dependents(deployment, ReplicaSet.class)) {
            if (ModelUtils.isControlledBy(rs, deployment) && !PodUtils.isTombstoned(rs)) {
                pods.addAll(WorkloadUtils.livePods(store, rs));
            }
        }

        int sum = 0;
        int count = 0;

        for (Pod pod : pods) {
            Integer sample = metricsFeed.sample(pod.getMetadata().getUid());

            if (sample != null && PodUtils.isHealthy(pod)) {
                sum += sample;
                count++;
            }
        }

        return count == 0 ? null : (double) sum / count;
    }

    private void failedGetScale(Reconciliation reconciliation, HorizontalPodAutoscaler hpa, String message) {
        String previous = reportedFailures.put(hpa.getMetadata().getUid(), message);

        if (!message.equals(previous)) {
            LOGGER.warnCr(reconciliation, message);
            events.warning(hpa, "FailedGetScale", message);
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
