/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentCondition;
import io.fabric8.kubernetes.api.model.apps.DeploymentConditionBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetBuilder;
import io.fabric8.kubernetes.api.model.apps.RollingUpdateDeployment;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.Util;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.model.Annotations;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.TemplateHash;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolls Deployments out through ReplicaSets. Each distinct pod template gets its own ReplicaSet named after the
 * template hash. The ReplicaSet matching the current template is the active one, all others are old and are scaled
 * down as the active one scales up, within the limits of the rollout strategy.
 */
public class DeploymentController extends AbstractController<Deployment> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DeploymentController.class);

    private static final String ROLLING_UPDATE = "RollingUpdate";
    private static final String RECREATE = "Recreate";
    private static final IntOrString DEFAULT_MAX_SURGE = new IntOrString("25%");
    private static final IntOrString DEFAULT_MAX_UNAVAILABLE = new IntOrString("25%");
    private static final int DEFAULT_REVISION_HISTORY_LIMIT = 10;

    /**
     * Available condition type
     */
    public static final String CONDITION_AVAILABLE = "Available";
    /**
     * Progressing condition type
     */
    public static final String CONDITION_PROGRESSING = "Progressing";

    static final String REASON_NEW_RS_CREATED = "NewReplicaSetCreated";
    static final String REASON_RS_UPDATED = "ReplicaSetUpdated";
    static final String REASON_NEW_RS_AVAILABLE = "NewReplicaSetAvailable";
    static final String REASON_PROGRESS_DEADLINE_EXCEEDED = "ProgressDeadlineExceeded";
    static final String REASON_PAUSED = "DeploymentPaused";

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public DeploymentController(ControllerContext context) {
        super(Deployment.class, context);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, Deployment deployment) {
        String hash = TemplateHash.of(deployment.getSpec().getTemplate());
        List<ReplicaSet> owned = ownedReplicaSets(deployment);
        ReplicaSet current = owned.stream().filter(rs -> hash.equals(templateHash(rs))).findFirst().orElse(null);
        List<ReplicaSet> old = owned.stream().filter(rs -> rs != current).toList();

        if (Boolean.TRUE.equals(deployment.getSpec().getPaused())) {
            scalePaused(reconciliation, deployment, current, old);
            pruneHistory(reconciliation, deployment, old);
            return;
        }

        ReplicaSet active = current;
        if (active == null) {
            active = createReplicaSet(reconciliation, deployment, hash, maxRevision(old) + 1);

            if (active == null) {
                return;
            }
        } else if (revision(active) <= maxRevision(old)) {
            // The template went back to an older revision
            long newRevision = maxRevision(old) + 1;
            Annotations.annotate(active, Annotations.ANNO_DEP_KUBE_IO_REVISION, String.valueOf(newRevision));
            store.touch(active, false);
            LOGGER.infoCr(reconciliation, "ReplicaSet {} is active again as revision {}", active.getMetadata().getName(), newRevision);
        }

        setDeploymentRevision(deployment, active);

        if (RECREATE.equals(strategyType(deployment))) {
            recreate(reconciliation, deployment, active, old);
        } else {
            rollingUpdate(reconciliation, deployment, active, old);
        }

        pruneHistory(reconciliation, deployment, old);
    }

    private void rollingUpdate(Reconciliation reconciliation, Deployment deployment, ReplicaSet active, List<ReplicaSet> old) {
        int desired = WorkloadUtils.replicas(deployment.getSpec().getReplicas());
        int maxSurge = maxSurge(deployment, desired);
        int maxUnavailable = maxUnavailable(deployment, desired);

        // Scale up the active ReplicaSet within the surge
        int activeReplicas = replicas(active);
        if (activeReplicas < desired) {
            int scaleUp = Math.min(desired + maxSurge - totalReplicas(active, old), desired - activeReplicas);

            if (scaleUp > 0) {
                scale(reconciliation, deployment, active, activeReplicas + scaleUp);
            }
        } else if (activeReplicas > desired) {
            scale(reconciliation, deployment, active, desired);
        }

        List<ReplicaSet> oldWithReplicas = old.stream()
                .filter(rs -> replicas(rs) > 0)
                .sorted(Comparator.comparingLong(DeploymentController::revision).thenComparingLong(store::sequence))
                .toList();

        if (oldWithReplicas.isEmpty()) {
            return;
        }

        // Scale down the old ReplicaSets without going below the minimal availability
        int minAvailable = desired - maxUnavailable;
        List<Pod> activePods = WorkloadUtils.livePods(store, active);
        int newUnavailable = replicas(active) - WorkloadUtils.healthy(activePods);
        int maxScaledDown = totalReplicas(active, old) - minAvailable - newUnavailable;

        if (maxScaledDown <= 0) {
            return;
        }

        // Unhealthy old replicas go first, they do not add to the availability anyway
        for (ReplicaSet rs : oldWithReplicas) {
            if (maxScaledDown <= 0) {
                break;
            }

            int replicas = replicas(rs);
            int unhealthy = replicas - WorkloadUtils.healthy(WorkloadUtils.livePods(store, rs));

            if (replicas > 0 && unhealthy > 0) {
                int scaledDown = Math.min(maxScaledDown, unhealthy);
                scale(reconciliation, deployment, rs, replicas - scaledDown);
                maxScaledDown -= scaledDown;
            }
        }

        int available = WorkloadUtils.healthy(activePods);
        for (ReplicaSet rs : old) {
            available += WorkloadUtils.healthy(WorkloadUtils.livePods(store, rs));
        }

        int totalScaleDown = available - minAvailable;
        for (ReplicaSet rs : oldWithReplicas) {
            if (totalScaleDown <= 0) {
                break;
            }

            int replicas = replicas(rs);

            if (replicas > 0) {
                int scaledDown = Math.min(replicas, totalScaleDown);
                scale(reconciliation, deployment, rs, replicas - scaledDown);
                totalScaleDown -= scaledDown;
            }
        }
    }

    private void recreate(Reconciliation reconciliation, Deployment deployment, ReplicaSet active, List<ReplicaSet> old) {
        boolean scaledDown = false;

        for (ReplicaSet rs : old) {
            if (replicas(rs) > 0) {
                scale(reconciliation, deployment, rs, 0);
                scaledDown = true;
            }
        }

        if (scaledDown) {
            return;
        }

        boolean oldPodsRunning = old.stream().anyMatch(rs -> !WorkloadUtils.livePods(store, rs).isEmpty());

        if (oldPodsRunning) {
            LOGGER.debugCr(reconciliation, "Waiting for the old pods to terminate");
        } else {
            scale(reconciliation, deployment, active, WorkloadUtils.replicas(deployment.getSpec().getReplicas()));
        }
    }

    private void scalePaused(Reconciliation reconciliation, Deployment deployment, ReplicaSet active, List<ReplicaSet> old) {
        List<ReplicaSet> candidates = new ArrayList<>(old);
        if (active != null) {
            candidates.add(active);
        }

        // The newest ReplicaSet with replicas absorbs the difference
        ReplicaSet newest = candidates.stream()
                .filter(rs -> replicas(rs) > 0 || rs == active)
                .max(Comparator.comparingLong(DeploymentController::revision).thenComparingLong(store::sequence))
                .orElse(null);

        if (newest != null) {
            int desired = WorkloadUtils.replicas(deployment.getSpec().getReplicas());
            int total = candidates.stream().mapToInt(DeploymentController::replicas).sum();
            scale(reconciliation, deployment, newest, Math.max(0, replicas(newest) + desired - total));
        }
    }

    private ReplicaSet createReplicaSet(Reconciliation reconciliation, Deployment deployment, String hash, long revision) {
        String namespace = deployment.getMetadata().getNamespace();
        String name = deployment.getMetadata().getName() + "-" + hash;

        if (store.get(ReplicaSet.class, namespace, name) != null) {
            // A ReplicaSet with this name is still being deleted
            LOGGER.debugCr(reconciliation, "Waiting for the old ReplicaSet {} to be removed", name);
            return null;
        }

        PodTemplateSpec template = ModelUtils.deepCopy(deployment.getSpec().getTemplate());
        if (template.getMetadata() == null) {
            template.setMetadata(new ObjectMeta());
        }

        Labels podLabels = Labels.fromMap(template.getMetadata().getLabels()).with(Labels.POD_TEMPLATE_HASH_LABEL, hash);
        template.getMetadata().setLabels(podLabels.toMutableMap());

        LabelSelector selector = ModelUtils.deepCopy(deployment.getSpec().getSelector());
        Map<String, String> matchLabels = selector.getMatchLabels() != null ? new HashMap<>(selector.getMatchLabels()) : new HashMap<>(1);
        matchLabels.put(Labels.POD_TEMPLATE_HASH_LABEL, hash);
        selector.setMatchLabels(matchLabels);

        Map<String, String> annotations = new HashMap<>(1);
        annotations.put(Annotations.ANNO_DEP_KUBE_IO_REVISION, String.valueOf(revision));

        ReplicaSet replicaSet = new ReplicaSetBuilder()
                .withMetadata(new ObjectMetaBuilder()
                        .withName(name)
                        .withNamespace(namespace)
                        .withLabels(podLabels.toMutableMap())
                        .withAnnotations(annotations)
                        .withOwnerReferences(ModelUtils.createOwnerReference(deployment, true))
                        .build())
                .withNewSpec()
                    .withReplicas(0)
                    .withMinReadySeconds(deployment.getSpec().getMinReadySeconds())
                    .withSelector(selector)
                    .withTemplate(template)
                .endSpec()
                .build();

        ReplicaSet created = store.create(replicaSet);
        setCondition(deployment, CONDITION_PROGRESSING, "True", REASON_NEW_RS_CREATED, "Created new replica set \"" + name + "\"", true);
        LOGGER.infoCr(reconciliation, "Created ReplicaSet {} with revision {}", name, revision);

        return created;
    }

    private void scale(Reconciliation reconciliation, Deployment deployment, ReplicaSet replicaSet, int replicas) {
        int current = replicas(replicaSet);

        if (current == replicas) {
            return;
        }

        replicaSet.getSpec().setReplicas(replicas);
        store.touch(replicaSet, true);

        String direction = replicas > current ? "up" : "down";
        LOGGER.infoCr(reconciliation, "Scaled {} ReplicaSet {} from {} to {}", direction, replicaSet.getMetadata().getName(), current, replicas);
        events.normal(deployment, "ScalingReplicaSet", "Scaled " + direction + " replica set " + replicaSet.getMetadata().getName() + " to " + replicas);
    }

    private void pruneHistory(Reconciliation reconciliation, Deployment deployment, List<ReplicaSet> old) {
        int limit = deployment.getSpec().getRevisionHistoryLimit() != null ? deployment.getSpec().getRevisionHistoryLimit() : DEFAULT_REVISION_HISTORY_LIMIT;

        List<ReplicaSet> history = old.stream()
                .filter(rs -> replicas(rs) == 0 && !PodUtils.isTombstoned(rs))
                .filter(rs -> WorkloadUtils.livePods(store, rs).isEmpty())
                .sorted(Comparator.comparingLong(DeploymentController::revision).thenComparingLong(store::sequence))
                .toList();

        for (int i = 0; i < history.size() - limit; i++) {
            ReplicaSet rs = history.get(i);
            store.markDeleted(rs);
            LOGGER.infoCr(reconciliation, "Removed ReplicaSet {} (revision {}) from the history", rs.getMetadata().getName(), revision(rs));
        }
    }

    /**
     * Rolls a Deployment back to an earlier revision by copying the template of the ReplicaSet of that revision
     *
     * @param deployment    The live Deployment
     * @param revision      Revision to roll back to or null for the previous one
     *
     * @throws InvalidResourceException When there is no such revision
     */
    public void undo(Deployment deployment, Long revision) throws InvalidResourceException {
        String hash = TemplateHash.of(deployment.getSpec().getTemplate());
        List<ReplicaSet> owned = ownedReplicaSets(deployment);
        ReplicaSet active = owned.stream().filter(rs -> hash.equals(templateHash(rs))).findFirst().orElse(null);
        NamespaceAndName name = NamespaceAndName.of(deployment);
        ReplicaSet target;

        if (revision == null) {
            target = owned.stream()
                    .filter(rs -> rs != active)
                    .max(Comparator.comparingLong(DeploymentController::revision).thenComparingLong(store::sequence))
                    .orElseThrow(() -> new InvalidResourceException("Deployment " + name + " has no previous revision"));
        } else {
            target = owned.stream()
                    .filter(rs -> revision(rs) == revision)
                    .findFirst()
                    .orElseThrow(() -> new InvalidResourceException("Deployment " + name + " has no revision " + revision));

            if (target == active) {
                LOGGER.info("Deployment {} already runs revision {}", name, revision);
                return;
            }
        }

        PodTemplateSpec template = ModelUtils.deepCopy(target.getSpec().getTemplate());
        if (template.getMetadata() != null) {
            template.getMetadata().setLabels(Labels.fromMap(template.getMetadata().getLabels()).without(Labels.POD_TEMPLATE_HASH_LABEL).toMutableMap());
        }

        deployment.getSpec().setTemplate(template);
        store.touch(deployment, true);

        LOGGER.info("Deployment {} rolled back to revision {}", name, revision(target));
        events.normal(deployment, "DeploymentRollback", "Rolled back deployment \"" + deployment.getMetadata().getName() + "\" to revision " + revision(target));
    }

    @Override
    protected void updateStatus(Deployment deployment) {
        String hash = TemplateHash.of(deployment.getSpec().getTemplate());
        List<ReplicaSet> owned = ownedReplicaSets(deployment);
        ReplicaSet active = owned.stream().filter(rs -> hash.equals(templateHash(rs))).findFirst().orElse(null);

        List<Pod> allPods = new ArrayList<>();
        owned.forEach(rs -> allPods.addAll(WorkloadUtils.livePods(store, rs)));
        List<Pod> activePods = active != null ? WorkloadUtils.livePods(store, active) : List.of();

        int desired = WorkloadUtils.replicas(deployment.getSpec().getReplicas());
        int available = WorkloadUtils.healthy(allPods);

        DeploymentStatus previous = deployment.getStatus() != null ? deployment.getStatus() : new DeploymentStatus();
        DeploymentStatus status = new DeploymentStatus();
        status.setReplicas(allPods.size());
        status.setUpdatedReplicas(activePods.size());
        status.setReadyReplicas((int) allPods.stream().filter(PodUtils::isReady).count());
        status.setAvailableReplicas(available);
        status.setUnavailableReplicas(Math.max(0, desired - available));
        status.setObservedGeneration(deployment.getMetadata().getGeneration());
        status.setConditions(previous.getConditions() != null ? new ArrayList<>(previous.getConditions()) : new ArrayList<>());

        boolean countsChanged = !Objects.equals(previous.getReplicas(), status.getReplicas())
                || !Objects.equals(previous.getUpdatedReplicas(), status.getUpdatedReplicas())
                || !Objects.equals(previous.getReadyReplicas(), status.getReadyReplicas())
                || !Objects.equals(previous.getAvailableReplicas(), status.getAvailableReplicas());

        deployment.setStatus(status);

        int maxUnavailable = RECREATE.equals(strategyType(deployment)) ? 0 : maxUnavailable(deployment, desired);
        boolean minimumAvailable = available >= desired - maxUnavailable;
        setCondition(deployment, CONDITION_AVAILABLE, minimumAvailable ? "True" : "False",
                minimumAvailable ? "MinimumReplicasAvailable" : "MinimumReplicasUnavailable",
                minimumAvailable ? "Deployment has minimum availability." : "Deployment does not have minimum availability.", false);

        updateProgressing(deployment, active, desired, countsChanged);

        if (!Objects.equals(previous, deployment.getStatus())) {
            store.touch(deployment, false);
        }
    }

    private void updateProgressing(Deployment deployment, ReplicaSet active, int desired, boolean countsChanged) {
        DeploymentStatus status = deployment.getStatus();
        DeploymentCondition progressing = condition(deployment, CONDITION_PROGRESSING);
        String previousReason = progressing != null ? progressing.getReason() : null;
        String activeName = active != null ? active.getMetadata().getName() : "";

        boolean complete = active != null
                && status.getUpdatedReplicas() == desired
                && status.getReplicas() == desired
                && status.getAvailableReplicas() == desired;

        if (complete) {
            setCondition(deployment, CONDITION_PROGRESSING, "True", REASON_NEW_RS_AVAILABLE, "ReplicaSet \"" + activeName + "\" has successfully progressed.", countsChanged);

            if (!REASON_NEW_RS_AVAILABLE.equals(previousReason)) {
                events.normal(deployment, "RolloutComplete", "Deployment " + deployment.getMetadata().getName() + " successfully rolled out replica set " + activeName);
            }
        } else if (Boolean.TRUE.equals(deployment.getSpec().getPaused())) {
            setCondition(deployment, CONDITION_PROGRESSING, "Unknown", REASON_PAUSED, "Deployment is paused", countsChanged);
        } else if (countsChanged || progressing == null || REASON_NEW_RS_AVAILABLE.equals(previousReason)) {
            String reason = REASON_NEW_RS_CREATED.equals(previousReason) && !countsChanged ? REASON_NEW_RS_CREATED : REASON_RS_UPDATED;
            setCondition(deployment, CONDITION_PROGRESSING, "True", reason, "ReplicaSet \"" + activeName + "\" is progressing.", true);
        } else if (!REASON_PROGRESS_DEADLINE_EXCEEDED.equals(previousReason)
                && clock.tick() - clock.tickOf(progressing.getLastUpdateTime()) > progressDeadline(deployment)) {
            setCondition(deployment, CONDITION_PROGRESSING, "False", REASON_PROGRESS_DEADLINE_EXCEEDED, "ReplicaSet \"" + activeName + "\" has timed out progressing.", false);
            events.warning(deployment, "RolloutStalled", "Deployment " + deployment.getMetadata().getName() + " exceeded its progress deadline");
        }
    }

    private int progressDeadline(Deployment deployment) {
        Integer seconds = deployment.getSpec().getProgressDeadlineSeconds();
        return seconds != null ? seconds : context.config().getRolloutProgressDeadlineTicks();
    }

    private void setCondition(Deployment deployment, String type, String status, String reason, String message, boolean updated) {
        if (deployment.getStatus() == null) {
            deployment.setStatus(new DeploymentStatus());
        }

        if (deployment.getStatus().getConditions() == null) {
            deployment.getStatus().setConditions(new ArrayList<>());
        }

        String timestamp = clock.timestamp();
        DeploymentCondition existing = condition(deployment, type);

        if (existing == null) {
            deployment.getStatus().getConditions().add(new DeploymentConditionBuilder()
                    .withType(type)
                    .withStatus(status)
                    .withReason(reason)
                    .withMessage(message)
                    .withLastTransitionTime(timestamp)
                    .withLastUpdateTime(timestamp)
                    .build());
        } else {
            boolean changed = !status.equals(existing.getStatus()) || !Objects.equals(reason, existing.getReason());

            if (!status.equals(existing.getStatus())) {
                existing.setLastTransitionTime(timestamp);
            }

            if (changed || updated) {
                existing.setLastUpdateTime(timestamp);
            }

            existing.setStatus(status);
            existing.setReason(reason);
            existing.setMessage(message);
        }
    }

    private static DeploymentCondition condition(Deployment deployment, String type) {
        if (deployment.getStatus() == null || deployment.getStatus().getConditions() == null) {
            return null;
        }

        return deployment.getStatus().getConditions().stream().filter(condition -> type.equals(condition.getType())).findFirst().orElse(null);
    }

    private void setDeploymentRevision(Deployment deployment, ReplicaSet active) {
        String revision = String.valueOf(revision(active));

        if (!revision.equals(Annotations.stringAnnotation(deployment, Annotations.ANNO_DEP_KUBE_IO_REVISION, null))) {
            Annotations.annotate(deployment, Annotations.ANNO_DEP_KUBE_IO_REVISION, revision);
            store.touch(deployment, false);
        }
    }

    private List<ReplicaSet> ownedReplicaSets(Deployment deployment) {
        return store.dependents(deployment, ReplicaSet.class).stream()
                .filter(rs -> ModelUtils.isControlledBy(rs, deployment))
                .filter(rs -> !PodUtils.isTombstoned(rs))
                .toList();
    }

    private static String strategyType(Deployment deployment) {
        return deployment.getSpec().getStrategy() != null && deployment.getSpec().getStrategy().getType() != null
                ? deployment.getSpec().getStrategy().getType() : ROLLING_UPDATE;
    }

    private static RollingUpdateDeployment rollingUpdate(Deployment deployment) {
        return deployment.getSpec().getStrategy() != null ? deployment.getSpec().getStrategy().getRollingUpdate() : null;
    }

    static int maxSurge(Deployment deployment, int desired) {
        RollingUpdateDeployment rollingUpdate = rollingUpdate(deployment);
        IntOrString value = rollingUpdate != null && rollingUpdate.getMaxSurge() != null ? rollingUpdate.getMaxSurge() : DEFAULT_MAX_SURGE;

        return Util.scaledValueFromIntOrPercent(value, desired, true);
    }

    static int maxUnavailable(Deployment deployment, int desired) {
        RollingUpdateDeployment rollingUpdate = rollingUpdate(deployment);
        IntOrString value = rollingUpdate != null && rollingUpdate.getMaxUnavailable() != null ? rollingUpdate.getMaxUnavailable() : DEFAULT_MAX_UNAVAILABLE;
        int maxUnavailable = Math.min(Util.scaledValueFromIntOrPercent(value, desired, false), desired);

        // Both zero would block the rollout forever
        if (maxUnavailable == 0 && maxSurge(deployment, desired) == 0) {
            return 1;
        }

        return maxUnavailable;
    }

    private static int totalReplicas(ReplicaSet active, List<ReplicaSet> old) {
        return replicas(active) + old.stream().mapToInt(DeploymentController::replicas).sum();
    }

    private static int replicas(ReplicaSet replicaSet) {
        return replicaSet.getSpec().getReplicas() != null ? replicaSet.getSpec().getReplicas() : 0;
    }

    private static String templateHash(ReplicaSet replicaSet) {
        return Labels.fromResource(replicaSet).toMap().get(Labels.POD_TEMPLATE_HASH_LABEL);
    }

    static long revision(ReplicaSet replicaSet) {
        return Annotations.intAnnotation(replicaSet, Annotations.ANNO_DEP_KUBE_IO_REVISION, 0);
    }

    private static long maxRevision(List<ReplicaSet> replicaSets) {
        return replicaSets.stream().mapToLong(DeploymentController::revision).max().orElse(0);
    }
}
