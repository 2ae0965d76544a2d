/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Taint;
import io.fabric8.kubernetes.api.model.Toleration;
import io.kubesim.common.model.StatusUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.store.ClusterStore;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rules deciding whether a pod can be placed on a node: readiness, cordoning, pod capacity and taints.
 */
public class NodeEligibility {
    /**
     * Taint effect which blocks scheduling
     */
    public static final String EFFECT_NO_SCHEDULE = "NoSchedule";
    /**
     * Taint effect which blocks scheduling and evicts running pods
     */
    public static final String EFFECT_NO_EXECUTE = "NoExecute";
    /**
     * Taint effect which only lowers the preference of the node
     */
    public static final String EFFECT_PREFER_NO_SCHEDULE = "PreferNoSchedule";

    /**
     * Reason used when a node is cordoned
     */
    public static final String REASON_UNSCHEDULABLE = "node(s) were unschedulable";
    /**
     * Reason used when a node is not ready
     */
    public static final String REASON_NOT_READY = "node(s) were not ready";
    /**
     * Reason used when a node is full
     */
    public static final String REASON_TOO_MANY_PODS = "Too many pods";

    private NodeEligibility() { }

    /**
     * @param node  Node
     *
     * @return  True if the node has the Ready condition set to True
     */
    public static boolean isReady(Node node) {
        if (node.getStatus() == null || node.getStatus().getConditions() == null) {
            return false;
        }

        for (NodeCondition condition : node.getStatus().getConditions()) {
            if ("Ready".equals(condition.getType())) {
                return StatusUtils.isTrue(condition.getStatus());
            }
        }

        return false;
    }

    /**
     * @param node  Node
     *
     * @return  True if the node is cordoned
     */
    public static boolean isCordoned(Node node) {
        return node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable());
    }

    /**
     * @param node              Node
     * @param defaultCapacity   Capacity used when the node does not declare one
     *
     * @return  Maximal number of pods the node can run
     */
    public static int capacity(Node node, int defaultCapacity) {
        if (node.getStatus() != null && node.getStatus().getCapacity() != null) {
            Quantity pods = node.getStatus().getCapacity().get("pods");

            if (pods != null) {
                return Integer.parseInt(pods.getAmount());
            }
        }

        return defaultCapacity;
    }

    /**
     * @param node  Node
     *
     * @return  Taints of the node
     */
    public static List<Taint> taints(Node node) {
        return node.getSpec() != null && node.getSpec().getTaints() != null ? node.getSpec().getTaints() : List.of();
    }

    /**
     * Checks whether a toleration matches a taint
     *
     * @param toleration    Toleration of a pod
     * @param taint         Taint of a node
     *
     * @return  True if the toleration tolerates the taint
     */
    public static boolean tolerates(Toleration toleration, Taint taint) {
        if (toleration.getEffect() != null && !toleration.getEffect().isEmpty() && !toleration.getEffect().equals(taint.getEffect())) {
            return false;
        }

        String operator = toleration.getOperator() == null || toleration.getOperator().isEmpty() ? "Equal" : toleration.getOperator();

        if (toleration.getKey() == null || toleration.getKey().isEmpty()) {
            // An empty key with Exists matches all taints
            return "Exists".equals(operator);
        } else if (!toleration.getKey().equals(taint.getKey())) {
            return false;
        }

        return switch (operator) {
            case "Exists" -> true;
            case "Equal" -> Objects.equals(emptyToNull(toleration.getValue()), emptyToNull(taint.getValue()));
            default -> false;
        };
    }

    /**
     * Finds the first taint with one of the given effects which none of the tolerations tolerates
     *
     * @param tolerations   Tolerations of the pod
     * @param node          Node
     * @param effects       Effects which are considered
     *
     * @return  The untolerated taint or null
     */
    public static Taint untoleratedTaint(List<Toleration> tolerations, Node node, String... effects) {
        List<Toleration> podTolerations = tolerations != null ? tolerations : List.of();

        for (Taint taint : taints(node)) {
            if (!List.of(effects).contains(taint.getEffect())) {
                continue;
            }

            if (podTolerations.stream().noneMatch(toleration -> tolerates(toleration, taint))) {
                return taint;
            }
        }

        return null;
    }

    /**
     * Counts the PreferNoSchedule taints of a node which the pod does not tolerate
     *
     * @param tolerations   Tolerations of the pod
     * @param node          Node
     *
     * @return  Number of untolerated soft taints
     */
    public static int preferNoSchedulePenalty(List<Toleration> tolerations, Node node) {
        List<Toleration> podTolerations = tolerations != null ? tolerations : List.of();

        return (int) taints(node).stream()
                .filter(taint -> EFFECT_PREFER_NO_SCHEDULE.equals(taint.getEffect()))
                .filter(taint -> podTolerations.stream().noneMatch(toleration -> tolerates(toleration, taint)))
                .count();
    }

    /**
     * Checks the node conditions which do not depend on its current load: readiness, cordon and the hard taints
     *
     * @param tolerations   Tolerations of the pod
     * @param node          Node
     *
     * @return  The reason why the pod cannot run on the node or null if it can
     */
    public static String ineligibilityReason(List<Toleration> tolerations, Node node) {
        if (!isReady(node)) {
            return REASON_NOT_READY;
        } else if (isCordoned(node)) {
            return REASON_UNSCHEDULABLE;
        }

        Taint taint = untoleratedTaint(tolerations, node, EFFECT_NO_SCHEDULE, EFFECT_NO_EXECUTE);
        if (taint != null) {
            return "node(s) had untolerated taint {" + taint.getKey() + ": " + (taint.getValue() != null ? taint.getValue() : "") + "}";
        }

        return null;
    }

    /**
     * Counts the pods which occupy a slot on each node: bound pods which are neither tombstoned nor terminal
     *
     * @param store     Object store
     *
     * @return  Map from node name to the number of allocated pods
     */
    public static Map<String, Integer> allocatedPods(ClusterStore store) {
        Map<String, Integer> allocated = new HashMap<>();

        for (Pod pod : store.list(Pod.class)) {
            String nodeName = pod.getSpec().getNodeName();

            if (nodeName != null && PodUtils.isLive(pod)) {
                allocated.merge(nodeName, 1, Integer::sum);
            }
        }

        return allocated;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
