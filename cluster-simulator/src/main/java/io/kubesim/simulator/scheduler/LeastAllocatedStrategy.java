/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Spreads the pods: nodes with untolerated PreferNoSchedule taints come last, then the node with the fewest allocated
 * pods wins. Ties keep the node creation order.
 */
public class LeastAllocatedStrategy implements SchedulingStrategy {
    /**
     * Name of the strategy
     */
    public static final String NAME = "LeastAllocated";

    @Override
    public Node selectNode(Pod pod, List<Node> eligibleNodes, Map<String, Integer> allocatedPods) {
        // min() returns the first of equal elements, which keeps the creation order for ties
        return eligibleNodes.stream()
                .min(Comparator.<Node>comparingInt(node -> NodeEligibility.preferNoSchedulePenalty(pod.getSpec().getTolerations(), node))
                        .thenComparingInt(node -> allocatedPods.getOrDefault(node.getMetadata().getName(), 0)))
                .orElse(eligibleNodes.get(0));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
