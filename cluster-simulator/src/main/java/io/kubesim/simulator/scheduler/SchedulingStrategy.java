/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.common.InvalidConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * Strategy which picks the node for a pod among the eligible ones
 */
public interface SchedulingStrategy {
    /**
     * Select the node for the given pod
     *
     * @param pod               The pod to be scheduled
     * @param eligibleNodes     Nodes which can run the pod, in node creation order. Never empty.
     * @param allocatedPods     Number of allocated pods per node name
     *
     * @return The selected node
     */
    Node selectNode(Pod pod, List<Node> eligibleNodes, Map<String, Integer> allocatedPods);

    /**
     * @return  Name of the strategy
     */
    String getName();

    /**
     * Creates the strategy by its name
     *
     * @param name  FirstFit or LeastAllocated
     *
     * @return  The strategy
     */
    static SchedulingStrategy forName(String name) {
        return switch (name) {
            case FirstFitStrategy.NAME -> new FirstFitStrategy();
            case LeastAllocatedStrategy.NAME -> new LeastAllocatedStrategy();
            default -> throw new InvalidConfigurationException("Unknown scheduling strategy " + name);
        };
    }
}
