/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;
import java.util.Map;

/**
 * Places the pod on the first eligible node in node creation order
 */
public class FirstFitStrategy implements SchedulingStrategy {
    /**
     * Name of the strategy
     */
    public static final String NAME = "FirstFit";

    @Override
    public Node selectNode(Pod pod, List<Node> eligibleNodes, Map<String, Integer> allocatedPods) {
        return eligibleNodes.get(0);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
