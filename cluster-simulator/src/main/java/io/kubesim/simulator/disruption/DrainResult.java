/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.disruption;

import java.util.List;

/**
 * Outcome of draining a node
 *
 * @param node      Name of the drained node
 * @param evicted   Names of the evicted pods
 * @param blocked   Names of the pods whose eviction was refused by a disruption budget
 */
public record DrainResult(String node, List<String> evicted, List<String> blocked) {
    /**
     * @return  True if all pods were evicted
     */
    public boolean isComplete() {
        return blocked.isEmpty();
    }
}
