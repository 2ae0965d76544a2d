/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.Pod;

/**
 * Decides the outcome of a single probe run. There is no real application behind the simulated containers, so the
 * outcome has to come from somewhere else: the default policy reads it from the pod annotations.
 */
public interface ProbeOutcomePolicy {
    /**
     * Runs the probe
     *
     * @param pod           The probed pod
     * @param type          Type of the probe
     * @param containerAge  Ticks since the container started running
     *
     * @return  True if the probe succeeded
     */
    boolean probe(Pod pod, ProbeType type, long containerAge);
}
