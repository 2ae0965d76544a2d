/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.simulator.model.Annotations;

/**
 * Probe outcomes driven by annotations. Probes listed in {@code kubesim.io/failing-probes} always fail. The startup
 * probe fails until the container is {@code kubesim.io/startup-ticks} ticks old. Everything else succeeds.
 */
public class AnnotationProbeOutcomePolicy implements ProbeOutcomePolicy {
    @Override
    public boolean probe(Pod pod, ProbeType type, long containerAge) {
        String failing = Annotations.stringAnnotation(pod, Annotations.ANNO_FAILING_PROBES, "");

        for (String probe : failing.split(",")) {
            if (!probe.isBlank() && ProbeType.fromValue(probe) == type) {
                return false;
            }
        }

        if (type == ProbeType.STARTUP) {
            return containerAge >= Annotations.intAnnotation(pod, Annotations.ANNO_STARTUP_TICKS, 0);
        }

        return true;
    }
}
