/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import java.util.EnumMap;
import java.util.Map;

/**
 * Kubelet-side state of one pod which is not part of the pod status: when the current container attempt started,
 * the progress of the init containers and the consecutive probe failures.
 */
class PodRuntimeState {
    static final long NOT_RUNNING = -1L;

    /**
     * Tick from which the startup of the current attempt is counted
     */
    long settleFrom;
    /**
     * Tick in which the containers of the current attempt started running
     */
    long runningSince = NOT_RUNNING;
    /**
     * Number of init containers which completed
     */
    int initContainersDone = 0;
    /**
     * Whether the startup probe succeeded in the current attempt
     */
    boolean startupDone = false;
    /**
     * Whether the image pull failure was already reported
     */
    boolean imagePullFailureReported = false;
    /**
     * Message of the missing reference which keeps the containers from being created
     */
    String blockedBy;

    private final Map<ProbeType, Integer> probeFailures = new EnumMap<>(ProbeType.class);

    PodRuntimeState(long settleFrom) {
        this.settleFrom = settleFrom;
    }

    int recordProbeFailure(ProbeType type) {
        return probeFailures.merge(type, 1, Integer::sum);
    }

    void recordProbeSuccess(ProbeType type) {
        probeFailures.remove(type);
    }

    /**
     * Resets the state for a new container attempt
     *
     * @param settleFrom    Tick from which the startup of the new attempt is counted
     */
    void restart(long settleFrom) {
        this.settleFrom = settleFrom;
        this.runningSince = NOT_RUNNING;
        this.startupDone = false;
        this.probeFailures.clear();
    }

    boolean isRunning() {
        return runningSince != NOT_RUNNING;
    }
}
