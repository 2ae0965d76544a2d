/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Probe;

/**
 * Container probes evaluated by the simulated kubelet
 */
public enum ProbeType {
    STARTUP("startup"),
    READINESS("readiness"),
    LIVENESS("liveness");

    private final String value;

    ProbeType(String value) {
        this.value = value;
    }

    /**
     * @return  Name of the probe as used in the failing probes annotation
     */
    public String value() {
        return value;
    }

    /**
     * @param container Container
     *
     * @return  The probe of this type configured on the container or null
     */
    public Probe of(Container container) {
        return switch (this) {
            case STARTUP -> container.getStartupProbe();
            case READINESS -> container.getReadinessProbe();
            case LIVENESS -> container.getLivenessProbe();
        };
    }

    /**
     * @param value Name of the probe
     *
     * @return  The probe type or null if the name is unknown
     */
    public static ProbeType fromValue(String value) {
        for (ProbeType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }

        return null;
    }
}
