/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.kubesim.common.model.InvalidResourceException;

/**
 * Failures which can be injected into pods through the {@link Annotations#ANNO_FAILURE_MODE} annotation
 */
public enum FailureMode {
    /**
     * The image cannot be pulled and the pod never starts
     */
    IMAGE_PULL_ERROR("ImagePullError"),
    /**
     * The container crashes shortly after every start
     */
    CRASH_LOOP_BACK_OFF("CrashLoopBackOff"),
    /**
     * The container is killed for exceeding its memory limit
     */
    OOM_KILLED("OOMKilled");

    private final String value;

    FailureMode(String value) {
        this.value = value;
    }

    /**
     * @return  Annotation value of this failure mode
     */
    public String value() {
        return value;
    }

    /**
     * Parses the failure mode from the annotation value
     *
     * @param value     Annotation value
     *
     * @return  The failure mode or null when the value is null or empty
     */
    public static FailureMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        for (FailureMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }

        throw new InvalidResourceException("Unknown failure mode " + value + ". Supported modes are ImagePullError, CrashLoopBackOff and OOMKilled");
    }

    @Override
    public String toString() {
        return value;
    }
}
