/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.disruption;

/**
 * Outcome of a voluntary eviction
 *
 * @param pod               Name of the pod
 * @param evicted           True if the pod was evicted (or was already being deleted)
 * @param blockingBudget    Name of the PodDisruptionBudget which refused the eviction or null
 * @param message           Human readable description of the outcome
 */
public record EvictionResult(String pod, boolean evicted, String blockingBudget, String message) {
}
