/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

/**
 * A component of the reconciliation engine. The simulator calls every controller once per tick, in a fixed order.
 */
public interface Controller {
    /**
     * @return  Name of the controller used in logs
     */
    String name();

    /**
     * Runs one reconciliation pass over all resources of the controller. The pass has to finish within the tick:
     * whatever cannot be done now is retried in the next tick.
     */
    void reconcile();

    /**
     * Recomputes the status of the resources of the controller. It is called after all controllers reconciled, so
     * the status reflects the state at the end of the tick.
     */
    default void updateStatus() {
        // Nothing to do by default
    }
}
