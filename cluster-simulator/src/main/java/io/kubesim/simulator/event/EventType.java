/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.event;

/**
 * Severity of an event
 */
public enum EventType {
    /**
     * Regular progress
     */
    Normal,
    /**
     * Something that needs attention, usually a stalled convergence
     */
    Warning
}
