/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.event;

/**
 * Entry in the event log
 *
 * @param tick          Tick in which the event happened
 * @param timestamp     Simulated time of the event
 * @param type          Severity
 * @param reason        Short machine readable reason such as SuccessfulCreate
 * @param kind          Kind of the involved object
 * @param namespace     Namespace of the involved object (null for cluster scoped objects)
 * @param name          Name of the involved object
 * @param message       Human readable message
 */
public record Event(long tick, String timestamp, EventType type, String reason, String kind, String namespace, String name, String message) {
    @Override
    public String toString() {
        return "[" + tick + "] " + type + " " + reason + " " + kind + "/" + (namespace == null ? name : namespace + "/" + name) + ": " + message;
    }
}
