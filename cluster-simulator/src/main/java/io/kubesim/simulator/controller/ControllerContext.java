/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.kubesim.common.MetricsProvider;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.SimulatorConfig;
import io.kubesim.simulator.event.EventRecorder;
import io.kubesim.simulator.model.NameGenerator;
import io.kubesim.simulator.store.ClusterStore;

/**
 * The state shared by the controllers. It is created by the simulator and passed explicitly to each controller.
 *
 * @param store     Object store
 * @param clock     Simulated clock
 * @param events    Event log
 * @param config    Simulator configuration
 * @param names     Generator of names
 * @param metrics   Metrics provider
 */
@SuppressFBWarnings({"EI_EXPOSE_REP", "EI_EXPOSE_REP2"}) // The controllers share the live store, clock and event log
public record ControllerContext(ClusterStore store, SimulatedClock clock, EventRecorder events, SimulatorConfig config,
                                NameGenerator names, MetricsProvider metrics) {
}
