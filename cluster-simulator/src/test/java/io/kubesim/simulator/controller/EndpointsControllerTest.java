/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.kubesim.simulator.ClusterSimulator;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.model.FailureMode;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class EndpointsControllerTest {
    @Test
    public void testReadyPodsBackTheService() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.service("web", "web", 80, 8080));
        simulator.create(ResourceUtils.pod("web-b", "web"));
        simulator.create(ResourceUtils.pod("web-a", "web"));
        simulator.create(ResourceUtils.pod("db", "db"));

        simulator.tick();

        assertThat(simulator.endpoints("default", "web"), contains("web-a", "web-b"));
        assertThat(simulator.events("EndpointsAdded").size(), is(2));

        Endpoints endpoints = simulator.endpointsObject("default", "web");
        EndpointSubset subset = endpoints.getSubsets().get(0);
        assertThat(subset.getAddresses().size(), is(2));
        assertThat(subset.getAddresses().get(0).getNodeName(), is("node-1"));
        assertThat(subset.getAddresses().get(0).getTargetRef().getName(), is("web-a"));
        assertThat(subset.getPorts().get(0).getPort(), is(8080));
        assertThat(subset.getPorts().get(0).getProtocol(), is("TCP"));
    }

    @Test
    public void testPendingPodsAreNotEndpoints() {
        ClusterSimulator simulator = ResourceUtils.simulator();
        simulator.create(ResourceUtils.service("web", "web", 80, 8080));
        simulator.create(ResourceUtils.pod("web", "web"));

        simulator.tick(2);

        assertThat(simulator.endpoints("default", "web").isEmpty(), is(true));
        assertThat(simulator.endpointsObject("default", "web").getSubsets().isEmpty(), is(true));
    }

    @Test
    public void testPodLeavesEndpointsWhenNotReady() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.service("web", "web", 80, 8080));
        simulator.create(ResourceUtils.pod("web", "web"));
        simulator.tick();
        assertThat(simulator.endpoints("default", "web"), contains("web"));

        simulator.injectFailure("default", "web", FailureMode.CRASH_LOOP_BACK_OFF);
        simulator.tick();

        assertThat(simulator.endpoints("default", "web").isEmpty(), is(true));
        assertThat(simulator.events("EndpointsRemoved").size(), is(1));
    }

    @Test
    public void testDeletedPodLeavesEndpoints() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.service("web", "web", 80, 8080));
        simulator.create(ResourceUtils.pod("web", "web"));
        simulator.tick();

        simulator.delete(ResourceKind.POD, "default", "web");
        simulator.tick();

        assertThat(simulator.endpoints("default", "web").isEmpty(), is(true));
    }

    @Test
    public void testUnknownAndDeletedServices() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        assertThat(simulator.endpoints("default", "missing").isEmpty(), is(true));
        assertThat(simulator.endpointsObject("default", "missing"), is(nullValue()));

        simulator.create(ResourceUtils.service("web", "web", 80, 8080));
        simulator.create(ResourceUtils.pod("web", "web"));
        simulator.tick();

        simulator.delete(ResourceKind.SERVICE, "default", "web");
        simulator.tick();

        assertThat(simulator.endpointsObject("default", "web"), is(nullValue()));
    }
}
