/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.simulator.ClusterSimulator;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

public class NodeLifecycleControllerTest {
    @Test
    public void testPodsOnNotReadyNodeAreLost() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.pod("my-pod", "app"));
        simulator.tick();

        simulator.setNodeReady("node-1", false);
        simulator.tick();

        Pod pod = simulator.get(ResourceKind.POD, "default", "my-pod");
        assertThat(PodUtils.phase(pod), is(PodUtils.PHASE_FAILED));
        assertThat(pod.getStatus().getReason(), is(NodeLifecycleController.REASON_NODE_LOST));
        assertThat(pod.getMetadata().getDeletionTimestamp(), is(notNullValue()));
        assertThat(simulator.events(NodeLifecycleController.REASON_NODE_LOST).size(), is(1));
        assertThat(simulator.events("NodeNotReady").size(), is(1));
        assertThat(simulator.events("NodeNotReady").get(0).message(), is("Node node-1 status is now: NodeNotReady"));

        // The lost pod is collected after the grace period
        simulator.tick();
        assertThat(simulator.get(ResourceKind.POD, "default", "my-pod"), is(nullValue()));
        assertThat(simulator.events("NodeNotReady").size(), is(1));
    }

    @Test
    public void testNodeReadyAgain() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.setNodeReady("node-1", false);
        simulator.tick();

        simulator.setNodeReady("node-1", true);
        simulator.tick();

        assertThat(simulator.events("NodeReady").size(), is(1));
        assertThat(simulator.events("NodeReady").get(0).message(), is("Node node-1 status is now: NodeReady"));

        simulator.create(ResourceUtils.pod("my-pod", "app"));
        simulator.tick();
        assertThat(PodUtils.isHealthy(simulator.get(ResourceKind.POD, "default", "my-pod")), is(true));
    }

    @Test
    public void testPodsOfDeletedNodeAreLost() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.pod("my-pod", "app"));
        simulator.tick();

        simulator.delete(ResourceKind.NODE, null, "node-1");
        simulator.tick();

        Pod pod = simulator.get(ResourceKind.POD, "default", "my-pod");
        assertThat(pod.getStatus().getReason(), is(NodeLifecycleController.REASON_NODE_LOST));
    }
}
