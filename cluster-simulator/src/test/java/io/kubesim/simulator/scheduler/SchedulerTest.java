/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.scheduler;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.kubesim.simulator.ClusterSimulator;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.event.Event;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class SchedulerTest {
    @Test
    public void testNoNodes() {
        ClusterSimulator simulator = ResourceUtils.simulator();
        simulator.create(ResourceUtils.pod("my-pod", "app"));

        simulator.tick(3);

        Pod pod = simulator.get(ResourceKind.POD, "default", "my-pod");
        assertThat(pod.getSpec().getNodeName(), is(nullValue()));
        assertThat(PodUtils.phase(pod), is(PodUtils.PHASE_PENDING));
        assertThat(PodUtils.condition(pod, PodUtils.CONDITION_POD_SCHEDULED).getStatus(), is("False"));
        assertThat(PodUtils.condition(pod, PodUtils.CONDITION_POD_SCHEDULED).getReason(), is(Scheduler.REASON_UNSCHEDULABLE));

        // The same reason is reported only once
        List<Event> failures = simulator.events("FailedScheduling");
        assertThat(failures.size(), is(1));
        assertThat(failures.get(0).message(), is("no nodes available to schedule pods"));
    }

    @Test
    public void testPendingPodIsScheduledWhenNodeAppears() {
        ClusterSimulator simulator = ResourceUtils.simulator();
        simulator.create(ResourceUtils.pod("my-pod", "app"));
        simulator.tick();

        simulator.addNode("node-1", 10);
        simulator.tick();

        Pod pod = simulator.get(ResourceKind.POD, "default", "my-pod");
        assertThat(pod.getSpec().getNodeName(), is("node-1"));
        assertThat(simulator.events("Scheduled").get(0).message(), is("Successfully assigned default/my-pod to node-1"));
    }

    @Test
    public void testCapacityIsRespected() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 1);
        simulator.create(ResourceUtils.pod("pod-a", "app"));
        simulator.create(ResourceUtils.pod("pod-b", "app"));
        simulator.create(ResourceUtils.pod("pod-c", "app"));

        simulator.tick();

        assertThat(nodeOf(simulator, "pod-a"), is("node-1"));
        assertThat(nodeOf(simulator, "pod-b"), is("node-2"));
        assertThat(nodeOf(simulator, "pod-c"), is(nullValue()));
        assertThat(simulator.events("FailedScheduling").get(0).message(), is("0/2 nodes are available: 2 Too many pods."));

        // A freed slot is reused
        simulator.delete(ResourceKind.POD, "default", "pod-a");
        simulator.tick(2);

        assertThat(nodeOf(simulator, "pod-c"), is("node-1"));
    }

    @Test
    public void testPodWithUnboundClaimIsNotScheduled() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 1);
        simulator.create(ResourceUtils.persistentVolumeClaim("data", "manual", "1Gi"));
        simulator.create(ResourceUtils.podWithClaim("db", "db", "data"));
        simulator.create(ResourceUtils.pod("web", "web"));

        simulator.tick(3);

        // The waiting pod does not take the only slot
        assertThat(nodeOf(simulator, "db"), is(nullValue()));
        assertThat(nodeOf(simulator, "web"), is("node-1"));

        Pod pod = simulator.get(ResourceKind.POD, "default", "db");
        assertThat(PodUtils.condition(pod, PodUtils.CONDITION_POD_SCHEDULED).getReason(), is(Scheduler.REASON_UNSCHEDULABLE));
        List<Event> failures = simulator.events("FailedScheduling");
        assertThat(failures.size(), is(1));
        assertThat(failures.get(0).message(), is("persistentvolumeclaim \"data\" not bound"));

        simulator.delete(ResourceKind.POD, "default", "web");
        simulator.create(ResourceUtils.persistentVolume("disk", "manual", "1Gi", "Retain"));
        simulator.tick(2);

        assertThat(nodeOf(simulator, "db"), is("node-1"));
    }

    @Test
    public void testFirstFitFillsNodesInOrder() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.pod("pod-a", "app"));
        simulator.create(ResourceUtils.pod("pod-b", "app"));

        simulator.tick();

        assertThat(nodeOf(simulator, "pod-a"), is("node-1"));
        assertThat(nodeOf(simulator, "pod-b"), is("node-1"));
    }

    @Test
    public void testLeastAllocatedSpreadsPods() {
        ClusterSimulator simulator = ResourceUtils.simulator(Map.of("KUBESIM_SCHEDULING_STRATEGY", "LeastAllocated"));
        simulator.addNode("node-1", 10);
        simulator.addNode("node-2", 10);
        simulator.create(ResourceUtils.pod("pod-a", "app"));
        simulator.create(ResourceUtils.pod("pod-b", "app"));
        simulator.create(ResourceUtils.pod("pod-c", "app"));

        simulator.tick();

        assertThat(nodeOf(simulator, "pod-a"), is("node-1"));
        assertThat(nodeOf(simulator, "pod-b"), is("node-2"));
        assertThat(nodeOf(simulator, "pod-c"), is("node-1"));
    }

    @Test
    public void testLeastAllocatedAvoidsSoftTaints() {
        ClusterSimulator simulator = ResourceUtils.simulator(Map.of("KUBESIM_SCHEDULING_STRATEGY", "LeastAllocated"));
        simulator.addNode("node-1", 10);
        simulator.addNode("node-2", 10);
        simulator.taint("node-1", "maintenance", "soon", NodeEligibility.EFFECT_PREFER_NO_SCHEDULE);
        simulator.create(ResourceUtils.pod("pod-a", "app"));

        simulator.tick();

        assertThat(nodeOf(simulator, "pod-a"), is("node-2"));
    }

    @Test
    public void testIneligibleNodesAreReported() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(3, 10);
        simulator.cordon("node-1");
        simulator.setNodeReady("node-2", false);
        simulator.taint("node-3", "dedicated", "gpu", NodeEligibility.EFFECT_NO_SCHEDULE);
        simulator.create(ResourceUtils.pod("my-pod", "app"));

        simulator.tick();

        assertThat(nodeOf(simulator, "my-pod"), is(nullValue()));
        assertThat(simulator.events("FailedScheduling").get(0).message(),
                is("0/3 nodes are available: 1 node(s) had untolerated taint {dedicated: gpu}, 1 node(s) were not ready, 1 node(s) were unschedulable."));
    }

    @Test
    public void testTolerationAllowsTaintedNode() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.taint("node-1", "dedicated", "gpu", NodeEligibility.EFFECT_NO_SCHEDULE);

        simulator.create(ResourceUtils.pod("plain", "app"));
        simulator.create(new PodBuilder(ResourceUtils.pod("tolerant", "app"))
                .editSpec()
                    .addNewToleration()
                        .withKey("dedicated")
                        .withOperator("Equal")
                        .withValue("gpu")
                        .withEffect(NodeEligibility.EFFECT_NO_SCHEDULE)
                    .endToleration()
                .endSpec()
                .build());

        simulator.tick();

        assertThat(nodeOf(simulator, "plain"), is(nullValue()));
        assertThat(nodeOf(simulator, "tolerant"), is("node-1"));
    }

    @Test
    public void testUntaintMakesNodeEligible() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.taint("node-1", "dedicated", "gpu", NodeEligibility.EFFECT_NO_SCHEDULE);
        simulator.create(ResourceUtils.pod("my-pod", "app"));
        simulator.tick();

        simulator.untaint("node-1", "dedicated", null);
        simulator.tick();

        assertThat(nodeOf(simulator, "my-pod"), is("node-1"));
    }

    @Test
    public void testFailureMessage() {
        Map<String, Integer> reasons = new TreeMap<>();
        reasons.put(NodeEligibility.REASON_UNSCHEDULABLE, 2);
        reasons.put(NodeEligibility.REASON_TOO_MANY_PODS, 1);

        assertThat(Scheduler.failureMessage(3, reasons), is("0/3 nodes are available: 1 Too many pods, 2 node(s) were unschedulable."));
        assertThat(Scheduler.failureMessage(0, Map.of()), is("no nodes available to schedule pods"));
    }

    private static String nodeOf(ClusterSimulator simulator, String pod) {
        Pod current = simulator.get(ResourceKind.POD, "default", pod);
        return current.getSpec().getNodeName();
    }
}
