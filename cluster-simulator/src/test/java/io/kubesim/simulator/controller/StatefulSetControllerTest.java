/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.kubesim.common.model.Labels;
import io.kubesim.simulator.ClusterSimulator;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class StatefulSetControllerTest {
    private static List<String> liveNames(ClusterSimulator simulator) {
        return ResourceUtils.livePods(simulator, "web").stream().map(pod -> pod.getMetadata().getName()).sorted().toList();
    }

    private static String revision(ClusterSimulator simulator, String pod) {
        Pod current = simulator.get(ResourceKind.POD, "default", pod);
        return current.getMetadata().getLabels().get(Labels.CONTROLLER_REVISION_HASH_LABEL);
    }

    @Test
    public void testOrderedReadyCreatesPodsOneByOne() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 3, "OrderedReady"));

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0"));

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1"));

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1", "web-2"));

        simulator.tick();
        assertThat(ResourceUtils.healthyPods(simulator, "web").size(), is(3));

        StatefulSet sts = simulator.get(ResourceKind.STATEFUL_SET, "default", "web");
        assertThat(sts.getStatus().getReplicas(), is(3));
        assertThat(sts.getStatus().getReadyReplicas(), is(3));
        assertThat(sts.getStatus().getCurrentRevision(), is(sts.getStatus().getUpdateRevision()));

        Pod web1 = simulator.get(ResourceKind.POD, "default", "web-1");
        assertThat(web1.getSpec().getHostname(), is("web-1"));
        assertThat(web1.getSpec().getSubdomain(), is("web"));
        assertThat(web1.getMetadata().getLabels().get(Labels.STATEFULSET_POD_NAME_LABEL), is("web-1"));
    }

    @Test
    public void testParallelCreatesAllPodsAtOnce() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 3, "Parallel"));

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1", "web-2"));

        simulator.tick();
        assertThat(ResourceUtils.healthyPods(simulator, "web").size(), is(3));
    }

    @Test
    public void testOrderedScaleDownRemovesHighestOrdinalFirst() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 3, "OrderedReady"));
        simulator.tick(4);

        simulator.scale(ResourceKind.STATEFUL_SET, "default", "web", 1);

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1"));

        // web-1 waits until web-2 is gone
        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1"));

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0"));

        simulator.tick();
        assertThat(simulator.<Pod>list(ResourceKind.POD).size(), is(1));
    }

    @Test
    public void testParallelScaleDownRemovesAllExcessPods() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 3, "Parallel"));
        simulator.tick(2);

        simulator.scale(ResourceKind.STATEFUL_SET, "default", "web", 1);
        simulator.tick();

        assertThat(liveNames(simulator), contains("web-0"));
    }

    @Test
    public void testRollingUpdateReplacesPodsFromHighestOrdinal() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 3, "OrderedReady"));
        simulator.tick(4);

        String oldRevision = revision(simulator, "web-0");

        StatefulSet sts = simulator.get(ResourceKind.STATEFUL_SET, "default", "web");
        sts.getSpec().getTemplate().getSpec().getContainers().get(0).setImage("nginx:1.26");
        simulator.update(sts);

        simulator.tick();
        assertThat(liveNames(simulator), contains("web-0", "web-1"));

        // web-2 is recreated under the same name once the old pod is removed
        simulator.tick(2);
        assertThat(liveNames(simulator), contains("web-0", "web-1", "web-2"));
        assertThat(revision(simulator, "web-2"), is(not(oldRevision)));
        assertThat(revision(simulator, "web-0"), is(oldRevision));

        simulator.tick(9);

        sts = simulator.get(ResourceKind.STATEFUL_SET, "default", "web");
        assertThat(sts.getStatus().getUpdatedReplicas(), is(3));
        assertThat(sts.getStatus().getCurrentRevision(), is(sts.getStatus().getUpdateRevision()));
        assertThat(ResourceUtils.healthyPods(simulator, "web").size(), is(3));
        assertThat(revision(simulator, "web-0"), is(not(oldRevision)));
    }

    @Test
    public void testPartitionKeepsLowerOrdinals() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(new StatefulSetBuilder(ResourceUtils.statefulSet("web", 3, "OrderedReady"))
                .editSpec()
                    .withNewUpdateStrategy()
                        .withType("RollingUpdate")
                        .withNewRollingUpdate()
                            .withPartition(2)
                        .endRollingUpdate()
                    .endUpdateStrategy()
                .endSpec()
                .build());
        simulator.tick(4);

        String oldRevision = revision(simulator, "web-0");

        StatefulSet sts = simulator.get(ResourceKind.STATEFUL_SET, "default", "web");
        sts.getSpec().getTemplate().getSpec().getContainers().get(0).setImage("nginx:1.26");
        simulator.update(sts);
        simulator.tick(10);

        assertThat(revision(simulator, "web-2"), is(not(oldRevision)));
        assertThat(revision(simulator, "web-1"), is(oldRevision));
        assertThat(revision(simulator, "web-0"), is(oldRevision));

        sts = simulator.get(ResourceKind.STATEFUL_SET, "default", "web");
        assertThat(sts.getStatus().getUpdatedReplicas(), is(1));
        assertThat(sts.getStatus().getCurrentRevision(), is(not(sts.getStatus().getUpdateRevision())));
    }

    @Test
    public void testPodsAreDeletedWithTheStatefulSet() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(2, 10);
        simulator.create(ResourceUtils.statefulSet("web", 2, "Parallel"));
        simulator.tick(2);

        simulator.delete(ResourceKind.STATEFUL_SET, "default", "web");
        simulator.tick(3);

        assertThat(simulator.<Pod>list(ResourceKind.POD).isEmpty(), is(true));
        assertThat(simulator.<StatefulSet>list(ResourceKind.STATEFUL_SET).isEmpty(), is(true));
    }

    @Test
    public void testPodsAreNamedByOrdinal() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.statefulSet("db", 2, "Parallel"));
        simulator.tick();

        List<String> names = simulator.<Pod>list(ResourceKind.POD).stream()
                .filter(PodUtils::isLive)
                .map(pod -> pod.getMetadata().getName())
                .toList();
        assertThat(names, containsInAnyOrder("db-0", "db-1"));
    }
}
