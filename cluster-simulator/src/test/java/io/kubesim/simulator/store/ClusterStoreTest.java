/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.store;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.NameGenerator;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ClusterStoreTest {
    private SimulatedClock clock;
    private ClusterStore store;

    @BeforeEach
    public void setUp() {
        clock = new SimulatedClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofMinutes(1));
        store = new ClusterStore(clock, new NameGenerator(0), 110);
    }

    @Test
    public void testCreateAssignsIdentity() {
        Deployment input = ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE);
        input.getMetadata().setNamespace(null);

        Deployment created = store.create(input);

        assertThat(created, is(not(sameInstance(input))));
        assertThat(created.getMetadata().getNamespace(), is("default"));
        assertThat(created.getMetadata().getUid(), is(notNullValue()));
        assertThat(created.getMetadata().getGeneration(), is(1L));
        assertThat(created.getMetadata().getCreationTimestamp(), is("2024-01-01T00:00:00Z"));
        assertThat(created.getMetadata().getDeletionTimestamp(), is(nullValue()));
        assertThat(input.getMetadata().getUid(), is(nullValue()));

        assertThat(store.get(ResourceKind.DEPLOYMENT, null, "web"), is(sameInstance(created)));
        assertThat(store.getByUid(created.getMetadata().getUid()), is(sameInstance(created)));
    }

    @Test
    public void testCreateDuplicateFails() {
        store.create(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE));

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> store.create(ResourceUtils.deployment("web", 1, ResourceUtils.IMAGE)));
        assertThat(e.getMessage(), is("Deployment default/web already exists"));
    }

    @Test
    public void testSameNameInDifferentNamespaces() {
        store.create(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE));
        store.create(new DeploymentBuilder(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE)).editMetadata().withNamespace("prod").endMetadata().build());

        assertThat(store.list(Deployment.class).size(), is(2));
        assertThat(store.list(Deployment.class, "prod").size(), is(1));
    }

    @Test
    public void testCreateInvalidResourceLeavesStoreUnchanged() {
        Deployment invalid = ResourceUtils.deployment("Web_1", 3, ResourceUtils.IMAGE);

        assertThrows(InvalidResourceException.class, () -> store.create(invalid));
        assertThat(store.list(Deployment.class).isEmpty(), is(true));
    }

    @Test
    public void testNodeDefaults() {
        Node node = store.create(new NodeBuilder().withNewMetadata().withName("node-1").endMetadata().build());

        assertThat(node.getMetadata().getNamespace(), is(nullValue()));
        assertThat(node.getStatus().getCapacity().get("pods").getAmount(), is("110"));
        assertThat(node.getStatus().getConditions().get(0).getType(), is("Ready"));
        assertThat(node.getStatus().getConditions().get(0).getStatus(), is("True"));
    }

    @Test
    public void testPodDefaults() {
        Pod pod = store.create(ResourceUtils.pod("my-pod", "my-app"));

        assertThat(pod.getSpec().getRestartPolicy(), is("Always"));
        assertThat(pod.getStatus().getPhase(), is(PodUtils.PHASE_PENDING));
    }

    @Test
    public void testUpdateBumpsGenerationOnlyOnSpecChange() {
        Deployment created = store.create(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE));
        String uid = created.getMetadata().getUid();

        Deployment relabeled = ModelUtils.deepCopy(created);
        relabeled.getMetadata().setLabels(ResourceUtils.appLabels("other"));
        Deployment updated = store.update(relabeled);

        assertThat(updated.getMetadata().getGeneration(), is(1L));
        assertThat(updated.getMetadata().getLabels().get("app"), is("other"));
        assertThat(updated.getMetadata().getUid(), is(uid));

        Deployment scaled = ModelUtils.deepCopy(updated);
        scaled.getSpec().setReplicas(5);
        updated = store.update(scaled);

        assertThat(updated.getMetadata().getGeneration(), is(2L));
        assertThat(updated.getSpec().getReplicas(), is(5));
        assertThat(store.get(Deployment.class, "default", "web"), is(sameInstance(updated)));
    }

    @Test
    public void testUpdateKeepsStatusAndPlacement() {
        Pod pod = store.create(ResourceUtils.pod("my-pod", "my-app"));
        pod.getSpec().setNodeName("node-1");
        pod.getStatus().setPhase(PodUtils.PHASE_RUNNING);

        Pod incoming = new PodBuilder(ResourceUtils.pod("my-pod", "my-app")).withStatus(null).build();
        Pod updated = store.update(incoming);

        assertThat(updated.getSpec().getNodeName(), is("node-1"));
        assertThat(updated.getStatus().getPhase(), is(PodUtils.PHASE_RUNNING));
    }

    @Test
    public void testUpdateMissingOrDeletedFails() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> store.update(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE)));
        assertThat(e.getMessage(), is("Deployment default/web not found"));

        store.create(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE));
        store.markDeleted(ResourceKind.DEPLOYMENT, "default", "web");

        e = assertThrows(InvalidResourceException.class, () -> store.update(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE)));
        assertThat(e.getMessage(), containsString("is being deleted"));
    }

    @Test
    public void testMarkDeletedIsIdempotent() {
        clock.advance();
        Pod pod = store.create(ResourceUtils.pod("my-pod", "my-app"));
        PodUtils.setReady(pod, true, clock.timestamp());

        assertThat(store.markDeleted(pod), is(true));
        assertThat(pod.getMetadata().getDeletionTimestamp(), is("2024-01-01T00:01:00Z"));
        assertThat(pod.getStatus().getPhase(), is(PodUtils.PHASE_TERMINATING));
        assertThat(PodUtils.isReady(pod), is(false));

        clock.advance();
        assertThat(store.markDeleted(pod), is(false));
        assertThat(pod.getMetadata().getDeletionTimestamp(), is("2024-01-01T00:01:00Z"));
    }

    @Test
    public void testMarkDeletedMissingFails() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> store.markDeleted(ResourceKind.NODE, null, "node-9"));
        assertThat(e.getMessage(), is("Node node-9 not found"));
    }

    @Test
    public void testDependentsIndex() {
        ReplicaSet rs = store.create(ResourceUtils.replicaSet("web", 2));

        Pod first = ResourceUtils.pod("web-a", "web");
        first.getMetadata().setOwnerReferences(List.of(ModelUtils.createOwnerReference(rs, true)));
        first = store.create(first);

        Pod second = ResourceUtils.pod("web-b", "web");
        second.getMetadata().setOwnerReferences(List.of(ModelUtils.createOwnerReference(rs, true)));
        second = store.create(second);

        assertThat(names(store.dependents(rs)), contains("web-a", "web-b"));
        assertThat(store.dependents(rs, Pod.class), contains(first, second));

        store.remove(first);
        assertThat(names(store.dependents(rs)), contains("web-b"));
        assertThat(store.get(ResourceKind.POD, "default", "web-a"), is(nullValue()));
    }

    @Test
    public void testSetOwnerAdoptsOrphan() {
        ReplicaSet rs = store.create(ResourceUtils.replicaSet("web", 1));
        Pod orphan = store.create(ResourceUtils.pod("web-a", "web"));

        store.setOwner(orphan, rs);

        assertThat(names(store.dependents(rs)), contains("web-a"));
        assertThat(ModelUtils.isControlledBy(orphan, rs), is(true));
    }

    @Test
    public void testTouch() {
        Deployment deployment = store.create(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE));
        String version = deployment.getMetadata().getResourceVersion();

        store.touch(deployment, false);
        assertThat(deployment.getMetadata().getGeneration(), is(1L));
        assertThat(deployment.getMetadata().getResourceVersion(), is(not(version)));

        store.touch(deployment, true);
        assertThat(deployment.getMetadata().getGeneration(), is(2L));
    }

    @Test
    public void testListKeepsCreationOrder() {
        store.create(ResourceUtils.pod("c", "app"));
        store.create(ResourceUtils.pod("a", "app"));
        store.create(ResourceUtils.pod("b", "app"));

        assertThat(names(store.list(Pod.class)), contains("c", "a", "b"));
    }

    private static List<String> names(List<? extends HasMetadata> resources) {
        return resources.stream().map(resource -> resource.getMetadata().getName()).toList();
    }
}
