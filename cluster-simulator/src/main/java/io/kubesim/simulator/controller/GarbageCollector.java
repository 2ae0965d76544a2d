/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.autoscaler.MetricsFeed;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.store.ClusterStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Second phase of the two-phase deletion. Tombstones propagate from owners to their dependents, dependents of owners
 * which no longer exist are tombstoned as well, and tombstoned resources are physically removed once nothing depends
 * on them anymore. Pods are removed only after the termination grace period and once all their finalizers are gone.
 */
public class GarbageCollector implements Controller {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(GarbageCollector.class);

    /**
     * Kinds removed first, in this order. Dependents go before their owners, so an owner can often be removed in the
     * same pass as its last dependent.
     */
    private static final List<ResourceKind> REMOVAL_ORDER = List.of(ResourceKind.POD, ResourceKind.REPLICA_SET, ResourceKind.JOB);

    private final ClusterStore store;
    private final SimulatedClock clock;
    private final MetricsFeed metricsFeed;
    private final int terminationGraceTicks;

    /**
     * Constructs the garbage collector
     *
     * @param context       Controller context
     * @param metricsFeed   Feed with the utilization samples of the pods
     */
    public GarbageCollector(ControllerContext context, MetricsFeed metricsFeed) {
        this.store = context.store();
        this.clock = context.clock();
        this.metricsFeed = metricsFeed;
        this.terminationGraceTicks = context.config().getTerminationGraceTicks();
    }

    @Override
    public String name() {
        return "GarbageCollector";
    }

    @Override
    public void reconcile() {
        tombstoneOrphans();
        cascade();
        removeCollectable();

        Set<String> podUids = store.list(Pod.class).stream().map(pod -> pod.getMetadata().getUid()).collect(Collectors.toSet());
        metricsFeed.retainAll(podUids);
    }

    /**
     * Dependents whose controller does not exist anymore can never be reconciled again
     */
    private void tombstoneOrphans() {
        for (ResourceKind kind : ResourceKind.values()) {
            for (HasMetadata resource : store.list(kind)) {
                OwnerReference owner = ModelUtils.controllerOf(resource);

                if (owner != null && !PodUtils.isTombstoned(resource) && store.getByUid(owner.getUid()) == null) {
                    LOGGER.info("{} {} lost its owner {} {}, deleting it", kind.kind(), NamespaceAndName.of(resource), owner.getKind(), owner.getName());
                    store.markDeleted(resource);
                }
            }
        }
    }

    private void cascade() {
        for (ResourceKind kind : ResourceKind.values()) {
            for (HasMetadata resource : store.list(kind)) {
                if (PodUtils.isTombstoned(resource)) {
                    cascade(resource);
                }
            }
        }
    }

    private void cascade(HasMetadata owner) {
        for (HasMetadata dependent : store.dependents(owner)) {
            if (store.markDeleted(dependent)) {
                LOGGER.debug("Deleting {} {} together with its owner {}", ResourceKind.forResource(dependent).kind(),
                        NamespaceAndName.of(dependent), NamespaceAndName.of(owner));
            }

            // Dependents tombstoned earlier have been cascaded already
            cascade(dependent);
        }
    }

    private void removeCollectable() {
        List<ResourceKind> order = new ArrayList<>(REMOVAL_ORDER);
        for (ResourceKind kind : ResourceKind.values()) {
            if (!order.contains(kind)) {
                order.add(kind);
            }
        }

        for (ResourceKind kind : order) {
            for (HasMetadata resource : store.list(kind)) {
                if (isCollectable(resource)) {
                    store.remove(resource);
                }
            }
        }
    }

    private boolean isCollectable(HasMetadata resource) {
        if (!PodUtils.isTombstoned(resource)) {
            return false;
        }

        List<String> finalizers = resource.getMetadata().getFinalizers();
        if (finalizers != null && !finalizers.isEmpty()) {
            return false;
        }

        if (resource instanceof Pod) {
            return clock.tick() - clock.tickOf(resource.getMetadata().getDeletionTimestamp()) >= terminationGraceTicks;
        }

        return store.dependents(resource).isEmpty();
    }
}
