/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.NameGenerator;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.store.ClusterStore;

import java.util.List;

/**
 * Helpers shared by the workload controllers
 */
public class WorkloadUtils {
    private WorkloadUtils() { }

    /**
     * @param replicas  The replicas field of a workload spec
     *
     * @return  The number of replicas, 1 when the field is not set
     */
    public static int replicas(Integer replicas) {
        return replicas != null ? replicas : 1;
    }

    /**
     * @param store     Object store
     * @param owner     Controller
     *
     * @return  All pods controlled by the owner (including tombstoned and terminal ones) in creation order
     */
    public static List<Pod> controlledPods(ClusterStore store, HasMetadata owner) {
        return store.dependents(owner, Pod.class).stream()
                .filter(pod -> ModelUtils.isControlledBy(pod, owner))
                .toList();
    }

    /**
     * @param store     Object store
     * @param owner     Controller
     *
     * @return  Live pods controlled by the owner in creation order
     */
    public static List<Pod> livePods(ClusterStore store, HasMetadata owner) {
        return controlledPods(store, owner).stream().filter(PodUtils::isLive).toList();
    }

    /**
     * @param pods  Pods
     *
     * @return  Number of Running and Ready pods which are not tombstoned
     */
    public static int healthy(List<Pod> pods) {
        return (int) pods.stream().filter(PodUtils::isHealthy).count();
    }

    /**
     * Generates a name which is not used by any pod in the namespace
     *
     * @param store         Object store
     * @param names         Name generator
     * @param namespace     Namespace
     * @param baseName      Name prefix
     *
     * @return  Free pod name
     */
    public static String freePodName(ClusterStore store, NameGenerator names, String namespace, String baseName) {
        String name = names.generateName(baseName);

        while (store.get(Pod.class, namespace, name) != null) {
            name = names.generateName(baseName);
        }

        return name;
    }
}
