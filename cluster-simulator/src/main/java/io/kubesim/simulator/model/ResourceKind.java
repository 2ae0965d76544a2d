/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.autoscaling.v1.HorizontalPodAutoscaler;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudget;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.kubesim.common.model.InvalidResourceException;

/**
 * The resource kinds kept by the simulator
 */
public enum ResourceKind {
    /**
     * Nodes (cluster scoped)
     */
    NODE("Node", "v1", Node.class, false),
    /**
     * Pods
     */
    POD("Pod", "v1", Pod.class, true),
    /**
     * Services
     */
    SERVICE("Service", "v1", Service.class, true),
    /**
     * ReplicaSets
     */
    REPLICA_SET("ReplicaSet", "apps/v1", ReplicaSet.class, true),
    /**
     * Deployments
     */
    DEPLOYMENT("Deployment", "apps/v1", Deployment.class, true),
    /**
     * StatefulSets
     */
    STATEFUL_SET("StatefulSet", "apps/v1", StatefulSet.class, true),
    /**
     * DaemonSets
     */
    DAEMON_SET("DaemonSet", "apps/v1", DaemonSet.class, true),
    /**
     * Jobs
     */
    JOB("Job", "batch/v1", Job.class, true),
    /**
     * CronJobs
     */
    CRON_JOB("CronJob", "batch/v1", CronJob.class, true),
    /**
     * Horizontal Pod Autoscalers
     */
    HORIZONTAL_POD_AUTOSCALER("HorizontalPodAutoscaler", "autoscaling/v1", HorizontalPodAutoscaler.class, true),
    /**
     * Pod Disruption Budgets
     */
    POD_DISRUPTION_BUDGET("PodDisruptionBudget", "policy/v1", PodDisruptionBudget.class, true),
    /**
     * ConfigMaps
     */
    CONFIG_MAP("ConfigMap", "v1", ConfigMap.class, true),
    /**
     * Secrets
     */
    SECRET("Secret", "v1", Secret.class, true),
    /**
     * Persistent Volume Claims
     */
    PERSISTENT_VOLUME_CLAIM("PersistentVolumeClaim", "v1", PersistentVolumeClaim.class, true),
    /**
     * Persistent Volumes (cluster scoped)
     */
    PERSISTENT_VOLUME("PersistentVolume", "v1", PersistentVolume.class, false),
    /**
     * Storage Classes (cluster scoped)
     */
    STORAGE_CLASS("StorageClass", "storage.k8s.io/v1", StorageClass.class, false);

    private final String kind;
    private final String apiVersion;
    private final Class<? extends HasMetadata> type;
    private final boolean namespaced;

    ResourceKind(String kind, String apiVersion, Class<? extends HasMetadata> type, boolean namespaced) {
        this.kind = kind;
        this.apiVersion = apiVersion;
        this.type = type;
        this.namespaced = namespaced;
    }

    /**
     * @return  Kubernetes kind
     */
    public String kind() {
        return kind;
    }

    /**
     * @return  API version of the kind
     */
    public String apiVersion() {
        return apiVersion;
    }

    /**
     * @return  Model class of the kind
     */
    public Class<? extends HasMetadata> type() {
        return type;
    }

    /**
     * @return  True if the kind lives in namespaces
     */
    public boolean isNamespaced() {
        return namespaced;
    }

    /**
     * Finds the kind for a model class
     *
     * @param type  Model class
     *
     * @return  Resource kind
     */
    public static ResourceKind forType(Class<?> type) {
        for (ResourceKind kind : values()) {
            if (kind.type.equals(type)) {
                return kind;
            }
        }

        throw new InvalidResourceException("Resources of type " + type.getSimpleName() + " are not supported");
    }

    /**
     * Finds the kind for a resource
     *
     * @param resource  Resource
     *
     * @return  Resource kind
     */
    public static ResourceKind forResource(HasMetadata resource) {
        return forType(resource.getClass());
    }

    /**
     * Finds the kind by its name. The match is case-insensitive.
     *
     * @param kind  Kind name such as Deployment
     *
     * @return  Resource kind
     */
    public static ResourceKind forKind(String kind) {
        for (ResourceKind value : values()) {
            if (value.kind.equalsIgnoreCase(kind)) {
                return value;
            }
        }

        throw new InvalidResourceException("Unknown resource kind " + kind);
    }
}
