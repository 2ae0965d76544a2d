/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.ContainerStatusBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.PodConditionBuilder;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.kubesim.common.model.StatusUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading and writing the pod status the way the simulated kubelet maintains it
 */
public class PodUtils {
    /**
     * Pod is waiting to be scheduled or started
     */
    public static final String PHASE_PENDING = "Pending";
    /**
     * Pod is running
     */
    public static final String PHASE_RUNNING = "Running";
    /**
     * All containers terminated successfully
     */
    public static final String PHASE_SUCCEEDED = "Succeeded";
    /**
     * The pod terminated with a failure
     */
    public static final String PHASE_FAILED = "Failed";
    /**
     * The pod was tombstoned and waits for removal
     */
    public static final String PHASE_TERMINATING = "Terminating";

    /**
     * Pod condition set by the scheduler
     */
    public static final String CONDITION_POD_SCHEDULED = "PodScheduled";
    /**
     * Pod condition set once all init containers completed
     */
    public static final String CONDITION_INITIALIZED = "Initialized";
    /**
     * Pod condition set when all containers are ready
     */
    public static final String CONDITION_CONTAINERS_READY = "ContainersReady";
    /**
     * Pod readiness condition
     */
    public static final String CONDITION_READY = "Ready";

    private PodUtils() { }

    /**
     * @param pod   Pod
     *
     * @return  The phase of the pod, Pending when it was not set yet
     */
    public static String phase(Pod pod) {
        return pod.getStatus() != null && pod.getStatus().getPhase() != null ? pod.getStatus().getPhase() : PHASE_PENDING;
    }

    /**
     * @param pod   Pod
     *
     * @return  True if the pod is in the Running phase
     */
    public static boolean isRunning(Pod pod) {
        return PHASE_RUNNING.equals(phase(pod));
    }

    /**
     * @param pod   Pod
     *
     * @return  True if the pod succeeded or failed
     */
    public static boolean isTerminal(Pod pod) {
        String phase = phase(pod);
        return PHASE_SUCCEEDED.equals(phase) || PHASE_FAILED.equals(phase);
    }

    /**
     * @param pod   Pod
     *
     * @return  True if the pod failed
     */
    public static boolean isFailed(Pod pod) {
        return PHASE_FAILED.equals(phase(pod));
    }

    /**
     * @param pod   Pod
     *
     * @return  True if the pod succeeded
     */
    public static boolean isSucceeded(Pod pod) {
        return PHASE_SUCCEEDED.equals(phase(pod));
    }

    /**
     * @param resource  Any resource
     *
     * @return  True if the resource carries the deletion tombstone
     */
    public static boolean isTombstoned(HasMetadata resource) {
        return resource.getMetadata().getDeletionTimestamp() != null;
    }

    /**
     * A live pod is not tombstoned and not terminal. Live pods are the ones which count toward the replicas of their
     * controllers.
     *
     * @param pod   Pod
     *
     * @return  True if the pod is live
     */
    public static boolean isLive(Pod pod) {
        return !isTombstoned(pod) && !isTerminal(pod);
    }

    /**
     * @param pod   Pod
     *
     * @return  True if the pod has the Ready condition set to True
     */
    public static boolean isReady(Pod pod) {
        PodCondition ready = condition(pod, CONDITION_READY);
        return ready != null && StatusUtils.isTrue(ready.getStatus());
    }

    /**
     * Healthy pods serve traffic: they are live, Running and Ready
     *
     * @param pod   Pod
     *
     * @return  True if the pod is healthy
     */
    public static boolean isHealthy(Pod pod) {
        return !isTombstoned(pod) && isRunning(pod) && isReady(pod);
    }

    /**
     * @param pod   Pod
     *
     * @return  Image of the first container
     */
    public static String image(Pod pod) {
        List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : null;
        return containers == null || containers.isEmpty() ? null : containers.get(0).getImage();
    }

    /**
     * @param pod   Pod
     *
     * @return  Restart count of the first container
     */
    public static int restartCount(Pod pod) {
        ContainerStatus status = mainContainerStatus(pod);
        return status != null && status.getRestartCount() != null ? status.getRestartCount() : 0;
    }

    /**
     * @param pod   Pod
     *
     * @return  Status of the first container or null if there is none
     */
    public static ContainerStatus mainContainerStatus(Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null || pod.getStatus().getContainerStatuses().isEmpty()) {
            return null;
        }

        return pod.getStatus().getContainerStatuses().get(0);
    }

    /**
     * Fills in the initial status of a new pod: Pending phase and one waiting status per container
     *
     * @param pod   Pod
     */
    public static void initializeStatus(Pod pod) {
        PodStatus status = pod.getStatus() != null ? pod.getStatus() : new PodStatus();
        status.setPhase(PHASE_PENDING);

        if (status.getContainerStatuses() == null || status.getContainerStatuses().isEmpty()) {
            List<ContainerStatus> containerStatuses = new ArrayList<>();

            if (pod.getSpec() != null && pod.getSpec().getContainers() != null) {
                for (Container container : pod.getSpec().getContainers()) {
                    containerStatuses.add(new ContainerStatusBuilder()
                            .withName(container.getName())
                            .withImage(container.getImage())
                            .withReady(false)
                            .withStarted(false)
                            .withRestartCount(0)
                            .withNewState()
                                .withNewWaiting()
                                    .withReason("ContainerCreating")
                                .endWaiting()
                            .endState()
                            .build());
                }
            }

            status.setContainerStatuses(containerStatuses);
        }

        if (status.getConditions() == null) {
            status.setConditions(new ArrayList<>());
        }

        pod.setStatus(status);
    }

    /**
     * @param pod   Pod
     * @param type  Condition type
     *
     * @return  The condition or null if the pod does not have it
     */
    public static PodCondition condition(Pod pod, String type) {
        if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
            return null;
        }

        return pod.getStatus().getConditions().stream()
                .filter(condition -> type.equals(condition.getType()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Sets a pod condition. The transition time changes only when the status of the condition changes.
     *
     * @param pod           Pod
     * @param type          Condition type
     * @param value         Condition status
     * @param reason        Reason (can be null)
     * @param message       Message (can be null)
     * @param timestamp     Current time
     *
     * @return  True if the status of the condition changed
     */
    public static boolean setCondition(Pod pod, String type, boolean value, String reason, String message, String timestamp) {
        if (pod.getStatus() == null) {
            pod.setStatus(new PodStatus());
        }

        if (pod.getStatus().getConditions() == null) {
            pod.getStatus().setConditions(new ArrayList<>());
        }

        String status = value ? "True" : "False";
        PodCondition existing = condition(pod, type);

        if (existing == null) {
            pod.getStatus().getConditions().add(new PodConditionBuilder()
                    .withType(type)
                    .withStatus(status)
                    .withReason(reason)
                    .withMessage(message)
                    .withLastTransitionTime(timestamp)
                    .build());
            return true;
        } else {
            boolean changed = !status.equals(existing.getStatus());

            if (changed) {
                existing.setLastTransitionTime(timestamp);
            }

            existing.setStatus(status);
            existing.setReason(reason);
            existing.setMessage(message);
            return changed;
        }
    }

    /**
     * Sets the readiness of a pod: the Ready and ContainersReady conditions and the ready flag of the containers
     *
     * @param pod           Pod
     * @param ready         New readiness
     * @param timestamp     Current time
     *
     * @return  True if the readiness changed
     */
    public static boolean setReady(Pod pod, boolean ready, String timestamp) {
        boolean changed = setCondition(pod, CONDITION_READY, ready, null, null, timestamp);
        setCondition(pod, CONDITION_CONTAINERS_READY, ready, null, null, timestamp);

        if (pod.getStatus().getContainerStatuses() != null) {
            pod.getStatus().getContainerStatuses().forEach(status -> status.setReady(ready));
        }

        return changed;
    }
}
