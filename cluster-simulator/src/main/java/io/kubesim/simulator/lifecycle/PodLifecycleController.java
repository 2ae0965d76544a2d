/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapEnvSource;
import io.fabric8.kubernetes.api.model.ConfigMapKeySelector;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerState;
import io.fabric8.kubernetes.api.model.ContainerStateBuilder;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.ContainerStatusBuilder;
import io.fabric8.kubernetes.api.model.EnvFromSource;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarSource;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretEnvSource;
import io.fabric8.kubernetes.api.model.SecretKeySelector;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.simulator.controller.AbstractController;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.model.Annotations;
import io.kubesim.simulator.model.FailureMode;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.storage.StorageController;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The simulated kubelet. It moves scheduled pods through their phases: init containers, startup, probes, injected
 * failures, restarts and the completion of Job pods. Containers are not created while a referenced ConfigMap or
 * Secret is missing or a mounted claim is not bound.
 * <p>
 * A pod starts running once {@code podStartupTicks} ticks passed since it was created or last restarted. Restarts
 * caused by crashes wait for a back-off of {@code min(restarts, 4)} ticks on top of that.
 */
public class PodLifecycleController extends AbstractController<Pod> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(PodLifecycleController.class);

    private static final int MAX_BACK_OFF_TICKS = 4;
    private static final int DEFAULT_FAILURE_THRESHOLD = 3;
    private static final int EXIT_CODE_ERROR = 1;
    private static final int EXIT_CODE_OOM_KILLED = 137;

    private final ProbeOutcomePolicy probeOutcomePolicy;
    private final int podStartupTicks;
    private final Map<String, PodRuntimeState> states = new HashMap<>();
    private int nextIp = 0;

    /**
     * Constructs the controller
     *
     * @param context               Controller context
     * @param probeOutcomePolicy    Policy deciding the probe outcomes
     */
    public PodLifecycleController(ControllerContext context, ProbeOutcomePolicy probeOutcomePolicy) {
        super(Pod.class, context);
        this.probeOutcomePolicy = probeOutcomePolicy;
        this.podStartupTicks = context.config().getPodStartupTicks();
    }

    @Override
    public String name() {
        return "PodLifecycleController";
    }

    @Override
    public void reconcile() {
        Set<String> uids = store.list(Pod.class).stream().map(pod -> pod.getMetadata().getUid()).collect(Collectors.toSet());
        states.keySet().retainAll(uids);

        super.reconcile();
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, Pod pod) {
        if (pod.getSpec().getNodeName() == null || PodUtils.isTerminal(pod)) {
            return;
        }

        PodRuntimeState state = states.computeIfAbsent(pod.getMetadata().getUid(),
                uid -> new PodRuntimeState(clock.tickOf(pod.getMetadata().getCreationTimestamp())));

        if (pod.getStatus().getStartTime() == null) {
            pod.getStatus().setStartTime(clock.timestamp());
        }

        FailureMode failure = FailureMode.fromValue(Annotations.stringAnnotation(pod, Annotations.ANNO_FAILURE_MODE, null));

        if (state.isRunning()) {
            run(reconciliation, pod, state, failure);
        } else {
            start(reconciliation, pod, state, failure);
        }
    }

    private void start(Reconciliation reconciliation, Pod pod, PodRuntimeState state, FailureMode failure) {
        if (failure == FailureMode.IMAGE_PULL_ERROR) {
            String message = "Failed to pull image \"" + PodUtils.image(pod) + "\"";
            setContainerStates(pod, waiting("ErrImagePull", message));

            if (!state.imagePullFailureReported) {
                state.imagePullFailureReported = true;
                store.touch(pod, false);
                events.warning(pod, "Failed", message);
            }

            return;
        }

        state.imagePullFailureReported = false;

        String missingConfig = missingConfigReference(pod);
        if (missingConfig != null) {
            block(reconciliation, pod, state, "CreateContainerConfigError", missingConfig, "Failed", "Error: " + missingConfig);
            return;
        }

        String unboundClaim = StorageController.unboundClaim(store, pod);
        if (unboundClaim != null) {
            String message = "persistentvolumeclaim \"" + unboundClaim + "\" not bound";
            block(reconciliation, pod, state, "ContainerCreating", message, "FailedMount", "Unable to attach or mount volumes: " + message);
            return;
        }

        if (state.blockedBy != null) {
            unblock(reconciliation, pod, state);
        }

        if (!runInitContainers(reconciliation, pod, state)
                || clock.tick() - state.settleFrom < podStartupTicks) {
            return;
        }

        String timestamp = clock.timestamp();
        state.runningSince = clock.tick();

        pod.getStatus().setPhase(PodUtils.PHASE_RUNNING);
        pod.getStatus().setReason(null);
        pod.getStatus().setMessage(null);
        if (pod.getStatus().getPodIP() == null) {
            pod.getStatus().setPodIP(nextPodIp());
        }

        ContainerState running = new ContainerStateBuilder().withNewRunning().withStartedAt(timestamp).endRunning().build();
        setContainerStates(pod, running);
        pod.getStatus().getContainerStatuses().forEach(status -> status.setStarted(true));
        PodUtils.setCondition(pod, PodUtils.CONDITION_INITIALIZED, true, null, null, timestamp);

        store.touch(pod, false);
        LOGGER.debugCr(reconciliation, "Containers started on node {}", pod.getSpec().getNodeName());

        evaluateProbes(reconciliation, pod, state, 0);
    }

    /**
     * Keeps the containers waiting. The event is emitted only when the blocking message changes.
     */
    private void block(Reconciliation reconciliation, Pod pod, PodRuntimeState state, String waitingReason, String message, String eventReason, String eventMessage) {
        if (!message.equals(state.blockedBy)) {
            state.blockedBy = message;
            setContainerStates(pod, waiting(waitingReason, message));
            store.touch(pod, false);

            LOGGER.debugCr(reconciliation, "Containers cannot be created: {}", message);
            events.warning(pod, eventReason, eventMessage);
        }
    }

    /**
     * The startup of the containers is counted from the tick in which the blocking reference was resolved
     */
    private void unblock(Reconciliation reconciliation, Pod pod, PodRuntimeState state) {
        LOGGER.debugCr(reconciliation, "Containers are not blocked anymore by: {}", state.blockedBy);

        state.blockedBy = null;
        state.settleFrom = clock.tick();
        setContainerStates(pod, waiting("ContainerCreating", null));
        store.touch(pod, false);
    }

    /**
     * Finds the first ConfigMap or Secret referenced by the containers which does not exist or misses the referenced
     * key. Optional references are ignored.
     *
     * @return  Message describing the missing reference or null when all references resolve
     */
    private String missingConfigReference(Pod pod) {
        List<Container> containers = new ArrayList<>(pod.getSpec().getContainers());
        if (pod.getSpec().getInitContainers() != null) {
            containers.addAll(pod.getSpec().getInitContainers());
        }

        String namespace = pod.getMetadata().getNamespace();

        for (Container container : containers) {
            if (container.getEnvFrom() != null) {
                for (EnvFromSource source : container.getEnvFrom()) {
                    ConfigMapEnvSource configMapRef = source.getConfigMapRef();
                    if (configMapRef != null && !Boolean.TRUE.equals(configMapRef.getOptional())
                            && configMap(namespace, configMapRef.getName()) == null) {
                        return "configmap \"" + configMapRef.getName() + "\" not found";
                    }

                    SecretEnvSource secretRef = source.getSecretRef();
                    if (secretRef != null && !Boolean.TRUE.equals(secretRef.getOptional())
                            && secret(namespace, secretRef.getName()) == null) {
                        return "secret \"" + secretRef.getName() + "\" not found";
                    }
                }
            }

            if (container.getEnv() != null) {
                for (EnvVar env : container.getEnv()) {
                    String missing = missingKeyReference(namespace, env.getValueFrom());
                    if (missing != null) {
                        return missing;
                    }
                }
            }
        }

        return null;
    }

    private String missingKeyReference(String namespace, EnvVarSource valueFrom) {
        if (valueFrom == null) {
            return null;
        }

        ConfigMapKeySelector configMapKey = valueFrom.getConfigMapKeyRef();
        if (configMapKey != null && !Boolean.TRUE.equals(configMapKey.getOptional())) {
            ConfigMap configMap = configMap(namespace, configMapKey.getName());

            if (configMap == null) {
                return "configmap \"" + configMapKey.getName() + "\" not found";
            } else if (!containsKey(configMap.getData(), configMapKey.getKey()) && !containsKey(configMap.getBinaryData(), configMapKey.getKey())) {
                return "couldn't find key " + configMapKey.getKey() + " in ConfigMap " + namespace + "/" + configMapKey.getName();
            }
        }

        SecretKeySelector secretKey = valueFrom.getSecretKeyRef();
        if (secretKey != null && !Boolean.TRUE.equals(secretKey.getOptional())) {
            Secret secret = secret(namespace, secretKey.getName());

            if (secret == null) {
                return "secret \"" + secretKey.getName() + "\" not found";
            } else if (!containsKey(secret.getData(), secretKey.getKey()) && !containsKey(secret.getStringData(), secretKey.getKey())) {
                return "couldn't find key " + secretKey.getKey() + " in Secret " + namespace + "/" + secretKey.getName();
            }
        }

        return null;
    }

    private ConfigMap configMap(String namespace, String name) {
        ConfigMap configMap = store.get(ConfigMap.class, namespace, name);
        return configMap == null || PodUtils.isTombstoned(configMap) ? null : configMap;
    }

    private Secret secret(String namespace, String name) {
        Secret secret = store.get(Secret.class, namespace, name);
        return secret == null || PodUtils.isTombstoned(secret) ? null : secret;
    }

    private static boolean containsKey(Map<String, String> data, String key) {
        return data != null && data.containsKey(key);
    }

    private void run(Reconciliation reconciliation, Pod pod, PodRuntimeState state, FailureMode failure) {
        long age = clock.tick() - state.runningSince;

        if (failure == FailureMode.CRASH_LOOP_BACK_OFF && age >= 1) {
            events.warning(pod, "BackOff", "Back-off restarting failed container " + mainContainerName(pod));
            restart(reconciliation, pod, state, "Error", "CrashLoopBackOff", true);
        } else if (failure == FailureMode.OOM_KILLED && age >= 1) {
            oomKill(reconciliation, pod);
        } else if (Annotations.hasAnnotation(pod, Annotations.ANNO_COMPLETION_TICKS)
                && age >= Annotations.intAnnotation(pod, Annotations.ANNO_COMPLETION_TICKS, context.config().getJobCompletionTicks())) {
            complete(reconciliation, pod);
        } else {
            evaluateProbes(reconciliation, pod, state, age);
        }
    }

    /**
     * Advances the init containers by at most one per tick.
     *
     * @return  True when all init containers completed before this tick
     */
    private boolean runInitContainers(Reconciliation reconciliation, Pod pod, PodRuntimeState state) {
        List<Container> initContainers = pod.getSpec().getInitContainers();

        if (initContainers == null || initContainers.isEmpty()) {
            return true;
        }

        int total = initContainers.size();
        if (state.initContainersDone >= total) {
            return true;
        }

        ensureInitContainerStatuses(pod, initContainers);

        if (clock.tick() <= state.settleFrom) {
            pod.getStatus().setReason("Init:" + state.initContainersDone + "/" + total);
            return false;
        }

        Container init = initContainers.get(state.initContainersDone);
        ContainerStatus initStatus = pod.getStatus().getInitContainerStatuses().get(state.initContainersDone);

        if (failingInitContainers(pod).contains(init.getName())) {
            failInitContainer(reconciliation, pod, state, init, initStatus);
        } else {
            initStatus.setState(terminated("Completed", 0));
            initStatus.setReady(true);
            state.initContainersDone++;

            if (state.initContainersDone == total) {
                pod.getStatus().setReason(null);
                PodUtils.setCondition(pod, PodUtils.CONDITION_INITIALIZED, true, null, null, clock.timestamp());
            } else {
                pod.getStatus().setReason("Init:" + state.initContainersDone + "/" + total);
            }

            LOGGER.debugCr(reconciliation, "Init container {} completed", init.getName());
        }

        store.touch(pod, false);
        return false;
    }

    private void failInitContainer(Reconciliation reconciliation, Pod pod, PodRuntimeState state, Container init, ContainerStatus initStatus) {
        initStatus.setState(terminated("Error", EXIT_CODE_ERROR));
        events.warning(pod, "Failed", "Init container " + init.getName() + " failed");

        if ("Never".equals(pod.getSpec().getRestartPolicy())) {
            fail(pod, "Init:Error", "Init container " + init.getName() + " failed", "Error", EXIT_CODE_ERROR);
            LOGGER.infoCr(reconciliation, "Init container {} failed and the pod is not restarted", init.getName());
        } else {
            int restarts = (initStatus.getRestartCount() != null ? initStatus.getRestartCount() : 0) + 1;
            initStatus.setRestartCount(restarts);
            state.settleFrom = clock.tick() + Math.min(restarts, MAX_BACK_OFF_TICKS);
            pod.getStatus().setReason("Init:CrashLoopBackOff");
            LOGGER.debugCr(reconciliation, "Init container {} failed, restart {} with back-off", init.getName(), restarts);
        }
    }

    private void evaluateProbes(Reconciliation reconciliation, Pod pod, PodRuntimeState state, long age) {
        Container main = pod.getSpec().getContainers().get(0);

        if (!state.startupDone) {
            Probe startup = ProbeType.STARTUP.of(main);

            if (startup == null) {
                state.startupDone = true;
            } else if (isDue(startup, age)) {
                if (probeOutcomePolicy.probe(pod, ProbeType.STARTUP, age)) {
                    state.recordProbeSuccess(ProbeType.STARTUP);
                    state.startupDone = true;
                } else if (state.recordProbeFailure(ProbeType.STARTUP) >= failureThreshold(startup)) {
                    events.warning(pod, "Unhealthy", "Startup probe failed");
                    restart(reconciliation, pod, state, "Error", "ContainerCreating", false);
                    return;
                }
            }

            if (!state.startupDone) {
                return;
            }
        }

        Probe liveness = ProbeType.LIVENESS.of(main);
        if (liveness != null && isDue(liveness, age)) {
            if (probeOutcomePolicy.probe(pod, ProbeType.LIVENESS, age)) {
                state.recordProbeSuccess(ProbeType.LIVENESS);
            } else if (state.recordProbeFailure(ProbeType.LIVENESS) >= failureThreshold(liveness)) {
                events.warning(pod, "Unhealthy", "Liveness probe failed");
                restart(reconciliation, pod, state, "Error", "ContainerCreating", false);
                return;
            }
        }

        Probe readiness = ProbeType.READINESS.of(main);
        boolean changed = false;

        if (readiness == null) {
            changed = PodUtils.setReady(pod, true, clock.timestamp());
        } else if (isDue(readiness, age)) {
            if (probeOutcomePolicy.probe(pod, ProbeType.READINESS, age)) {
                state.recordProbeSuccess(ProbeType.READINESS);
                changed = PodUtils.setReady(pod, true, clock.timestamp());
            } else if (state.recordProbeFailure(ProbeType.READINESS) >= failureThreshold(readiness)) {
                changed = PodUtils.setReady(pod, false, clock.timestamp());
            }
        }

        if (changed) {
            store.touch(pod, false);
            LOGGER.debugCr(reconciliation, "Pod readiness changed to {}", PodUtils.isReady(pod));
        }
    }

    private void restart(Reconciliation reconciliation, Pod pod, PodRuntimeState state, String terminationReason, String waitingReason, boolean withBackOff) {
        if ("Never".equals(pod.getSpec().getRestartPolicy())) {
            fail(pod, null, null, terminationReason, EXIT_CODE_ERROR);
            LOGGER.infoCr(reconciliation, "Container terminated and the pod is not restarted");
            return;
        }

        int restarts = PodUtils.restartCount(pod) + 1;
        long backOff = withBackOff ? Math.min(restarts, MAX_BACK_OFF_TICKS) : 0;
        state.restart(clock.tick() + backOff);

        ContainerState lastState = terminated(terminationReason, EXIT_CODE_ERROR);
        for (ContainerStatus status : pod.getStatus().getContainerStatuses()) {
            status.setRestartCount(restarts);
            status.setLastState(lastState);
            status.setState(waiting(waitingReason, null));
            status.setStarted(false);
        }

        pod.getStatus().setPhase(PodUtils.PHASE_PENDING);
        PodUtils.setReady(pod, false, clock.timestamp());
        store.touch(pod, false);

        LOGGER.infoCr(reconciliation, "Container restarted ({} restarts, back-off {} ticks)", restarts, backOff);
    }

    private void oomKill(Reconciliation reconciliation, Pod pod) {
        fail(pod, "OOMKilled", "Container " + mainContainerName(pod) + " exceeded its memory limit", "OOMKilled", EXIT_CODE_OOM_KILLED);
        events.warning(pod, "OOMKilled", "Container " + mainContainerName(pod) + " was OOM killed");
        LOGGER.infoCr(reconciliation, "Pod was OOM killed");

        // The owner replaces the pod. Job pods stay so that the Job counts the failure.
        if (ModelUtils.controllerOf(pod) != null && !ModelUtils.isControlledByKind(pod, ResourceKind.JOB)) {
            store.markDeleted(pod);
        }
    }

    private void complete(Reconciliation reconciliation, Pod pod) {
        if (Annotations.booleanAnnotation(pod, Annotations.ANNO_SIMULATE_FAILURE, false)) {
            fail(pod, null, null, "Error", EXIT_CODE_ERROR);
            LOGGER.infoCr(reconciliation, "Pod completed with a failure");
        } else {
            pod.getStatus().setPhase(PodUtils.PHASE_SUCCEEDED);
            setContainerStates(pod, terminated("Completed", 0));
            PodUtils.setReady(pod, false, clock.timestamp());
            store.touch(pod, false);
            LOGGER.infoCr(reconciliation, "Pod completed successfully");
        }
    }

    private void fail(Pod pod, String reason, String message, String terminationReason, int exitCode) {
        pod.getStatus().setPhase(PodUtils.PHASE_FAILED);
        pod.getStatus().setReason(reason);
        pod.getStatus().setMessage(message);
        setContainerStates(pod, terminated(terminationReason, exitCode));
        PodUtils.setReady(pod, false, clock.timestamp());
        store.touch(pod, false);
    }

    private boolean isDue(Probe probe, long age) {
        int delay = probe.getInitialDelaySeconds() != null ? Math.max(probe.getInitialDelaySeconds(), 0) : 0;
        int period = probe.getPeriodSeconds() != null && probe.getPeriodSeconds() > 0 ? probe.getPeriodSeconds() : 1;

        return age >= delay && (age - delay) % period == 0;
    }

    private int failureThreshold(Probe probe) {
        return probe.getFailureThreshold() != null && probe.getFailureThreshold() > 0 ? probe.getFailureThreshold() : DEFAULT_FAILURE_THRESHOLD;
    }

    private void setContainerStates(Pod pod, ContainerState state) {
        for (ContainerStatus status : pod.getStatus().getContainerStatuses()) {
            status.setState(ModelUtils.deepCopy(state));
        }
    }

    private void ensureInitContainerStatuses(Pod pod, List<Container> initContainers) {
        if (pod.getStatus().getInitContainerStatuses() == null || pod.getStatus().getInitContainerStatuses().size() != initContainers.size()) {
            List<ContainerStatus> statuses = new ArrayList<>(initContainers.size());

            for (Container container : initContainers) {
                statuses.add(new ContainerStatusBuilder()
                        .withName(container.getName())
                        .withImage(container.getImage())
                        .withReady(false)
                        .withRestartCount(0)
                        .withState(waiting("PodInitializing", null))
                        .build());
            }

            pod.getStatus().setInitContainerStatuses(statuses);
            PodUtils.setCondition(pod, PodUtils.CONDITION_INITIALIZED, false, "ContainersNotInitialized", null, clock.timestamp());
        }
    }

    private static Set<String> failingInitContainers(Pod pod) {
        return Arrays.stream(Annotations.stringAnnotation(pod, Annotations.ANNO_FAIL_INIT_CONTAINER, "").split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String mainContainerName(Pod pod) {
        return pod.getSpec().getContainers().get(0).getName();
    }

    private static ContainerState waiting(String reason, String message) {
        return new ContainerStateBuilder().withNewWaiting().withReason(reason).withMessage(message).endWaiting().build();
    }

    private ContainerState terminated(String reason, int exitCode) {
        return new ContainerStateBuilder()
                .withNewTerminated()
                    .withReason(reason)
                    .withExitCode(exitCode)
                    .withFinishedAt(clock.timestamp())
                .endTerminated()
                .build();
    }

    private String nextPodIp() {
        int ip = nextIp++;
        return "10.244." + (ip / 254 % 256) + "." + (ip % 254 + 1);
    }
}
