/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.api.model.batch.v1.JobConditionBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.StatusUtils;
import io.kubesim.simulator.model.Annotations;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs Jobs to completion. Job pods carry a tracking finalizer, so that finished pods are counted into the Job status
 * exactly once before the garbage collector can remove them.
 * <p>
 * A Job which failed more than {@code backoffLimit} times is terminal: its pods are removed and no pod is ever
 * created for it again.
 */
public class JobController extends AbstractController<Job> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(JobController.class);

    /**
     * Condition type of a successfully finished Job
     */
    public static final String CONDITION_COMPLETE = "Complete";
    /**
     * Condition type of a failed Job
     */
    public static final String CONDITION_FAILED = "Failed";

    private static final int DEFAULT_BACKOFF_LIMIT = 6;

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public JobController(ControllerContext context) {
        super(Job.class, context);
    }

    @Override
    public void reconcile() {
        releaseOrphanedPods();
        super.reconcile();
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, Job job) {
        JobStatus status = job.getStatus() != null ? job.getStatus() : new JobStatus();
        job.setStatus(status);

        if (status.getStartTime() == null) {
            status.setStartTime(clock.timestamp());
        }

        List<Pod> pods = WorkloadUtils.controlledPods(store, job);
        countFinishedPods(reconciliation, job, pods);

        if (isFinished(job)) {
            status.setActive(0);
            return;
        }

        int completions = job.getSpec().getCompletions() != null ? job.getSpec().getCompletions() : 1;
        int parallelism = job.getSpec().getParallelism() != null ? job.getSpec().getParallelism() : 1;
        int backoffLimit = job.getSpec().getBackoffLimit() != null ? job.getSpec().getBackoffLimit() : DEFAULT_BACKOFF_LIMIT;
        int succeeded = value(status.getSucceeded());
        int failed = value(status.getFailed());

        List<Pod> active = pods.stream().filter(PodUtils::isLive).toList();

        if (failed > backoffLimit) {
            LOGGER.warnCr(reconciliation, "Job failed {} times, the backoff limit is {}", failed, backoffLimit);
            setCondition(job, CONDITION_FAILED, "BackoffLimitExceeded", "Job has reached the specified backoff limit");
            events.warning(job, "BackoffLimitExceeded", "Job has reached the specified backoff limit");
            active.forEach(store::markDeleted);
            status.setActive(0);
            status.setReady(0);
            store.touch(job, false);
            return;
        }

        if (succeeded >= completions) {
            LOGGER.infoCr(reconciliation, "Job completed");
            status.setCompletionTime(clock.timestamp());
            setCondition(job, CONDITION_COMPLETE, null, null);
            events.normal(job, "Completed", "Job completed");
            active.forEach(store::markDeleted);
            status.setActive(0);
            status.setReady(0);
            store.touch(job, false);
            return;
        }

        int wanted = Boolean.TRUE.equals(job.getSpec().getSuspend()) ? 0 : Math.min(parallelism, completions - succeeded);

        if (active.size() < wanted) {
            for (int i = active.size(); i < wanted; i++) {
                createPod(job);
            }
        } else if (active.size() > wanted) {
            active.stream()
                    .sorted(Comparator.comparingLong(store::sequence).reversed())
                    .limit(active.size() - wanted)
                    .forEach(pod -> {
                        store.markDeleted(pod);
                        events.normal(job, "SuccessfulDelete", "Deleted pod: " + pod.getMetadata().getName());
                    });
        }
    }

    private void countFinishedPods(Reconciliation reconciliation, Job job, List<Pod> pods) {
        JobStatus status = job.getStatus();
        boolean changed = false;

        for (Pod pod : pods) {
            if (!hasTrackingFinalizer(pod)) {
                continue;
            }

            if (PodUtils.isSucceeded(pod)) {
                status.setSucceeded(value(status.getSucceeded()) + 1);
                LOGGER.debugCr(reconciliation, "Pod {} succeeded", pod.getMetadata().getName());
            } else if (PodUtils.isFailed(pod)) {
                status.setFailed(value(status.getFailed()) + 1);
                LOGGER.infoCr(reconciliation, "Pod {} failed", pod.getMetadata().getName());
            } else if (!PodUtils.isTombstoned(pod)) {
                continue;
            }

            removeTrackingFinalizer(pod);
            changed = true;
        }

        if (changed) {
            store.touch(job, false);
        }
    }

    /**
     * Releases the tracking finalizer of pods whose Job is gone, they can never be counted
     */
    private void releaseOrphanedPods() {
        for (Pod pod : store.list(Pod.class)) {
            if (!hasTrackingFinalizer(pod)) {
                continue;
            }

            OwnerReference owner = ModelUtils.controllerOf(pod);
            HasMetadata job = owner != null ? store.getByUid(owner.getUid()) : null;

            if (job == null || PodUtils.isTombstoned(job)) {
                removeTrackingFinalizer(pod);
            }
        }
    }

    private void createPod(Job job) {
        String namespace = job.getMetadata().getNamespace();
        String name = WorkloadUtils.freePodName(store, context.names(), namespace, job.getMetadata().getName());
        Labels labels = Labels.EMPTY
                .with(Labels.JOB_NAME_LABEL, job.getMetadata().getName())
                .with(Labels.CONTROLLER_UID_LABEL, job.getMetadata().getUid());

        Pod pod = ModelUtils.podFromTemplate(job.getSpec().getTemplate(), namespace, name, job, labels);
        pod.getSpec().setRestartPolicy("Never");
        pod.getMetadata().setFinalizers(new ArrayList<>(List.of(Annotations.JOB_TRACKING_FINALIZER)));

        if (!Annotations.hasAnnotation(pod, Annotations.ANNO_COMPLETION_TICKS)) {
            Annotations.annotate(pod, Annotations.ANNO_COMPLETION_TICKS, String.valueOf(context.config().getJobCompletionTicks()));
        }

        store.create(pod);
        events.normal(job, "SuccessfulCreate", "Created pod: " + name);
    }

    @Override
    protected void updateStatus(Job job) {
        if (job.getStatus() == null || isFinished(job)) {
            return;
        }

        List<Pod> active = WorkloadUtils.livePods(store, job);
        int ready = (int) active.stream().filter(PodUtils::isReady).count();

        if (value(job.getStatus().getActive()) != active.size() || value(job.getStatus().getReady()) != ready) {
            job.getStatus().setActive(active.size());
            job.getStatus().setReady(ready);
            store.touch(job, false);
        }
    }

    /**
     * @param job   Job
     *
     * @return  True if the Job completed or failed
     */
    public static boolean isFinished(Job job) {
        return hasCondition(job, CONDITION_COMPLETE) || hasCondition(job, CONDITION_FAILED);
    }

    /**
     * @param job   Job
     * @param type  Condition type
     *
     * @return  True if the Job has the condition set to True
     */
    public static boolean hasCondition(Job job, String type) {
        if (job.getStatus() == null || job.getStatus().getConditions() == null) {
            return false;
        }

        return job.getStatus().getConditions().stream().anyMatch(condition -> type.equals(condition.getType()) && StatusUtils.isTrue(condition.getStatus()));
    }

    private void setCondition(Job job, String type, String reason, String message) {
        List<JobCondition> conditions = job.getStatus().getConditions() != null ? new ArrayList<>(job.getStatus().getConditions()) : new ArrayList<>(1);
        conditions.add(new JobConditionBuilder()
                .withType(type)
                .withStatus("True")
                .withReason(reason)
                .withMessage(message)
                .withLastProbeTime(clock.timestamp())
                .withLastTransitionTime(clock.timestamp())
                .build());
        job.getStatus().setConditions(conditions);
    }

    private static boolean hasTrackingFinalizer(Pod pod) {
        return pod.getMetadata().getFinalizers() != null && pod.getMetadata().getFinalizers().contains(Annotations.JOB_TRACKING_FINALIZER);
    }

    private void removeTrackingFinalizer(Pod pod) {
        List<String> finalizers = new ArrayList<>(pod.getMetadata().getFinalizers());
        finalizers.remove(Annotations.JOB_TRACKING_FINALIZER);
        pod.getMetadata().setFinalizers(finalizers);
        store.touch(pod, false);
    }

    private static int value(Integer value) {
        return value != null ? value : 0;
    }
}
