/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobStatus;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.StatusUtils;
import io.kubesim.simulator.model.CronSchedule;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Starts Jobs on a schedule. The schedule is evaluated once per tick against the simulated time, so with the default
 * tick of one minute every minute of the simulated time is checked exactly once.
 */
public class CronJobController extends AbstractController<CronJob> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(CronJobController.class);

    private static final String ALLOW = "Allow";
    private static final String FORBID = "Forbid";
    private static final String REPLACE = "Replace";
    private static final int DEFAULT_SUCCESSFUL_JOBS_HISTORY_LIMIT = 3;
    private static final int DEFAULT_FAILED_JOBS_HISTORY_LIMIT = 1;

    private final Map<String, CronSchedule> schedules = new HashMap<>();

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public CronJobController(ControllerContext context) {
        super(CronJob.class, context);
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, CronJob cronJob) {
        CronJobStatus status = cronJob.getStatus() != null ? cronJob.getStatus() : new CronJobStatus();
        cronJob.setStatus(status);

        List<Job> jobs = store.dependents(cronJob, Job.class).stream()
                .filter(job -> ModelUtils.isControlledBy(job, cronJob))
                .filter(job -> !PodUtils.isTombstoned(job))
                .toList();

        reportCompletedJobs(cronJob, jobs);
        enforceHistoryLimits(reconciliation, cronJob, jobs);

        List<Job> active = new ArrayList<>(jobs.stream().filter(job -> !JobController.isFinished(job)).toList());

        if (!Boolean.TRUE.equals(cronJob.getSpec().getSuspend()) && isDue(cronJob)) {
            String policy = cronJob.getSpec().getConcurrencyPolicy() != null ? cronJob.getSpec().getConcurrencyPolicy() : ALLOW;

            if (FORBID.equals(policy) && !active.isEmpty()) {
                LOGGER.infoCr(reconciliation, "Skipping the scheduled run, a previous Job is still active");
                events.normal(cronJob, "JobAlreadyActive", "Not starting job because prior execution is running and concurrency policy is Forbid");
            } else {
                if (REPLACE.equals(policy)) {
                    for (Job job : active) {
                        store.markDeleted(job);
                        events.normal(cronJob, "SuccessfulDelete", "Deleted job " + job.getMetadata().getName());
                    }

                    active.clear();
                }

                Job job = createJob(reconciliation, cronJob);
                if (job != null) {
                    active.add(job);
                }
            }
        }

        List<ObjectReference> references = active.stream().map(CronJobController::reference).toList();
        if (!Objects.equals(references, status.getActive() != null ? status.getActive() : List.of())) {
            status.setActive(new ArrayList<>(references));
            store.touch(cronJob, false);
        }
    }

    private boolean isDue(CronJob cronJob) {
        CronSchedule schedule = schedules.computeIfAbsent(cronJob.getSpec().getSchedule(), CronSchedule::parse);
        long tick = clock.tick();
        Instant now = clock.now();

        if (!schedule.matches(now, tick)) {
            return false;
        }

        String lastScheduleTime = cronJob.getStatus().getLastScheduleTime();
        if (lastScheduleTime != null) {
            // Never fire twice for the same tick or the same minute
            if (clock.tickOf(lastScheduleTime) == tick) {
                return false;
            }

            return schedule.isTickBased()
                    || !StatusUtils.isoUtcDatetime(lastScheduleTime).truncatedTo(ChronoUnit.MINUTES).equals(now.truncatedTo(ChronoUnit.MINUTES));
        }

        return true;
    }

    private Job createJob(Reconciliation reconciliation, CronJob cronJob) {
        String namespace = cronJob.getMetadata().getNamespace();
        String name = cronJob.getMetadata().getName() + "-" + clock.tick();

        if (store.get(Job.class, namespace, name) != null) {
            LOGGER.warnCr(reconciliation, "Job {} already exists", name);
            return null;
        }

        ObjectMeta templateMetadata = cronJob.getSpec().getJobTemplate().getMetadata();
        Job job = new JobBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(templateMetadata != null && templateMetadata.getLabels() != null ? new HashMap<>(templateMetadata.getLabels()) : null)
                    .withAnnotations(templateMetadata != null && templateMetadata.getAnnotations() != null ? new HashMap<>(templateMetadata.getAnnotations()) : null)
                    .withOwnerReferences(ModelUtils.createOwnerReference(cronJob, true))
                .endMetadata()
                .withSpec(ModelUtils.deepCopy(cronJob.getSpec().getJobTemplate().getSpec()))
                .build();

        Job created = store.create(job);
        cronJob.getStatus().setLastScheduleTime(clock.timestamp());
        store.touch(cronJob, false);

        LOGGER.infoCr(reconciliation, "Created Job {}", name);
        events.normal(cronJob, "SuccessfulCreate", "Created job " + name);
        return created;
    }

    private void reportCompletedJobs(CronJob cronJob, List<Job> jobs) {
        Set<String> previouslyActive = new HashSet<>();
        if (cronJob.getStatus().getActive() != null) {
            cronJob.getStatus().getActive().forEach(reference -> previouslyActive.add(reference.getUid()));
        }

        for (Job job : jobs) {
            if (previouslyActive.contains(job.getMetadata().getUid()) && JobController.isFinished(job)) {
                String result = JobController.hasCondition(job, JobController.CONDITION_COMPLETE) ? JobController.CONDITION_COMPLETE : JobController.CONDITION_FAILED;
                events.normal(cronJob, "SawCompletedJob", "Saw completed job: " + job.getMetadata().getName() + ", status: " + result);

                if (JobController.CONDITION_COMPLETE.equals(result)) {
                    cronJob.getStatus().setLastSuccessfulTime(job.getStatus().getCompletionTime());
                }
            }
        }
    }

    private void enforceHistoryLimits(Reconciliation reconciliation, CronJob cronJob, List<Job> jobs) {
        int successfulLimit = cronJob.getSpec().getSuccessfulJobsHistoryLimit() != null ? cronJob.getSpec().getSuccessfulJobsHistoryLimit() : DEFAULT_SUCCESSFUL_JOBS_HISTORY_LIMIT;
        int failedLimit = cronJob.getSpec().getFailedJobsHistoryLimit() != null ? cronJob.getSpec().getFailedJobsHistoryLimit() : DEFAULT_FAILED_JOBS_HISTORY_LIMIT;

        prune(reconciliation, jobs.stream().filter(job -> JobController.hasCondition(job, JobController.CONDITION_COMPLETE)).toList(), successfulLimit);
        prune(reconciliation, jobs.stream().filter(job -> JobController.hasCondition(job, JobController.CONDITION_FAILED)).toList(), failedLimit);
    }

    private void prune(Reconciliation reconciliation, List<Job> finished, int limit) {
        // The Jobs are in creation order, the oldest go first
        for (int i = 0; i < finished.size() - limit; i++) {
            Job job = finished.get(i);
            store.markDeleted(job);
            LOGGER.debugCr(reconciliation, "Removed finished Job {} from the history", job.getMetadata().getName());
        }
    }

    private static ObjectReference reference(Job job) {
        return new ObjectReferenceBuilder()
                .withApiVersion("batch/v1")
                .withKind("Job")
                .withName(job.getMetadata().getName())
                .withNamespace(job.getMetadata().getNamespace())
                .withUid(job.getMetadata().getUid())
                .build();
    }
}
