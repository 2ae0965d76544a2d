/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.kubesim.common.model.Labels;
import io.kubesim.simulator.ClusterSimulator;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.model.Annotations;
import io.kubesim.simulator.model.FailureMode;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

public class JobControllerTest {
    private static Job job(ClusterSimulator simulator, String name) {
        return simulator.get(ResourceKind.JOB, "default", name);
    }

    private static List<Pod> jobPods(ClusterSimulator simulator, String job) {
        return simulator.<Pod>list(ResourceKind.POD).stream()
                .filter(pod -> job.equals(pod.getMetadata().getLabels().get(Labels.JOB_NAME_LABEL)))
                .toList();
    }

    @Test
    public void testRunsToCompletionWithParallelism() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.job("batch", 3, 2, 1));

        simulator.tick();
        assertThat(jobPods(simulator, "batch").size(), is(2));
        assertThat(jobPods(simulator, "batch").stream().map(pod -> pod.getSpec().getRestartPolicy()).toList(), everyItem(is("Never")));
        assertThat(job(simulator, "batch").getStatus().getStartTime(), is(notNullValue()));

        // Two pods finish, the last completion needs one more pod
        simulator.tick(3);
        assertThat(job(simulator, "batch").getStatus().getSucceeded(), is(2));
        assertThat(jobPods(simulator, "batch").stream().filter(PodUtils::isLive).count(), is(1L));

        simulator.tick(2);
        assertThat(JobController.isFinished(job(simulator, "batch")), is(false));

        simulator.tick();

        Job job = job(simulator, "batch");
        assertThat(job.getStatus().getSucceeded(), is(3));
        assertThat(job.getStatus().getActive(), is(0));
        assertThat(job.getStatus().getCompletionTime(), is(notNullValue()));
        assertThat(JobController.hasCondition(job, JobController.CONDITION_COMPLETE), is(true));
        assertThat(simulator.events("Completed").size(), is(1));
        assertThat(jobPods(simulator, "batch").size(), is(3));
        assertThat(jobPods(simulator, "batch").stream().allMatch(PodUtils::isSucceeded), is(true));
    }

    @Test
    public void testFinishedPodsAreCountedOnce() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.job("batch", 1, 1, 1));
        simulator.tick(10);

        Job job = job(simulator, "batch");
        assertThat(job.getStatus().getSucceeded(), is(1));
        assertThat(job.getStatus().getFailed(), is(nullValue()));
        assertThat(jobPods(simulator, "batch").get(0).getMetadata().getFinalizers().isEmpty(), is(true));
    }

    @Test
    public void testBackoffLimitFailsTheJob() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(new JobBuilder(ResourceUtils.job("batch", 1, 1, 1))
                .editSpec()
                    .editTemplate()
                        .editMetadata()
                            .addToAnnotations(Annotations.ANNO_SIMULATE_FAILURE, "true")
                        .endMetadata()
                    .endTemplate()
                .endSpec()
                .build());

        simulator.tick(4);
        assertThat(job(simulator, "batch").getStatus().getFailed(), is(1));
        assertThat(jobPods(simulator, "batch").size(), is(2));
        assertThat(JobController.isFinished(job(simulator, "batch")), is(false));

        simulator.tick(3);

        Job job = job(simulator, "batch");
        assertThat(job.getStatus().getFailed(), is(2));
        assertThat(JobController.hasCondition(job, JobController.CONDITION_FAILED), is(true));
        assertThat(job.getStatus().getConditions().get(0).getReason(), is("BackoffLimitExceeded"));
        assertThat(simulator.events("BackoffLimitExceeded").size(), is(1));

        // No more pods once the Job failed
        simulator.tick(5);
        assertThat(jobPods(simulator, "batch").size(), is(2));
    }

    @Test
    public void testSuspendedJobCreatesNoPods() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(new JobBuilder(ResourceUtils.job("batch", 2, 2, 1))
                .editSpec()
                    .withSuspend(true)
                .endSpec()
                .build());

        simulator.tick(3);
        assertThat(jobPods(simulator, "batch").isEmpty(), is(true));

        Job job = job(simulator, "batch");
        job.getSpec().setSuspend(false);
        simulator.update(job);
        simulator.tick();

        assertThat(jobPods(simulator, "batch").size(), is(2));
    }

    @Test
    public void testOomKilledJobPodCountsAsFailure() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.job("batch", 1, 1, 0));
        simulator.tick(2);

        String pod = jobPods(simulator, "batch").get(0).getMetadata().getName();
        simulator.injectFailure("default", pod, FailureMode.OOM_KILLED);
        simulator.tick();

        Job job = job(simulator, "batch");
        assertThat(job.getStatus().getFailed(), is(1));
        assertThat(JobController.hasCondition(job, JobController.CONDITION_FAILED), is(true));
    }

    @Test
    public void testPodsAreRemovedWithTheJob() {
        ClusterSimulator simulator = ResourceUtils.simulatorWithNodes(1, 10);
        simulator.create(ResourceUtils.job("batch", 2, 2, 1));
        simulator.tick(2);

        simulator.delete(ResourceKind.JOB, "default", "batch");
        simulator.tick(3);

        assertThat(jobPods(simulator, "batch").isEmpty(), is(true));
        assertThat(job(simulator, "batch"), is(nullValue()));
    }
}
