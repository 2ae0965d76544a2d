/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.store;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.api.model.autoscaling.v1.HorizontalPodAutoscalerBuilder;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudgetBuilder;
import io.fabric8.kubernetes.api.model.storage.StorageClassBuilder;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ResourceValidatorTest {
    @Test
    public void testValidResources() {
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE)));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.STATEFUL_SET, ResourceUtils.statefulSet("db", 3, "OrderedReady")));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.JOB, ResourceUtils.job("batch", 3, 2, 1)));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.CRON_JOB, ResourceUtils.cronJob("nightly", "0 2 * * *", "Forbid")));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.HORIZONTAL_POD_AUTOSCALER, ResourceUtils.hpa("web", "web", 1, 5, 50)));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.POD_DISRUPTION_BUDGET, ResourceUtils.pdbMinAvailable("web", "web", new IntOrString("50%"))));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME, ResourceUtils.persistentVolume("disk", "manual", "10Gi", "Retain")));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME_CLAIM, ResourceUtils.persistentVolumeClaim("data", null, "500Mi")));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.STORAGE_CLASS, ResourceUtils.storageClass("standard", null)));
        assertDoesNotThrow(() -> ResourceValidator.validate(ResourceKind.CONFIG_MAP, ResourceUtils.configMap("settings")));
    }

    @Test
    public void testInvalidNames() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.POD, ResourceUtils.pod("My_Pod", "app")));
        assertThat(e.getMessage(), containsString("RFC 1123"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.POD, ResourceUtils.pod("", "app")));
        assertThat(e.getMessage(), is("Pod is invalid: metadata.name: Required value"));

        assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.POD, ResourceUtils.pod("a".repeat(254), "app")));
    }

    @Test
    public void testPodWithoutContainers() {
        Pod pod = new PodBuilder(ResourceUtils.pod("my-pod", "app")).editSpec().withContainers().endSpec().build();

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> ResourceValidator.validate(ResourceKind.POD, pod));
        assertThat(e.getMessage(), is("Pod default/my-pod is invalid: spec.containers: Required value"));
    }

    @Test
    public void testContainerWithoutImage() {
        Pod pod = new PodBuilder(ResourceUtils.pod("my-pod", "app")).editSpec().editFirstContainer().withImage(null).endContainer().endSpec().build();

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> ResourceValidator.validate(ResourceKind.POD, pod));
        assertThat(e.getMessage(), containsString("spec.containers.image"));
    }

    @Test
    public void testSelectorHasToMatchTemplate() {
        Deployment deployment = new DeploymentBuilder(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE))
                .editSpec()
                    .editSelector()
                        .withMatchLabels(Map.of("app", "other"))
                    .endSelector()
                .endSpec()
                .build();

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, deployment));
        assertThat(e.getMessage(), containsString("`selector` does not match template `labels`"));
    }

    @Test
    public void testEmptySelector() {
        Deployment deployment = new DeploymentBuilder(ResourceUtils.deployment("web", 3, ResourceUtils.IMAGE))
                .editSpec()
                    .withNewSelector()
                    .endSelector()
                .endSpec()
                .build();

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, deployment));
        assertThat(e.getMessage(), is("Deployment default/web is invalid: spec.selector: Required value"));
    }

    @Test
    public void testNegativeReplicas() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, ResourceUtils.deployment("web", -1, ResourceUtils.IMAGE)));
        assertThat(e.getMessage(), containsString("spec.replicas: must be greater than or equal to 0"));
    }

    @Test
    public void testUnsupportedEnumValues() {
        assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, new DeploymentBuilder(ResourceUtils.deployment("web", 1, ResourceUtils.IMAGE))
                        .editSpec().withNewStrategy().withType("BlueGreen").endStrategy().endSpec().build()));

        assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.STATEFUL_SET, new StatefulSetBuilder(ResourceUtils.statefulSet("db", 1, "OrderedReady"))
                        .editSpec().withPodManagementPolicy("Random").endSpec().build()));

        assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.CRON_JOB, ResourceUtils.cronJob("nightly", "0 2 * * *", "Sometimes")));
    }

    @Test
    public void testInvalidRollingUpdatePercentage() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.DEPLOYMENT, new DeploymentBuilder(ResourceUtils.rollingDeployment("web", 3, ResourceUtils.IMAGE, 1, 1))
                        .editSpec().editStrategy().editRollingUpdate().withMaxSurge(new IntOrString("lots")).endRollingUpdate().endStrategy().endSpec().build()));
        assertThat(e.getMessage(), containsString("spec.strategy.rollingUpdate.maxSurge"));
    }

    @Test
    public void testInvalidCronSchedule() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.CRON_JOB, ResourceUtils.cronJob("nightly", "every now and then", "Allow")));
        assertThat(e.getMessage(), containsString("spec.schedule"));
    }

    @Test
    public void testHpaBounds() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.HORIZONTAL_POD_AUTOSCALER, ResourceUtils.hpa("web", "web", 5, 2, 50)));
        assertThat(e.getMessage(), containsString("must be greater than or equal to `minReplicas`"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.HORIZONTAL_POD_AUTOSCALER, ResourceUtils.hpa("web", "web", 1, 5, 0)));
        assertThat(e.getMessage(), containsString("spec.targetCPUUtilizationPercentage"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.HORIZONTAL_POD_AUTOSCALER, new HorizontalPodAutoscalerBuilder(ResourceUtils.hpa("web", "web", 1, 5, 50))
                        .editSpec().withScaleTargetRef(null).endSpec().build()));
        assertThat(e.getMessage(), containsString("spec.scaleTargetRef"));
    }

    @Test
    public void testPdbNeedsExactlyOneBudget() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.POD_DISRUPTION_BUDGET, new PodDisruptionBudgetBuilder(ResourceUtils.pdbMinAvailable("web", "web", new IntOrString(1)))
                        .editSpec().withMaxUnavailable(new IntOrString(1)).endSpec().build()));
        assertThat(e.getMessage(), containsString("cannot be both set"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.POD_DISRUPTION_BUDGET, ResourceUtils.pdbMinAvailable("web", "web", null)));
        assertThat(e.getMessage(), containsString("one of minAvailable or maxUnavailable is required"));
    }

    @Test
    public void testStorageResources() {
        InvalidResourceException e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME, ResourceUtils.persistentVolume("disk", "manual", "lots", "Retain")));
        assertThat(e.getMessage(), containsString("spec.capacity.storage: quantities must match the regular expression"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME, ResourceUtils.persistentVolume("disk", "manual", "1Gi", "Recycle")));
        assertThat(e.getMessage(), is("PersistentVolume disk is invalid: spec.persistentVolumeReclaimPolicy: Unsupported value: Recycle"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME_CLAIM, new PersistentVolumeClaimBuilder(ResourceUtils.persistentVolumeClaim("data", null, "1Gi"))
                        .editSpec().withAccessModes("ReadWriteSometimes").endSpec().build()));
        assertThat(e.getMessage(), is("PersistentVolumeClaim default/data is invalid: spec.accessModes: Unsupported value: ReadWriteSometimes"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.PERSISTENT_VOLUME_CLAIM, new PersistentVolumeClaimBuilder(ResourceUtils.persistentVolumeClaim("data", null, "1Gi"))
                        .editSpec().withResources(null).endSpec().build()));
        assertThat(e.getMessage(), containsString("spec.resources.requests: Required value"));

        e = assertThrows(InvalidResourceException.class,
                () -> ResourceValidator.validate(ResourceKind.STORAGE_CLASS, new StorageClassBuilder(ResourceUtils.storageClass("standard", null)).withProvisioner(null).build()));
        assertThat(e.getMessage(), is("StorageClass standard is invalid: provisioner: Required value"));
    }
}
