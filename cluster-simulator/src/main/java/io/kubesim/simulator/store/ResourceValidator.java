/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.store;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentStrategy;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.autoscaling.v1.HorizontalPodAutoscaler;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobSpec;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudget;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.kubesim.common.Util;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.model.CronSchedule;
import io.kubesim.simulator.model.ResourceKind;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates resources at the mutation boundary. Invalid resources are rejected with {@link InvalidResourceException}
 * before they reach the store.
 */
public class ResourceValidator {
    private static final Pattern DNS_1123_SUBDOMAIN = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*$");
    private static final int MAX_NAME_LENGTH = 253;

    private static final Set<String> DEPLOYMENT_STRATEGIES = Set.of("RollingUpdate", "Recreate");
    private static final Set<String> POD_MANAGEMENT_POLICIES = Set.of("OrderedReady", "Parallel");
    private static final Set<String> STATEFUL_SET_UPDATE_STRATEGIES = Set.of("RollingUpdate", "OnDelete");
    private static final Set<String> CONCURRENCY_POLICIES = Set.of("Allow", "Forbid", "Replace");
    private static final Set<String> TAINT_EFFECTS = Set.of("NoSchedule", "PreferNoSchedule", "NoExecute");
    private static final Set<String> ACCESS_MODES = Set.of("ReadWriteOnce", "ReadOnlyMany", "ReadWriteMany", "ReadWriteOncePod");
    private static final Set<String> RECLAIM_POLICIES = Set.of("Retain", "Delete");

    private ResourceValidator() { }

    /**
     * Validates a resource. The namespace is expected to be already defaulted.
     *
     * @param kind      Kind of the resource
     * @param resource  Resource
     *
     * @throws InvalidResourceException When the resource is not valid
     */
    public static void validate(ResourceKind kind, HasMetadata resource) throws InvalidResourceException {
        String name = resource.getMetadata() != null ? resource.getMetadata().getName() : null;

        if (name == null || name.isEmpty()) {
            throw new InvalidResourceException(kind.kind() + " is invalid: metadata.name: Required value");
        } else if (name.length() > MAX_NAME_LENGTH || !DNS_1123_SUBDOMAIN.matcher(name).matches()) {
            throw new InvalidResourceException(kind.kind() + " " + name + " is invalid: metadata.name: a lowercase RFC 1123 subdomain must consist of lower case alphanumeric characters, '-' or '.'");
        }

        Validation validation = new Validation(kind, NamespaceAndName.of(resource));

        switch (kind) {
            case NODE -> validateNode(validation, (Node) resource);
            case POD -> validatePodSpec(validation, "spec", ((Pod) resource).getSpec());
            case REPLICA_SET -> {
                ReplicaSet rs = (ReplicaSet) resource;
                validation.require(rs.getSpec() != null, "spec", "Required value");
                validation.nonNegative(rs.getSpec().getReplicas(), "spec.replicas");
                validateSelectedTemplate(validation, rs.getSpec().getSelector(), rs.getSpec().getTemplate());
            }
            case DEPLOYMENT -> validateDeployment(validation, (Deployment) resource);
            case STATEFUL_SET -> validateStatefulSet(validation, (StatefulSet) resource);
            case DAEMON_SET -> {
                DaemonSet ds = (DaemonSet) resource;
                validation.require(ds.getSpec() != null, "spec", "Required value");
                validateSelectedTemplate(validation, ds.getSpec().getSelector(), ds.getSpec().getTemplate());
            }
            case JOB -> validateJobSpec(validation, "spec", ((Job) resource).getSpec());
            case CRON_JOB -> validateCronJob(validation, (CronJob) resource);
            case HORIZONTAL_POD_AUTOSCALER -> validateHpa(validation, (HorizontalPodAutoscaler) resource);
            case POD_DISRUPTION_BUDGET -> validatePdb(validation, (PodDisruptionBudget) resource);
            case SERVICE -> validation.require(((Service) resource).getSpec() != null, "spec", "Required value");
            case PERSISTENT_VOLUME -> validatePersistentVolume(validation, (PersistentVolume) resource);
            case PERSISTENT_VOLUME_CLAIM -> validatePersistentVolumeClaim(validation, (PersistentVolumeClaim) resource);
            case STORAGE_CLASS -> {
                StorageClass storageClass = (StorageClass) resource;
                validation.require(storageClass.getProvisioner() != null && !storageClass.getProvisioner().isEmpty(), "provisioner", "Required value");
                validation.require(storageClass.getReclaimPolicy() == null || RECLAIM_POLICIES.contains(storageClass.getReclaimPolicy()),
                        "reclaimPolicy", "Unsupported value: " + storageClass.getReclaimPolicy());
            }
            case CONFIG_MAP, SECRET -> {
                // Any data is accepted
            }
            default -> throw new IllegalStateException("Unexpected kind " + kind);
        }
    }

    private static void validateNode(Validation validation, Node node) {
        if (node.getStatus() != null && node.getStatus().getCapacity() != null) {
            Quantity pods = node.getStatus().getCapacity().get("pods");

            if (pods != null) {
                try {
                    int capacity = Integer.parseInt(pods.getAmount());
                    validation.require(capacity >= 0, "status.capacity.pods", "must be greater than or equal to 0");
                } catch (NumberFormatException e) {
                    throw validation.invalid("status.capacity.pods", "must be an integer");
                }
            }
        }

        if (node.getSpec() != null && node.getSpec().getTaints() != null) {
            node.getSpec().getTaints().forEach(taint -> {
                validation.require(taint.getKey() != null && !taint.getKey().isEmpty(), "spec.taints.key", "Required value");
                validation.require(TAINT_EFFECTS.contains(taint.getEffect()), "spec.taints.effect", "Unsupported value: " + taint.getEffect());
            });
        }
    }

    private static void validatePodSpec(Validation validation, String path, PodSpec spec) {
        validation.require(spec != null, path, "Required value");

        List<Container> containers = spec.getContainers();
        validation.require(containers != null && !containers.isEmpty(), path + ".containers", "Required value");

        for (Container container : containers) {
            validation.require(container.getName() != null && !container.getName().isEmpty(), path + ".containers.name", "Required value");
            validation.require(container.getImage() != null && !container.getImage().isEmpty(), path + ".containers.image", "Required value");
        }

        if (spec.getInitContainers() != null) {
            for (Container container : spec.getInitContainers()) {
                validation.require(container.getName() != null && !container.getName().isEmpty(), path + ".initContainers.name", "Required value");
                validation.require(container.getImage() != null && !container.getImage().isEmpty(), path + ".initContainers.image", "Required value");
            }
        }
    }

    private static void validateSelectedTemplate(Validation validation, LabelSelector selector, PodTemplateSpec template) {
        validation.require(!Labels.isEmpty(selector), "spec.selector", "Required value");
        validation.require(template != null, "spec.template", "Required value");
        validatePodSpec(validation, "spec.template.spec", template.getSpec());

        boolean matches = template.getMetadata() != null && Labels.matchesSelector(selector, template.getMetadata().getLabels());
        validation.require(matches, "spec.template.metadata.labels", "`selector` does not match template `labels`");
    }

    private static void validateDeployment(Validation validation, Deployment deployment) {
        validation.require(deployment.getSpec() != null, "spec", "Required value");
        validation.nonNegative(deployment.getSpec().getReplicas(), "spec.replicas");
        validation.nonNegative(deployment.getSpec().getRevisionHistoryLimit(), "spec.revisionHistoryLimit");
        validateSelectedTemplate(validation, deployment.getSpec().getSelector(), deployment.getSpec().getTemplate());

        DeploymentStrategy strategy = deployment.getSpec().getStrategy();
        if (strategy != null) {
            validation.require(strategy.getType() == null || DEPLOYMENT_STRATEGIES.contains(strategy.getType()), "spec.strategy.type", "Unsupported value: " + strategy.getType());

            if (strategy.getRollingUpdate() != null) {
                validation.intOrPercent(strategy.getRollingUpdate().getMaxSurge(), "spec.strategy.rollingUpdate.maxSurge");
                validation.intOrPercent(strategy.getRollingUpdate().getMaxUnavailable(), "spec.strategy.rollingUpdate.maxUnavailable");
            }
        }
    }

    private static void validateStatefulSet(Validation validation, StatefulSet sts) {
        validation.require(sts.getSpec() != null, "spec", "Required value");
        validation.nonNegative(sts.getSpec().getReplicas(), "spec.replicas");
        validateSelectedTemplate(validation, sts.getSpec().getSelector(), sts.getSpec().getTemplate());

        String policy = sts.getSpec().getPodManagementPolicy();
        validation.require(policy == null || POD_MANAGEMENT_POLICIES.contains(policy), "spec.podManagementPolicy", "Unsupported value: " + policy);

        if (sts.getSpec().getUpdateStrategy() != null) {
            String type = sts.getSpec().getUpdateStrategy().getType();
            validation.require(type == null || STATEFUL_SET_UPDATE_STRATEGIES.contains(type), "spec.updateStrategy.type", "Unsupported value: " + type);

            if (sts.getSpec().getUpdateStrategy().getRollingUpdate() != null) {
                validation.nonNegative(sts.getSpec().getUpdateStrategy().getRollingUpdate().getPartition(), "spec.updateStrategy.rollingUpdate.partition");
            }
        }
    }

    private static void validateJobSpec(Validation validation, String path, JobSpec spec) {
        validation.require(spec != null, path, "Required value");
        validation.require(spec.getTemplate() != null, path + ".template", "Required value");
        validatePodSpec(validation, path + ".template.spec", spec.getTemplate().getSpec());
        validation.nonNegative(spec.getCompletions(), path + ".completions");
        validation.nonNegative(spec.getParallelism(), path + ".parallelism");
        validation.nonNegative(spec.getBackoffLimit(), path + ".backoffLimit");
    }

    private static void validateCronJob(Validation validation, CronJob cronJob) {
        validation.require(cronJob.getSpec() != null, "spec", "Required value");

        try {
            CronSchedule.parse(cronJob.getSpec().getSchedule());
        } catch (InvalidResourceException e) {
            throw validation.invalid("spec.schedule", e.getMessage());
        }

        validation.require(cronJob.getSpec().getJobTemplate() != null, "spec.jobTemplate", "Required value");
        validateJobSpec(validation, "spec.jobTemplate.spec", cronJob.getSpec().getJobTemplate().getSpec());

        String policy = cronJob.getSpec().getConcurrencyPolicy();
        validation.require(policy == null || CONCURRENCY_POLICIES.contains(policy), "spec.concurrencyPolicy", "Unsupported value: " + policy);
        validation.nonNegative(cronJob.getSpec().getSuccessfulJobsHistoryLimit(), "spec.successfulJobsHistoryLimit");
        validation.nonNegative(cronJob.getSpec().getFailedJobsHistoryLimit(), "spec.failedJobsHistoryLimit");
    }

    private static void validateHpa(Validation validation, HorizontalPodAutoscaler hpa) {
        validation.require(hpa.getSpec() != null, "spec", "Required value");
        validation.require(hpa.getSpec().getScaleTargetRef() != null
                && hpa.getSpec().getScaleTargetRef().getKind() != null
                && hpa.getSpec().getScaleTargetRef().getName() != null, "spec.scaleTargetRef", "Required value");

        Integer max = hpa.getSpec().getMaxReplicas();
        int min = hpa.getSpec().getMinReplicas() != null ? hpa.getSpec().getMinReplicas() : 1;

        validation.require(max != null && max >= 1, "spec.maxReplicas", "must be greater than or equal to 1");
        validation.require(min >= 1, "spec.minReplicas", "must be greater than or equal to 1");
        validation.require(min <= max, "spec.maxReplicas", "must be greater than or equal to `minReplicas`");

        Integer target = hpa.getSpec().getTargetCPUUtilizationPercentage();
        validation.require(target == null || target > 0, "spec.targetCPUUtilizationPercentage", "must be greater than 0");
    }

    private static void validatePersistentVolume(Validation validation, PersistentVolume pv) {
        validation.require(pv.getSpec() != null, "spec", "Required value");
        validation.require(pv.getSpec().getCapacity() != null, "spec.capacity", "Required value");
        validation.quantity(pv.getSpec().getCapacity().get("storage"), "spec.capacity.storage");
        validation.accessModes(pv.getSpec().getAccessModes(), "spec.accessModes");

        String policy = pv.getSpec().getPersistentVolumeReclaimPolicy();
        validation.require(policy == null || RECLAIM_POLICIES.contains(policy), "spec.persistentVolumeReclaimPolicy", "Unsupported value: " + policy);
    }

    private static void validatePersistentVolumeClaim(Validation validation, PersistentVolumeClaim pvc) {
        validation.require(pvc.getSpec() != null, "spec", "Required value");
        validation.accessModes(pvc.getSpec().getAccessModes(), "spec.accessModes");
        validation.require(pvc.getSpec().getResources() != null && pvc.getSpec().getResources().getRequests() != null,
                "spec.resources.requests", "Required value");
        validation.quantity(pvc.getSpec().getResources().getRequests().get("storage"), "spec.resources.requests.storage");
    }

    private static void validatePdb(Validation validation, PodDisruptionBudget pdb) {
        validation.require(pdb.getSpec() != null, "spec", "Required value");
        validation.require(!Labels.isEmpty(pdb.getSpec().getSelector()), "spec.selector", "Required value");

        IntOrString minAvailable = pdb.getSpec().getMinAvailable();
        IntOrString maxUnavailable = pdb.getSpec().getMaxUnavailable();

        validation.require(minAvailable == null || maxUnavailable == null, "spec", "minAvailable and maxUnavailable cannot be both set");
        validation.require(minAvailable != null || maxUnavailable != null, "spec", "one of minAvailable or maxUnavailable is required");
        validation.intOrPercent(minAvailable, "spec.minAvailable");
        validation.intOrPercent(maxUnavailable, "spec.maxUnavailable");
    }

    /**
     * Collects the identity of the validated resource for the error messages
     */
    private record Validation(ResourceKind kind, NamespaceAndName resource) {
        InvalidResourceException invalid(String field, String message) {
            return new InvalidResourceException(kind.kind() + " " + resource + " is invalid: " + field + ": " + message);
        }

        void require(boolean condition, String field, String message) {
            if (!condition) {
                throw invalid(field, message);
            }
        }

        void nonNegative(Integer value, String field) {
            require(value == null || value >= 0, field, "must be greater than or equal to 0");
        }

        void quantity(Quantity value, String field) {
            require(value != null, field, "Required value");

            try {
                require(Quantity.getAmountInBytes(value).signum() >= 0, field, "must be greater than or equal to 0");
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw invalid(field, "quantities must match the regular expression '^([+-]?[0-9.]+)([eEinumkKMGTP]*[-+]?[0-9]*)$'");
            }
        }

        void accessModes(List<String> modes, String field) {
            require(modes != null && !modes.isEmpty(), field, "Required value");
            modes.forEach(mode -> require(ACCESS_MODES.contains(mode), field, "Unsupported value: " + mode));
        }

        void intOrPercent(IntOrString value, String field) {
            if (value == null) {
                return;
            }

            require(value.getIntVal() == null || value.getIntVal() >= 0, field, "must be greater than or equal to 0");

            try {
                Util.scaledValueFromIntOrPercent(value, 100, true);
            } catch (IllegalArgumentException e) {
                throw invalid(field, e.getMessage());
            }
        }
    }
}
