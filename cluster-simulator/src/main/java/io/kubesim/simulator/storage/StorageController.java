/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.storage;

import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.controller.AbstractController;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.model.VolumeClaims;
import io.kubesim.simulator.store.ClusterStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds PersistentVolumeClaims to PersistentVolumes. A pending claim gets the first Available volume of its storage
 * class which offers the requested access modes and capacity. When there is none and the claim names a StorageClass,
 * a new volume is provisioned for it. Claims are bound immediately, the binding does not wait for a consumer.
 * <p>
 * The volume of a removed claim is Released and then handled according to its reclaim policy: Delete removes it,
 * Retain keeps it Released. Claims used by pods are protected by a finalizer until the last pod using them is gone.
 */
public class StorageController extends AbstractController<PersistentVolumeClaim> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StorageController.class);

    // Last reported binding failure per claim UID
    private final Map<String, String> reportedFailures = new HashMap<>();

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public StorageController(ControllerContext context) {
        super(PersistentVolumeClaim.class, context);
    }

    @Override
    public String name() {
        return "StorageController";
    }

    @Override
    public void reconcile() {
        Set<String> claimUids = store.list(PersistentVolumeClaim.class).stream()
                .map(pvc -> pvc.getMetadata().getUid())
                .collect(Collectors.toSet());
        reportedFailures.keySet().retainAll(claimUids);

        releaseVolumes();
        releaseUnusedClaims();
        super.reconcile();
        reclaimVolumes();
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, PersistentVolumeClaim pvc) {
        String phase = VolumeClaims.phase(pvc);

        if (VolumeClaims.PHASE_BOUND.equals(phase)) {
            checkVolume(reconciliation, pvc);
        } else if (VolumeClaims.PHASE_PENDING.equals(phase)) {
            bindOrProvision(reconciliation, pvc);
        }
    }

    private void checkVolume(Reconciliation reconciliation, PersistentVolumeClaim pvc) {
        PersistentVolume pv = store.get(PersistentVolume.class, null, pvc.getSpec().getVolumeName());

        if (pv == null || pv.getSpec().getClaimRef() == null || !pvc.getMetadata().getUid().equals(pv.getSpec().getClaimRef().getUid())) {
            pvc.getStatus().setPhase(VolumeClaims.PHASE_LOST);
            store.touch(pvc, false);

            LOGGER.warnCr(reconciliation, "Volume {} of the claim is gone", pvc.getSpec().getVolumeName());
            events.warning(pvc, "ClaimLost", "Bound claim has lost reference to PersistentVolume. Data on the volume is lost!");
        }
    }

    private void bindOrProvision(Reconciliation reconciliation, PersistentVolumeClaim pvc) {
        String storageClassName = VolumeClaims.storageClass(pvc.getSpec().getStorageClassName());

        PersistentVolume available = store.list(PersistentVolume.class).stream()
                .filter(pv -> !PodUtils.isTombstoned(pv))
                .filter(pv -> VolumeClaims.PHASE_AVAILABLE.equals(VolumeClaims.phase(pv)) && pv.getSpec().getClaimRef() == null)
                .filter(pv -> VolumeClaims.satisfies(pv, pvc))
                .findFirst()
                .orElse(null);

        if (available != null) {
            bind(pvc, available);
            LOGGER.infoCr(reconciliation, "Bound to volume {}", available.getMetadata().getName());
            events.normal(pvc, "Bound", "Bound to volume " + available.getMetadata().getName());
        } else if (storageClassName.isEmpty()) {
            failedBinding(reconciliation, pvc, "FailedBinding", "no persistent volumes available for this claim and no storage class is set");
        } else {
            StorageClass storageClass = store.get(StorageClass.class, null, storageClassName);

            if (storageClass == null || PodUtils.isTombstoned(storageClass)) {
                failedBinding(reconciliation, pvc, "ProvisioningFailed", "storageclass.storage.k8s.io \"" + storageClassName + "\" not found");
            } else {
                PersistentVolume provisioned = store.create(provisionedVolume(pvc, storageClass));
                bind(pvc, provisioned);

                LOGGER.infoCr(reconciliation, "Provisioned volume {} using StorageClass {}", provisioned.getMetadata().getName(), storageClassName);
                events.normal(pvc, "ProvisioningSucceeded", "Successfully provisioned volume " + provisioned.getMetadata().getName()
                        + " using " + storageClass.getProvisioner());
            }
        }
    }

    private PersistentVolume provisionedVolume(PersistentVolumeClaim pvc, StorageClass storageClass) {
        return new PersistentVolumeBuilder()
                .withNewMetadata()
                    .withName("pvc-" + pvc.getMetadata().getUid())
                    .addToAnnotations("pv.kubernetes.io/provisioned-by", storageClass.getProvisioner())
                .endMetadata()
                .withNewSpec()
                    .addToCapacity("storage", VolumeClaims.requestedStorage(pvc))
                    .withAccessModes(new ArrayList<>(pvc.getSpec().getAccessModes()))
                    .withStorageClassName(storageClass.getMetadata().getName())
                    .withPersistentVolumeReclaimPolicy(storageClass.getReclaimPolicy() != null ? storageClass.getReclaimPolicy() : VolumeClaims.RECLAIM_DELETE)
                .endSpec()
                .build();
    }

    private void bind(PersistentVolumeClaim pvc, PersistentVolume pv) {
        pv.getSpec().setClaimRef(new ObjectReferenceBuilder()
                .withApiVersion(ResourceKind.PERSISTENT_VOLUME_CLAIM.apiVersion())
                .withKind(ResourceKind.PERSISTENT_VOLUME_CLAIM.kind())
                .withNamespace(pvc.getMetadata().getNamespace())
                .withName(pvc.getMetadata().getName())
                .withUid(pvc.getMetadata().getUid())
                .build());
        pv.getStatus().setPhase(VolumeClaims.PHASE_BOUND);
        store.touch(pv, false);

        pvc.getSpec().setVolumeName(pv.getMetadata().getName());
        pvc.getStatus().setPhase(VolumeClaims.PHASE_BOUND);
        pvc.getStatus().setAccessModes(new ArrayList<>(pv.getSpec().getAccessModes()));
        pvc.getStatus().setCapacity(new HashMap<>(pv.getSpec().getCapacity()));
        store.touch(pvc, false);

        reportedFailures.remove(pvc.getMetadata().getUid());
    }

    private void failedBinding(Reconciliation reconciliation, PersistentVolumeClaim pvc, String reason, String message) {
        String previous = reportedFailures.put(pvc.getMetadata().getUid(), message);

        if (!message.equals(previous)) {
            LOGGER.debugCr(reconciliation, "Claim cannot be bound: {}", message);
            events.warning(pvc, reason, message);
        }
    }

    /**
     * Volumes bound to claims which do not exist anymore are released
     */
    private void releaseVolumes() {
        for (PersistentVolume pv : store.list(PersistentVolume.class)) {
            if (VolumeClaims.PHASE_BOUND.equals(VolumeClaims.phase(pv))
                    && pv.getSpec().getClaimRef() != null
                    && store.getByUid(pv.getSpec().getClaimRef().getUid()) == null) {
                pv.getStatus().setPhase(VolumeClaims.PHASE_RELEASED);
                store.touch(pv, false);
                LOGGER.info("Volume {} was released by claim {}/{}", pv.getMetadata().getName(),
                        pv.getSpec().getClaimRef().getNamespace(), pv.getSpec().getClaimRef().getName());
            }
        }
    }

    /**
     * Deleted claims lose their protection finalizer once no pod uses them
     */
    private void releaseUnusedClaims() {
        for (PersistentVolumeClaim pvc : store.list(PersistentVolumeClaim.class)) {
            List<String> finalizers = pvc.getMetadata().getFinalizers();

            if (PodUtils.isTombstoned(pvc)
                    && finalizers != null
                    && finalizers.contains(VolumeClaims.PROTECTION_FINALIZER)
                    && !isInUse(pvc)) {
                List<String> remaining = new ArrayList<>(finalizers);
                remaining.remove(VolumeClaims.PROTECTION_FINALIZER);
                pvc.getMetadata().setFinalizers(remaining);
                store.touch(pvc, false);
                LOGGER.debug("Claim {} is not used by any pod anymore", NamespaceAndName.of(pvc));
            }
        }
    }

    private boolean isInUse(PersistentVolumeClaim pvc) {
        return store.list(Pod.class, pvc.getMetadata().getNamespace()).stream()
                .filter(pod -> !PodUtils.isTerminal(pod))
                .anyMatch(pod -> VolumeClaims.claimNames(pod).contains(pvc.getMetadata().getName()));
    }

    /**
     * Released volumes with the Delete policy are removed. Volumes without their own policy follow their StorageClass.
     */
    private void reclaimVolumes() {
        for (PersistentVolume pv : store.list(PersistentVolume.class)) {
            if (VolumeClaims.PHASE_RELEASED.equals(VolumeClaims.phase(pv))
                    && !PodUtils.isTombstoned(pv)
                    && VolumeClaims.RECLAIM_DELETE.equals(reclaimPolicy(pv))) {
                store.markDeleted(pv);
                LOGGER.info("Deleting released volume {}", pv.getMetadata().getName());
            }
        }
    }

    private String reclaimPolicy(PersistentVolume pv) {
        if (pv.getSpec().getPersistentVolumeReclaimPolicy() != null) {
            return pv.getSpec().getPersistentVolumeReclaimPolicy();
        }

        StorageClass storageClass = store.get(StorageClass.class, null, VolumeClaims.storageClass(pv.getSpec().getStorageClassName()));
        return storageClass != null && storageClass.getReclaimPolicy() != null ? storageClass.getReclaimPolicy() : VolumeClaims.RECLAIM_DELETE;
    }

    /**
     * Finds the first claim mounted by a pod which is not bound
     *
     * @param store Object store
     * @param pod   Pod
     *
     * @return  Name of the unbound claim or null when all claims are bound
     */
    public static String unboundClaim(ClusterStore store, Pod pod) {
        for (String claim : VolumeClaims.claimNames(pod)) {
            PersistentVolumeClaim pvc = store.get(PersistentVolumeClaim.class, pod.getMetadata().getNamespace(), claim);

            if (pvc == null || !VolumeClaims.isBound(pvc)) {
                return claim;
            }
        }

        return null;
    }

    /* test */ int reportedFailureCount() {
        return reportedFailures.size();
    }
}
