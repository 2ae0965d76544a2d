/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Volume;

import java.util.ArrayList;
import java.util.List;

/**
 * Phases, finalizers and helper methods for persistent volumes and their claims
 */
public class VolumeClaims {
    /**
     * Claim waiting for a volume
     */
    public static final String PHASE_PENDING = "Pending";
    /**
     * Volume and claim bound to each other
     */
    public static final String PHASE_BOUND = "Bound";
    /**
     * Volume without a claim which can be bound
     */
    public static final String PHASE_AVAILABLE = "Available";
    /**
     * Volume whose claim was deleted
     */
    public static final String PHASE_RELEASED = "Released";
    /**
     * Bound claim whose volume disappeared
     */
    public static final String PHASE_LOST = "Lost";

    /**
     * Reclaim policy removing released volumes
     */
    public static final String RECLAIM_DELETE = "Delete";
    /**
     * Reclaim policy keeping released volumes
     */
    public static final String RECLAIM_RETAIN = "Retain";

    /**
     * Finalizer which keeps claims used by pods from being removed
     */
    public static final String PROTECTION_FINALIZER = "kubernetes.io/pvc-protection";

    private static final String STORAGE = "storage";

    private VolumeClaims() { }

    /**
     * @param pod   Pod
     *
     * @return  Names of the claims mounted by the pod
     */
    public static List<String> claimNames(Pod pod) {
        List<String> claims = new ArrayList<>();

        if (pod.getSpec() != null && pod.getSpec().getVolumes() != null) {
            for (Volume volume : pod.getSpec().getVolumes()) {
                if (volume.getPersistentVolumeClaim() != null && volume.getPersistentVolumeClaim().getClaimName() != null) {
                    claims.add(volume.getPersistentVolumeClaim().getClaimName());
                }
            }
        }

        return claims;
    }

    /**
     * @param pvc   Claim
     *
     * @return  Phase of the claim
     */
    public static String phase(PersistentVolumeClaim pvc) {
        return pvc.getStatus() != null ? pvc.getStatus().getPhase() : null;
    }

    /**
     * @param pv    Volume
     *
     * @return  Phase of the volume
     */
    public static String phase(PersistentVolume pv) {
        return pv.getStatus() != null ? pv.getStatus().getPhase() : null;
    }

    /**
     * @param pvc   Claim
     *
     * @return  True if the claim is bound and not being deleted
     */
    public static boolean isBound(PersistentVolumeClaim pvc) {
        return PHASE_BOUND.equals(phase(pvc)) && !PodUtils.isTombstoned(pvc);
    }

    /**
     * Storage class of a claim or a volume. Both sides without a class match each other.
     *
     * @param storageClassName  Value of storageClassName
     *
     * @return  Class name, empty string when not set
     */
    public static String storageClass(String storageClassName) {
        return storageClassName == null ? "" : storageClassName;
    }

    /**
     * @param pvc   Claim
     *
     * @return  Requested storage
     */
    public static Quantity requestedStorage(PersistentVolumeClaim pvc) {
        return pvc.getSpec().getResources().getRequests().get(STORAGE);
    }

    /**
     * Checks whether a volume can satisfy a claim: same storage class, all requested access modes and enough capacity
     *
     * @param pv    Volume
     * @param pvc   Claim
     *
     * @return  True if the volume is big enough and offers the requested access modes
     */
    public static boolean satisfies(PersistentVolume pv, PersistentVolumeClaim pvc) {
        return storageClass(pv.getSpec().getStorageClassName()).equals(storageClass(pvc.getSpec().getStorageClassName()))
                && pv.getSpec().getAccessModes().containsAll(pvc.getSpec().getAccessModes())
                && Quantity.getAmountInBytes(pv.getSpec().getCapacity().get(STORAGE))
                    .compareTo(Quantity.getAmountInBytes(requestedStorage(pvc))) >= 0;
    }
}
