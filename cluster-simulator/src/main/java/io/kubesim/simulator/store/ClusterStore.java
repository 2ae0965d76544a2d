/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeConditionBuilder;
import io.fabric8.kubernetes.api.model.NodeSpec;
import io.fabric8.kubernetes.api.model.NodeStatus;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimStatusBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeStatusBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.NameGenerator;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.model.VolumeClaims;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory store of all cluster resources.
 * <p>
 * Resources are kept per kind in creation order. The store assigns the identity of new resources (UID, creation
 * timestamp, generation and resource version) and maintains an index from owner UIDs to their dependents. Owner
 * references are non-owning: the store holds all resources in its primary collections and the index only links UIDs.
 * <p>
 * The objects returned by the store are the live objects. Controllers mutate them in place during a tick and call
 * {@link #touch(HasMetadata, boolean)} afterwards. Callers outside the reconciliation engine get copies.
 */
public class ClusterStore {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClusterStore.class);

    /**
     * Namespace used for namespaced resources which do not set one
     */
    public static final String DEFAULT_NAMESPACE = "default";

    /**
     * Spec fields written by the controllers: the pod placement and the volume binding. Updates which omit them keep
     * the current value.
     */
    private static final Map<ResourceKind, String> CONTROLLER_OWNED_SPEC_FIELDS = Map.of(
            ResourceKind.POD, "nodeName",
            ResourceKind.PERSISTENT_VOLUME_CLAIM, "volumeName",
            ResourceKind.PERSISTENT_VOLUME, "claimRef");

    private final SimulatedClock clock;
    private final NameGenerator names;
    private final int defaultNodeCapacity;

    private final Map<ResourceKind, Map<NamespaceAndName, HasMetadata>> resources = new EnumMap<>(ResourceKind.class);
    private final Map<String, HasMetadata> byUid = new HashMap<>();
    private final Map<String, Long> creationSequence = new HashMap<>();
    private final Map<String, Set<String>> dependentsByOwnerUid = new HashMap<>();

    private long nextSequence = 0;
    private long resourceVersion = 0;

    /**
     * Constructs the store
     *
     * @param clock                 Simulated clock used for the timestamps
     * @param names                 Generator of UIDs
     * @param defaultNodeCapacity   Pod capacity of nodes which do not declare one
     */
    public ClusterStore(SimulatedClock clock, NameGenerator names, int defaultNodeCapacity) {
        this.clock = clock;
        this.names = names;
        this.defaultNodeCapacity = defaultNodeCapacity;

        for (ResourceKind kind : ResourceKind.values()) {
            resources.put(kind, new LinkedHashMap<>());
        }
    }

    /**
     * Adds a new resource. The resource passed in is copied and the stored copy is returned.
     *
     * @param resource  Resource to create
     * @param <T>       Type of the resource
     *
     * @return  The stored resource
     *
     * @throws InvalidResourceException When the resource is invalid or already exists
     */
    public <T extends HasMetadata> T create(T resource) throws InvalidResourceException {
        ResourceKind kind = ResourceKind.forResource(resource);
        T copy = ModelUtils.deepCopy(resource);

        if (copy.getMetadata() == null) {
            copy.setMetadata(new ObjectMeta());
        }

        normalizeNamespace(kind, copy.getMetadata());
        ResourceValidator.validate(kind, copy);

        NamespaceAndName key = NamespaceAndName.of(copy);
        if (resources.get(kind).containsKey(key)) {
            throw new InvalidResourceException(kind.kind() + " " + key + " already exists");
        }

        ObjectMeta metadata = copy.getMetadata();
        metadata.setUid(names.uid());
        metadata.setCreationTimestamp(clock.timestamp());
        metadata.setDeletionTimestamp(null);
        metadata.setGeneration(1L);
        metadata.setResourceVersion(nextResourceVersion());

        applyDefaults(kind, copy);

        resources.get(kind).put(key, copy);
        byUid.put(metadata.getUid(), copy);
        creationSequence.put(metadata.getUid(), nextSequence++);
        indexOwners(copy);

        LOGGER.debug("Created {} {}", kind.kind(), key);
        return copy;
    }

    /**
     * Replaces the labels, annotations and spec of an existing resource. The identity, owner references, finalizers
     * and status of the stored resource are kept. The generation is increased when the spec changed.
     *
     * @param resource  Resource with the new desired state
     * @param <T>       Type of the resource
     *
     * @return  The stored resource
     *
     * @throws InvalidResourceException When the resource is invalid or does not exist
     */
    @SuppressWarnings("unchecked")
    public <T extends HasMetadata> T update(T resource) throws InvalidResourceException {
        ResourceKind kind = ResourceKind.forResource(resource);
        T incoming = ModelUtils.deepCopy(resource);

        if (incoming.getMetadata() == null) {
            incoming.setMetadata(new ObjectMeta());
        }

        normalizeNamespace(kind, incoming.getMetadata());
        ResourceValidator.validate(kind, incoming);

        NamespaceAndName key = NamespaceAndName.of(incoming);
        HasMetadata existing = resources.get(kind).get(key);

        if (existing == null) {
            throw new InvalidResourceException(kind.kind() + " " + key + " not found");
        } else if (PodUtils.isTombstoned(existing)) {
            throw new InvalidResourceException(kind.kind() + " " + key + " is being deleted");
        }

        JsonNode oldTree = ModelUtils.MAPPER.valueToTree(existing);
        ObjectNode newTree = ModelUtils.MAPPER.valueToTree(incoming);

        String controllerField = CONTROLLER_OWNED_SPEC_FIELDS.get(kind);
        if (controllerField != null && newTree.path("spec").isObject() && !newTree.path("spec").has(controllerField) && oldTree.path("spec").has(controllerField)) {
            ((ObjectNode) newTree.get("spec")).set(controllerField, oldTree.path("spec").get(controllerField));
        }

        boolean specChanged = !Objects.equals(oldTree.get("spec"), newTree.get("spec"));

        ObjectMeta metadata = ModelUtils.deepCopy(existing.getMetadata());
        metadata.setLabels(incoming.getMetadata().getLabels());
        metadata.setAnnotations(incoming.getMetadata().getAnnotations());
        metadata.setResourceVersion(nextResourceVersion());
        if (specChanged) {
            metadata.setGeneration(metadata.getGeneration() + 1);
        }

        newTree.set("metadata", ModelUtils.MAPPER.valueToTree(metadata));
        if (oldTree.has("status")) {
            newTree.set("status", oldTree.get("status"));
        } else {
            newTree.remove("status");
        }

        T merged = (T) ModelUtils.MAPPER.convertValue(newTree, existing.getClass());
        resources.get(kind).put(key, merged);
        byUid.put(metadata.getUid(), merged);

        LOGGER.debug("Updated {} {} (spec changed: {})", kind.kind(), key, specChanged);
        return merged;
    }

    /**
     * Records an in-place change of a live resource done by a controller
     *
     * @param resource      The live resource
     * @param specChanged   True if the desired state changed, which increases the generation
     */
    public void touch(HasMetadata resource, boolean specChanged) {
        ObjectMeta metadata = resource.getMetadata();
        metadata.setResourceVersion(nextResourceVersion());

        if (specChanged) {
            metadata.setGeneration(metadata.getGeneration() == null ? 1L : metadata.getGeneration() + 1);
        }
    }

    /**
     * Sets the controller of a resource (used when orphans are adopted)
     *
     * @param dependent The live resource
     * @param owner     Its new owner
     */
    public void setOwner(HasMetadata dependent, HasMetadata owner) {
        unindexOwners(dependent);
        dependent.getMetadata().setOwnerReferences(new ArrayList<>(List.of(ModelUtils.createOwnerReference(owner, true))));
        indexOwners(dependent);
        touch(dependent, false);
    }

    /**
     * Sets the deletion tombstone on a resource. Pods which did not terminate yet move to the Terminating phase and
     * lose their readiness. Tombstoning is idempotent.
     *
     * @param resource  The live resource
     *
     * @return  True if the resource was tombstoned by this call, false if it already was
     */
    public boolean markDeleted(HasMetadata resource) {
        if (PodUtils.isTombstoned(resource)) {
            return false;
        }

        String timestamp = clock.timestamp();
        resource.getMetadata().setDeletionTimestamp(timestamp);

        if (resource instanceof Pod pod) {
            if (pod.getStatus() == null) {
                PodUtils.initializeStatus(pod);
            }

            if (!PodUtils.isTerminal(pod)) {
                pod.getStatus().setPhase(PodUtils.PHASE_TERMINATING);
            }

            PodUtils.setReady(pod, false, timestamp);
        }

        touch(resource, false);
        LOGGER.debug("Marked {} {} for deletion", ResourceKind.forResource(resource).kind(), NamespaceAndName.of(resource));
        return true;
    }

    /**
     * Sets the deletion tombstone on a resource identified by its kind and name
     *
     * @param kind      Kind
     * @param namespace Namespace
     * @param name      Name
     *
     * @return  True if the resource was tombstoned by this call
     *
     * @throws InvalidResourceException When the resource does not exist
     */
    public boolean markDeleted(ResourceKind kind, String namespace, String name) throws InvalidResourceException {
        HasMetadata resource = get(kind, namespace, name);

        if (resource == null) {
            throw new InvalidResourceException(kind.kind() + " " + new NamespaceAndName(namespace(kind, namespace), name) + " not found");
        }

        return markDeleted(resource);
    }

    /**
     * Physically removes a resource
     *
     * @param resource  The live resource
     */
    public void remove(HasMetadata resource) {
        ResourceKind kind = ResourceKind.forResource(resource);
        String uid = resource.getMetadata().getUid();

        resources.get(kind).remove(NamespaceAndName.of(resource));
        byUid.remove(uid);
        creationSequence.remove(uid);
        unindexOwners(resource);
        dependentsByOwnerUid.remove(uid);

        LOGGER.debug("Removed {} {}", kind.kind(), NamespaceAndName.of(resource));
    }

    /**
     * @param kind      Kind
     * @param namespace Namespace (null means the default namespace for namespaced kinds)
     * @param name      Name
     *
     * @return  The live resource or null
     */
    public HasMetadata get(ResourceKind kind, String namespace, String name) {
        return resources.get(kind).get(new NamespaceAndName(namespace(kind, namespace), name));
    }

    /**
     * @param type      Model class
     * @param namespace Namespace (null means the default namespace for namespaced kinds)
     * @param name      Name
     * @param <T>       Type of the resource
     *
     * @return  The live resource or null
     */
    public <T extends HasMetadata> T get(Class<T> type, String namespace, String name) {
        return type.cast(get(ResourceKind.forType(type), namespace, name));
    }

    /**
     * @param uid   UID
     *
     * @return  The live resource with this UID or null
     */
    public HasMetadata getByUid(String uid) {
        return uid == null ? null : byUid.get(uid);
    }

    /**
     * @param kind  Kind
     *
     * @return  Snapshot list of the live resources of the kind in creation order
     */
    public List<HasMetadata> list(ResourceKind kind) {
        return new ArrayList<>(resources.get(kind).values());
    }

    /**
     * @param type  Model class
     * @param <T>   Type of the resources
     *
     * @return  Snapshot list of the live resources of the kind in creation order
     */
    public <T extends HasMetadata> List<T> list(Class<T> type) {
        return resources.get(ResourceKind.forType(type)).values().stream().map(type::cast).toList();
    }

    /**
     * @param type      Model class
     * @param namespace Namespace
     * @param <T>       Type of the resources
     *
     * @return  Snapshot list of the live resources of the kind in the namespace in creation order
     */
    public <T extends HasMetadata> List<T> list(Class<T> type, String namespace) {
        return list(type).stream().filter(resource -> Objects.equals(namespace, resource.getMetadata().getNamespace())).toList();
    }

    /**
     * @param owner     Owner
     *
     * @return  All resources which reference the owner, in creation order
     */
    public List<HasMetadata> dependents(HasMetadata owner) {
        Set<String> uids = dependentsByOwnerUid.get(owner.getMetadata().getUid());

        if (uids == null) {
            return List.of();
        }

        return uids.stream()
                .map(byUid::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingLong(this::sequence))
                .toList();
    }

    /**
     * @param owner     Owner
     * @param type      Model class of the dependents
     * @param <T>       Type of the dependents
     *
     * @return  Resources of the given type which reference the owner, in creation order
     */
    public <T extends HasMetadata> List<T> dependents(HasMetadata owner, Class<T> type) {
        return dependents(owner).stream().filter(type::isInstance).map(type::cast).toList();
    }

    /**
     * @param resource  A stored resource
     *
     * @return  Position of the resource in the global creation order
     */
    public long sequence(HasMetadata resource) {
        return creationSequence.getOrDefault(resource.getMetadata().getUid(), Long.MAX_VALUE);
    }

    /**
     * @return  The default pod capacity of nodes
     */
    public int defaultNodeCapacity() {
        return defaultNodeCapacity;
    }

    private String namespace(ResourceKind kind, String namespace) {
        if (!kind.isNamespaced()) {
            return null;
        }

        return namespace == null || namespace.isEmpty() ? DEFAULT_NAMESPACE : namespace;
    }

    private void normalizeNamespace(ResourceKind kind, ObjectMeta metadata) {
        metadata.setNamespace(namespace(kind, metadata.getNamespace()));
    }

    private void applyDefaults(ResourceKind kind, HasMetadata resource) {
        if (kind == ResourceKind.POD) {
            Pod pod = (Pod) resource;

            if (pod.getSpec().getRestartPolicy() == null) {
                pod.getSpec().setRestartPolicy("Always");
            }

            if (pod.getStatus() == null || pod.getStatus().getPhase() == null) {
                PodUtils.initializeStatus(pod);
            }
        } else if (kind == ResourceKind.NODE) {
            Node node = (Node) resource;

            if (node.getSpec() == null) {
                node.setSpec(new NodeSpec());
            }

            if (node.getStatus() == null) {
                node.setStatus(new NodeStatus());
            }

            if (node.getStatus().getCapacity() == null || !node.getStatus().getCapacity().containsKey("pods")) {
                Map<String, Quantity> capacity = node.getStatus().getCapacity() != null ? new HashMap<>(node.getStatus().getCapacity()) : new HashMap<>(1);
                capacity.put("pods", new Quantity(String.valueOf(defaultNodeCapacity)));
                node.getStatus().setCapacity(capacity);
            }

            List<NodeCondition> conditions = node.getStatus().getConditions() != null ? new ArrayList<>(node.getStatus().getConditions()) : new ArrayList<>(1);
            if (conditions.stream().noneMatch(condition -> "Ready".equals(condition.getType()))) {
                conditions.add(new NodeConditionBuilder()
                        .withType("Ready")
                        .withStatus("True")
                        .withReason("KubeletReady")
                        .withLastTransitionTime(clock.timestamp())
                        .build());
            }

            node.getStatus().setConditions(conditions);
        } else if (kind == ResourceKind.PERSISTENT_VOLUME_CLAIM) {
            PersistentVolumeClaim pvc = (PersistentVolumeClaim) resource;

            if (pvc.getStatus() == null || pvc.getStatus().getPhase() == null) {
                pvc.setStatus(new PersistentVolumeClaimStatusBuilder().withPhase(VolumeClaims.PHASE_PENDING).build());
            }

            List<String> finalizers = pvc.getMetadata().getFinalizers() != null ? new ArrayList<>(pvc.getMetadata().getFinalizers()) : new ArrayList<>(1);
            if (!finalizers.contains(VolumeClaims.PROTECTION_FINALIZER)) {
                finalizers.add(VolumeClaims.PROTECTION_FINALIZER);
            }
            pvc.getMetadata().setFinalizers(finalizers);
        } else if (kind == ResourceKind.PERSISTENT_VOLUME) {
            PersistentVolume pv = (PersistentVolume) resource;

            if (pv.getStatus() == null || pv.getStatus().getPhase() == null) {
                pv.setStatus(new PersistentVolumeStatusBuilder()
                        .withPhase(pv.getSpec().getClaimRef() == null ? VolumeClaims.PHASE_AVAILABLE : VolumeClaims.PHASE_BOUND)
                        .build());
            }
        }
    }

    private void indexOwners(HasMetadata resource) {
        List<OwnerReference> references = resource.getMetadata().getOwnerReferences();

        if (references != null) {
            for (OwnerReference reference : references) {
                if (reference.getUid() != null) {
                    dependentsByOwnerUid.computeIfAbsent(reference.getUid(), k -> new LinkedHashSet<>()).add(resource.getMetadata().getUid());
                }
            }
        }
    }

    private void unindexOwners(HasMetadata resource) {
        List<OwnerReference> references = resource.getMetadata().getOwnerReferences();

        if (references != null) {
            for (OwnerReference reference : references) {
                Set<String> dependents = dependentsByOwnerUid.get(reference.getUid());

                if (dependents != null) {
                    dependents.remove(resource.getMetadata().getUid());

                    if (dependents.isEmpty()) {
                        dependentsByOwnerUid.remove(reference.getUid());
                    }
                }
            }
        }
    }

    private String nextResourceVersion() {
        return String.valueOf(++resourceVersion);
    }
}
