/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.kubesim.common.model.Labels;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ModelUtils is a utility class that holds generic static helper functions used by the controllers
 */
public class ModelUtils {
    /**
     * Object mapper used to copy the model objects
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelUtils() {}

    /**
     * Creates a deep copy of a model object. The copy does not share any mutable state with the original.
     *
     * @param object    Object to copy
     * @param <T>       Type of the object
     *
     * @return  The copy or null if the object was null
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T object) {
        if (object == null) {
            return null;
        }

        return (T) MAPPER.convertValue(MAPPER.valueToTree(object), object.getClass());
    }

    /**
     * Creates the OwnerReference based on the resource passed as parameter
     *
     * @param owner         The resource which should be the owner
     * @param isController  Indicates whether the owner acts also as the controller. This value is used in the
     *                      controller flag which is part of the OwnerReference object.
     *
     * @return          The new OwnerReference
     */
    public static OwnerReference createOwnerReference(HasMetadata owner, boolean isController)   {
        ResourceKind kind = ResourceKind.forResource(owner);

        return new OwnerReferenceBuilder()
                .withApiVersion(kind.apiVersion())
                .withKind(kind.kind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withBlockOwnerDeletion(false)
                .withController(isController)
                .build();
    }

    /**
     * Finds the controller reference of a resource
     *
     * @param resource  Resource
     *
     * @return  The owner reference marked as controller (or the first one when none is marked), null if the resource
     *          has no owner
     */
    public static OwnerReference controllerOf(HasMetadata resource) {
        List<OwnerReference> references = resource.getMetadata().getOwnerReferences();

        if (references == null || references.isEmpty()) {
            return null;
        }

        return references.stream()
                .filter(reference -> Boolean.TRUE.equals(reference.getController()))
                .findFirst()
                .orElse(references.get(0));
    }

    /**
     * Checks whether the resource is controlled by the given owner
     *
     * @param resource  Resource which should be checked
     * @param owner     Expected owner
     *
     * @return  True if the controller reference of the resource points to the owner
     */
    public static boolean isControlledBy(HasMetadata resource, HasMetadata owner) {
        OwnerReference reference = controllerOf(resource);
        return reference != null && reference.getUid() != null && reference.getUid().equals(owner.getMetadata().getUid());
    }

    /**
     * Checks whether the resource is controlled by a resource of the given kind
     *
     * @param resource  Resource which should be checked
     * @param kind      Kind of the owner
     *
     * @return  True if the resource has a controller of the given kind
     */
    public static boolean isControlledByKind(HasMetadata resource, ResourceKind kind) {
        OwnerReference reference = controllerOf(resource);
        return reference != null && kind.kind().equals(reference.getKind());
    }

    /**
     * Generates a pod from a pod template. The template is copied so the pod does not share anything with it.
     *
     * @param template      Pod template
     * @param namespace     Namespace of the pod
     * @param name          Name of the pod
     * @param owner         Controller of the pod
     * @param extraLabels   Labels added on top of the template labels
     *
     * @return  New pod in the Pending phase
     */
    public static Pod podFromTemplate(PodTemplateSpec template, String namespace, String name, HasMetadata owner, Labels extraLabels) {
        PodTemplateSpec copy = deepCopy(template);

        Map<String, String> annotations = copy.getMetadata() != null && copy.getMetadata().getAnnotations() != null
                ? new HashMap<>(copy.getMetadata().getAnnotations()) : new HashMap<>(0);
        Labels labels = copy.getMetadata() != null ? Labels.fromMap(copy.getMetadata().getLabels()) : Labels.EMPTY;
        PodSpec spec = copy.getSpec() != null ? copy.getSpec() : new PodSpec();

        return new PodBuilder()
                .withMetadata(new ObjectMetaBuilder()
                        .withName(name)
                        .withNamespace(namespace)
                        .withLabels(labels.withAdditionalLabels(extraLabels.toMap()).toMutableMap())
                        .withAnnotations(annotations)
                        .withOwnerReferences(createOwnerReference(owner, true))
                        .build())
                .withSpec(spec)
                .build();
    }
}
