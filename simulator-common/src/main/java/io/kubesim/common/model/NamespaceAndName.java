/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.model;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Namespace and name holder used to identify an object of a given kind in a single key. Cluster scoped objects
 * (Nodes) have a null namespace.
 *
 * @param namespace     Namespace or null
 * @param name          Name
 */
public record NamespaceAndName(String namespace, String name) {
    /**
     * Key of an existing resource
     *
     * @param resource  Resource
     *
     * @return  Namespace and name of the resource
     */
    public static NamespaceAndName of(HasMetadata resource) {
        return new NamespaceAndName(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    @Override
    public String toString() {
        return namespace == null ? name : namespace + "/" + name;
    }
}
