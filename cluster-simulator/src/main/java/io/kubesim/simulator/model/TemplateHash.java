/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.kubesim.common.Util;
import io.kubesim.common.model.Labels;

import java.util.Iterator;
import java.util.TreeMap;

/**
 * Computes the template hash which identifies one generation of a pod template.
 * <p>
 * The template is serialized into a JSON tree, normalized (object keys sorted, nulls and empty values dropped, the
 * {@code pod-template-hash} label removed) and hashed. Two templates with the same content therefore always have the
 * same hash, regardless of map insertion order or of whether empty lists were set.
 */
public class TemplateHash {
    private TemplateHash() { }

    /**
     * @param template  Pod template
     *
     * @return  8 character hash of the template
     */
    public static String of(PodTemplateSpec template) {
        return Util.hashStub(canonicalForm(template));
    }

    /**
     * @param template  Pod template
     *
     * @return  The normalized JSON form which is hashed
     */
    static String canonicalForm(PodTemplateSpec template) {
        JsonNode tree = template != null ? ModelUtils.MAPPER.valueToTree(template) : JsonNodeFactory.instance.objectNode();

        JsonNode labels = tree.path("metadata").path("labels");
        if (labels.isObject()) {
            ((ObjectNode) labels).remove(Labels.POD_TEMPLATE_HASH_LABEL);
        }

        JsonNode normalized = normalize(tree);
        return normalized == null ? "{}" : normalized.toString();
    }

    private static JsonNode normalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        } else if (node.isObject()) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();

            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                String field = it.next();
                JsonNode value = normalize(node.get(field));

                if (value != null) {
                    fields.put(field, value);
                }
            }

            if (fields.isEmpty()) {
                return null;
            }

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            fields.forEach(sorted::set);
            return sorted;
        } else if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();

            for (JsonNode element : node) {
                JsonNode value = normalize(element);
                array.add(value != null ? value : JsonNodeFactory.instance.nullNode());
            }

            return array.isEmpty() ? null : array;
        } else {
            return node;
        }
    }
}
