/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * An immutable set of labels, the well-known label keys used by the workload controllers, and the label selector
 * matching rules.
 * <p>
 * Selector matching never treats an empty selector as "match everything": an empty or missing selector matches
 * nothing. Resources which need a selector are rejected at the mutation boundary when it is empty.
 */
public class Labels {
    /**
     * Domain used for the simulator specific labels and annotations
     */
    public static final String KUBESIM_DOMAIN = "kubesim.io/";

    /**
     * Label holding the template hash of the ReplicaSet generation which created the pod
     */
    public static final String POD_TEMPLATE_HASH_LABEL = "pod-template-hash";

    /**
     * Label holding the revision of the StatefulSet or DaemonSet template which created the pod
     */
    public static final String CONTROLLER_REVISION_HASH_LABEL = "controller-revision-hash";

    /**
     * Label with the name of the StatefulSet pod (it makes each pod individually selectable)
     */
    public static final String STATEFULSET_POD_NAME_LABEL = "statefulset.kubernetes.io/pod-name";

    /**
     * Label with the name of the Job which created the pod
     */
    public static final String JOB_NAME_LABEL = "job-name";

    /**
     * Label with the UID of the controller which created the pod
     */
    public static final String CONTROLLER_UID_LABEL = "controller-uid";

    /**
     * Empty set of labels
     */
    public static final Labels EMPTY = new Labels(emptyMap());

    private final Map<String, String> labels;

    private Labels(Map<String, String> labels) {
        this.labels = unmodifiableMap(new HashMap<>(labels));
    }

    /**
     * @param labels The map of labels.
     * @return A labels instance from Map.
     */
    public static Labels fromMap(Map<String, String> labels) {
        if (labels != null) {
            return new Labels(labels);
        }

        return EMPTY;
    }

    /**
     * @param resource The resource to get the labels of.
     * @return A new instance with the labels of the given {@code resource}.
     */
    public static Labels fromResource(HasMetadata resource) {
        return fromMap(resource.getMetadata().getLabels());
    }

    /**
     * Parse Labels from String into Labels object. The expected format of the String with labels is `key1=value1,key2=value2`
     *
     * @param stringLabels String with labels
     * @return Labels object with parsed labels
     * @throws IllegalArgumentException The string could not be parsed.
     */
    public static Labels fromString(String stringLabels) throws IllegalArgumentException {
        Map<String, String> labels = new HashMap<>();

        if (stringLabels != null && !stringLabels.isBlank()) {
            for (String label : stringLabels.split(",")) {
                String[] fields = label.split("=", -1);
                if (fields.length != 2 || fields[0].isBlank()) {
                    throw new IllegalArgumentException("Failed to parse labels from string " + stringLabels);
                }
                labels.put(fields[0].trim(), fields[1].trim());
            }
        }

        return new Labels(labels);
    }

    /**
     * The same labels as this instance with one more label
     *
     * @param label     Label key
     * @param value     Label value
     *
     * @return A new instance with the label added
     */
    public Labels with(String label, String value) {
        Map<String, String> newLabels = new HashMap<>(labels.size() + 1);
        newLabels.putAll(labels);
        newLabels.put(label, value);
        return new Labels(newLabels);
    }

    /**
     * @param additionalLabels The labels to add.
     * @return A new instances with the given {@code additionalLabels} added to the labels in this instance.
     */
    public Labels withAdditionalLabels(Map<String, String> additionalLabels) {
        if (additionalLabels == null || additionalLabels.isEmpty()) {
            return this;
        } else {
            Map<String, String> newLabels = new HashMap<>(labels.size() + additionalLabels.size());
            newLabels.putAll(labels);
            newLabels.putAll(additionalLabels);

            return new Labels(newLabels);
        }
    }

    /**
     * The same labels as this instance without the given key
     *
     * @param label     Label key to remove
     *
     * @return A new instance without the label
     */
    public Labels without(String label) {
        if (!labels.containsKey(label)) {
            return this;
        }

        Map<String, String> newLabels = new HashMap<>(labels);
        newLabels.remove(label);
        return new Labels(newLabels);
    }

    /**
     * @return an unmodifiable map of the labels.
     */
    public Map<String, String> toMap() {
        return labels;
    }

    /**
     * @return a new mutable map with the labels, suitable for setting into object metadata
     */
    public Map<String, String> toMutableMap() {
        return new HashMap<>(labels);
    }

    /**
     * @return A string which can be used as the Kubernetes label selector (e.g. key1=value1,key2=value2).
     */
    public String toSelectorString() {
        return new TreeMap<>(labels).entrySet().stream().map(entry -> entry.getKey() + "=" + entry.getValue()).collect(Collectors.joining(","));
    }

    /**
     * @param selector  Label selector
     *
     * @return  True if these labels are selected by the selector
     */
    public boolean matches(LabelSelector selector) {
        return matchesSelector(selector, labels);
    }

    /**
     * Checks whether a set of labels satisfies the required key-value pairs of a selector. Each selector key has to
     * be present with an equal value, additional labels are allowed. An empty or null selector matches nothing.
     *
     * @param selector          Required labels
     * @param resourceLabels    Labels of the candidate resource
     *
     * @return  True if the labels match the selector
     */
    public static boolean matchesSelector(Map<String, String> selector, Map<String, String> resourceLabels) {
        if (selector == null || selector.isEmpty() || resourceLabels == null) {
            return false;
        }

        for (var selectorEntry : selector.entrySet()) {
            String resourceValue = resourceLabels.get(selectorEntry.getKey());
            if (resourceValue == null
                    || !resourceValue.equals(selectorEntry.getValue())) {
                return false;
            }
        }

        return true;
    }

    /**
     * Checks whether a set of labels satisfies a label selector with both the {@code matchLabels} and the
     * {@code matchExpressions} parts. An empty or null selector matches nothing.
     *
     * @param selector          Label selector
     * @param resourceLabels    Labels of the candidate resource
     *
     * @return  True if the labels match the selector
     */
    public static boolean matchesSelector(LabelSelector selector, Map<String, String> resourceLabels) {
        if (isEmpty(selector)) {
            return false;
        }

        Map<String, String> labels = resourceLabels != null ? resourceLabels : emptyMap();
        Map<String, String> matchLabels = selector.getMatchLabels();

        if (matchLabels != null && !matchLabels.isEmpty() && !matchesSelector(matchLabels, labels)) {
            return false;
        }

        List<LabelSelectorRequirement> expressions = selector.getMatchExpressions();
        if (expressions != null) {
            for (LabelSelectorRequirement requirement : expressions) {
                if (!matchesRequirement(requirement, labels)) {
                    return false;
                }
            }
        }

        return true;
    }

    private static boolean matchesRequirement(LabelSelectorRequirement requirement, Map<String, String> labels) {
        String value = labels.get(requirement.getKey());
        List<String> values = requirement.getValues();

        switch (requirement.getOperator()) {
            case "In":
                return value != null && values != null && values.contains(value);
            case "NotIn":
                return value == null || values == null || !values.contains(value);
            case "Exists":
                return labels.containsKey(requirement.getKey());
            case "DoesNotExist":
                return !labels.containsKey(requirement.getKey());
            default:
                throw new IllegalArgumentException("Unsupported label selector operator " + requirement.getOperator());
        }
    }

    /**
     * @param selector  Label selector
     *
     * @return  True if the selector is null or has neither match labels nor match expressions
     */
    public static boolean isEmpty(LabelSelector selector) {
        return selector == null
                || (selector.getMatchLabels() == null || selector.getMatchLabels().isEmpty())
                && (selector.getMatchExpressions() == null || selector.getMatchExpressions().isEmpty());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Labels labels1 = (Labels) o;
        return Objects.equals(labels, labels1.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels);
    }

    @Override
    public String toString() {
        return "Labels" + labels;
    }
}
