/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.util.HashMap;
import java.util.Map;

import static io.kubesim.common.model.Labels.KUBESIM_DOMAIN;
import static java.lang.Boolean.parseBoolean;

/**
 * Class for holding some annotation keys and utility methods for handling annotations
 */
public class Annotations {
    /**
     * Failure injected into a pod (or into all pods of a template)
     */
    public static final String ANNO_FAILURE_MODE = KUBESIM_DOMAIN + "failure-mode";

    /**
     * Comma separated list of probes (startup, readiness, liveness) which fail
     */
    public static final String ANNO_FAILING_PROBES = KUBESIM_DOMAIN + "failing-probes";

    /**
     * Number of ticks the application needs before its startup probe succeeds
     */
    public static final String ANNO_STARTUP_TICKS = KUBESIM_DOMAIN + "startup-ticks";

    /**
     * Number of ticks a Job pod runs before it completes
     */
    public static final String ANNO_COMPLETION_TICKS = KUBESIM_DOMAIN + "completion-ticks";

    /**
     * When true, a Job pod fails instead of succeeding when its run completes
     */
    public static final String ANNO_SIMULATE_FAILURE = KUBESIM_DOMAIN + "simulate-failure";

    /**
     * Name of the init container which terminates with an error
     */
    public static final String ANNO_FAIL_INIT_CONTAINER = KUBESIM_DOMAIN + "fail-init-container";

    /**
     * Annotation for tracking Deployment revisions
     */
    public static final String ANNO_DEP_KUBE_IO_REVISION = "deployment.kubernetes.io/revision";

    /**
     * Finalizer which keeps finished Job pods in the store until the Job counted them
     */
    public static final String JOB_TRACKING_FINALIZER = "batch.kubernetes.io/job-tracking";

    private Annotations() { }

    /**
     * Gets the annotations of a resource. The resource is not modified when it has none.
     *
     * @param resource  Resource from which we want to get the annotations
     *
     * @return  Map with annotations
     */
    public static Map<String, String> annotations(HasMetadata resource) {
        return annotations(resource.getMetadata());
    }

    private static Map<String, String> annotations(ObjectMeta metadata) {
        if (metadata == null || metadata.getAnnotations() == null) {
            return Map.of();
        }

        return metadata.getAnnotations();
    }

    /**
     * Sets an annotation on a resource, creating the annotation map when needed
     *
     * @param resource      Resource
     * @param annotation    Annotation key
     * @param value         Annotation value, null removes the annotation
     */
    public static void annotate(HasMetadata resource, String annotation, String value) {
        ObjectMeta metadata = resource.getMetadata();
        Map<String, String> annotations = metadata.getAnnotations() != null ? new HashMap<>(metadata.getAnnotations()) : new HashMap<>(1);

        if (value == null) {
            annotations.remove(annotation);
        } else {
            annotations.put(annotation, value);
        }

        metadata.setAnnotations(annotations);
    }

    /**
     * Gets a boolean value of an annotation from a Kubernetes resource
     *
     * @param resource      Resource from which the annotation should be extracted
     * @param annotation    Annotation key for which we want the value
     * @param defaultValue  Default value if the annotation is not present
     *
     * @return  Boolean value form the annotation or the default value
     */
    public static boolean booleanAnnotation(HasMetadata resource, String annotation, boolean defaultValue) {
        String str = annotations(resource).get(annotation);
        return str != null ? parseBoolean(str.trim()) : defaultValue;
    }

    /**
     * Gets an integer value of an annotation from a Kubernetes resource. Values which are not numbers are treated
     * as missing.
     *
     * @param resource      Resource from which the annotation should be extracted
     * @param annotation    Annotation key for which we want the value
     * @param defaultValue  Default value if the annotation is not present
     *
     * @return  Integer value form the annotation or the default value
     */
    public static int intAnnotation(HasMetadata resource, String annotation, int defaultValue) {
        String str = annotations(resource).get(annotation);

        if (str != null) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        return defaultValue;
    }

    /**
     * Gets a string value of an annotation from a Kubernetes resource
     *
     * @param resource      Resource from which the annotation should be extracted
     * @param annotation    Annotation key for which we want the value
     * @param defaultValue  Default value if the annotation is not present
     *
     * @return  String value form the annotation or the default value
     */
    public static String stringAnnotation(HasMetadata resource, String annotation, String defaultValue) {
        String str = annotations(resource).get(annotation);
        return str != null ? str : defaultValue;
    }

    /**
     * Checks if Kubernetes resource has an annotation with given key
     *
     * @param resource      Kubernetes resource which should be checked for the annotations presence
     * @param annotation    Annotation key
     *
     * @return  True if the annotation exists. False otherwise.
     */
    public static boolean hasAnnotation(HasMetadata resource, String annotation) {
        return annotations(resource).containsKey(annotation);
    }
}
