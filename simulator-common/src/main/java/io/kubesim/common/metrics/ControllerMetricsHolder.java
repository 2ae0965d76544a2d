/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.kubesim.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Holds the metrics of one controller. The metrics are created lazily per namespace and cached, so that the
 * controllers can ask for them in every reconciliation.
 */
public class ControllerMetricsHolder {
    /**
     * Prefix used for the simulator metrics
     */
    public static final String METRICS_PREFIX = "kubesim.";
    /**
     * Metric name for number of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    /**
     * Metric name for number of failed reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    /**
     * Metric name for number of successful reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    /**
     * Metric name for duration of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    /**
     * Metric name for number of resources seen by the controller.
     */
    public static final String METRICS_RESOURCES = METRICS_PREFIX + "resources";

    private final String kind;
    private final MetricsProvider metricsProvider;

    private final Map<MetricKey, Counter> reconciliationsCounterMap = new HashMap<>(1);
    private final Map<MetricKey, Counter> failedReconciliationsCounterMap = new HashMap<>(1);
    private final Map<MetricKey, Counter> successfulReconciliationsCounterMap = new HashMap<>(1);
    private final Map<MetricKey, Timer> reconciliationsTimerMap = new HashMap<>(1);
    private final Map<MetricKey, AtomicInteger> resourceCounterMap = new HashMap<>(1);

    /**
     * Constructs the metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param metricsProvider   Metrics provider
     */
    @SuppressFBWarnings({"EI_EXPOSE_REP2"}) // The metrics provider is shared by all holders
    public ControllerMetricsHolder(String kind, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @return  Metrics provider used for the metrics by this holder class
     */
    public MetricsProvider metricsProvider()    {
        return metricsProvider;
    }

    /**
     * Counter metric for number of reconciliations. It increments once per resource and tick.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter reconciliationsCounter(String namespace) {
        return metric(namespace, reconciliationsCounterMap,
                tags -> metricsProvider.counter(METRICS_RECONCILIATIONS, "Number of reconciliations done by the controller for individual resources", tags));
    }

    /**
     * Counter metric for number of failed reconciliations.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter failedReconciliationsCounter(String namespace) {
        return metric(namespace, failedReconciliationsCounterMap,
                tags -> metricsProvider.counter(METRICS_RECONCILIATIONS_FAILED, "Number of reconciliations done by the controller for individual resources which failed", tags));
    }

    /**
     * Counter metric for number of successful reconciliations.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter successfulReconciliationsCounter(String namespace) {
        return metric(namespace, successfulReconciliationsCounterMap,
                tags -> metricsProvider.counter(METRICS_RECONCILIATIONS_SUCCESSFUL, "Number of reconciliations done by the controller for individual resources which were successful", tags));
    }

    /**
     * Timer which measures how long the reconciliations take.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics timer
     */
    public Timer reconciliationsTimer(String namespace) {
        return metric(namespace, reconciliationsTimerMap,
                tags -> metricsProvider.timer(METRICS_RECONCILIATIONS_DURATION, "The time the reconciliation takes to complete", tags));
    }

    /**
     * Gauge with the number of resources of this kind the controller sees.
     *
     * @param namespace     Namespace of the resources
     *
     * @return  Gauge value holder
     */
    public AtomicInteger resourceCounter(String namespace) {
        return metric(namespace, resourceCounterMap,
                tags -> metricsProvider.gauge(METRICS_RESOURCES, "Number of resources the controller sees", tags));
    }

    /**
     * Resets the resource gauges to zero. Called before the resources are counted again.
     */
    public void resetResourceCounters() {
        resourceCounterMap.values().forEach(counter -> counter.set(0));
    }

    private <M> M metric(String namespace, Map<MetricKey, M> metricMap, Function<Tags, M> fn) {
        MetricKey key = new MetricKey(kind, namespace == null ? "" : namespace);
        return metricMap.computeIfAbsent(key, k -> fn.apply(Tags.of(Tag.of("kind", k.kind()), Tag.of("namespace", k.namespace()))));
    }

    /**
     * Key of the cached metrics
     *
     * @param kind          Kind of the resource
     * @param namespace     Namespace of the resource
     */
    record MetricKey(String kind, String namespace) { }
}
