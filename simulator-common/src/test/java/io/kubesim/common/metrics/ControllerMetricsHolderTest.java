/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.metrics;

import io.kubesim.common.MicrometerMetricsProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

public class ControllerMetricsHolderTest {
    @Test
    public void testMetricsAreCachedPerNamespace() {
        MicrometerMetricsProvider provider = new MicrometerMetricsProvider();
        ControllerMetricsHolder metrics = new ControllerMetricsHolder("ReplicaSet", provider);

        metrics.reconciliationsCounter("default").increment();
        metrics.reconciliationsCounter("default").increment();
        metrics.reconciliationsCounter("other").increment();

        assertThat(metrics.reconciliationsCounter("default"), is(sameInstance(metrics.reconciliationsCounter("default"))));

        MeterRegistry registry = provider.meterRegistry();
        assertThat(registry.get(ControllerMetricsHolder.METRICS_RECONCILIATIONS).tag("kind", "ReplicaSet").tag("namespace", "default").counter().count(), is(2.0));
        assertThat(registry.get(ControllerMetricsHolder.METRICS_RECONCILIATIONS).tag("kind", "ReplicaSet").tag("namespace", "other").counter().count(), is(1.0));
    }

    @Test
    public void testResourceGauge() {
        MicrometerMetricsProvider provider = new MicrometerMetricsProvider();
        ControllerMetricsHolder metrics = new ControllerMetricsHolder("Node", provider);

        metrics.resourceCounter(null).incrementAndGet();
        metrics.resourceCounter(null).incrementAndGet();
        assertThat(provider.meterRegistry().get(ControllerMetricsHolder.METRICS_RESOURCES).tag("kind", "Node").gauge().value(), is(2.0));

        metrics.resetResourceCounters();
        assertThat(provider.meterRegistry().get(ControllerMetricsHolder.METRICS_RESOURCES).tag("kind", "Node").gauge().value(), is(0.0));
    }
}
