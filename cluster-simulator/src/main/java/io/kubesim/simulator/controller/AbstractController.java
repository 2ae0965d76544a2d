/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubesim.common.InvariantViolationException;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.metrics.ControllerMetricsHolder;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.event.EventRecorder;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;
import io.kubesim.simulator.store.ClusterStore;
import io.micrometer.core.instrument.Timer;

/**
 * Base class of the controllers which reconcile the resources of one kind. The resources are reconciled one by one
 * in creation order. Tombstoned resources are skipped: their dependents are handled by the garbage collector.
 * <p>
 * A failure while reconciling one resource does not stop the pass: it is logged, recorded as a Warning event and
 * counted, and the resource is retried in the next tick. Only {@link InvariantViolationException} is propagated,
 * because it means the controller logic itself is broken.
 *
 * @param <T>   Type of the reconciled resource
 */
public abstract class AbstractController<T extends HasMetadata> implements Controller {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractController.class);

    protected final ControllerContext context;
    protected final ClusterStore store;
    protected final SimulatedClock clock;
    protected final EventRecorder events;
    protected final ControllerMetricsHolder metrics;

    private final ResourceKind kind;
    private final Class<T> type;

    /**
     * Constructs the controller
     *
     * @param type      Model class of the reconciled resources
     * @param context   Controller context
     */
    protected AbstractController(Class<T> type, ControllerContext context) {
        this.type = type;
        this.kind = ResourceKind.forType(type);
        this.context = context;
        this.store = context.store();
        this.clock = context.clock();
        this.events = context.events();
        this.metrics = new ControllerMetricsHolder(kind.kind(), context.metrics());
    }

    @Override
    public String name() {
        return kind.kind() + "Controller";
    }

    /**
     * @return  Kind of the reconciled resources
     */
    public ResourceKind kind() {
        return kind;
    }

    @Override
    public void reconcile() {
        metrics.resetResourceCounters();

        for (T resource : store.list(type)) {
            String namespace = resource.getMetadata().getNamespace();
            metrics.resourceCounter(namespace).incrementAndGet();

            // The resource might have been removed or replaced by an earlier reconciliation in this pass
            if (PodUtils.isTombstoned(resource) || store.getByUid(resource.getMetadata().getUid()) != resource) {
                continue;
            }

            Reconciliation reconciliation = Reconciliation.forTick(clock.tick(), kind.kind(), namespace, resource.getMetadata().getName());
            metrics.reconciliationsCounter(namespace).increment();
            Timer.Sample sample = Timer.start(context.metrics().meterRegistry());

            try {
                reconcile(reconciliation, resource);
                metrics.successfulReconciliationsCounter(namespace).increment();
            } catch (InvariantViolationException e) {
                LOGGER.errorCr(reconciliation, "Invariant violated", e);
                metrics.failedReconciliationsCounter(namespace).increment();
                throw e;
            } catch (RuntimeException e) {
                LOGGER.errorCr(reconciliation, "Reconciliation failed", e);
                events.warning(resource, "ReconcileError", "Reconciliation failed: " + e.getMessage());
                metrics.failedReconciliationsCounter(namespace).increment();
            } finally {
                sample.stop(metrics.reconciliationsTimer(namespace));
            }
        }
    }

    @Override
    public void updateStatus() {
        for (T resource : store.list(type)) {
            if (!PodUtils.isTombstoned(resource)) {
                updateStatus(resource);
            }
        }
    }

    /**
     * Reconciles one resource
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          The live resource
     */
    protected abstract void reconcile(Reconciliation reconciliation, T resource);

    /**
     * Recomputes the status of one resource at the end of the tick
     *
     * @param resource  The live resource
     */
    protected void updateStatus(T resource) {
        // Nothing to do by default
    }
}
