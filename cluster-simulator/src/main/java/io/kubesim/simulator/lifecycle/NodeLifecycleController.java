/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.lifecycle;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.simulator.controller.AbstractController;
import io.kubesim.simulator.controller.ControllerContext;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.scheduler.NodeEligibility;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Watches the node health. Pods bound to a node which is not ready or which disappeared are lost: they fail with the
 * NodeLost reason and are tombstoned, so that their controllers replace them elsewhere.
 */
public class NodeLifecycleController extends AbstractController<Node> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(NodeLifecycleController.class);

    /**
     * Reason set on the pods lost together with their node
     */
    public static final String REASON_NODE_LOST = "NodeLost";

    private final Set<String> notReadyNodes = new HashSet<>();

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public NodeLifecycleController(ControllerContext context) {
        super(Node.class, context);
    }

    @Override
    public String name() {
        return "NodeLifecycleController";
    }

    @Override
    public void reconcile() {
        Set<String> nodeNames = store.list(Node.class).stream().map(node -> node.getMetadata().getName()).collect(Collectors.toSet());
        notReadyNodes.retainAll(nodeNames);

        super.reconcile();

        for (Pod pod : store.list(Pod.class)) {
            String nodeName = pod.getSpec().getNodeName();

            if (nodeName == null || !PodUtils.isLive(pod)) {
                continue;
            }

            Node node = store.get(Node.class, null, nodeName);
            if (node == null || PodUtils.isTombstoned(node) || !NodeEligibility.isReady(node)) {
                losePod(pod, nodeName);
            }
        }
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, Node node) {
        String name = node.getMetadata().getName();

        if (!NodeEligibility.isReady(node)) {
            if (notReadyNodes.add(name)) {
                LOGGER.warnCr(reconciliation, "Node became not ready");
                events.warning(node, "NodeNotReady", "Node " + name + " status is now: NodeNotReady");
            }
        } else if (notReadyNodes.remove(name)) {
            LOGGER.infoCr(reconciliation, "Node became ready");
            events.normal(node, "NodeReady", "Node " + name + " status is now: NodeReady");
        }
    }

    private void losePod(Pod pod, String nodeName) {
        String message = "Node " + nodeName + " which was running pod " + pod.getMetadata().getName() + " is unresponsive";

        pod.getStatus().setPhase(PodUtils.PHASE_FAILED);
        pod.getStatus().setReason(REASON_NODE_LOST);
        pod.getStatus().setMessage(message);
        PodUtils.setReady(pod, false, clock.timestamp());
        store.markDeleted(pod);

        LOGGER.info("Pod {}/{} lost with node {}", pod.getMetadata().getNamespace(), pod.getMetadata().getName(), nodeName);
        events.warning(pod, REASON_NODE_LOST, message);
    }
}
