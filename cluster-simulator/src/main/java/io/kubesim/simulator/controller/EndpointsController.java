/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.controller;

import io.fabric8.kubernetes.api.model.EndpointAddress;
import io.fabric8.kubernetes.api.model.EndpointAddressBuilder;
import io.fabric8.kubernetes.api.model.EndpointPort;
import io.fabric8.kubernetes.api.model.EndpointPortBuilder;
import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.api.model.EndpointSubsetBuilder;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.EndpointsBuilder;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.kubesim.common.Reconciliation;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.common.model.Labels;
import io.kubesim.common.model.NamespaceAndName;
import io.kubesim.simulator.model.ModelUtils;
import io.kubesim.simulator.model.PodUtils;
import io.kubesim.simulator.model.ResourceKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the endpoints of the Services. The endpoints of a Service are its selector-matching pods which are Running
 * and Ready. They are kept outside the object store and recomputed at the end of every tick.
 */
public class EndpointsController extends AbstractController<Service> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(EndpointsController.class);

    private final Map<NamespaceAndName, Endpoints> endpoints = new HashMap<>();

    /**
     * Constructs the controller
     *
     * @param context   Controller context
     */
    public EndpointsController(ControllerContext context) {
        super(Service.class, context);
    }

    @Override
    public String name() {
        return "EndpointsController";
    }

    @Override
    public void reconcile() {
        Set<NamespaceAndName> services = new HashSet<>();
        for (Service service : store.list(Service.class)) {
            if (!PodUtils.isTombstoned(service)) {
                services.add(NamespaceAndName.of(service));
            }
        }

        endpoints.keySet().retainAll(services);

        super.reconcile();
    }

    @Override
    protected void reconcile(Reconciliation reconciliation, Service service) {
        NamespaceAndName key = NamespaceAndName.of(service);
        Map<String, String> selector = service.getSpec() != null ? service.getSpec().getSelector() : null;

        List<Pod> ready = store.list(Pod.class, service.getMetadata().getNamespace()).stream()
                .filter(PodUtils::isHealthy)
                .filter(pod -> Labels.matchesSelector(selector, pod.getMetadata().getLabels()))
                .filter(pod -> pod.getStatus() != null && pod.getStatus().getPodIP() != null)
                .sorted(Comparator.comparing(pod -> pod.getMetadata().getName()))
                .toList();

        List<String> previous = addresses(endpoints.get(key));
        List<String> current = ready.stream().map(pod -> pod.getMetadata().getName()).toList();

        for (String name : current) {
            if (!previous.contains(name)) {
                events.normal(service, "EndpointsAdded", "Added pod " + name + " to the endpoints");
            }
        }

        for (String name : previous) {
            if (!current.contains(name)) {
                events.warning(service, "EndpointsRemoved", "Removed pod " + name + " from the endpoints");
            }
        }

        if (!previous.equals(current)) {
            LOGGER.debugCr(reconciliation, "Endpoints changed from {} to {}", previous, current);
        }

        endpoints.put(key, buildEndpoints(service, ready));
    }

    private Endpoints buildEndpoints(Service service, List<Pod> pods) {
        List<EndpointSubset> subsets = new ArrayList<>();

        if (!pods.isEmpty()) {
            List<EndpointAddress> addresses = pods.stream()
                    .map(pod -> new EndpointAddressBuilder()
                            .withIp(pod.getStatus().getPodIP())
                            .withNodeName(pod.getSpec().getNodeName())
                            .withTargetRef(new ObjectReferenceBuilder()
                                    .withKind(ResourceKind.POD.kind())
                                    .withNamespace(pod.getMetadata().getNamespace())
                                    .withName(pod.getMetadata().getName())
                                    .withUid(pod.getMetadata().getUid())
                                    .build())
                            .build())
                    .toList();

            subsets.add(new EndpointSubsetBuilder()
                    .withAddresses(addresses)
                    .withPorts(ports(service))
                    .build());
        }

        return new EndpointsBuilder()
                .withNewMetadata()
                    .withName(service.getMetadata().getName())
                    .withNamespace(service.getMetadata().getNamespace())
                    .withLabels(service.getMetadata().getLabels())
                .endMetadata()
                .withSubsets(subsets)
                .build();
    }

    private static List<EndpointPort> ports(Service service) {
        List<ServicePort> servicePorts = service.getSpec() != null ? service.getSpec().getPorts() : null;

        if (servicePorts == null) {
            return List.of();
        }

        return servicePorts.stream()
                .map(port -> new EndpointPortBuilder()
                        .withName(port.getName())
                        .withProtocol(port.getProtocol() != null ? port.getProtocol() : "TCP")
                        .withPort(port.getTargetPort() != null && port.getTargetPort().getIntVal() != null ? port.getTargetPort().getIntVal() : port.getPort())
                        .build())
                .toList();
    }

    private static List<String> addresses(Endpoints endpoints) {
        if (endpoints == null || endpoints.getSubsets() == null) {
            return List.of();
        }

        return endpoints.getSubsets().stream()
                .flatMap(subset -> subset.getAddresses().stream())
                .map(address -> address.getTargetRef().getName())
                .toList();
    }

    /**
     * @param namespace     Namespace of the Service
     * @param service       Name of the Service
     *
     * @return  Names of the pods backing the Service in name order. Empty when the Service is unknown.
     */
    public List<String> endpointNames(String namespace, String service) {
        return addresses(endpoints.get(new NamespaceAndName(namespace, service)));
    }

    /**
     * @param namespace     Namespace of the Service
     * @param service       Name of the Service
     *
     * @return  Copy of the Endpoints object of the Service or null when the Service is unknown
     */
    public Endpoints endpoints(String namespace, String service) {
        Endpoints current = endpoints.get(new NamespaceAndName(namespace, service));
        return current != null ? ModelUtils.deepCopy(current) : null;
    }
}
