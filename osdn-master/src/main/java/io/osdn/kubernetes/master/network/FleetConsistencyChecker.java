/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceSpec;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.openshift.api.model.HostSubnet;

/**
 * <p>Audits every {@link HostSubnet} and every {@link Service} in the cluster against a candidate
 * address space.</p>
 *
 * <p>The audit is exhaustive: a node subnet that can't be parsed is reported and the scan carries on,
 * so the caller gets one report listing every incompatible object. IPv6 node subnets and service
 * addresses never fall inside the IPv4 networks and are reported as outside them.</p>
 */
public class FleetConsistencyChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetConsistencyChecker.class);

    private final KubernetesClient client;

    public FleetConsistencyChecker(KubernetesClient client) {
        this.client = Objects.requireNonNull(client);
    }

    /**
     * @param networkInfo the candidate address space
     * @return the violations found, node subnets first, then services; empty if the fleet is consistent
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if the objects cannot be listed
     */
    public List<Violation> check(NetworkInfo networkInfo) {
        List<Violation> violations = new ArrayList<>();
        checkHostSubnets(networkInfo.clusterNetwork(), violations);
        checkServices(networkInfo.serviceNetwork(), violations);
        return violations;
    }

    private void checkHostSubnets(Cidr clusterNetwork, List<Violation> violations) {
        List<HostSubnet> subnets = client.resources(HostSubnet.class).list().getItems();
        for (HostSubnet hostSubnet : subnets) {
            Cidr subnet;
            try {
                subnet = Cidr.parseLenient(hostSubnet.getSubnet());
            }
            catch (IllegalArgumentException e) {
                if (Cidr.isIpv6Cidr(hostSubnet.getSubnet())) {
                    violations.add(outsideClusterNetwork(hostSubnet, clusterNetwork));
                }
                else {
                    violations.add(new Violation(Violation.Kind.UNPARSABLE_NODE_SUBNET,
                            "failed to parse network address: " + hostSubnet.getSubnet()));
                }
                continue;
            }
            if (!clusterNetwork.contains(subnet)) {
                violations.add(outsideClusterNetwork(hostSubnet, clusterNetwork));
            }
        }
        LOGGER.debug("Checked {} host subnets against cluster network {}", subnets.size(), clusterNetwork);
    }

    private static Violation outsideClusterNetwork(HostSubnet hostSubnet, Cidr clusterNetwork) {
        return new Violation(Violation.Kind.NODE_SUBNET_OUTSIDE_CLUSTER_NETWORK,
                "existing node subnet: " + hostSubnet.getSubnet() + " is not part of cluster network: " + clusterNetwork);
    }

    private void checkServices(Cidr serviceNetwork, List<Violation> violations) {
        List<Service> services = client.services().inAnyNamespace().list().getItems();
        for (Service service : services) {
            String clusterIp = Optional.ofNullable(service.getSpec())
                    .map(ServiceSpec::getClusterIP)
                    .orElse(null);
            Optional<InetAddress> address = Cidr.parseIp(clusterIp);
            if (address.isPresent() && !serviceNetwork.contains(address.get())) {
                violations.add(new Violation(Violation.Kind.SERVICE_OUTSIDE_SERVICE_NETWORK,
                        "existing service with IP: " + clusterIp + " is not part of service network: " + serviceNetwork));
            }
        }
        LOGGER.debug("Checked {} services against service network {}", services.size(), serviceNetwork);
    }
}
