/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.osdn.kubernetes.master.IllegalNetworkConfigurationException;

/**
 * The validated address space of the cluster: the network node subnets are carved from
 * and the network service addresses are assigned from.
 *
 * @param clusterNetwork the cluster network
 * @param serviceNetwork the service network, which never overlaps the cluster network
 */
public record NetworkInfo(Cidr clusterNetwork, Cidr serviceNetwork) {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkInfo.class);

    public NetworkInfo {
        Objects.requireNonNull(clusterNetwork, "clusterNetwork cannot be null");
        Objects.requireNonNull(serviceNetwork, "serviceNetwork cannot be null");
        if (clusterNetwork.isDegenerate()) {
            throw new IllegalNetworkConfigurationException("ClusterNetwork CIDR " + clusterNetwork + " must have a non-zero prefix length");
        }
        if (serviceNetwork.isDegenerate()) {
            throw new IllegalNetworkConfigurationException("ServiceNetwork CIDR " + serviceNetwork + " must have a non-zero prefix length");
        }
        if (clusterNetwork.overlaps(serviceNetwork)) {
            throw new IllegalNetworkConfigurationException("ClusterNetwork CIDR " + clusterNetwork + " overlaps with ServiceNetwork CIDR " + serviceNetwork);
        }
    }

    /**
     * Builds the network info from configured CIDR strings.
     * A CIDR with host bits set is accepted, masked to its network, and a warning logged.
     *
     * @param clusterNetworkCidr configured cluster network
     * @param serviceNetworkCidr configured service network
     * @return the network info
     * @throws IllegalNetworkConfigurationException if either CIDR cannot be parsed, is degenerate, or the two overlap
     */
    public static NetworkInfo parse(String clusterNetworkCidr, String serviceNetworkCidr) {
        return new NetworkInfo(parseCidr("ClusterNetwork", "clusterNetworkCIDR", clusterNetworkCidr),
                parseCidr("ServiceNetwork", "serviceNetworkCIDR", serviceNetworkCidr));
    }

    private static Cidr parseCidr(String networkName, String configName, String value) {
        Cidr cidr;
        try {
            cidr = Cidr.parseLenient(value);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalNetworkConfigurationException("failed to parse " + networkName + " CIDR " + value + ": " + e.getMessage(), e);
        }
        if (!cidr.toString().equals(value)) {
            LOGGER.warn("Configured {} value \"{}\" is invalid; treating it as \"{}\"", configName, value, cidr);
        }
        return cidr;
    }

    /**
     * Checks that a host subnet of the given length fits in the cluster network.
     *
     * @param hostSubnetLength number of address bits allocated to each node
     * @throws IllegalNetworkConfigurationException if it does not
     */
    public void validateHostSubnetLength(int hostSubnetLength) {
        if (hostSubnetLength <= 0 || hostSubnetLength >= 32) {
            throw new IllegalNetworkConfigurationException("hostSubnetLength " + hostSubnetLength + " must be between 1 and 31");
        }
        if (32 - hostSubnetLength < clusterNetwork.prefixLength()) {
            throw new IllegalNetworkConfigurationException("hostSubnetLength " + hostSubnetLength + " is too large for ClusterNetwork CIDR " + clusterNetwork);
        }
    }

    /**
     * Compares the cluster and service networks with the networks configured on the host.
     *
     * @param hostNetworks networks of the host interfaces
     * @return a violation for every conflict found, in host network order
     */
    public List<Violation> checkHostNetworks(List<Cidr> hostNetworks) {
        List<Violation> violations = new ArrayList<>();
        for (Cidr hostNetwork : hostNetworks) {
            if (hostNetwork.contains(clusterNetwork.address())) {
                violations.add(hostConflict("cluster IP: " + clusterNetwork.address().getHostAddress() + " conflicts with host network: " + hostNetwork));
            }
            if (clusterNetwork.contains(hostNetwork.address())) {
                violations.add(hostConflict("host network with IP: " + hostNetwork.address().getHostAddress() + " conflicts with cluster network: " + clusterNetwork));
            }
            if (hostNetwork.contains(serviceNetwork.address())) {
                violations.add(hostConflict("service IP: " + serviceNetwork.address().getHostAddress() + " conflicts with host network: " + hostNetwork));
            }
            if (serviceNetwork.contains(hostNetwork.address())) {
                violations.add(hostConflict("host network with IP: " + hostNetwork.address().getHostAddress() + " conflicts with service network: " + serviceNetwork));
            }
        }
        return violations;
    }

    private static Violation hostConflict(String detail) {
        return new Violation(Violation.Kind.HOST_NETWORK_CONFLICT, detail);
    }
}
