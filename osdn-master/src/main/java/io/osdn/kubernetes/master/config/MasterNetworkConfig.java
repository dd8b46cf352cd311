/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.osdn.kubernetes.master.IllegalNetworkConfigurationException;

/**
 * The network section of the master configuration.
 *
 * @param networkPluginName name of the network plugin, which also selects the isolation mode
 * @param clusterNetworkCIDR CIDR the node subnets are allocated from
 * @param serviceNetworkCIDR CIDR the service addresses are allocated from
 * @param hostSubnetLength number of address bits allocated to each node
 */
@JsonPropertyOrder({ "networkPluginName", "clusterNetworkCIDR", "serviceNetworkCIDR", "hostSubnetLength" })
public record MasterNetworkConfig(@JsonProperty(required = true) String networkPluginName,
                                  @JsonProperty(value = "clusterNetworkCIDR", required = true) String clusterNetworkCIDR,
                                  @JsonProperty(value = "serviceNetworkCIDR", required = true) String serviceNetworkCIDR,
                                  @JsonProperty(required = true) int hostSubnetLength) {

    public MasterNetworkConfig {
        requireNonBlank(networkPluginName, "networkPluginName");
        requireNonBlank(clusterNetworkCIDR, "clusterNetworkCIDR");
        requireNonBlank(serviceNetworkCIDR, "serviceNetworkCIDR");
        if (hostSubnetLength <= 0) {
            throw new IllegalNetworkConfigurationException("'hostSubnetLength' must be greater than zero, was " + hostSubnetLength);
        }
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalNetworkConfigurationException("'" + name + "' must be specified");
        }
    }
}
