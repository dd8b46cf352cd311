/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import io.osdn.kubernetes.master.network.Cidr;

/**
 * Hands out per-node subnets from the cluster network.
 */
@FunctionalInterface
public interface SubnetAllocation {

    /**
     * Starts allocating host subnets. Called once the cluster network has been reconciled.
     *
     * @param clusterNetwork the validated cluster network
     * @param hostSubnetLength number of address bits per node subnet
     */
    void start(Cidr clusterNetwork, int hostSubnetLength);
}
