/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Service provider for the subsystems started once the cluster network is in place.
 * Implementations are located with {@link java.util.ServiceLoader}; exactly one must be present.
 */
public interface DownstreamBootstrapProvider {

    SubnetAllocation subnetAllocation(KubernetesClient client, HostSubnetNodeIps hostSubnetNodeIps);

    VnidTracking vnidTracking(KubernetesClient client);
}
