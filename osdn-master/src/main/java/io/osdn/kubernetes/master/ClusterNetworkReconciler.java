/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.openshift.api.model.ClusterNetwork;
import io.fabric8.openshift.api.model.ClusterNetworkBuilder;

import io.osdn.kubernetes.master.network.FleetConsistencyChecker;
import io.osdn.kubernetes.master.network.LocalNetworkChecker;
import io.osdn.kubernetes.master.network.NetworkInfo;
import io.osdn.kubernetes.master.network.Violation;

/**
 * <p>Converges the cluster-wide {@link ClusterNetwork} named {@value #CLUSTER_NETWORK_DEFAULT}
 * to the desired address space.</p>
 *
 * <p>When the persisted record already matches, nothing is checked or written. Otherwise the desired
 * address space is validated against the local host networks and against every host subnet and
 * service in the cluster; the record is only created or updated if no violation is found.</p>
 */
public class ClusterNetworkReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterNetworkReconciler.class);

    /**
     * Name of the single {@link ClusterNetwork} describing the cluster's address space.
     */
    public static final String CLUSTER_NETWORK_DEFAULT = "default";

    private final KubernetesClient client;
    private final LocalNetworkChecker localNetworkChecker;
    private final FleetConsistencyChecker fleetConsistencyChecker;

    public ClusterNetworkReconciler(KubernetesClient client,
                                    LocalNetworkChecker localNetworkChecker,
                                    FleetConsistencyChecker fleetConsistencyChecker) {
        this.client = Objects.requireNonNull(client);
        this.localNetworkChecker = Objects.requireNonNull(localNetworkChecker);
        this.fleetConsistencyChecker = Objects.requireNonNull(fleetConsistencyChecker);
    }

    /**
     * Reconciles the persisted cluster network with the desired one.
     *
     * @param networkInfo desired cluster and service networks
     * @param hostSubnetLength desired number of address bits per node subnet
     * @param pluginName desired network plugin name
     * @return what was done to the record
     * @throws NetworkConflictException if the desired configuration conflicts with the host or the cluster, in which case nothing was written
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if the API server could not be read or written
     */
    public ReconcileOutcome reconcile(NetworkInfo networkInfo, int hostSubnetLength, String pluginName) {
        // the client returns null only when the server answers 404, every other failure is thrown
        ClusterNetwork existing = client.resources(ClusterNetwork.class).withName(CLUSTER_NETWORK_DEFAULT).get();

        ReconcileOutcome outcome;
        ClusterNetworkBuilder builder;
        if (existing == null) {
            outcome = ReconcileOutcome.CREATE;
            builder = new ClusterNetworkBuilder()
                    .withNewMetadata()
                    .withName(CLUSTER_NETWORK_DEFAULT)
                    .endMetadata();
        }
        else if (matches(existing, networkInfo, hostSubnetLength, pluginName)) {
            LOGGER.debug("ClusterNetwork {} is up to date", describe(existing));
            return ReconcileOutcome.NO_OP;
        }
        else {
            outcome = ReconcileOutcome.UPDATE;
            builder = new ClusterNetworkBuilder(existing);
        }

        checkConsistency(networkInfo);

        ClusterNetwork desired = builder
                .withNetwork(networkInfo.clusterNetwork().toString())
                .withHostsubnetlength(hostSubnetLength)
                .withServiceNetwork(networkInfo.serviceNetwork().toString())
                .withPluginName(pluginName)
                .build();

        if (outcome == ReconcileOutcome.CREATE) {
            ClusterNetwork created = client.resource(desired).create();
            LOGGER.info("Created ClusterNetwork {}", describe(created));
        }
        else {
            ClusterNetwork updated = client.resource(desired).update();
            LOGGER.info("Updated ClusterNetwork {}", describe(updated));
        }
        return outcome;
    }

    private void checkConsistency(NetworkInfo networkInfo) {
        List<Violation> violations = new ArrayList<>(localNetworkChecker.check(networkInfo));
        violations.addAll(fleetConsistencyChecker.check(networkInfo));
        if (!violations.isEmpty()) {
            throw new NetworkConflictException(violations);
        }
    }

    private static boolean matches(ClusterNetwork existing, NetworkInfo networkInfo, int hostSubnetLength, String pluginName) {
        return Objects.equals(networkInfo.clusterNetwork().toString(), existing.getNetwork())
                && Objects.equals(hostSubnetLength, existing.getHostsubnetlength())
                && Objects.equals(networkInfo.serviceNetwork().toString(), existing.getServiceNetwork())
                && Objects.equals(pluginName, existing.getPluginName());
    }

    static String describe(ClusterNetwork clusterNetwork) {
        return "%s (network: \"%s\", hostSubnetBits: %d, serviceNetwork: \"%s\", pluginName: \"%s\")".formatted(
                clusterNetwork.getMetadata().getName(),
                clusterNetwork.getNetwork(),
                clusterNetwork.getHostsubnetlength(),
                clusterNetwork.getServiceNetwork(),
                clusterNetwork.getPluginName());
    }
}
