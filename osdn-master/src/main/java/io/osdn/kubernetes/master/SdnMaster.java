/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

import io.osdn.kubernetes.master.config.MasterNetworkConfig;
import io.osdn.kubernetes.master.network.FleetConsistencyChecker;
import io.osdn.kubernetes.master.network.HostNetworks;
import io.osdn.kubernetes.master.network.LocalNetworkChecker;
import io.osdn.kubernetes.master.network.NetworkInfo;
import io.osdn.tag.VisibleForTesting;

/**
 * <p>The SDN master. {@link #start(MasterNetworkConfig)} makes sure the persisted cluster network matches
 * the configuration and then starts subnet allocation and, for the isolating plugins, VNID tracking.</p>
 *
 * <p>{@code start} is meant to be called once from a single thread at startup. Calling it again with the
 * same configuration is safe: the cluster network is left alone and only the downstream subsystems are
 * started again.</p>
 */
public class SdnMaster {

    private static final Logger LOGGER = LoggerFactory.getLogger(SdnMaster.class);

    static final String RECONCILIATIONS_METRIC_NAME = "osdn_master.cluster_network.reconciliations";

    private final ClusterNetworkReconciler reconciler;
    private final SubnetAllocation subnetAllocation;
    private final VnidTracking vnidTracking;
    private final HostSubnetNodeIps hostSubnetNodeIps;
    private final MeterRegistry meterRegistry;

    public SdnMaster(KubernetesClient client, HostNetworks hostNetworks, DownstreamBootstrapProvider downstream) {
        this.hostSubnetNodeIps = new HostSubnetNodeIps();
        this.reconciler = new ClusterNetworkReconciler(client, new LocalNetworkChecker(hostNetworks), new FleetConsistencyChecker(client));
        this.subnetAllocation = downstream.subnetAllocation(client, hostSubnetNodeIps);
        this.vnidTracking = downstream.vnidTracking(client);
        this.meterRegistry = Metrics.globalRegistry;
    }

    @VisibleForTesting
    SdnMaster(ClusterNetworkReconciler reconciler,
              SubnetAllocation subnetAllocation,
              VnidTracking vnidTracking,
              MeterRegistry meterRegistry) {
        this.hostSubnetNodeIps = new HostSubnetNodeIps();
        this.reconciler = Objects.requireNonNull(reconciler);
        this.subnetAllocation = Objects.requireNonNull(subnetAllocation);
        this.vnidTracking = Objects.requireNonNull(vnidTracking);
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    /**
     * Reconciles the cluster network and bootstraps the downstream subsystems.
     *
     * @param config desired network configuration
     * @return the reconciliation outcome, or empty if the configured plugin is not managed by this master
     * @throws IllegalNetworkConfigurationException if the configured networks are invalid
     * @throws NetworkConflictException if the configured networks conflict with the host or the cluster
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if the API server could not be read or written
     * @throws BootstrapException if a downstream subsystem failed to start
     */
    public Optional<ReconcileOutcome> start(MasterNetworkConfig config) {
        IsolationMode isolationMode = IsolationMode.fromPluginName(config.networkPluginName());
        if (isolationMode == IsolationMode.INACTIVE) {
            LOGGER.debug("Network plugin {} is not an OpenShift SDN plugin, not starting the SDN master", config.networkPluginName());
            return Optional.empty();
        }

        LOGGER.info("Initializing SDN master of type \"{}\"", config.networkPluginName());

        NetworkInfo networkInfo = NetworkInfo.parse(config.clusterNetworkCIDR(), config.serviceNetworkCIDR());
        networkInfo.validateHostSubnetLength(config.hostSubnetLength());

        ReconcileOutcome outcome = reconciler.reconcile(networkInfo, config.hostSubnetLength(), config.networkPluginName());
        Counter.builder(RECONCILIATIONS_METRIC_NAME)
                .description("Cluster network reconciliations, by outcome")
                .tag("outcome", outcome.metricTag())
                .register(meterRegistry)
                .increment();

        try {
            subnetAllocation.start(networkInfo.clusterNetwork(), config.hostSubnetLength());
        }
        catch (RuntimeException e) {
            throw new BootstrapException("failed to start subnet allocation for cluster network " + networkInfo.clusterNetwork(), e);
        }

        switch (isolationMode) {
            case MULTI_TENANT -> startVnidTracking(true);
            case NETWORK_POLICY -> startVnidTracking(false);
            default -> LOGGER.debug("Isolation mode {} does not use VNIDs", isolationMode);
        }
        return Optional.of(outcome);
    }

    private void startVnidTracking(boolean multiTenant) {
        try {
            vnidTracking.start(multiTenant);
        }
        catch (RuntimeException e) {
            throw new BootstrapException("failed to start " + (multiTenant ? "multi-tenant" : "shared") + " VNID tracking", e);
        }
    }

    /**
     * @return the node IP table shared with subnet allocation
     */
    public HostSubnetNodeIps hostSubnetNodeIps() {
        return hostSubnetNodeIps;
    }
}
