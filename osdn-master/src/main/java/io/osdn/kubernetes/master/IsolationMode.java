/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.Arrays;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The tenant isolation scheme selected by the configured network plugin name.
 */
public enum IsolationMode {

    /**
     * Flat network, no per-tenant VNIDs.
     */
    NONE("redhat/openshift-ovs-subnet"),
    /**
     * A distinct VNID for each tenant.
     */
    MULTI_TENANT("redhat/openshift-ovs-multitenant"),
    /**
     * A single shared VNID, isolation enforced by network policy.
     */
    NETWORK_POLICY("redhat/openshift-ovs-networkpolicy"),
    /**
     * The plugin is not one this master manages.
     */
    INACTIVE(null);

    @Nullable
    private final String pluginName;

    IsolationMode(@Nullable String pluginName) {
        this.pluginName = pluginName;
    }

    /**
     * @param pluginName configured plugin name
     * @return the matching mode, {@link #INACTIVE} if the name is not recognised
     */
    public static IsolationMode fromPluginName(@Nullable String pluginName) {
        return Arrays.stream(values())
                .filter(mode -> mode.pluginName != null && Objects.equals(mode.pluginName, pluginName))
                .findFirst()
                .orElse(INACTIVE);
    }
}
