/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.io.UncheckedIOException;
import java.net.SocketException;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a candidate address space against the networks already routed by the local host.
 * The overlay device is excluded as it carries the cluster network itself.
 */
public class LocalNetworkChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetworkChecker.class);

    /**
     * Name of the overlay tunnel device the data plane creates.
     */
    public static final String OVERLAY_INTERFACE = "tun0";

    private final HostNetworks hostNetworks;

    public LocalNetworkChecker(HostNetworks hostNetworks) {
        this.hostNetworks = Objects.requireNonNull(hostNetworks);
    }

    /**
     * @param networkInfo the candidate address space
     * @return every conflict between the candidate and the host networks, empty if there are none
     * @throws UncheckedIOException if the host interfaces cannot be enumerated
     */
    public List<Violation> check(NetworkInfo networkInfo) {
        List<Cidr> networks;
        try {
            networks = hostNetworks.ipv4Networks(Set.of(OVERLAY_INTERFACE));
        }
        catch (SocketException e) {
            throw new UncheckedIOException("failed to enumerate host network interfaces", e);
        }
        LOGGER.debug("Checking {} against host networks {}", networkInfo, networks);
        return networkInfo.checkHostNetworks(networks);
    }
}
