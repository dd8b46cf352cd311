/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.net.SocketException;
import java.util.List;
import java.util.Set;

/**
 * Source of the IPv4 networks configured on the local host's interfaces.
 */
@FunctionalInterface
public interface HostNetworks {

    /**
     * @param excludedInterfaces names of interfaces whose networks are ignored
     * @return the networks of every other interface, in enumeration order
     * @throws SocketException if the interfaces cannot be enumerated
     */
    List<Cidr> ipv4Networks(Set<String> excludedInterfaces) throws SocketException;

    /**
     * @return host networks read with {@link java.net.NetworkInterface}
     */
    static HostNetworks system() {
        return SystemHostNetworks.INSTANCE;
    }
}
