/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.net.Inet4Address;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

class SystemHostNetworks implements HostNetworks {

    static final HostNetworks INSTANCE = new SystemHostNetworks();

    private SystemHostNetworks() {
    }

    @Override
    public List<Cidr> ipv4Networks(Set<String> excludedInterfaces) throws SocketException {
        List<Cidr> networks = new ArrayList<>();
        for (NetworkInterface networkInterface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (excludedInterfaces.contains(networkInterface.getName())) {
                continue;
            }
            for (InterfaceAddress interfaceAddress : networkInterface.getInterfaceAddresses()) {
                if (interfaceAddress.getAddress() instanceof Inet4Address) {
                    networks.add(Cidr.of(interfaceAddress.getAddress(), interfaceAddress.getNetworkPrefixLength()));
                }
            }
        }
        return networks;
    }
}
